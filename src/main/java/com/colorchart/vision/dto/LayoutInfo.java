package com.colorchart.vision.dto;

import com.colorchart.vision.core.layout.ChartLayout;
import com.colorchart.vision.core.layout.ChartLayoutTable;

/**
 * 已启用版式的描述
 */
public class LayoutInfo {
    private String key;
    private String name;
    private int rows;
    private int cols;
    private int totalPatches;
    private double widthMm;
    private double heightMm;
    private double targetRatio;
    private double tolerance;
    private boolean supportsCompensation;

    public static LayoutInfo from(ChartLayoutTable.Entry entry) {
        ChartLayout layout = entry.getLayout();
        LayoutInfo info = new LayoutInfo();
        info.key = layout.getKey();
        info.name = layout.getName();
        info.rows = layout.getRows();
        info.cols = layout.getCols();
        info.totalPatches = layout.getPatchCount();
        info.widthMm = layout.getWidthMm();
        info.heightMm = layout.getHeightMm();
        info.targetRatio = entry.getTargetRatio();
        info.tolerance = entry.getTolerance();
        info.supportsCompensation = layout.hasIlluminationReferences();
        return info;
    }

    public String getKey() { return key; }
    public void setKey(String key) { this.key = key; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public int getRows() { return rows; }
    public void setRows(int rows) { this.rows = rows; }

    public int getCols() { return cols; }
    public void setCols(int cols) { this.cols = cols; }

    public int getTotalPatches() { return totalPatches; }
    public void setTotalPatches(int totalPatches) { this.totalPatches = totalPatches; }

    public double getWidthMm() { return widthMm; }
    public void setWidthMm(double widthMm) { this.widthMm = widthMm; }

    public double getHeightMm() { return heightMm; }
    public void setHeightMm(double heightMm) { this.heightMm = heightMm; }

    public double getTargetRatio() { return targetRatio; }
    public void setTargetRatio(double targetRatio) { this.targetRatio = targetRatio; }

    public double getTolerance() { return tolerance; }
    public void setTolerance(double tolerance) { this.tolerance = tolerance; }

    public boolean isSupportsCompensation() { return supportsCompensation; }
    public void setSupportsCompensation(boolean supportsCompensation) { this.supportsCompensation = supportsCompensation; }
}
