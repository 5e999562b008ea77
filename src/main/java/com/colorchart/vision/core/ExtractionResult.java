package com.colorchart.vision.core;

import com.colorchart.vision.core.geometry.Quadrilateral;
import com.colorchart.vision.core.layout.ChartLayout;
import com.colorchart.vision.core.sampling.PatchSample;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 色卡提取结果（不可变）
 * <p>
 * 颜色均为行优先、RGB 顺序，取值范围与源图像位深一致。
 */
public final class ExtractionResult {
    private final String layoutKey;
    private final String layoutName;
    private final int rows;
    private final int cols;
    private final BitDepth bitDepth;
    private final List<PatchSample> samples;
    private final List<double[]> compensatedColors;
    private final double[] compensationFactors;
    private final Quadrilateral markerCenters;
    private final Quadrilateral chartBoundary;

    public ExtractionResult(ChartLayout layout, BitDepth bitDepth, List<PatchSample> samples,
                            List<double[]> compensatedColors, double[] compensationFactors,
                            Quadrilateral markerCenters, Quadrilateral chartBoundary) {
        if (samples.size() != layout.getPatchCount()) {
            throw new IllegalArgumentException(
                "Expected " + layout.getPatchCount() + " samples, got " + samples.size());
        }
        if (compensatedColors != null && compensatedColors.size() != samples.size()) {
            throw new IllegalArgumentException("Compensated colors must match the patch count");
        }
        this.layoutKey = layout.getKey();
        this.layoutName = layout.getName();
        this.rows = layout.getRows();
        this.cols = layout.getCols();
        this.bitDepth = bitDepth;
        this.samples = Collections.unmodifiableList(new ArrayList<>(samples));
        this.compensatedColors = compensatedColors == null ? null : deepCopy(compensatedColors);
        this.compensationFactors = compensationFactors == null ? null : compensationFactors.clone();
        this.markerCenters = markerCenters;
        this.chartBoundary = chartBoundary;
    }

    public String getLayoutKey() { return layoutKey; }
    public String getLayoutName() { return layoutName; }
    public int getRows() { return rows; }
    public int getCols() { return cols; }
    public BitDepth getBitDepth() { return bitDepth; }

    public int getPatchCount() {
        return samples.size();
    }

    public List<PatchSample> getSamples() {
        return samples;
    }

    /**
     * 原始颜色（行优先）
     */
    public List<double[]> getRawColors() {
        List<double[]> colors = new ArrayList<>(samples.size());
        for (PatchSample s : samples) {
            colors.add(s.getRgb());
        }
        return colors;
    }

    /**
     * 补偿后的颜色；未做补偿时为空
     */
    public Optional<List<double[]>> getCompensatedColors() {
        return compensatedColors == null ? Optional.empty() : Optional.of(deepCopy(compensatedColors));
    }

    public boolean isCompensated() {
        return compensatedColors != null;
    }

    /**
     * 每通道校正系数（中心 / 外圈）；未做补偿时为空
     */
    public Optional<double[]> getCompensationFactors() {
        return compensationFactors == null ? Optional.empty() : Optional.of(compensationFactors.clone());
    }

    public Quadrilateral getMarkerCenters() {
        return markerCenters;
    }

    public Quadrilateral getChartBoundary() {
        return chartBoundary;
    }

    private static List<double[]> deepCopy(List<double[]> colors) {
        List<double[]> copy = new ArrayList<>(colors.size());
        for (double[] c : colors) {
            copy.add(c.clone());
        }
        return Collections.unmodifiableList(copy);
    }

    @Override
    public String toString() {
        return String.format("ExtractionResult[%s: %d patches (%dx%d), %d-bit, compensated=%s]",
            layoutKey, samples.size(), rows, cols, bitDepth.getBits(), isCompensated());
    }
}
