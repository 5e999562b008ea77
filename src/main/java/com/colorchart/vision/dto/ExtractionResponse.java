package com.colorchart.vision.dto;

import com.colorchart.vision.core.ExtractionResult;
import com.colorchart.vision.core.geometry.Point;
import com.colorchart.vision.core.geometry.Quadrilateral;
import com.colorchart.vision.core.sampling.PatchSample;
import com.colorchart.vision.model.ExtractionOutcome;
import com.colorchart.vision.model.ReportFiles;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/**
 * 色卡提取响应
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExtractionResponse {
    private String layoutKey;
    private String layoutName;
    private int rows;
    private int cols;
    private int totalPatches;
    private int bitDepth;
    private boolean compensated;
    private double[] compensationFactors;
    private List<PatchColor> patches;
    private List<double[]> markerCenters;
    private List<double[]> chartBoundary;
    private ReportFiles files;
    private long processingTimeMs;

    public static ExtractionResponse from(ExtractionOutcome outcome) {
        ExtractionResult result = outcome.getResult();
        ExtractionResponse response = new ExtractionResponse();
        response.layoutKey = result.getLayoutKey();
        response.layoutName = result.getLayoutName();
        response.rows = result.getRows();
        response.cols = result.getCols();
        response.totalPatches = result.getPatchCount();
        response.bitDepth = result.getBitDepth().getBits();
        response.compensated = result.isCompensated();
        response.compensationFactors = result.getCompensationFactors().orElse(null);

        List<double[]> compensatedColors = result.getCompensatedColors().orElse(null);
        response.patches = new ArrayList<>();
        for (PatchSample sample : result.getSamples()) {
            PatchColor patch = new PatchColor();
            patch.setIndex(sample.getIndex());
            patch.setRow(sample.getRow());
            patch.setCol(sample.getCol());
            patch.setRgb(sample.getRgb());
            if (compensatedColors != null) {
                patch.setCompensatedRgb(compensatedColors.get(sample.getIndex()));
            }
            response.patches.add(patch);
        }

        response.markerCenters = toPoints(result.getMarkerCenters());
        response.chartBoundary = toPoints(result.getChartBoundary());
        response.files = outcome.getFiles();
        response.processingTimeMs = outcome.getProcessingTimeMs();
        return response;
    }

    private static List<double[]> toPoints(Quadrilateral quad) {
        List<double[]> points = new ArrayList<>(4);
        for (Point p : quad.corners()) {
            points.add(new double[]{p.x, p.y});
        }
        return points;
    }

    public String getLayoutKey() { return layoutKey; }
    public void setLayoutKey(String layoutKey) { this.layoutKey = layoutKey; }

    public String getLayoutName() { return layoutName; }
    public void setLayoutName(String layoutName) { this.layoutName = layoutName; }

    public int getRows() { return rows; }
    public void setRows(int rows) { this.rows = rows; }

    public int getCols() { return cols; }
    public void setCols(int cols) { this.cols = cols; }

    public int getTotalPatches() { return totalPatches; }
    public void setTotalPatches(int totalPatches) { this.totalPatches = totalPatches; }

    public int getBitDepth() { return bitDepth; }
    public void setBitDepth(int bitDepth) { this.bitDepth = bitDepth; }

    public boolean isCompensated() { return compensated; }
    public void setCompensated(boolean compensated) { this.compensated = compensated; }

    public double[] getCompensationFactors() { return compensationFactors; }
    public void setCompensationFactors(double[] compensationFactors) { this.compensationFactors = compensationFactors; }

    public List<PatchColor> getPatches() { return patches; }
    public void setPatches(List<PatchColor> patches) { this.patches = patches; }

    public List<double[]> getMarkerCenters() { return markerCenters; }
    public void setMarkerCenters(List<double[]> markerCenters) { this.markerCenters = markerCenters; }

    public List<double[]> getChartBoundary() { return chartBoundary; }
    public void setChartBoundary(List<double[]> chartBoundary) { this.chartBoundary = chartBoundary; }

    public ReportFiles getFiles() { return files; }
    public void setFiles(ReportFiles files) { this.files = files; }

    public long getProcessingTimeMs() { return processingTimeMs; }
    public void setProcessingTimeMs(long processingTimeMs) { this.processingTimeMs = processingTimeMs; }

    /**
     * 单个色块颜色（RGB，源图像位深）
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class PatchColor {
        private int index;
        private int row;
        private int col;
        private double[] rgb;
        private double[] compensatedRgb;

        public int getIndex() { return index; }
        public void setIndex(int index) { this.index = index; }

        public int getRow() { return row; }
        public void setRow(int row) { this.row = row; }

        public int getCol() { return col; }
        public void setCol(int col) { this.col = col; }

        public double[] getRgb() { return rgb; }
        public void setRgb(double[] rgb) { this.rgb = rgb; }

        public double[] getCompensatedRgb() { return compensatedRgb; }
        public void setCompensatedRgb(double[] compensatedRgb) { this.compensatedRgb = compensatedRgb; }
    }
}
