package com.colorchart.vision.model;

import com.colorchart.vision.core.ExtractionResult;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.List;

/**
 * colorchecker_data.json 的内容
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ColorChartReport {
    @JsonProperty("colorchecker_type")
    private String colorcheckerType;

    @JsonProperty("colorchecker_name")
    private String colorcheckerName;

    private Layout layout;

    @JsonProperty("bit_depth")
    private int bitDepth;

    @JsonProperty("patch_colors")
    private List<double[]> patchColors;

    @JsonProperty("patch_colors_compensated")
    private List<double[]> patchColorsCompensated;

    @JsonProperty("compensation_factors")
    private double[] compensationFactors;

    @JsonProperty("created_at")
    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime createdAt;

    public static ColorChartReport from(ExtractionResult result) {
        ColorChartReport report = new ColorChartReport();
        report.colorcheckerType = result.getLayoutKey();
        report.colorcheckerName = result.getLayoutName();
        report.layout = new Layout(result.getRows(), result.getCols(), result.getPatchCount());
        report.bitDepth = result.getBitDepth().getBits();
        report.patchColors = result.getRawColors();
        report.patchColorsCompensated = result.getCompensatedColors().orElse(null);
        report.compensationFactors = result.getCompensationFactors().orElse(null);
        report.createdAt = LocalDateTime.now();
        return report;
    }

    public String getColorcheckerType() { return colorcheckerType; }
    public void setColorcheckerType(String colorcheckerType) { this.colorcheckerType = colorcheckerType; }

    public String getColorcheckerName() { return colorcheckerName; }
    public void setColorcheckerName(String colorcheckerName) { this.colorcheckerName = colorcheckerName; }

    public Layout getLayout() { return layout; }
    public void setLayout(Layout layout) { this.layout = layout; }

    public int getBitDepth() { return bitDepth; }
    public void setBitDepth(int bitDepth) { this.bitDepth = bitDepth; }

    public List<double[]> getPatchColors() { return patchColors; }
    public void setPatchColors(List<double[]> patchColors) { this.patchColors = patchColors; }

    public List<double[]> getPatchColorsCompensated() { return patchColorsCompensated; }
    public void setPatchColorsCompensated(List<double[]> patchColorsCompensated) { this.patchColorsCompensated = patchColorsCompensated; }

    public double[] getCompensationFactors() { return compensationFactors; }
    public void setCompensationFactors(double[] compensationFactors) { this.compensationFactors = compensationFactors; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public static class Layout {
        private int rows;
        private int cols;

        @JsonProperty("total_patches")
        private int totalPatches;

        public Layout() {
        }

        public Layout(int rows, int cols, int totalPatches) {
            this.rows = rows;
            this.cols = cols;
            this.totalPatches = totalPatches;
        }

        public int getRows() { return rows; }
        public void setRows(int rows) { this.rows = rows; }

        public int getCols() { return cols; }
        public void setCols(int cols) { this.cols = cols; }

        public int getTotalPatches() { return totalPatches; }
        public void setTotalPatches(int totalPatches) { this.totalPatches = totalPatches; }
    }
}
