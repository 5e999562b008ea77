package com.colorchart.vision.model;

/**
 * 一次提取写出的文件路径
 */
public class ReportFiles {
    private String extractedImage;
    private String visualization;
    private String data;

    public ReportFiles() {
    }

    public ReportFiles(String extractedImage, String visualization, String data) {
        this.extractedImage = extractedImage;
        this.visualization = visualization;
        this.data = data;
    }

    public String getExtractedImage() { return extractedImage; }
    public void setExtractedImage(String extractedImage) { this.extractedImage = extractedImage; }

    public String getVisualization() { return visualization; }
    public void setVisualization(String visualization) { this.visualization = visualization; }

    public String getData() { return data; }
    public void setData(String data) { this.data = data; }
}
