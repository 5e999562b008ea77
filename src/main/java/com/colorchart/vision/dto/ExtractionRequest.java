package com.colorchart.vision.dto;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * 色卡提取请求（Base64 图像）
 */
@Schema(description = "色卡提取请求")
public class ExtractionRequest {
    @Schema(description = "Base64 编码的图像，可带 data URL 前缀；支持 8/16 位", requiredMode = Schema.RequiredMode.REQUIRED)
    private String image;

    @Schema(description = "是否做光照补偿（仅对带灰阶参考的版式生效）", defaultValue = "true")
    private boolean compensate = true;

    @Schema(description = "相机内参矩阵 3x3，可选", example = "[[1200, 0, 960], [0, 1200, 540], [0, 0, 1]]")
    private double[][] cameraMatrix;

    @Schema(description = "畸变系数 k1, k2, p1, p2[, k3]，可选")
    private double[] distCoeffs;

    @Schema(description = "是否写出校正图、可视化图和 JSON", defaultValue = "false")
    private boolean saveReport;

    @Schema(description = "输出目录，为空时使用配置目录")
    private String outputDir;

    public String getImage() { return image; }
    public void setImage(String image) { this.image = image; }

    public boolean isCompensate() { return compensate; }
    public void setCompensate(boolean compensate) { this.compensate = compensate; }

    public double[][] getCameraMatrix() { return cameraMatrix; }
    public void setCameraMatrix(double[][] cameraMatrix) { this.cameraMatrix = cameraMatrix; }

    public double[] getDistCoeffs() { return distCoeffs; }
    public void setDistCoeffs(double[] distCoeffs) { this.distCoeffs = distCoeffs; }

    public boolean isSaveReport() { return saveReport; }
    public void setSaveReport(boolean saveReport) { this.saveReport = saveReport; }

    public String getOutputDir() { return outputDir; }
    public void setOutputDir(String outputDir) { this.outputDir = outputDir; }
}
