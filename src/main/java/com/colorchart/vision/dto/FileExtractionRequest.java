package com.colorchart.vision.dto;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * 色卡提取请求（服务器本地文件）
 */
@Schema(description = "本地文件色卡提取请求")
public class FileExtractionRequest {
    @Schema(description = "图像路径", example = "data/input/colorchecker.png", requiredMode = Schema.RequiredMode.REQUIRED)
    private String imagePath;

    @Schema(description = "相机标定 JSON 路径（camera_matrix, dist_coeffs），可选")
    private String cameraParamsPath;

    @Schema(description = "是否做光照补偿", defaultValue = "true")
    private boolean compensate = true;

    @Schema(description = "输出目录，为空时使用配置目录")
    private String outputDir;

    public String getImagePath() { return imagePath; }
    public void setImagePath(String imagePath) { this.imagePath = imagePath; }

    public String getCameraParamsPath() { return cameraParamsPath; }
    public void setCameraParamsPath(String cameraParamsPath) { this.cameraParamsPath = cameraParamsPath; }

    public boolean isCompensate() { return compensate; }
    public void setCompensate(boolean compensate) { this.compensate = compensate; }

    public String getOutputDir() { return outputDir; }
    public void setOutputDir(String outputDir) { this.outputDir = outputDir; }
}
