package com.colorchart.vision.service;

import com.colorchart.vision.core.ChartExtraction;
import com.colorchart.vision.core.ChartExtractionPipeline;
import com.colorchart.vision.core.rectify.CameraModel;
import com.colorchart.vision.model.ExtractionOutcome;
import com.colorchart.vision.model.ReportFiles;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * 色卡提取服务
 * <p>
 * 解码 -> 流水线 -> (可选) 落盘。光照补偿不稳定时回退为原始颜色并返回提示。
 * 请求中的路径经 {@link WorkspacePaths} 限定在配置的输入/输出目录内。
 */
@Service
public class ChartExtractionService {
    private static final Logger logger = LoggerFactory.getLogger(ChartExtractionService.class);

    private static final DateTimeFormatter RUN_DIR_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    @Autowired
    private ChartExtractionPipeline pipeline;

    @Autowired
    private ImageDecoder imageDecoder;

    @Autowired
    private CameraModelLoader cameraModelLoader;

    @Autowired
    private ExtractionReportWriter reportWriter;

    @Autowired
    private WorkspacePaths workspacePaths;

    /**
     * 提取 Base64 图像中的色卡颜色
     *
     * @param imageBase64 图像数据
     * @param camera      相机模型，可为 null
     * @param compensate  是否做光照补偿
     * @param saveReport  是否写出图像和 JSON
     * @param outputDir   输出目录（相对输出根目录），为空时使用按时间命名的子目录
     */
    public ExtractionOutcome extract(String imageBase64, CameraModel camera, boolean compensate,
                                     boolean saveReport, String outputDir) {
        Mat image = imageDecoder.decodeBase64(imageBase64);
        try {
            return run(image, camera, compensate, saveReport ? resolveOutputDir(outputDir) : null);
        } finally {
            image.release();
        }
    }

    /**
     * 提取服务器本地图像文件中的色卡颜色，结果总是落盘
     */
    public ExtractionOutcome extractFile(String imagePath, String cameraParamsPath, boolean compensate,
                                         String outputDir) {
        CameraModel camera = StringUtils.hasText(cameraParamsPath)
            ? cameraModelLoader.load(workspacePaths.resolveInput(cameraParamsPath))
            : null;
        Mat image = imageDecoder.read(workspacePaths.resolveInput(imagePath));
        try {
            return run(image, camera, compensate, resolveOutputDir(outputDir));
        } finally {
            image.release();
        }
    }

    private ExtractionOutcome run(Mat image, CameraModel camera, boolean compensate, Path outputDir) {
        long startTime = System.currentTimeMillis();
        try (ChartExtraction extraction = pipeline.extractDetailed(image, camera, compensate, true)) {
            String warning = extraction.getCompensationWarning().orElse(null);
            ReportFiles files = null;
            if (outputDir != null) {
                files = reportWriter.write(image, extraction, outputDir);
            }
            long duration = System.currentTimeMillis() - startTime;
            logger.info("Chart extraction finished in {} ms: {}", duration, extraction.getResult());
            return new ExtractionOutcome(extraction.getResult(), warning, files, duration);
        }
    }

    private Path resolveOutputDir(String outputDir) {
        if (StringUtils.hasText(outputDir)) {
            return workspacePaths.resolveOutput(outputDir);
        }
        return workspacePaths.outputRoot().resolve(LocalDateTime.now().format(RUN_DIR_FORMAT));
    }
}
