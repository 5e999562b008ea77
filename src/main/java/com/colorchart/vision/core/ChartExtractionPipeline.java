package com.colorchart.vision.core;

import com.colorchart.vision.core.illumination.CompensationResult;
import com.colorchart.vision.core.illumination.IlluminationCompensator;
import com.colorchart.vision.core.layout.ChartLayout;
import com.colorchart.vision.core.layout.ChartLayoutTable;
import com.colorchart.vision.core.layout.ChartTypeClassifier;
import com.colorchart.vision.core.marker.ArucoMarkerDetector;
import com.colorchart.vision.core.marker.Marker;
import com.colorchart.vision.core.marker.MarkerDetector;
import com.colorchart.vision.core.marker.MarkerRoleTable;
import com.colorchart.vision.core.marker.MarkerSetResolver;
import com.colorchart.vision.core.marker.ResolvedFrame;
import com.colorchart.vision.core.rectify.CameraModel;
import com.colorchart.vision.core.rectify.PerspectiveRectifier;
import com.colorchart.vision.core.rectify.RectifiedImage;
import com.colorchart.vision.core.sampling.PatchSample;
import com.colorchart.vision.core.sampling.PatchSampler;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 色卡检测与颜色提取流水线
 * <p>
 * 图像 (+相机模型) -> 标记检测 -> 标记集合解析 -> 版式识别 -> 透视校正 -> 色块取样 -> (光照补偿)
 * <p>
 * 每次调用相互独立，不保留状态；所有配置表在构建后只读，可被多个线程共享。
 */
public class ChartExtractionPipeline {
    private static final Logger logger = LoggerFactory.getLogger(ChartExtractionPipeline.class);

    private final MarkerDetector markerDetector;
    private final MarkerSetResolver resolver;
    private final ChartTypeClassifier classifier;
    private final PerspectiveRectifier rectifier;
    private final PatchSampler sampler;
    private final IlluminationCompensator compensator;

    public ChartExtractionPipeline(MarkerDetector markerDetector,
                                   MarkerSetResolver resolver,
                                   ChartTypeClassifier classifier,
                                   PerspectiveRectifier rectifier,
                                   PatchSampler sampler,
                                   IlluminationCompensator compensator) {
        this.markerDetector = markerDetector;
        this.resolver = resolver;
        this.classifier = classifier;
        this.rectifier = rectifier;
        this.sampler = sampler;
        this.compensator = compensator;
    }

    /**
     * 默认配置：ArUco DICT_4X4_100，ID 0-3 对应 TL/TR/BR/BL，内置两种版式
     */
    public static ChartExtractionPipeline withDefaults() {
        return new ChartExtractionPipeline(
            new ArucoMarkerDetector(),
            new MarkerSetResolver(MarkerRoleTable.defaults()),
            new ChartTypeClassifier(ChartLayoutTable.defaults()),
            new PerspectiveRectifier(),
            new PatchSampler(),
            new IlluminationCompensator());
    }

    /**
     * 提取色卡颜色
     *
     * @param image      源图像（8/16 位，1/3/4 通道，BGR 顺序）
     * @param camera     相机模型，可为 null
     * @param compensate 是否做光照补偿（仅对带灰阶参考的版式生效）
     */
    public ExtractionResult extract(Mat image, CameraModel camera, boolean compensate) {
        try (ChartExtraction extraction = extractDetailed(image, camera, compensate)) {
            return extraction.getResult();
        }
    }

    /**
     * 提取色卡颜色并保留校正图像和标记，调用方负责 {@link ChartExtraction#close()}
     */
    public ChartExtraction extractDetailed(Mat image, CameraModel camera, boolean compensate) {
        return extractDetailed(image, camera, compensate, false);
    }

    /**
     * 同上；rawOnUnstable 为 true 时，光照补偿不稳定不抛异常，而是返回原始颜色并记录提示，
     * 检测和校正只做一次。
     */
    public ChartExtraction extractDetailed(Mat image, CameraModel camera, boolean compensate,
                                           boolean rawOnUnstable) {
        validateInput(image);
        long startTime = System.currentTimeMillis();
        BitDepth bitDepth = BitDepth.of(image);

        Map<Integer, Marker> markers = markerDetector.detect(image);
        ResolvedFrame frame = resolver.resolve(markers);
        ChartLayout layout = classifier.classify(frame);

        RectifiedImage rectified = rectifier.rectify(image, frame, layout, camera);
        try {
            List<PatchSample> samples = sampler.sample(rectified, layout);

            List<double[]> compensated = null;
            double[] factors = null;
            String warning = null;
            if (compensate) {
                if (compensator.isApplicable(layout)) {
                    List<double[]> raw = samples.stream().map(PatchSample::getRgb).collect(Collectors.toList());
                    try {
                        CompensationResult compensation = compensator.compensate(raw, layout, bitDepth);
                        compensated = compensation.getColors();
                        factors = compensation.getRatio();
                    } catch (ChartExtractionException e) {
                        if (!rawOnUnstable || e.getKind() != FailureKind.COMPENSATION_UNSTABLE) {
                            throw e;
                        }
                        logger.warn("Illumination compensation unstable, keeping raw colors: {}", e.getMessage());
                        warning = e.getMessage();
                    }
                } else {
                    logger.info("Layout {} has no gray references, skipping illumination compensation",
                        layout.getKey());
                }
            }

            ExtractionResult result = new ExtractionResult(layout, bitDepth, samples, compensated, factors,
                frame.getCentroids(), rectified.getChartBoundary());
            logger.info("Extraction finished in {} ms: {}", System.currentTimeMillis() - startTime, result);
            return new ChartExtraction(result, rectified, markers, warning);

        } catch (RuntimeException e) {
            rectified.release();
            throw e;
        }
    }

    private static void validateInput(Mat image) {
        if (image == null || image.empty()) {
            throw new IllegalArgumentException("Input image is null or empty");
        }
        int channels = image.channels();
        if (channels != 1 && channels != 3 && channels != 4) {
            throw new IllegalArgumentException("Unsupported channel count: " + channels);
        }
        BitDepth.of(image);
    }
}
