package com.colorchart.vision.service;

import com.colorchart.vision.core.ChartExtraction;
import com.colorchart.vision.core.ExtractionResult;
import com.colorchart.vision.core.geometry.Point;
import com.colorchart.vision.core.geometry.Quadrilateral;
import com.colorchart.vision.core.marker.Marker;
import com.colorchart.vision.model.ColorChartReport;
import com.colorchart.vision.model.ReportFiles;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.core.Scalar;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 提取结果落盘
 * <p>
 * 输出目录下生成：
 * <ul>
 *   <li>colorchecker_extracted.png - 校正后的色卡图（保持源位深）</li>
 *   <li>detection_visualization.png - 8 位可视化图：标记轮廓、ID、色卡边界</li>
 *   <li>colorchecker_data.json - 版式信息与色块颜色</li>
 * </ul>
 */
@Component
public class ExtractionReportWriter {
    private static final Logger logger = LoggerFactory.getLogger(ExtractionReportWriter.class);

    public static final String EXTRACTED_IMAGE = "colorchecker_extracted.png";
    public static final String VISUALIZATION_IMAGE = "detection_visualization.png";
    public static final String DATA_FILE = "colorchecker_data.json";

    private static final Scalar MARKER_COLOR = new Scalar(255, 0, 0);
    private static final Scalar ID_COLOR = new Scalar(0, 0, 255);
    private static final Scalar BOUNDARY_COLOR = new Scalar(0, 255, 0);

    private final ObjectMapper objectMapper;

    public ExtractionReportWriter() {
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * 写出全部三个文件
     *
     * @param source     原始输入图像，用于绘制可视化图
     * @param extraction 提取结果（含校正图）
     * @param outputDir  输出目录，不存在时创建
     */
    public ReportFiles write(Mat source, ChartExtraction extraction, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create output directory " + outputDir, e);
        }

        Path extractedPath = outputDir.resolve(EXTRACTED_IMAGE);
        writeImage(extractedPath, extraction.getRectified().getImage());

        Path visualizationPath = outputDir.resolve(VISUALIZATION_IMAGE);
        Mat vis = renderVisualization(source, extraction);
        try {
            writeImage(visualizationPath, vis);
        } finally {
            vis.release();
        }

        Path dataPath = outputDir.resolve(DATA_FILE);
        writeJson(dataPath, extraction.getResult());

        logger.info("Report written to {}", outputDir.toAbsolutePath());
        return new ReportFiles(extractedPath.toString(), visualizationPath.toString(), dataPath.toString());
    }

    public void writeJson(Path path, ExtractionResult result) {
        try {
            objectMapper.writeValue(path.toFile(), ColorChartReport.from(result));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + path, e);
        }
    }

    /**
     * 8 位 BGR 可视化图；16 位输入按 1/257 缩放
     */
    Mat renderVisualization(Mat source, ChartExtraction extraction) {
        Mat vis = new Mat();
        Mat scaled = new Mat();
        try {
            if (source.depth() == CvType.CV_16U) {
                source.convertTo(scaled, CvType.CV_8U, 1.0 / 257.0);
            } else {
                source.copyTo(scaled);
            }
            switch (scaled.channels()) {
                case 1:
                    Imgproc.cvtColor(scaled, vis, Imgproc.COLOR_GRAY2BGR);
                    break;
                case 4:
                    Imgproc.cvtColor(scaled, vis, Imgproc.COLOR_BGRA2BGR);
                    break;
                default:
                    scaled.copyTo(vis);
            }
        } finally {
            scaled.release();
        }

        int thickness = Math.max(2, Math.max(vis.cols(), vis.rows()) / 500);

        for (Marker marker : extraction.getMarkers().values()) {
            drawPolygon(vis, marker.getCorners(), MARKER_COLOR, thickness);
            Point origin = marker.getCorner(0);
            Imgproc.putText(vis, "id=" + marker.getId(),
                new org.opencv.core.Point(origin.x, origin.y - 2.0 * thickness),
                Imgproc.FONT_HERSHEY_SIMPLEX, 0.4 * thickness, ID_COLOR, thickness);
        }

        Quadrilateral boundary = extraction.getResult().getChartBoundary();
        drawPolygon(vis, boundary.corners(), BOUNDARY_COLOR, thickness + 1);
        return vis;
    }

    private static void drawPolygon(Mat image, List<Point> corners, Scalar color, int thickness) {
        org.opencv.core.Point[] pts = new org.opencv.core.Point[corners.size()];
        for (int i = 0; i < pts.length; i++) {
            pts[i] = corners.get(i).toCv();
        }
        MatOfPoint polygon = new MatOfPoint(pts);
        try {
            List<MatOfPoint> polygons = new ArrayList<>();
            polygons.add(polygon);
            Imgproc.polylines(image, polygons, true, color, thickness, Imgproc.LINE_AA);
        } finally {
            polygon.release();
        }
    }

    private static void writeImage(Path path, Mat image) {
        if (!Imgcodecs.imwrite(path.toString(), image)) {
            throw new UncheckedIOException(new IOException("Failed to write image " + path));
        }
        logger.debug("Saved {} ({}x{}, depth {})", path, image.cols(), image.rows(),
            image.depth() == CvType.CV_16U ? 16 : 8);
    }
}
