package com.colorchart.vision.core.rectify;

import com.colorchart.vision.core.BitDepth;
import com.colorchart.vision.core.ChartExtractionException;
import com.colorchart.vision.core.FailureKind;
import com.colorchart.vision.core.geometry.Point;
import com.colorchart.vision.core.geometry.Quadrilateral;
import com.colorchart.vision.core.layout.ChartLayout;
import com.colorchart.vision.core.marker.CornerRole;
import com.colorchart.vision.core.marker.ResolvedFrame;
import org.opencv.calib3d.Calib3d;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDouble;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 透视校正
 * <p>
 * 流程：
 * 1. （可选）用相机模型对标记中心和图像去畸变
 * 2. 标记中心 -> 其在色卡坐标系中的已知位置，反推色卡边界在图像中的四边形
 * 3. 色卡边界 -> 正视矩形 (0,0)-(Wpx,Hpx) 的单应矩阵
 * 4. 双线性插值重采样
 */
public class PerspectiveRectifier {
    private static final Logger logger = LoggerFactory.getLogger(PerspectiveRectifier.class);

    public static final double DEFAULT_PIXELS_PER_MM = 5.0;

    // 色卡边界允许超出源图像的范围（以图像尺寸为单位）
    private static final double MAX_BOUNDARY_EXTENT = 4.0;
    private static final long MAX_OUTPUT_PIXELS = 100_000_000L;

    private final double pixelsPerMm;

    public PerspectiveRectifier() {
        this(DEFAULT_PIXELS_PER_MM);
    }

    public PerspectiveRectifier(double pixelsPerMm) {
        if (!(pixelsPerMm > 0)) {
            throw new IllegalArgumentException("pixelsPerMm must be positive: " + pixelsPerMm);
        }
        this.pixelsPerMm = pixelsPerMm;
    }

    public double getPixelsPerMm() {
        return pixelsPerMm;
    }

    /**
     * 正视图的像素尺寸
     */
    public Size canonicalSize(ChartLayout layout) {
        long w = Math.round(layout.getWidthMm() * pixelsPerMm);
        long h = Math.round(layout.getHeightMm() * pixelsPerMm);
        if (w <= 0 || h <= 0 || w * h > MAX_OUTPUT_PIXELS) {
            throw new IllegalArgumentException("Canonical chart size out of range: " + w + "x" + h);
        }
        return new Size(w, h);
    }

    /**
     * 由标记框校正色卡
     *
     * @param image  源图像
     * @param frame  已解析的标记框
     * @param layout 已识别的版式
     * @param camera 相机模型，可为 null
     */
    public RectifiedImage rectify(Mat image, ResolvedFrame frame, ChartLayout layout, CameraModel camera) {
        Quadrilateral markerQuad = frame.getCentroids();
        Mat source = image;

        try {
            if (camera != null) {
                markerQuad = undistortPoints(markerQuad, camera);
                source = undistortImage(image, camera);
                logger.debug("Undistorted marker centres: {}", markerQuad);
            }

            Quadrilateral boundary = chartBoundary(markerQuad, layout);
            checkBoundary(boundary, source);
            logger.debug("Chart boundary in image: {}", boundary);

            return rectify(source, boundary, layout);
        } finally {
            if (source != image) {
                source.release();
            }
        }
    }

    /**
     * 由色卡边界四边形直接校正
     */
    public RectifiedImage rectify(Mat source, Quadrilateral boundary, ChartLayout layout) {
        BitDepth bitDepth = BitDepth.of(source);
        Size size = canonicalSize(layout);
        double sx = size.width / layout.getWidthMm();
        double sy = size.height / layout.getHeightMm();

        MatOfPoint2f src = boundary.toMat();
        MatOfPoint2f dst = Quadrilateral.rectangle(0, 0, size.width, size.height).toMat();
        Mat homography = Imgproc.getPerspectiveTransform(src, dst);

        Mat warped = new Mat();
        Imgproc.warpPerspective(source, warped, homography, size,
            Imgproc.INTER_LINEAR, Core.BORDER_CONSTANT, Scalar.all(0));

        src.release();
        dst.release();
        homography.release();

        logger.info("Rectified {} chart to {}x{} ({} px/mm)",
            layout.getKey(), (int) size.width, (int) size.height, pixelsPerMm);
        return new RectifiedImage(warped, sx, sy, bitDepth, boundary);
    }

    /**
     * 由标记中心推算色卡边界在图像中的四边形
     * <p>
     * 先求 正视坐标(标记中心) -> 图像坐标 的单应，再映射正视矩形的四个角。
     */
    public Quadrilateral chartBoundary(Quadrilateral markerQuad, ChartLayout layout) {
        Size size = canonicalSize(layout);
        double sx = size.width / layout.getWidthMm();
        double sy = size.height / layout.getHeightMm();

        Point[] canonicalMarkers = new Point[4];
        for (CornerRole role : CornerRole.values()) {
            Point mm = layout.markerCenterMm(role);
            canonicalMarkers[role.ordinal()] = new Point(mm.x * sx, mm.y * sy);
        }

        MatOfPoint2f canonical = Quadrilateral.of(canonicalMarkers).toMat();
        MatOfPoint2f observed = markerQuad.toMat();
        Mat canonicalToImage = Imgproc.getPerspectiveTransform(canonical, observed);

        MatOfPoint2f chartCanonical = Quadrilateral.rectangle(0, 0, size.width, size.height).toMat();
        MatOfPoint2f chartImage = new MatOfPoint2f();
        Core.perspectiveTransform(chartCanonical, chartImage, canonicalToImage);
        Quadrilateral boundary = Quadrilateral.fromMat(chartImage);

        canonical.release();
        observed.release();
        canonicalToImage.release();
        chartCanonical.release();
        chartImage.release();
        return boundary;
    }

    private void checkBoundary(Quadrilateral boundary, Mat source) {
        if (!boundary.isFinite()) {
            throw new ChartExtractionException(FailureKind.DEGENERATE_GEOMETRY,
                "Chart boundary could not be computed from the marker positions");
        }
        double w = source.cols();
        double h = source.rows();
        for (Point p : boundary.corners()) {
            if (p.x < -MAX_BOUNDARY_EXTENT * w || p.x > (1 + MAX_BOUNDARY_EXTENT) * w
                || p.y < -MAX_BOUNDARY_EXTENT * h || p.y > (1 + MAX_BOUNDARY_EXTENT) * h) {
                throw new ChartExtractionException(FailureKind.DEGENERATE_GEOMETRY,
                    "Chart boundary " + boundary + " lies far outside the " + (int) w + "x" + (int) h + " image");
            }
        }
    }

    private Quadrilateral undistortPoints(Quadrilateral quad, CameraModel camera) {
        MatOfPoint2f src = quad.toMat();
        MatOfPoint2f dst = new MatOfPoint2f();
        Mat k = camera.cameraMatrix();
        MatOfDouble dist = camera.distortion();

        // P = K，结果仍为像素坐标
        Calib3d.undistortPoints(src, dst, k, dist, new Mat(), k);
        Quadrilateral result = Quadrilateral.fromMat(dst);

        src.release();
        dst.release();
        k.release();
        dist.release();
        return result;
    }

    private Mat undistortImage(Mat image, CameraModel camera) {
        Mat k = camera.cameraMatrix();
        MatOfDouble dist = camera.distortion();
        Mat undistorted = new Mat();
        Calib3d.undistort(image, undistorted, k, dist);
        k.release();
        dist.release();
        return undistorted;
    }
}
