package com.colorchart.vision.core;

import com.colorchart.vision.core.geometry.Point;
import com.colorchart.vision.core.layout.ChartLayout;
import com.colorchart.vision.core.marker.CornerRole;
import com.colorchart.vision.core.marker.MarkerRoleTable;
import com.colorchart.vision.core.rectify.CameraModel;
import org.opencv.calib3d.Calib3d;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDouble;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.opencv.objdetect.Dictionary;
import org.opencv.objdetect.Objdetect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * 测试用合成色卡：白底、四角 ArUco 标记、按版式铺满色块
 */
public final class SyntheticChartRenderer {

    public static final double SCALE = 3.0;
    public static final double MARGIN_MM = 40.0;

    private SyntheticChartRenderer() {
    }

    public static Mat render(ChartLayout layout, List<double[]> rgbColors) {
        return render(layout, rgbColors, Collections.emptySet());
    }

    /**
     * @param rgbColors      行优先的色块颜色（RGB, 0-255）
     * @param omittedMarkers 不绘制的标记 ID
     */
    public static Mat render(ChartLayout layout, List<double[]> rgbColors, Set<Integer> omittedMarkers) {
        int width = (int) Math.round((layout.getWidthMm() + 2 * MARGIN_MM) * SCALE);
        int height = (int) Math.round((layout.getHeightMm() + 2 * MARGIN_MM) * SCALE);
        Mat scene = new Mat(height, width, CvType.CV_8UC3, new Scalar(255, 255, 255));

        // 色卡底色
        Imgproc.rectangle(scene, px(0, 0), px(layout.getWidthMm(), layout.getHeightMm()),
            new Scalar(40, 40, 40), -1);

        for (int row = 0; row < layout.getRows(); row++) {
            for (int col = 0; col < layout.getCols(); col++) {
                double x0 = layout.getGridInsetXMm() + col * layout.getCellWidthMm();
                double y0 = layout.getGridInsetYMm() + row * layout.getCellHeightMm();
                double[] rgb = rgbColors.get(layout.indexOf(row, col));
                Imgproc.rectangle(scene, px(x0, y0),
                    px(x0 + layout.getCellWidthMm(), y0 + layout.getCellHeightMm()),
                    new Scalar(rgb[2], rgb[1], rgb[0]), -1);
            }
        }

        Dictionary dictionary = Objdetect.getPredefinedDictionary(Objdetect.DICT_4X4_100);
        MarkerRoleTable roles = MarkerRoleTable.defaults();
        int side = (int) Math.round(layout.getMarkerSizeMm() * SCALE);
        for (CornerRole role : CornerRole.values()) {
            int id = roles.idFor(role);
            if (omittedMarkers.contains(id)) {
                continue;
            }
            Point center = layout.markerCenterMm(role);
            int x = (int) Math.round((center.x + MARGIN_MM) * SCALE - side / 2.0);
            int y = (int) Math.round((center.y + MARGIN_MM) * SCALE - side / 2.0);

            Mat marker = new Mat();
            Mat markerBgr = new Mat();
            Objdetect.generateImageMarker(dictionary, id, side, marker, 1);
            Imgproc.cvtColor(marker, markerBgr, Imgproc.COLOR_GRAY2BGR);
            Mat target = scene.submat(new Rect(x, y, side, side));
            markerBgr.copyTo(target);
            target.release();
            marker.release();
            markerBgr.release();
        }
        return scene;
    }

    /**
     * 色卡坐标 (mm) -> 场景像素
     */
    public static org.opencv.core.Point px(double xMm, double yMm) {
        return new org.opencv.core.Point(
            Math.round((xMm + MARGIN_MM) * SCALE), Math.round((yMm + MARGIN_MM) * SCALE));
    }

    /**
     * 透视变换：四角按给定比例向内偏移，模拟倾斜拍摄
     */
    public static Mat tilt(Mat scene, double topInset, double bottomInset) {
        double w = scene.cols();
        double h = scene.rows();
        MatOfPoint2f src = new MatOfPoint2f(
            new org.opencv.core.Point(0, 0), new org.opencv.core.Point(w, 0),
            new org.opencv.core.Point(w, h), new org.opencv.core.Point(0, h));
        MatOfPoint2f dst = new MatOfPoint2f(
            new org.opencv.core.Point(w * topInset, h * 0.03), new org.opencv.core.Point(w * (1 - topInset), 0),
            new org.opencv.core.Point(w * (1 - bottomInset), h), new org.opencv.core.Point(w * bottomInset, h * 0.97));
        Mat homography = Imgproc.getPerspectiveTransform(src, dst);
        Mat warped = new Mat();
        Imgproc.warpPerspective(scene, warped, homography, new Size(w, h),
            Imgproc.INTER_LINEAR, Core.BORDER_CONSTANT, new Scalar(255, 255, 255));
        src.release();
        dst.release();
        homography.release();
        return warped;
    }

    /**
     * 先按对角线留白边再绕中心旋转，保证旋转后整张色卡仍在画面内
     */
    public static Mat rotate(Mat scene, double degrees) {
        double diagonal = Math.hypot(scene.cols(), scene.rows());
        int pad = (int) Math.ceil((diagonal - Math.min(scene.cols(), scene.rows())) / 2);
        Mat padded = new Mat();
        Core.copyMakeBorder(scene, padded, pad, pad, pad, pad, Core.BORDER_CONSTANT, new Scalar(255, 255, 255));

        org.opencv.core.Point center = new org.opencv.core.Point(padded.cols() / 2.0, padded.rows() / 2.0);
        Mat rotation = Imgproc.getRotationMatrix2D(center, degrees, 1.0);
        Mat rotated = new Mat();
        Imgproc.warpAffine(padded, rotated, rotation, padded.size(),
            Imgproc.INTER_LINEAR, Core.BORDER_CONSTANT, new Scalar(255, 255, 255));
        padded.release();
        rotation.release();
        return rotated;
    }

    /**
     * 按相机模型给理想场景加上镜头畸变
     * <p>
     * 畸变图中每个像素 p 取理想图中 undistort(p) 处的值，与校正阶段使用同一模型。
     */
    public static Mat distort(Mat scene, CameraModel camera) {
        int width = scene.cols();
        int height = scene.rows();
        float[] grid = new float[width * height * 2];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int i = (y * width + x) * 2;
                grid[i] = x;
                grid[i + 1] = y;
            }
        }
        MatOfPoint2f distorted = new MatOfPoint2f();
        distorted.alloc(width * height);
        distorted.put(0, 0, grid);

        MatOfPoint2f ideal = new MatOfPoint2f();
        Mat k = camera.cameraMatrix();
        MatOfDouble dist = camera.distortion();
        Calib3d.undistortPoints(distorted, ideal, k, dist, new Mat(), k);

        float[] mapped = new float[width * height * 2];
        ideal.get(0, 0, mapped);
        float[] xs = new float[width * height];
        float[] ys = new float[width * height];
        for (int i = 0; i < xs.length; i++) {
            xs[i] = mapped[2 * i];
            ys[i] = mapped[2 * i + 1];
        }
        Mat mapX = new Mat(height, width, CvType.CV_32FC1);
        Mat mapY = new Mat(height, width, CvType.CV_32FC1);
        mapX.put(0, 0, xs);
        mapY.put(0, 0, ys);

        Mat result = new Mat();
        Imgproc.remap(scene, result, mapX, mapY, Imgproc.INTER_LINEAR,
            Core.BORDER_CONSTANT, new Scalar(255, 255, 255));

        distorted.release();
        ideal.release();
        k.release();
        dist.release();
        mapX.release();
        mapY.release();
        return result;
    }

    /**
     * 按到色卡中心的归一化切比雪夫距离衰减亮度：gain = 1 - strength * d
     */
    public static void applyFalloff(Mat scene, ChartLayout layout, double strength) {
        int width = scene.cols();
        int height = scene.rows();
        int channels = scene.channels();
        byte[] data = new byte[width * height * channels];
        scene.get(0, 0, data);

        double cx = (layout.getWidthMm() / 2 + MARGIN_MM) * SCALE;
        double cy = (layout.getHeightMm() / 2 + MARGIN_MM) * SCALE;
        double halfW = layout.getWidthMm() / 2 * SCALE;
        double halfH = layout.getHeightMm() / 2 * SCALE;

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double d = Math.max(Math.abs(x + 0.5 - cx) / halfW, Math.abs(y + 0.5 - cy) / halfH);
                double gain = Math.max(0.3, 1.0 - strength * d);
                int offset = (y * width + x) * channels;
                for (int c = 0; c < channels; c++) {
                    int v = data[offset + c] & 0xFF;
                    data[offset + c] = (byte) Math.round(v * gain);
                }
            }
        }
        scene.put(0, 0, data);
    }

    /**
     * count 种互不相同的颜色
     */
    public static List<double[]> distinctColors(int count) {
        List<double[]> colors = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            colors.add(new double[]{
                30 + (i * 53) % 200,
                30 + (i * 97) % 200,
                30 + (i * 151) % 200});
        }
        return colors;
    }

    public static Mat to16Bit(Mat image8) {
        Mat image16 = new Mat();
        image8.convertTo(image16, CvType.CV_16U, 257.0);
        return image16;
    }
}
