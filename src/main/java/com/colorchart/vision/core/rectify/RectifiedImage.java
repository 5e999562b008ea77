package com.colorchart.vision.core.rectify;

import com.colorchart.vision.core.BitDepth;
import com.colorchart.vision.core.geometry.Quadrilateral;
import org.opencv.core.Mat;

/**
 * 校正后的色卡图像（色卡坐标系，固定像素/毫米密度）
 * <p>
 * 持有 native 内存，使用完毕后需 {@link #release()}。
 */
public class RectifiedImage implements AutoCloseable {
    private final Mat image;
    private final double pixelsPerMmX;
    private final double pixelsPerMmY;
    private final BitDepth bitDepth;
    private final Quadrilateral chartBoundary;

    public RectifiedImage(Mat image, double pixelsPerMmX, double pixelsPerMmY,
                          BitDepth bitDepth, Quadrilateral chartBoundary) {
        this.image = image;
        this.pixelsPerMmX = pixelsPerMmX;
        this.pixelsPerMmY = pixelsPerMmY;
        this.bitDepth = bitDepth;
        this.chartBoundary = chartBoundary;
    }

    public Mat getImage() {
        return image;
    }

    public int getWidth() {
        return image.cols();
    }

    public int getHeight() {
        return image.rows();
    }

    public double getPixelsPerMmX() {
        return pixelsPerMmX;
    }

    public double getPixelsPerMmY() {
        return pixelsPerMmY;
    }

    public BitDepth getBitDepth() {
        return bitDepth;
    }

    /**
     * 色卡边界在源图像中的位置 [TL, TR, BR, BL]（若提供了相机模型，则为去畸变后的坐标）
     */
    public Quadrilateral getChartBoundary() {
        return chartBoundary;
    }

    public void release() {
        image.release();
    }

    @Override
    public void close() {
        release();
    }
}
