package com.colorchart.vision.core.sampling;

import com.colorchart.vision.core.layout.ChartLayout;
import com.colorchart.vision.core.rectify.RectifiedImage;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 色块取样
 * <p>
 * 每个网格单元只取中心区域（面积占比 sampleAreaFraction），避开色块边缘和印刷瑕疵，
 * 区域内所有像素按通道求算术平均。不做离群值剔除，也不在 8/16 位之间缩放。
 */
public class PatchSampler {
    private static final Logger logger = LoggerFactory.getLogger(PatchSampler.class);

    public static final double DEFAULT_SAMPLE_AREA_FRACTION = 0.4;

    // 取样区域边长占单元边长的比例
    private final double sideFraction;

    public PatchSampler() {
        this(DEFAULT_SAMPLE_AREA_FRACTION);
    }

    public PatchSampler(double sampleAreaFraction) {
        if (!(sampleAreaFraction > 0) || sampleAreaFraction > 1) {
            throw new IllegalArgumentException("sampleAreaFraction must be in (0, 1]: " + sampleAreaFraction);
        }
        this.sideFraction = Math.sqrt(sampleAreaFraction);
    }

    public List<PatchSample> sample(RectifiedImage rectified, ChartLayout layout) {
        Mat image = rectified.getImage();
        List<PatchSample> samples = new ArrayList<>(layout.getPatchCount());

        for (int row = 0; row < layout.getRows(); row++) {
            for (int col = 0; col < layout.getCols(); col++) {
                int index = layout.indexOf(row, col);
                SamplingRegion region = region(rectified, layout, row, col);

                Mat roi = image.submat(region.toRect());
                Scalar mean = Core.mean(roi);
                roi.release();

                samples.add(new PatchSample(index, row, col, region, toRgb(mean, image.channels())));
            }
        }

        logger.info("Sampled {} patches ({}x{}) from {} chart",
            samples.size(), layout.getRows(), layout.getCols(), layout.getKey());
        return samples;
    }

    /**
     * 计算网格单元 (row, col) 的取样区域
     */
    public SamplingRegion region(RectifiedImage rectified, ChartLayout layout, int row, int col) {
        double sx = rectified.getPixelsPerMmX();
        double sy = rectified.getPixelsPerMmY();
        double cellW = layout.getCellWidthMm() * sx;
        double cellH = layout.getCellHeightMm() * sy;
        double cx = (layout.getGridInsetXMm() + (col + 0.5) * layout.getCellWidthMm()) * sx;
        double cy = (layout.getGridInsetYMm() + (row + 0.5) * layout.getCellHeightMm()) * sy;

        double halfW = cellW * sideFraction / 2.0;
        double halfH = cellH * sideFraction / 2.0;

        int[] xs = clampSpan(cx - halfW, cx + halfW, rectified.getWidth());
        int[] ys = clampSpan(cy - halfH, cy + halfH, rectified.getHeight());
        return new SamplingRegion(xs[0], ys[0], xs[1], ys[1]);
    }

    /**
     * 取整并裁剪到 [0, limit)，至少保留一个像素
     */
    private static int[] clampSpan(double from, double to, int limit) {
        int lo = (int) Math.round(from);
        int hi = (int) Math.round(to);
        lo = Math.max(0, Math.min(lo, limit - 1));
        hi = Math.max(lo + 1, Math.min(hi, limit));
        return new int[]{lo, hi};
    }

    /**
     * OpenCV 通道顺序 (B, G, R[, A]) -> RGB；灰度复制到三个通道
     */
    static double[] toRgb(Scalar mean, int channels) {
        if (channels == 1) {
            return new double[]{mean.val[0], mean.val[0], mean.val[0]};
        }
        return new double[]{mean.val[2], mean.val[1], mean.val[0]};
    }
}
