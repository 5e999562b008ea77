package com.colorchart.vision.core.illumination;

import com.colorchart.vision.core.BitDepth;
import com.colorchart.vision.core.ChartExtractionException;
import com.colorchart.vision.core.FailureKind;
import com.colorchart.vision.core.geometry.Point;
import com.colorchart.vision.core.layout.ChartLayout;
import com.colorchart.vision.core.layout.GrayRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 光照补偿
 * <p>
 * 假设光照在色卡上平滑变化：
 * 1. 分别求外圈灰阶和中心灰阶参考的平均颜色
 * 2. 每通道校正系数 ratio = 中心均值 / 外圈均值
 * 3. 非参考色块按其到色卡中心的距离线性插值：
 *    w = clamp((d - dC) / (dP - dC), 0, 1)，factor = 1 + w * (ratio - 1)
 *    d 为色块中心相对色卡中心的归一化切比雪夫距离，dP / dC 为外圈 / 中心参考的平均距离。
 * 参考色块本身原样输出。
 */
public class IlluminationCompensator {
    private static final Logger logger = LoggerFactory.getLogger(IlluminationCompensator.class);

    public static final double DEFAULT_MIN_SIGNAL_FRACTION = 0.005;

    // 外圈灰阶均值的下限（满量程的比例）
    private final double minSignalFraction;

    public IlluminationCompensator() {
        this(DEFAULT_MIN_SIGNAL_FRACTION);
    }

    public IlluminationCompensator(double minSignalFraction) {
        if (!(minSignalFraction > 0) || minSignalFraction >= 1) {
            throw new IllegalArgumentException("minSignalFraction must be in (0, 1): " + minSignalFraction);
        }
        this.minSignalFraction = minSignalFraction;
    }

    public boolean isApplicable(ChartLayout layout) {
        return layout.hasIlluminationReferences();
    }

    /**
     * @param raw      行优先的原始颜色（RGB）
     * @param layout   版式，必须同时包含外圈和中心灰阶参考
     * @param bitDepth 位深，用于下限判断和裁剪
     */
    public CompensationResult compensate(List<double[]> raw, ChartLayout layout, BitDepth bitDepth) {
        if (!isApplicable(layout)) {
            throw new IllegalStateException("Layout " + layout.getKey() + " has no illumination references");
        }
        if (raw.size() != layout.getPatchCount()) {
            throw new IllegalArgumentException(
                "Expected " + layout.getPatchCount() + " colors, got " + raw.size());
        }

        List<Integer> peripheral = layout.indicesWithRole(GrayRole.PERIPHERAL);
        List<Integer> center = layout.indicesWithRole(GrayRole.CENTER);
        double[] peripheralMean = meanColor(raw, peripheral);
        double[] centerMean = meanColor(raw, center);

        double minSignal = minSignalFraction * bitDepth.getMaxValue();
        for (int ch = 0; ch < 3; ch++) {
            if (peripheralMean[ch] < minSignal) {
                String message = String.format(
                    "Peripheral gray reference too dark for compensation (channel %d mean %.2f < %.2f) "
                        + "- increase exposure or use raw colors", ch, peripheralMean[ch], minSignal);
                logger.warn(message);
                throw new ChartExtractionException(FailureKind.COMPENSATION_UNSTABLE, message);
            }
        }

        double[] ratio = new double[3];
        for (int ch = 0; ch < 3; ch++) {
            ratio[ch] = centerMean[ch] / peripheralMean[ch];
        }

        double dPeripheral = meanDistance(layout, peripheral);
        double dCenter = meanDistance(layout, center);
        double span = dPeripheral - dCenter;

        List<double[]> compensated = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            double[] color = raw.get(i);
            if (layout.grayRole(i) != null) {
                compensated.add(color.clone());
                continue;
            }

            double w = span > 1e-9
                ? clamp((normalizedDistance(layout, i) - dCenter) / span, 0, 1)
                : 1.0;

            double[] out = new double[3];
            for (int ch = 0; ch < 3; ch++) {
                double factor = 1.0 + w * (ratio[ch] - 1.0);
                out[ch] = clamp(color[ch] * factor, 0, bitDepth.getMaxValue());
            }
            compensated.add(out);
        }

        logger.info("Illumination compensation ratio (RGB): {}", Arrays.toString(ratio));
        return new CompensationResult(compensated, ratio, peripheralMean, centerMean);
    }

    /**
     * 色块中心相对色卡中心的归一化切比雪夫距离（色卡边缘为 1）
     */
    static double normalizedDistance(ChartLayout layout, int index) {
        Point p = layout.patchCenterMm(index);
        double halfW = layout.getWidthMm() / 2.0;
        double halfH = layout.getHeightMm() / 2.0;
        double dx = Math.abs(p.x - halfW) / halfW;
        double dy = Math.abs(p.y - halfH) / halfH;
        return Math.max(dx, dy);
    }

    private static double meanDistance(ChartLayout layout, List<Integer> indices) {
        double sum = 0;
        for (int i : indices) {
            sum += normalizedDistance(layout, i);
        }
        return sum / indices.size();
    }

    private static double[] meanColor(List<double[]> colors, List<Integer> indices) {
        double[] sum = new double[3];
        for (int i : indices) {
            double[] c = colors.get(i);
            for (int ch = 0; ch < 3; ch++) {
                sum[ch] += c[ch];
            }
        }
        for (int ch = 0; ch < 3; ch++) {
            sum[ch] /= indices.size();
        }
        return sum;
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
