package com.colorchart.vision.core.illumination;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 光照补偿结果
 */
public final class CompensationResult {
    private final List<double[]> colors;
    private final double[] ratio;
    private final double[] peripheralMean;
    private final double[] centerMean;

    CompensationResult(List<double[]> colors, double[] ratio, double[] peripheralMean, double[] centerMean) {
        List<double[]> copy = new ArrayList<>(colors.size());
        for (double[] c : colors) {
            copy.add(c.clone());
        }
        this.colors = Collections.unmodifiableList(copy);
        this.ratio = ratio.clone();
        this.peripheralMean = peripheralMean.clone();
        this.centerMean = centerMean.clone();
    }

    /**
     * 补偿后的颜色（行优先，RGB）
     */
    public List<double[]> getColors() {
        List<double[]> copy = new ArrayList<>(colors.size());
        for (double[] c : colors) {
            copy.add(c.clone());
        }
        return copy;
    }

    /**
     * 每通道校正系数 = 中心灰阶均值 / 外圈灰阶均值
     */
    public double[] getRatio() {
        return ratio.clone();
    }

    public double[] getPeripheralMean() {
        return peripheralMean.clone();
    }

    public double[] getCenterMean() {
        return centerMean.clone();
    }
}
