package com.colorchart.vision.core.layout;

import com.colorchart.vision.core.ChartExtractionException;
import com.colorchart.vision.core.FailureKind;
import com.colorchart.vision.core.marker.ResolvedFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 色卡版式识别
 * <p>
 * 根据标记中心四边形的宽高比选择版式：
 * 1. 计算每个表项的相对偏差
 * 2. 只考虑偏差在各自容差内的表项
 * 3. 取偏差最小者；偏差相差不超过 TIE_EPSILON 视为平局，取表中靠前的
 */
public class ChartTypeClassifier {
    private static final Logger logger = LoggerFactory.getLogger(ChartTypeClassifier.class);

    static final double TIE_EPSILON = 1e-9;

    private final ChartLayoutTable table;

    public ChartTypeClassifier(ChartLayoutTable table) {
        if (table == null) {
            throw new IllegalArgumentException("table is required");
        }
        this.table = table;
    }

    public ChartLayout classify(ResolvedFrame frame) {
        return classify(frame.getCentroids().aspectRatio());
    }

    public ChartLayout classify(double ratio) {
        if (!Double.isFinite(ratio) || ratio <= 0) {
            throw new ChartExtractionException(FailureKind.UNRECOGNIZED_LAYOUT,
                "Cannot classify chart: invalid aspect ratio " + ratio);
        }

        ChartLayoutTable.Entry best = null;
        double bestDeviation = Double.MAX_VALUE;

        for (ChartLayoutTable.Entry entry : table.entries()) {
            double deviation = entry.deviation(ratio);
            logger.debug("Layout {}: ratio={}, deviation={}", entry.getLayout().getKey(), ratio, deviation);

            if (deviation > entry.getTolerance()) {
                continue;
            }
            if (best == null || deviation < bestDeviation - TIE_EPSILON) {
                best = entry;
                bestDeviation = deviation;
            }
        }

        if (best == null) {
            String message = String.format(
                "Unrecognized chart layout: marker aspect ratio %.3f matches none of %s", ratio, table.entries());
            logger.warn(message);
            throw new ChartExtractionException(FailureKind.UNRECOGNIZED_LAYOUT, message);
        }

        logger.info("Classified chart as {} (ratio={}, target={}, deviation={})",
            best.getLayout().getKey(), String.format("%.3f", ratio),
            String.format("%.3f", best.getTargetRatio()), String.format("%.3f", bestDeviation));
        return best.getLayout();
    }
}
