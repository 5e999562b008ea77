package com.colorchart.vision.core.layout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 版式识别表
 * <p>
 * 有序列表：每项为版式 + 目标宽高比 + 相对容差。声明顺序决定平局时的优先级。
 * 构建后不可变。
 */
public final class ChartLayoutTable {

    public static final double DEFAULT_TOLERANCE = 0.15;

    private final List<Entry> entries;

    private ChartLayoutTable(List<Entry> entries) {
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    /**
     * 内置表：classic 在前，digitalsg 在后
     */
    public static ChartLayoutTable defaults() {
        return defaults(DEFAULT_TOLERANCE);
    }

    public static ChartLayoutTable defaults(double tolerance) {
        return builder()
            .add(ChartLayouts.classic(), tolerance)
            .add(ChartLayouts.digitalSg(), tolerance)
            .build();
    }

    public List<Entry> entries() {
        return entries;
    }

    public Optional<ChartLayout> find(String key) {
        for (Entry e : entries) {
            if (e.layout.getKey().equals(key)) {
                return Optional.of(e.layout);
            }
        }
        return Optional.empty();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 识别表项
     */
    public static final class Entry {
        private final ChartLayout layout;
        private final double targetRatio;
        private final double tolerance;

        public Entry(ChartLayout layout, double targetRatio, double tolerance) {
            if (layout == null) {
                throw new IllegalArgumentException("layout is required");
            }
            if (!(targetRatio > 0) || !(tolerance > 0)) {
                throw new IllegalArgumentException("targetRatio and tolerance must be positive");
            }
            this.layout = layout;
            this.targetRatio = targetRatio;
            this.tolerance = tolerance;
        }

        public ChartLayout getLayout() { return layout; }
        public double getTargetRatio() { return targetRatio; }
        public double getTolerance() { return tolerance; }

        /**
         * 相对偏差 |ratio - target| / target
         */
        public double deviation(double ratio) {
            return Math.abs(ratio - targetRatio) / targetRatio;
        }

        @Override
        public String toString() {
            return String.format("%s(target=%.4f, tol=%.2f)", layout.getKey(), targetRatio, tolerance);
        }
    }

    public static class Builder {
        private final List<Entry> entries = new ArrayList<>();

        /**
         * 以标记中心四边形的理论宽高比作为目标
         */
        public Builder add(ChartLayout layout, double tolerance) {
            return add(layout, layout.markerAspectRatio(), tolerance);
        }

        public Builder add(ChartLayout layout, double targetRatio, double tolerance) {
            for (Entry e : entries) {
                if (e.layout.getKey().equals(layout.getKey())) {
                    throw new IllegalArgumentException("Duplicate layout key: " + layout.getKey());
                }
            }
            entries.add(new Entry(layout, targetRatio, tolerance));
            return this;
        }

        public ChartLayoutTable build() {
            if (entries.isEmpty()) {
                throw new IllegalArgumentException("At least one layout required");
            }
            return new ChartLayoutTable(entries);
        }
    }
}
