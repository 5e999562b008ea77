package com.colorchart.vision.core.layout;

import com.colorchart.vision.core.geometry.Point;
import com.colorchart.vision.core.marker.CornerRole;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 色卡版式（静态配置）
 * <p>
 * 物理坐标系：原点在色卡左上角，x 向右，y 向下，单位毫米。
 * 色块网格位于色卡内缩 gridInset 后的区域，按行优先编号。
 * 标记中心位于色卡四角沿两个轴各向外 markerOffset 处。
 */
public final class ChartLayout {
    private final String key;
    private final String name;
    private final int rows;
    private final int cols;
    private final double widthMm;
    private final double heightMm;
    private final double gridInsetXMm;
    private final double gridInsetYMm;
    private final double markerOffsetMm;
    private final double markerSizeMm;
    private final Map<Integer, GrayRole> grayRoles;

    private ChartLayout(Builder builder) {
        this.key = builder.key;
        this.name = builder.name;
        this.rows = builder.rows;
        this.cols = builder.cols;
        this.widthMm = builder.widthMm;
        this.heightMm = builder.heightMm;
        this.gridInsetXMm = builder.gridInsetXMm;
        this.gridInsetYMm = builder.gridInsetYMm;
        this.markerOffsetMm = builder.markerOffsetMm;
        this.markerSizeMm = builder.markerSizeMm;
        this.grayRoles = Collections.unmodifiableMap(new TreeMap<>(builder.grayRoles));
    }

    public String getKey() { return key; }
    public String getName() { return name; }
    public int getRows() { return rows; }
    public int getCols() { return cols; }
    public double getWidthMm() { return widthMm; }
    public double getHeightMm() { return heightMm; }
    public double getGridInsetXMm() { return gridInsetXMm; }
    public double getGridInsetYMm() { return gridInsetYMm; }
    public double getMarkerOffsetMm() { return markerOffsetMm; }
    public double getMarkerSizeMm() { return markerSizeMm; }

    public int getPatchCount() {
        return rows * cols;
    }

    public double getCellWidthMm() {
        return (widthMm - 2 * gridInsetXMm) / cols;
    }

    public double getCellHeightMm() {
        return (heightMm - 2 * gridInsetYMm) / rows;
    }

    public int indexOf(int row, int col) {
        return row * cols + col;
    }

    /**
     * 色块中心的物理坐标
     */
    public Point patchCenterMm(int index) {
        checkIndex(index);
        int row = index / cols;
        int col = index % cols;
        return new Point(
            gridInsetXMm + (col + 0.5) * getCellWidthMm(),
            gridInsetYMm + (row + 0.5) * getCellHeightMm());
    }

    /**
     * 标记中心的物理坐标
     */
    public Point markerCenterMm(CornerRole role) {
        double o = markerOffsetMm;
        switch (role) {
            case TOP_LEFT:
                return new Point(-o, -o);
            case TOP_RIGHT:
                return new Point(widthMm + o, -o);
            case BOTTOM_RIGHT:
                return new Point(widthMm + o, heightMm + o);
            case BOTTOM_LEFT:
                return new Point(-o, heightMm + o);
            default:
                throw new IllegalArgumentException("Unknown role: " + role);
        }
    }

    /**
     * 标记中心四边形的理论宽高比
     */
    public double markerAspectRatio() {
        return (widthMm + 2 * markerOffsetMm) / (heightMm + 2 * markerOffsetMm);
    }

    public GrayRole grayRole(int index) {
        return grayRoles.get(index);
    }

    public Map<Integer, GrayRole> getGrayRoles() {
        return grayRoles;
    }

    public List<Integer> indicesWithRole(GrayRole role) {
        List<Integer> indices = new ArrayList<>();
        for (Map.Entry<Integer, GrayRole> e : grayRoles.entrySet()) {
            if (e.getValue() == role) {
                indices.add(e.getKey());
            }
        }
        return indices;
    }

    /**
     * 同时具有外圈和中心灰阶参考时才能做光照补偿
     */
    public boolean hasIlluminationReferences() {
        return grayRoles.containsValue(GrayRole.PERIPHERAL) && grayRoles.containsValue(GrayRole.CENTER);
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= getPatchCount()) {
            throw new IndexOutOfBoundsException("Patch index " + index + " out of range 0.." + (getPatchCount() - 1));
        }
    }

    public static Builder builder(String key) {
        return new Builder().key(key);
    }

    public static class Builder {
        private String key;
        private String name;
        private int rows;
        private int cols;
        private double widthMm;
        private double heightMm;
        private double gridInsetXMm;
        private double gridInsetYMm;
        private double markerOffsetMm;
        private double markerSizeMm;
        private final Map<Integer, GrayRole> grayRoles = new TreeMap<>();

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder grid(int rows, int cols) {
            this.rows = rows;
            this.cols = cols;
            return this;
        }

        public Builder size(double widthMm, double heightMm) {
            this.widthMm = widthMm;
            this.heightMm = heightMm;
            return this;
        }

        public Builder gridInset(double insetXMm, double insetYMm) {
            this.gridInsetXMm = insetXMm;
            this.gridInsetYMm = insetYMm;
            return this;
        }

        public Builder marker(double offsetMm, double sizeMm) {
            this.markerOffsetMm = offsetMm;
            this.markerSizeMm = sizeMm;
            return this;
        }

        public Builder gray(GrayRole role, Iterable<Integer> indices) {
            for (int index : indices) {
                grayRoles.put(index, role);
            }
            return this;
        }

        public ChartLayout build() {
            if (key == null || key.isEmpty()) {
                throw new IllegalArgumentException("Layout key is required");
            }
            if (rows <= 0 || cols <= 0) {
                throw new IllegalArgumentException("Layout grid must be positive: " + rows + "x" + cols);
            }
            if (widthMm <= 0 || heightMm <= 0) {
                throw new IllegalArgumentException("Layout size must be positive");
            }
            if (gridInsetXMm < 0 || gridInsetYMm < 0
                || 2 * gridInsetXMm >= widthMm || 2 * gridInsetYMm >= heightMm) {
                throw new IllegalArgumentException("Grid inset leaves no patch area");
            }
            for (int index : grayRoles.keySet()) {
                if (index < 0 || index >= rows * cols) {
                    throw new IllegalArgumentException("Gray reference index out of range: " + index);
                }
            }
            if (name == null) {
                name = key;
            }
            return new ChartLayout(this);
        }
    }

    /**
     * 每种角色的参考数量，用于日志
     */
    public Map<GrayRole, Integer> grayRoleCounts() {
        Map<GrayRole, Integer> counts = new EnumMap<>(GrayRole.class);
        for (GrayRole role : grayRoles.values()) {
            counts.merge(role, 1, Integer::sum);
        }
        return counts;
    }

    @Override
    public String toString() {
        return String.format("ChartLayout[%s: %dx%d, %.1fx%.1f mm, gray=%s]",
            key, rows, cols, widthMm, heightMm, grayRoleCounts());
    }
}
