package com.colorchart.vision.core.layout;

import java.util.ArrayList;
import java.util.List;

/**
 * 内置色卡版式
 * <p>
 * 尺寸、标记偏移和标记边长必须与打印模板一致：
 * 标记边长 20 mm，标记中心距色卡角 15 mm（两个轴向）。
 * 网格内缩取色卡尺寸的 5%。
 */
public final class ChartLayouts {

    public static final String CLASSIC = "classic";
    public static final String DIGITAL_SG = "digitalsg";

    public static final double MARKER_OFFSET_MM = 15.0;
    public static final double MARKER_SIZE_MM = 20.0;
    private static final double GRID_INSET_RATIO = 0.05;

    private ChartLayouts() {
    }

    /**
     * ColorChecker Classic：4 行 x 6 列，24 色块，无灰阶参考
     */
    public static ChartLayout classic() {
        double w = 215.9;
        double h = 139.7;
        return ChartLayout.builder(CLASSIC)
            .name("ColorChecker Classic")
            .grid(4, 6)
            .size(w, h)
            .gridInset(w * GRID_INSET_RATIO, h * GRID_INSET_RATIO)
            .marker(MARKER_OFFSET_MM, MARKER_SIZE_MM)
            .build();
    }

    /**
     * ColorChecker Digital SG：10 行 x 14 列，140 色块
     * <p>
     * 外圈一周为外圈灰阶参考，正中 2x2 为中心灰阶参考
     */
    public static ChartLayout digitalSg() {
        int rows = 10;
        int cols = 14;
        double w = 215.9;
        double h = 279.4;
        return ChartLayout.builder(DIGITAL_SG)
            .name("ColorChecker Digital SG")
            .grid(rows, cols)
            .size(w, h)
            .gridInset(w * GRID_INSET_RATIO, h * GRID_INSET_RATIO)
            .marker(MARKER_OFFSET_MM, MARKER_SIZE_MM)
            .gray(GrayRole.PERIPHERAL, outerRing(rows, cols))
            .gray(GrayRole.CENTER, centerBlock(rows, cols))
            .build();
    }

    /**
     * 网格最外圈的行优先索引
     */
    static List<Integer> outerRing(int rows, int cols) {
        List<Integer> indices = new ArrayList<>();
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                if (r == 0 || r == rows - 1 || c == 0 || c == cols - 1) {
                    indices.add(r * cols + c);
                }
            }
        }
        return indices;
    }

    /**
     * 网格正中的色块（偶数维取中间两格，奇数维取中间一格）
     */
    static List<Integer> centerBlock(int rows, int cols) {
        List<Integer> indices = new ArrayList<>();
        int r0 = (rows - 1) / 2;
        int r1 = rows / 2;
        int c0 = (cols - 1) / 2;
        int c1 = cols / 2;
        for (int r = r0; r <= r1; r++) {
            for (int c = c0; c <= c1; c++) {
                indices.add(r * cols + c);
            }
        }
        return indices;
    }
}
