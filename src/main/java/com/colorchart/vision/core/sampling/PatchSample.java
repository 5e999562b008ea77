package com.colorchart.vision.core.sampling;

/**
 * 单个色块的取样结果
 * <p>
 * 颜色为 RGB 顺序，取值范围与源图像一致（8 位 0–255，16 位 0–65535）。
 */
public final class PatchSample {
    private final int index;
    private final int row;
    private final int col;
    private final SamplingRegion region;
    private final double[] rgb;

    public PatchSample(int index, int row, int col, SamplingRegion region, double[] rgb) {
        if (rgb == null || rgb.length != 3) {
            throw new IllegalArgumentException("Patch color must be an RGB triple");
        }
        this.index = index;
        this.row = row;
        this.col = col;
        this.region = region;
        this.rgb = rgb.clone();
    }

    public int getIndex() { return index; }
    public int getRow() { return row; }
    public int getCol() { return col; }
    public SamplingRegion getRegion() { return region; }

    public double[] getRgb() {
        return rgb.clone();
    }

    @Override
    public String toString() {
        return String.format("Patch[%d (r%d,c%d): %.1f, %.1f, %.1f]", index, row, col, rgb[0], rgb[1], rgb[2]);
    }
}
