package com.colorchart.vision.core.sampling;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.opencv.core.Rect;

/**
 * 取样区域（校正图像中的像素矩形，[minX, maxX) x [minY, maxY)）
 */
public final class SamplingRegion {
    private final int minX;
    private final int minY;
    private final int maxX;
    private final int maxY;

    public SamplingRegion(int minX, int minY, int maxX, int maxY) {
        if (maxX <= minX || maxY <= minY) {
            throw new IllegalArgumentException(String.format(
                "Empty sampling region [%d,%d)-[%d,%d)", minX, minY, maxX, maxY));
        }
        this.minX = minX;
        this.minY = minY;
        this.maxX = maxX;
        this.maxY = maxY;
    }

    public int getMinX() { return minX; }
    public int getMinY() { return minY; }
    public int getMaxX() { return maxX; }
    public int getMaxY() { return maxY; }

    @JsonIgnore
    public int getWidth() {
        return maxX - minX;
    }

    @JsonIgnore
    public int getHeight() {
        return maxY - minY;
    }

    @JsonIgnore
    public int getArea() {
        return getWidth() * getHeight();
    }

    public Rect toRect() {
        return new Rect(minX, minY, getWidth(), getHeight());
    }

    @Override
    public String toString() {
        return String.format("SamplingRegion[%d,%d - %d,%d] (%d x %d)",
            minX, minY, maxX, maxY, getWidth(), getHeight());
    }
}
