package com.colorchart.vision.core.marker;

import com.colorchart.vision.core.geometry.Point;

import java.util.Arrays;
import java.util.List;

/**
 * 检测到的基准标记
 * <p>
 * 角点按检测器输出顺序排列（标记自身的左上角起顺时针）。
 */
public class Marker {
    private final int id;
    private final Point[] corners;

    public Marker(int id, Point[] corners) {
        if (corners == null || corners.length != 4) {
            throw new IllegalArgumentException("Marker " + id + " must have exactly 4 corners");
        }
        this.id = id;
        this.corners = corners.clone();
    }

    public int getId() {
        return id;
    }

    public List<Point> getCorners() {
        return Arrays.asList(corners.clone());
    }

    public Point getCorner(int index) {
        return corners[index];
    }

    /**
     * 标记中心（四个角点的平均值）
     */
    public Point centroid() {
        return Point.centroid(corners);
    }

    @Override
    public String toString() {
        return "Marker[id=" + id + ", center=" + centroid() + "]";
    }
}
