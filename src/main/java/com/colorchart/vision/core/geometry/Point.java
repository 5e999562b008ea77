package com.colorchart.vision.core.geometry;

/**
 * 二维点（图像像素坐标或物理毫米坐标）
 */
public class Point {
    public final double x;
    public final double y;

    public Point(double x, double y) {
        this.x = x;
        this.y = y;
    }

    /**
     * 计算到另一个点的欧几里得距离
     */
    public double distanceTo(Point other) {
        double dx = this.x - other.x;
        double dy = this.y - other.y;
        return Math.sqrt(dx * dx + dy * dy);
    }

    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y);
    }

    /**
     * 多个点的算术平均
     */
    public static Point centroid(Point... points) {
        if (points == null || points.length == 0) {
            throw new IllegalArgumentException("At least one point required");
        }
        double sx = 0, sy = 0;
        for (Point p : points) {
            sx += p.x;
            sy += p.y;
        }
        return new Point(sx / points.length, sy / points.length);
    }

    public org.opencv.core.Point toCv() {
        return new org.opencv.core.Point(x, y);
    }

    public static Point fromCv(org.opencv.core.Point p) {
        return new Point(p.x, p.y);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Point)) return false;
        Point other = (Point) o;
        return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(x) + Double.hashCode(y);
    }

    @Override
    public String toString() {
        return String.format("(%.2f, %.2f)", x, y);
    }
}
