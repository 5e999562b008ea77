package com.colorchart.vision.core.geometry;

import org.opencv.core.MatOfPoint2f;

import java.util.Arrays;
import java.util.List;

/**
 * 四边形
 * <p>
 * 角点顺序固定为 [TL, TR, BR, BL]，坐标系为图像坐标（y 轴向下）。
 * 在该坐标系下 TL→TR→BR→BL 是视觉上的顺时针，鞋带公式得到的有向面积为正。
 */
public class Quadrilateral {
    private final Point[] corners;

    public Quadrilateral(Point tl, Point tr, Point br, Point bl) {
        this.corners = new Point[]{tl, tr, br, bl};
        for (Point p : corners) {
            if (p == null) {
                throw new IllegalArgumentException("Quadrilateral corners must not be null");
            }
        }
    }

    public static Quadrilateral of(Point[] corners) {
        if (corners == null || corners.length != 4) {
            throw new IllegalArgumentException("Must have exactly 4 corners");
        }
        return new Quadrilateral(corners[0], corners[1], corners[2], corners[3]);
    }

    /**
     * 轴对齐矩形 (x0,y0)-(x1,y1)
     */
    public static Quadrilateral rectangle(double x0, double y0, double x1, double y1) {
        return new Quadrilateral(new Point(x0, y0), new Point(x1, y0), new Point(x1, y1), new Point(x0, y1));
    }

    public Point topLeft() { return corners[0]; }
    public Point topRight() { return corners[1]; }
    public Point bottomRight() { return corners[2]; }
    public Point bottomLeft() { return corners[3]; }

    public Point corner(int index) {
        if (index < 0 || index >= 4) {
            throw new IllegalArgumentException("Corner index must be 0-3");
        }
        return corners[index];
    }

    public List<Point> corners() {
        return Arrays.asList(corners.clone());
    }

    /**
     * 有向面积（鞋带公式），TL→TR→BR→BL 绕向为正
     */
    public double signedArea() {
        double sum = 0;
        for (int i = 0; i < 4; i++) {
            Point a = corners[i];
            Point b = corners[(i + 1) % 4];
            sum += a.x * b.y - b.x * a.y;
        }
        return sum / 2.0;
    }

    /**
     * 每个顶点处相邻两条边的叉积 (e_in × e_out)
     */
    public double[] turnCrossProducts() {
        double[] cross = new double[4];
        for (int i = 0; i < 4; i++) {
            Point prev = corners[(i + 3) % 4];
            Point cur = corners[i];
            Point next = corners[(i + 1) % 4];
            double ax = cur.x - prev.x;
            double ay = cur.y - prev.y;
            double bx = next.x - cur.x;
            double by = next.y - cur.y;
            cross[i] = ax * by - ay * bx;
        }
        return cross;
    }

    /**
     * 凸且按 TL→TR→BR→BL 绕向（自相交的四边形至少有一个顶点转向相反）
     */
    public boolean isConvexInCanonicalWinding() {
        for (double c : turnCrossProducts()) {
            if (!(c > 0)) {
                return false;
            }
        }
        return signedArea() > 0;
    }

    public double minCornerSeparation() {
        double min = Double.MAX_VALUE;
        for (int i = 0; i < 4; i++) {
            for (int j = i + 1; j < 4; j++) {
                min = Math.min(min, corners[i].distanceTo(corners[j]));
            }
        }
        return min;
    }

    /**
     * 上下两边长度的平均
     */
    public double meanHorizontalEdge() {
        return (corners[0].distanceTo(corners[1]) + corners[3].distanceTo(corners[2])) / 2.0;
    }

    /**
     * 左右两边长度的平均
     */
    public double meanVerticalEdge() {
        return (corners[0].distanceTo(corners[3]) + corners[1].distanceTo(corners[2])) / 2.0;
    }

    /**
     * 宽高比 = 上下边均值 / 左右边均值
     */
    public double aspectRatio() {
        double vertical = meanVerticalEdge();
        if (vertical <= 0) {
            return Double.NaN;
        }
        return meanHorizontalEdge() / vertical;
    }

    public boolean isFinite() {
        for (Point p : corners) {
            if (!p.isFinite()) {
                return false;
            }
        }
        return true;
    }

    public MatOfPoint2f toMat() {
        return new MatOfPoint2f(
            corners[0].toCv(), corners[1].toCv(), corners[2].toCv(), corners[3].toCv());
    }

    public static Quadrilateral fromMat(MatOfPoint2f mat) {
        org.opencv.core.Point[] pts = mat.toArray();
        if (pts.length != 4) {
            throw new IllegalArgumentException("Expected 4 points, got " + pts.length);
        }
        return new Quadrilateral(Point.fromCv(pts[0]), Point.fromCv(pts[1]),
            Point.fromCv(pts[2]), Point.fromCv(pts[3]));
    }

    @Override
    public String toString() {
        return String.format("Quad[TL%s, TR%s, BR%s, BL%s]", corners[0], corners[1], corners[2], corners[3]);
    }
}
