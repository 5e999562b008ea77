package com.colorchart.vision.core.rectify;

import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDouble;

import java.util.Arrays;

/**
 * 针孔相机模型：内参矩阵 + 畸变系数 (k1, k2, p1, p2[, k3])
 * <p>
 * 由外部标定得到，这里只负责使用。
 */
public final class CameraModel {
    private final double fx;
    private final double fy;
    private final double cx;
    private final double cy;
    private final double[] distCoeffs;

    public CameraModel(double fx, double fy, double cx, double cy, double... distCoeffs) {
        if (!(fx > 0) || !(fy > 0)) {
            throw new IllegalArgumentException("Focal lengths must be positive: fx=" + fx + ", fy=" + fy);
        }
        double[] coeffs = distCoeffs == null ? new double[0] : distCoeffs.clone();
        if (coeffs.length > 5) {
            throw new IllegalArgumentException("At most 5 distortion coefficients supported, got " + coeffs.length);
        }
        this.fx = fx;
        this.fy = fy;
        this.cx = cx;
        this.cy = cy;
        this.distCoeffs = coeffs;
    }

    /**
     * 从 3x3 内参矩阵构建
     */
    public static CameraModel fromMatrix(double[][] cameraMatrix, double[] distCoeffs) {
        if (cameraMatrix == null || cameraMatrix.length != 3) {
            throw new IllegalArgumentException("camera_matrix must be 3x3");
        }
        for (double[] row : cameraMatrix) {
            if (row == null || row.length != 3) {
                throw new IllegalArgumentException("camera_matrix must be 3x3");
            }
        }
        return new CameraModel(cameraMatrix[0][0], cameraMatrix[1][1],
            cameraMatrix[0][2], cameraMatrix[1][2], distCoeffs);
    }

    public double getFx() { return fx; }
    public double getFy() { return fy; }
    public double getCx() { return cx; }
    public double getCy() { return cy; }

    public double[] getDistCoeffs() {
        return distCoeffs.clone();
    }

    public Mat cameraMatrix() {
        Mat k = Mat.zeros(3, 3, CvType.CV_64F);
        k.put(0, 0, fx, 0, cx, 0, fy, cy, 0, 0, 1);
        return k;
    }

    /**
     * 畸变系数，不足 4 个时补零
     */
    public MatOfDouble distortion() {
        double[] padded = Arrays.copyOf(distCoeffs, Math.max(4, distCoeffs.length));
        return new MatOfDouble(padded);
    }

    @Override
    public String toString() {
        return String.format("CameraModel[fx=%.1f, fy=%.1f, cx=%.1f, cy=%.1f, dist=%s]",
            fx, fy, cx, cy, Arrays.toString(distCoeffs));
    }
}
