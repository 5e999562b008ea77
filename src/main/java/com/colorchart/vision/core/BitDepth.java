package com.colorchart.vision.core;

import org.opencv.core.CvType;
import org.opencv.core.Mat;

/**
 * 图像位深
 */
public enum BitDepth {
    EIGHT(8, 255.0, CvType.CV_8U),
    SIXTEEN(16, 65535.0, CvType.CV_16U);

    private final int bits;
    private final double maxValue;
    private final int cvDepth;

    BitDepth(int bits, double maxValue, int cvDepth) {
        this.bits = bits;
        this.maxValue = maxValue;
        this.cvDepth = cvDepth;
    }

    public int getBits() {
        return bits;
    }

    /**
     * 满量程值（8 位 255，16 位 65535）
     */
    public double getMaxValue() {
        return maxValue;
    }

    public int getCvDepth() {
        return cvDepth;
    }

    public static BitDepth of(Mat image) {
        int depth = image.depth();
        if (depth == CvType.CV_8U) {
            return EIGHT;
        }
        if (depth == CvType.CV_16U) {
            return SIXTEEN;
        }
        throw new IllegalArgumentException("Unsupported image depth: " + CvType.typeToString(image.type())
            + " (expected 8-bit or 16-bit unsigned)");
    }

    public static BitDepth ofBits(int bits) {
        for (BitDepth d : values()) {
            if (d.bits == bits) {
                return d;
            }
        }
        throw new IllegalArgumentException("Unsupported bit depth: " + bits);
    }
}
