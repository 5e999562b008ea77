package com.colorchart.vision.core.marker;

import org.opencv.core.Mat;

import java.util.Map;

/**
 * 基准标记检测
 * <p>
 * 实现可替换为任意能给出"标记 ID + 四个角点"的检测算法，下游阶段不受影响。
 */
public interface MarkerDetector {
    /**
     * 检测图像中的所有标记
     *
     * @param image 已解码的图像（8 位或 16 位，1/3/4 通道）
     * @return 标记 ID -> 标记；未检测到任何标记时返回空映射，不抛异常
     */
    Map<Integer, Marker> detect(Mat image);
}
