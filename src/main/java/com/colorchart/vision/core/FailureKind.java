package com.colorchart.vision.core;

/**
 * 提取失败类型
 * <p>
 * 每种失败对单次提取都是终止性的，调用方可重新拍摄后再次调用。
 */
public enum FailureKind {
    /** 四个必需标记未全部检测到 */
    INSUFFICIENT_MARKERS,
    /** 标记中心不能构成有效的简单四边形 */
    DEGENERATE_GEOMETRY,
    /** 宽高比不在任何已知版式的容差范围内 */
    UNRECOGNIZED_LAYOUT,
    /** 灰阶参考信号过低，无法计算补偿系数 */
    COMPENSATION_UNSTABLE
}
