package com.colorchart.vision.core.layout;

/**
 * 灰阶参考色块的角色
 */
public enum GrayRole {
    /** 色卡外圈的灰阶参考 */
    PERIPHERAL,
    /** 色卡中心的灰阶参考 */
    CENTER
}
