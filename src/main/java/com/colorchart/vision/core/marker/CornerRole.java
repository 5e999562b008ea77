package com.colorchart.vision.core.marker;

/**
 * 标记在色卡外框上的角位置（顺时针）
 */
public enum CornerRole {
    TOP_LEFT,
    TOP_RIGHT,
    BOTTOM_RIGHT,
    BOTTOM_LEFT
}
