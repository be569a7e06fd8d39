package com.timxs.watermarktoolkit.model;

/**
 * 水印在原图上的位置和缩放后的尺寸
 *
 * @param x      左上角 X 坐标
 * @param y      左上角 Y 坐标
 * @param width  缩放后宽度
 * @param height 缩放后高度
 */
public record WatermarkPlacement(int x, int y, int width, int height) {
}
