package com.timxs.watermarktoolkit.config;

import java.awt.Dimension;

/**
 * 输出尺寸限制 record
 * 等比缩小到不超过最大宽高，不裁剪也不放大
 *
 * @param maxWidth  最大宽度，0 表示不限制
 * @param maxHeight 最大高度，0 表示不限制
 */
public record ResizeTarget(int maxWidth, int maxHeight) {

    public static final ResizeTarget NONE = new ResizeTarget(0, 0);

    public ResizeTarget {
        maxWidth = Math.max(0, maxWidth);
        maxHeight = Math.max(0, maxHeight);
    }

    public boolean isEnabled() {
        return maxWidth > 0 || maxHeight > 0;
    }

    /**
     * 计算适配后的尺寸
     *
     * @param width  原宽度
     * @param height 原高度
     * @return 适配后的尺寸，无需缩小时返回原尺寸
     */
    public Dimension fit(int width, int height) {
        double ratio = 1.0;
        if (maxWidth > 0) {
            ratio = Math.min(ratio, (double) maxWidth / width);
        }
        if (maxHeight > 0) {
            ratio = Math.min(ratio, (double) maxHeight / height);
        }
        if (ratio >= 1.0) {
            return new Dimension(width, height);
        }
        return new Dimension(
            Math.max(1, (int) Math.round(width * ratio)),
            Math.max(1, (int) Math.round(height * ratio)));
    }
}
