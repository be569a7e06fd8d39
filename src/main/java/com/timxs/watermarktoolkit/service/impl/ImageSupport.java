package com.timxs.watermarktoolkit.service.impl;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;

/**
 * BufferedImage 类型转换工具
 */
final class ImageSupport {

    private ImageSupport() {
    }

    /**
     * 是否可以转换为 RGBA 参与混合
     * 仅支持 RGB 和灰度色彩空间，CMYK、YCCK 等不支持
     *
     * @param image 图片
     * @return 是否支持
     */
    static boolean isBlendable(BufferedImage image) {
        int type = image.getColorModel().getColorSpace().getType();
        return type == ColorSpace.TYPE_RGB || type == ColorSpace.TYPE_GRAY;
    }

    /**
     * 将任意类型的 BufferedImage 转换为 TYPE_INT_RGB
     * 透明区域填充为白色
     *
     * @param src 源图片
     * @return RGB 格式的图片
     */
    static BufferedImage toRgb(BufferedImage src) {
        if (src.getType() == BufferedImage.TYPE_INT_RGB) {
            return src;
        }
        BufferedImage rgb = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, src.getWidth(), src.getHeight());
            g.drawImage(src, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    /**
     * 将任意类型的 BufferedImage 转换为 TYPE_INT_ARGB
     * 没有 alpha 通道的图片转换后完全不透明
     *
     * @param src 源图片
     * @return ARGB 格式的图片
     */
    static BufferedImage toArgb(BufferedImage src) {
        if (src.getType() == BufferedImage.TYPE_INT_ARGB) {
            return src;
        }
        BufferedImage argb = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = argb.createGraphics();
        try {
            g.drawImage(src, 0, 0, null);
        } finally {
            g.dispose();
        }
        return argb;
    }
}
