package com.timxs.watermarktoolkit.service.impl;

import com.timxs.watermarktoolkit.config.WatermarkConfig;
import com.timxs.watermarktoolkit.exception.ErrorReason;
import com.timxs.watermarktoolkit.exception.WatermarkException;
import com.timxs.watermarktoolkit.model.WatermarkPlacement;
import com.timxs.watermarktoolkit.service.WatermarkCompositor;
import lombok.extern.slf4j.Slf4j;
import net.coobird.thumbnailator.Thumbnails;
import net.coobird.thumbnailator.resizers.configurations.Antialiasing;
import net.coobird.thumbnailator.resizers.configurations.Rendering;
import org.springframework.stereotype.Service;

import java.awt.AlphaComposite;
import java.awt.Dimension;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * 水印合成器实现
 * 使用 Thumbnailator 缩放水印和结果图，使用 Java 2D 的 AlphaComposite 混合
 */
@Slf4j
@Service
public class WatermarkCompositorImpl implements WatermarkCompositor {

    /**
     * 合成水印
     * 处理顺序：校验 -> 计算位置 -> 缩放水印 -> 混合 -> 限制输出尺寸
     *
     * @param source    原图
     * @param watermark 水印图片
     * @param config    水印配置
     * @return 合成后的图片（TYPE_INT_ARGB）
     * @throws WatermarkException 配置无效或色彩模式不支持时抛出
     */
    @Override
    public BufferedImage compose(BufferedImage source, BufferedImage watermark, WatermarkConfig config) {
        if (source == null) {
            throw WatermarkException.invalidConfig("原图不能为空");
        }
        if (watermark == null) {
            throw WatermarkException.invalidConfig("水印图片不能为空");
        }
        if (config == null) {
            throw WatermarkException.invalidConfig("水印配置不能为空");
        }
        if (watermark.getWidth() <= 0 || watermark.getHeight() <= 0) {
            throw WatermarkException.invalidConfig(String.format(
                "水印图片尺寸无效: %dx%d", watermark.getWidth(), watermark.getHeight()));
        }
        if (!ImageSupport.isBlendable(source)) {
            throw WatermarkException.unsupportedColorMode("原图色彩模式不支持混合: "
                + source.getColorModel().getColorSpace().getType());
        }
        if (!ImageSupport.isBlendable(watermark)) {
            throw WatermarkException.unsupportedColorMode("水印图片色彩模式不支持混合: "
                + watermark.getColorModel().getColorSpace().getType());
        }

        WatermarkPlacement placement = place(source.getWidth(), source.getHeight(),
            watermark.getWidth(), watermark.getHeight(), config);
        BufferedImage scaledWatermark = resample(watermark, placement.width(), placement.height());

        // 创建带 alpha 通道的新图片，原图保持不变
        BufferedImage result = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D g2d = result.createGraphics();
        try {
            g2d.drawImage(source, 0, 0, null);
            g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            // SRC_OVER 的额外 alpha 会乘到水印自身的 alpha 上，没有 alpha 的水印相当于统一透明度
            g2d.setComposite(AlphaComposite.getInstance(AlphaComposite.SRC_OVER, config.opacity()));
            g2d.drawImage(scaledWatermark, placement.x(), placement.y(), null);
        } finally {
            g2d.dispose();
        }

        log.debug("Added image watermark at position ({}, {}) with size {}x{}, opacity {}",
            placement.x(), placement.y(), placement.width(), placement.height(), config.opacity());

        if (config.resize().isEnabled()) {
            Dimension target = config.resize().fit(result.getWidth(), result.getHeight());
            if (target.width != result.getWidth() || target.height != result.getHeight()) {
                log.debug("限制输出尺寸: {}x{} -> {}x{}",
                    result.getWidth(), result.getHeight(), target.width, target.height);
                result = resample(result, target.width, target.height);
            }
        }
        return result;
    }

    /**
     * 计算水印的位置和缩放尺寸
     * 水印宽度 = 缩放比例 × 基准边长，高度按水印宽高比计算；
     * 超出边距内可用区域时等比缩小，保证水印完全落在原图内
     *
     * @param imageWidth      原图宽度
     * @param imageHeight     原图高度
     * @param watermarkWidth  水印原始宽度
     * @param watermarkHeight 水印原始高度
     * @param config          水印配置
     * @return 水印位置和尺寸
     */
    @Override
    public WatermarkPlacement place(int imageWidth, int imageHeight, int watermarkWidth, int watermarkHeight,
                                    WatermarkConfig config) {
        if (watermarkWidth <= 0 || watermarkHeight <= 0) {
            throw WatermarkException.invalidConfig(String.format(
                "水印图片尺寸无效: %dx%d", watermarkWidth, watermarkHeight));
        }

        int marginX = config.calculateMarginX(imageWidth);
        int marginY = config.calculateMarginY(imageHeight);

        double targetWidth = config.scale() * config.scaleBasis().basis(imageWidth, imageHeight);
        if (!config.upscale()) {
            targetWidth = Math.min(targetWidth, watermarkWidth);
        }
        double targetHeight = targetWidth * watermarkHeight / watermarkWidth;

        // 边距内的可用区域
        int availableWidth = Math.max(1, imageWidth - marginX * 2);
        int availableHeight = Math.max(1, imageHeight - marginY * 2);
        double fit = Math.min(1.0, Math.min(availableWidth / targetWidth, availableHeight / targetHeight));

        int width = Math.min(availableWidth, Math.max(1, (int) Math.round(targetWidth * fit)));
        int height = Math.min(availableHeight, Math.max(1, (int) Math.round(targetHeight * fit)));

        int x = clamp(config.position().calculateX(imageWidth, width, marginX), imageWidth - width);
        int y = clamp(config.position().calculateY(imageHeight, height, marginY), imageHeight - height);
        return new WatermarkPlacement(x, y, width, height);
    }

    /**
     * 高质量缩放
     *
     * @param image  源图片
     * @param width  目标宽度
     * @param height 目标高度
     * @return 缩放后的 ARGB 图片
     */
    private BufferedImage resample(BufferedImage image, int width, int height) {
        if (image.getWidth() == width && image.getHeight() == height) {
            return ImageSupport.toArgb(image);
        }
        try {
            return Thumbnails.of(image)
                .forceSize(width, height)
                .rendering(Rendering.QUALITY)
                .antialiasing(Antialiasing.ON)
                .imageType(BufferedImage.TYPE_INT_ARGB)
                .asBufferedImage();
        } catch (IOException e) {
            throw new WatermarkException(ErrorReason.UNSUPPORTED_COLOR_MODE,
                "图片缩放失败: " + e.getMessage(), e);
        }
    }

    private static int clamp(int value, int max) {
        return Math.max(0, Math.min(max, value));
    }
}
