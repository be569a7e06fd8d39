package com.timxs.watermarktoolkit.service;

import com.timxs.watermarktoolkit.config.WatermarkConfig;
import com.timxs.watermarktoolkit.model.WatermarkPlacement;

import java.awt.image.BufferedImage;

/**
 * 水印合成器接口
 * 把一张水印图片按配置缩放、定位并混合到原图上
 */
public interface WatermarkCompositor {

    /**
     * 合成水印
     * 不修改原图，返回新的图片
     *
     * @param source    原图
     * @param watermark 水印图片
     * @param config    水印配置
     * @return 合成后的图片
     * @throws com.timxs.watermarktoolkit.exception.WatermarkException 配置无效或色彩模式不支持时抛出
     */
    BufferedImage compose(BufferedImage source, BufferedImage watermark, WatermarkConfig config);

    /**
     * 计算水印的位置和缩放尺寸
     *
     * @param imageWidth      原图宽度
     * @param imageHeight     原图高度
     * @param watermarkWidth  水印原始宽度
     * @param watermarkHeight 水印原始高度
     * @param config          水印配置
     * @return 水印位置和尺寸
     */
    WatermarkPlacement place(int imageWidth, int imageHeight, int watermarkWidth, int watermarkHeight,
                             WatermarkConfig config);
}
