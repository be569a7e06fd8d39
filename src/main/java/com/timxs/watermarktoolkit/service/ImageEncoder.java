package com.timxs.watermarktoolkit.service;

import com.timxs.watermarktoolkit.config.FormatOptions;
import com.timxs.watermarktoolkit.model.OutputFormat;

import java.awt.image.BufferedImage;

/**
 * 图片编码器接口
 * 按输出格式和对应的编码参数把图片编码为字节数组
 */
public interface ImageEncoder {

    /**
     * 编码图片
     *
     * @param image   图片
     * @param format  输出格式
     * @param options 编码参数，只使用与 format 对应的一组
     * @return 编码后的字节数组
     * @throws com.timxs.watermarktoolkit.exception.WatermarkException 编码失败时抛出（ENCODE_ERROR）
     */
    byte[] encode(BufferedImage image, OutputFormat format, FormatOptions options);

    /**
     * 检查当前环境是否有指定格式的 ImageIO 写入器
     *
     * @param format 输出格式
     * @return 是否支持
     */
    boolean supportsFormat(OutputFormat format);
}
