package com.timxs.watermarktoolkit.service;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

/**
 * 图片读取接口
 */
public interface ImageLoader {

    /**
     * 读取并解码图片文件
     *
     * @param path 图片路径
     * @return 解码后的图片，不会返回 null
     * @throws com.timxs.watermarktoolkit.exception.WatermarkException 无法解码（DECODE_ERROR）
     *                                                                 或色彩模式不支持（UNSUPPORTED_COLOR_MODE）时抛出
     */
    BufferedImage load(Path path);
}
