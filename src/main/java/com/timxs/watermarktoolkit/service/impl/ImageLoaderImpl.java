package com.timxs.watermarktoolkit.service.impl;

import com.timxs.watermarktoolkit.exception.ErrorReason;
import com.timxs.watermarktoolkit.exception.WatermarkException;
import com.timxs.watermarktoolkit.service.ImageLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.imageio.IIOException;
import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 图片读取实现
 * 使用 ImageIO 解码，并把失败归类为解码错误或色彩模式不支持
 */
@Slf4j
@Service
public class ImageLoaderImpl implements ImageLoader {

    /**
     * JDK JPEG 解码器遇到 CMYK/YCCK 时的错误信息
     */
    private static final String UNSUPPORTED_IMAGE_TYPE = "Unsupported Image Type";

    /**
     * 读取并解码图片文件
     *
     * @param path 图片路径
     * @return 解码后的图片
     * @throws WatermarkException 无法解码或色彩模式不支持时抛出
     */
    @Override
    public BufferedImage load(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("Path cannot be null");
        }
        if (!Files.isRegularFile(path)) {
            throw WatermarkException.decodeError("文件不存在: " + path, null);
        }

        BufferedImage image;
        try {
            image = ImageIO.read(path.toFile());
        } catch (IIOException e) {
            if (e.getMessage() != null && e.getMessage().contains(UNSUPPORTED_IMAGE_TYPE)) {
                throw new WatermarkException(ErrorReason.UNSUPPORTED_COLOR_MODE,
                    "不支持的色彩模式: " + path.getFileName(), e);
            }
            throw WatermarkException.decodeError("无法解码图片 " + path.getFileName() + ": " + e.getMessage(), e);
        } catch (IOException | RuntimeException e) {
            // 部分解码器遇到截断数据时抛出运行时异常
            throw WatermarkException.decodeError("无法读取图片 " + path.getFileName() + ": " + e.getMessage(), e);
        }

        if (image == null) {
            throw WatermarkException.decodeError("无法读取图片数据: " + path.getFileName(), null);
        }
        if (!ImageSupport.isBlendable(image)) {
            throw WatermarkException.unsupportedColorMode("不支持的色彩模式: " + path.getFileName());
        }
        log.debug("图片读取成功: {} {}x{}, 类型: {}", path.getFileName(), image.getWidth(), image.getHeight(),
            image.getType());
        return image;
    }
}
