package com.timxs.watermarktoolkit.config;

import com.timxs.watermarktoolkit.model.OutputFormat;

/**
 * WebP 编码参数
 *
 * @param quality  质量 1-100（有损模式）
 * @param lossless 是否无损
 */
public record WebpOptions(int quality, boolean lossless) implements EncodeOptions {

    public WebpOptions {
        quality = Math.max(1, Math.min(100, quality));
    }

    public static WebpOptions from(FormatSettings.Webp settings) {
        return new WebpOptions(settings.getQuality(), settings.isLossless());
    }

    @Override
    public OutputFormat format() {
        return OutputFormat.WEBP;
    }
}
