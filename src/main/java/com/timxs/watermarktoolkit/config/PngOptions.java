package com.timxs.watermarktoolkit.config;

import com.timxs.watermarktoolkit.model.OutputFormat;

/**
 * PNG 编码参数
 *
 * @param compressionLevel 压缩级别 0-9
 * @param optimize         是否尽量减小体积
 * @param transparency     是否保留透明通道
 */
public record PngOptions(int compressionLevel, boolean optimize, boolean transparency) implements EncodeOptions {

    public PngOptions {
        compressionLevel = Math.max(0, Math.min(9, compressionLevel));
    }

    public static PngOptions from(FormatSettings.Png settings) {
        return new PngOptions(settings.getCompressionLevel(), settings.isOptimize(), settings.isTransparency());
    }

    /**
     * 实际使用的压缩级别，optimize 时固定为最高级别
     */
    public int effectiveCompressionLevel() {
        return optimize ? 9 : compressionLevel;
    }

    @Override
    public OutputFormat format() {
        return OutputFormat.PNG;
    }
}
