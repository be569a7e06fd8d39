package com.timxs.watermarktoolkit.config;

import com.timxs.watermarktoolkit.model.OutputFormat;

/**
 * 输出格式到编码参数的映射
 * 每种格式对应一个强类型参数 record，DPI 对所有格式通用
 *
 * @param jpeg JPEG 参数
 * @param png  PNG 参数
 * @param tiff TIFF 参数
 * @param webp WebP 参数
 * @param dpi  写入文件的 DPI，0 表示不写入
 */
public record FormatOptions(JpegOptions jpeg, PngOptions png, TiffOptions tiff, WebpOptions webp, int dpi) {

    public FormatOptions {
        dpi = Math.max(0, dpi);
    }

    /**
     * 从设置创建 FormatOptions
     */
    public static FormatOptions from(FormatSettings formats, int dpi) {
        return new FormatOptions(
            JpegOptions.from(formats.getJpeg()),
            PngOptions.from(formats.getPng()),
            TiffOptions.from(formats.getTiff()),
            WebpOptions.from(formats.getWebp()),
            dpi
        );
    }

    /**
     * 默认参数
     */
    public static FormatOptions defaults() {
        return from(new FormatSettings(), 0);
    }

    /**
     * 选出指定格式的编码参数
     *
     * @param format 输出格式
     * @return 对应的参数
     */
    public EncodeOptions forFormat(OutputFormat format) {
        return switch (format) {
            case JPEG -> jpeg;
            case PNG -> png;
            case TIFF -> tiff;
            case WEBP -> webp;
        };
    }
}
