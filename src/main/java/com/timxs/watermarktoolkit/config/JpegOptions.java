package com.timxs.watermarktoolkit.config;

import com.timxs.watermarktoolkit.model.ChromaSubsampling;
import com.timxs.watermarktoolkit.model.OutputFormat;

/**
 * JPEG 编码参数
 *
 * @param quality     质量 1-100
 * @param progressive 是否渐进式
 * @param subsampling 色度子采样
 * @param optimize    是否优化 Huffman 表
 */
public record JpegOptions(int quality, boolean progressive, ChromaSubsampling subsampling, boolean optimize)
    implements EncodeOptions {

    public JpegOptions {
        quality = Math.max(1, Math.min(100, quality));
        if (subsampling == null) {
            subsampling = ChromaSubsampling.S444;
        }
    }

    public static JpegOptions from(FormatSettings.Jpeg settings) {
        return new JpegOptions(settings.getQuality(), settings.isProgressive(),
            settings.getSubsampling(), settings.isOptimize());
    }

    @Override
    public OutputFormat format() {
        return OutputFormat.JPEG;
    }
}
