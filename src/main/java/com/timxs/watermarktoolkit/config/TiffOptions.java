package com.timxs.watermarktoolkit.config;

import com.timxs.watermarktoolkit.model.OutputFormat;
import com.timxs.watermarktoolkit.model.TiffCompression;

/**
 * TIFF 编码参数
 *
 * @param compression 压缩算法
 */
public record TiffOptions(TiffCompression compression) implements EncodeOptions {

    public TiffOptions {
        if (compression == null) {
            compression = TiffCompression.LZW;
        }
    }

    public static TiffOptions from(FormatSettings.Tiff settings) {
        return new TiffOptions(settings.getCompression());
    }

    @Override
    public OutputFormat format() {
        return OutputFormat.TIFF;
    }
}
