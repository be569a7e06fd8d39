package com.timxs.watermarktoolkit.config;

import com.timxs.watermarktoolkit.model.ChromaSubsampling;
import com.timxs.watermarktoolkit.model.TiffCompression;
import lombok.Data;

/**
 * 各输出格式的编码参数设置
 * 每次任务只使用与输出格式对应的一组
 */
@Data
public class FormatSettings {

    private Jpeg jpeg = new Jpeg();

    private Png png = new Png();

    private Tiff tiff = new Tiff();

    private Webp webp = new Webp();

    @Data
    public static class Jpeg {
        /**
         * 质量（1-100）
         */
        private int quality = 95;

        /**
         * 是否使用渐进式编码
         */
        private boolean progressive = false;

        /**
         * 色度子采样
         */
        private ChromaSubsampling subsampling = ChromaSubsampling.S444;

        /**
         * 是否优化 Huffman 表
         */
        private boolean optimize = true;
    }

    @Data
    public static class Png {
        /**
         * 压缩级别（0-9）
         */
        private int compressionLevel = 6;

        /**
         * 是否尽量减小体积（启用后压缩级别固定为 9）
         */
        private boolean optimize = true;

        /**
         * 是否保留透明通道
         */
        private boolean transparency = true;
    }

    @Data
    public static class Tiff {
        /**
         * 压缩算法
         */
        private TiffCompression compression = TiffCompression.LZW;
    }

    @Data
    public static class Webp {
        /**
         * 质量（1-100，仅有损模式有效）
         */
        private int quality = 95;

        /**
         * 是否使用无损压缩
         */
        private boolean lossless = false;
    }
}
