package com.timxs.watermarktoolkit.model;

/**
 * TIFF 压缩算法
 */
public enum TiffCompression {

    /**
     * 不压缩
     */
    NONE(null, "raw"),

    /**
     * LZW 无损压缩
     */
    LZW("LZW", "tiff_lzw"),

    /**
     * Deflate 无损压缩
     */
    DEFLATE("Deflate", "tiff_deflate"),

    /**
     * PackBits 行程编码
     */
    PACKBITS("PackBits", "packbits");

    /**
     * JDK TIFF 写入器使用的压缩类型名
     */
    private final String compressionType;

    /**
     * 旧版本设置文件中的名称
     */
    private final String legacyName;

    TiffCompression(String compressionType, String legacyName) {
        this.compressionType = compressionType;
        this.legacyName = legacyName;
    }

    public String getCompressionType() {
        return compressionType;
    }

    /**
     * 解析压缩算法
     * 支持枚举名和旧版本名称（raw、tiff_lzw、tiff_deflate）
     *
     * @param value 压缩算法名称
     * @return 对应的压缩算法
     * @throws IllegalArgumentException 无法识别时抛出
     */
    public static TiffCompression parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("TIFF compression must not be blank");
        }
        String trimmed = value.trim();
        for (TiffCompression compression : values()) {
            if (compression.legacyName.equalsIgnoreCase(trimmed)) {
                return compression;
            }
        }
        return valueOf(trimmed.toUpperCase());
    }
}
