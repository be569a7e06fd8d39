package com.timxs.watermarktoolkit.model;

/**
 * 输出格式枚举
 * 定义支持的目标图片格式及其 MIME 类型、扩展名和 ImageIO 格式名
 */
public enum OutputFormat {

    /**
     * JPEG 格式（有损压缩，不支持透明通道）
     */
    JPEG("image/jpeg", "jpg", "jpeg"),

    /**
     * PNG 格式（无损压缩，支持透明通道）
     */
    PNG("image/png", "png", "png"),

    /**
     * TIFF 格式（JDK 自带编码器）
     */
    TIFF("image/tiff", "tiff", "tiff"),

    /**
     * WebP 格式（有损/无损压缩，体积小，需要 webp-imageio）
     */
    WEBP("image/webp", "webp", "webp");

    /**
     * MIME 类型
     */
    private final String mimeType;

    /**
     * 文件扩展名
     */
    private final String extension;

    /**
     * ImageIO 写入器格式名
     */
    private final String formatName;

    OutputFormat(String mimeType, String extension, String formatName) {
        this.mimeType = mimeType;
        this.extension = extension;
        this.formatName = formatName;
    }

    /**
     * 获取 MIME 类型
     *
     * @return MIME 类型
     */
    public String getMimeType() {
        return mimeType;
    }

    /**
     * 获取文件扩展名
     *
     * @return 扩展名（不带点号）
     */
    public String getExtension() {
        return extension;
    }

    /**
     * 获取 ImageIO 格式名
     *
     * @return 格式名
     */
    public String getFormatName() {
        return formatName;
    }

    /**
     * 根据名称或扩展名解析格式
     * 兼容旧版本设置中的 "JPG"、"JPEG"、".tif" 等写法
     *
     * @param name 格式名或扩展名（可带点号，不区分大小写）
     * @return 对应的格式
     * @throws IllegalArgumentException 无法识别时抛出
     */
    public static OutputFormat fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Output format must not be blank");
        }
        String normalized = name.trim().toLowerCase().replace(".", "");
        return switch (normalized) {
            case "jpg", "jpeg" -> JPEG;
            case "png" -> PNG;
            case "tif", "tiff" -> TIFF;
            case "webp" -> WEBP;
            default -> throw new IllegalArgumentException("不支持的输出格式: " + name);
        };
    }
}
