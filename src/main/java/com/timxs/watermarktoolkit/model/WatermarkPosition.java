package com.timxs.watermarktoolkit.model;

/**
 * 水印位置枚举
 * 四个角加正中央，共五个锚点
 */
public enum WatermarkPosition {

    /**
     * 左上角
     */
    TOP_LEFT("左上"),

    /**
     * 右上角
     */
    TOP_RIGHT("右上"),

    /**
     * 左下角
     */
    BOTTOM_LEFT("左下"),

    /**
     * 右下角
     */
    BOTTOM_RIGHT("右下"),

    /**
     * 正中央
     */
    CENTER("居中");

    /**
     * 旧版本设置文件中使用的中文名称
     */
    private final String label;

    WatermarkPosition(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * 计算水印在图片上的 X 坐标
     *
     * @param imageWidth     图片宽度
     * @param watermarkWidth 水印宽度
     * @param marginX        X 方向边距
     * @return X 坐标
     */
    public int calculateX(int imageWidth, int watermarkWidth, int marginX) {
        return switch (this) {
            case TOP_LEFT, BOTTOM_LEFT -> marginX;
            case CENTER -> (imageWidth - watermarkWidth) / 2;
            case TOP_RIGHT, BOTTOM_RIGHT -> imageWidth - watermarkWidth - marginX;
        };
    }

    /**
     * 计算水印在图片上的 Y 坐标
     *
     * @param imageHeight     图片高度
     * @param watermarkHeight 水印高度
     * @param marginY         Y 方向边距
     * @return Y 坐标
     */
    public int calculateY(int imageHeight, int watermarkHeight, int marginY) {
        return switch (this) {
            case TOP_LEFT, TOP_RIGHT -> marginY;
            case CENTER -> (imageHeight - watermarkHeight) / 2;
            case BOTTOM_LEFT, BOTTOM_RIGHT -> imageHeight - watermarkHeight - marginY;
        };
    }

    /**
     * 解析位置
     * 支持枚举名（TOP_LEFT、top-left）和中文名称（左上）
     *
     * @param value 位置字符串
     * @return 对应的位置
     * @throws IllegalArgumentException 无法识别时抛出
     */
    public static WatermarkPosition parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Watermark position must not be blank");
        }
        String trimmed = value.trim();
        for (WatermarkPosition position : values()) {
            if (position.label.equals(trimmed)) {
                return position;
            }
        }
        return valueOf(trimmed.toUpperCase().replace('-', '_'));
    }
}
