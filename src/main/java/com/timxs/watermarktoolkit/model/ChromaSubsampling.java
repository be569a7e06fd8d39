package com.timxs.watermarktoolkit.model;

/**
 * JPEG 色度子采样模式
 * 数值与旧版本设置中的 0/1/2 对应
 */
public enum ChromaSubsampling {

    /**
     * 4:4:4，不做子采样，质量最好
     */
    S444(0, 1, 1),

    /**
     * 4:2:2，水平方向减半
     */
    S422(1, 2, 1),

    /**
     * 4:2:0，水平垂直都减半，压缩率最高
     */
    S420(2, 2, 2);

    private final int code;

    /**
     * 亮度分量水平采样因子
     */
    private final int horizontalFactor;

    /**
     * 亮度分量垂直采样因子
     */
    private final int verticalFactor;

    ChromaSubsampling(int code, int horizontalFactor, int verticalFactor) {
        this.code = code;
        this.horizontalFactor = horizontalFactor;
        this.verticalFactor = verticalFactor;
    }

    public int getCode() {
        return code;
    }

    public int getHorizontalFactor() {
        return horizontalFactor;
    }

    public int getVerticalFactor() {
        return verticalFactor;
    }

    /**
     * 根据旧版本数值获取模式
     *
     * @param code 0、1 或 2
     * @return 对应的模式，未知数值返回 S444
     */
    public static ChromaSubsampling fromCode(int code) {
        for (ChromaSubsampling value : values()) {
            if (value.code == code) {
                return value;
            }
        }
        return S444;
    }
}
