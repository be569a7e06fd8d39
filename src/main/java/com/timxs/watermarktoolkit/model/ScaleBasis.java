package com.timxs.watermarktoolkit.model;

/**
 * 水印缩放基准
 * 水印宽度 = 缩放比例 × 基准边长
 */
public enum ScaleBasis {

    /**
     * 原图宽度
     */
    WIDTH,

    /**
     * 原图高度
     */
    HEIGHT,

    /**
     * 原图短边
     */
    SHORTER_SIDE,

    /**
     * 原图长边
     */
    LONGER_SIDE;

    /**
     * 获取基准边长
     *
     * @param imageWidth  图片宽度
     * @param imageHeight 图片高度
     * @return 基准边长（像素）
     */
    public int basis(int imageWidth, int imageHeight) {
        return switch (this) {
            case WIDTH -> imageWidth;
            case HEIGHT -> imageHeight;
            case SHORTER_SIDE -> Math.min(imageWidth, imageHeight);
            case LONGER_SIDE -> Math.max(imageWidth, imageHeight);
        };
    }
}
