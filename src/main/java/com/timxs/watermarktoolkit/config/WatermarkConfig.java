package com.timxs.watermarktoolkit.config;

import com.timxs.watermarktoolkit.model.ScaleBasis;
import com.timxs.watermarktoolkit.model.WatermarkPosition;

/**
 * 水印配置 record
 * 构造时把透明度、缩放比例和边距限制在允许范围内，批处理期间只读
 *
 * @param opacity        透明度 0.1-1.0
 * @param scale          缩放比例 0.1-1.0
 * @param scaleBasis     缩放基准边
 * @param position       位置
 * @param marginXPercent X 边距百分比 0-50
 * @param marginYPercent Y 边距百分比 0-50
 * @param upscale        是否允许放大水印
 * @param resize         输出尺寸限制
 */
public record WatermarkConfig(
    float opacity,
    float scale,
    ScaleBasis scaleBasis,
    WatermarkPosition position,
    double marginXPercent,
    double marginYPercent,
    boolean upscale,
    ResizeTarget resize
) {
    public static final float MIN_OPACITY = 0.1f;
    public static final float MAX_OPACITY = 1.0f;
    public static final float MIN_SCALE = 0.1f;
    public static final float MAX_SCALE = 1.0f;
    public static final double MAX_MARGIN_PERCENT = 50.0;

    public WatermarkConfig {
        opacity = clamp(opacity, MIN_OPACITY, MAX_OPACITY);
        scale = clamp(scale, MIN_SCALE, MAX_SCALE);
        marginXPercent = clampMargin(marginXPercent);
        marginYPercent = clampMargin(marginYPercent);
        if (scaleBasis == null) {
            scaleBasis = ScaleBasis.WIDTH;
        }
        if (position == null) {
            position = WatermarkPosition.TOP_LEFT;
        }
        if (resize == null) {
            resize = ResizeTarget.NONE;
        }
    }

    /**
     * 从设置创建 WatermarkConfig
     */
    public static WatermarkConfig from(WatermarkSettings watermark, OutputSettings output) {
        return new WatermarkConfig(
            watermark.getOpacity(),
            watermark.getScale(),
            watermark.getScaleBasis(),
            watermark.getPosition(),
            watermark.getMarginX(),
            watermark.getMarginY(),
            watermark.isUpscale(),
            new ResizeTarget(output.getMaxWidth(), output.getMaxHeight())
        );
    }

    /**
     * 根据图片尺寸计算实际X边距（像素）
     */
    public int calculateMarginX(int imageWidth) {
        return (int) (imageWidth * marginXPercent / 100.0);
    }

    /**
     * 根据图片尺寸计算实际Y边距（像素）
     */
    public int calculateMarginY(int imageHeight) {
        return (int) (imageHeight * marginYPercent / 100.0);
    }

    private static float clamp(float value, float min, float max) {
        if (Float.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }

    private static double clampMargin(double value) {
        if (Double.isNaN(value)) {
            return 0;
        }
        return Math.max(0, Math.min(MAX_MARGIN_PERCENT, value));
    }
}
