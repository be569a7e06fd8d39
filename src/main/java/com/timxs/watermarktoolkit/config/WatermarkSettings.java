package com.timxs.watermarktoolkit.config;

import com.timxs.watermarktoolkit.model.ScaleBasis;
import com.timxs.watermarktoolkit.model.WatermarkPosition;
import lombok.Data;

/**
 * 水印设置
 * 可变配置对象，由 Spring 绑定默认值、由设置文件覆盖
 * 任务开始时转换为不可变的 {@link WatermarkConfig}
 */
@Data
public class WatermarkSettings {

    /**
     * 水印图片路径
     */
    private String imagePath = "bin/logo/watermark.png";

    /**
     * 透明度（0.1-1.0）
     */
    private float opacity = 0.5f;

    /**
     * 水印缩放比例（0.1-1.0）
     */
    private float scale = 0.1f;

    /**
     * 缩放基准边
     */
    private ScaleBasis scaleBasis = ScaleBasis.WIDTH;

    /**
     * 水印位置
     */
    private WatermarkPosition position = WatermarkPosition.TOP_LEFT;

    /**
     * X 方向边距（原图宽度的百分比 0-50）
     */
    private double marginX = 2;

    /**
     * Y 方向边距（原图高度的百分比 0-50）
     */
    private double marginY = 2;

    /**
     * 是否允许把水印放大到超过其原始分辨率
     */
    private boolean upscale = true;
}
