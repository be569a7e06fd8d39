package com.timxs.watermarktoolkit.config;

import com.timxs.watermarktoolkit.model.OutputFormat;
import lombok.Data;

/**
 * 输出设置
 * 包含输出目录、格式、尺寸限制和命名规则
 */
@Data
public class OutputSettings {

    /**
     * 输出目录
     */
    private String directory = "";

    /**
     * 输出格式
     */
    private OutputFormat format = OutputFormat.JPEG;

    // ========== 尺寸限制 ==========

    /**
     * 最大宽度（像素），0 表示不限制
     */
    private int maxWidth = 0;

    /**
     * 最大高度（像素），0 表示不限制
     */
    private int maxHeight = 0;

    /**
     * 写入文件的 DPI，0 表示不写入
     */
    private int dpi = 300;

    // ========== 命名规则 ==========

    /**
     * 文件名前缀，为空则直接使用原文件名
     */
    private String namePrefix = "";

    /**
     * 是否保留原文件名（为 false 时使用 前缀_序号）
     */
    private boolean keepOriginalName = true;
}
