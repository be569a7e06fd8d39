package com.timxs.watermarktoolkit.config;

import lombok.Data;

/**
 * 图片处理设置
 * 包含输入目录、水印、输出、格式参数和批处理设置
 * 默认值来自 application.yml，运行时由设置文件覆盖
 */
@Data
public class ProcessingSettings {

    // ========== 输入 ==========

    /**
     * 输入目录
     */
    private String inputDirectory = "";

    // ========== 水印设置 ==========

    private WatermarkSettings watermark = new WatermarkSettings();

    // ========== 输出设置 ==========

    private OutputSettings output = new OutputSettings();

    // ========== 格式参数 ==========

    private FormatSettings formats = new FormatSettings();

    // ========== 批处理设置 ==========

    /**
     * 并行处理的文件数，1 表示顺序处理
     */
    private int workers = 1;
}
