package com.timxs.watermarktoolkit.model;

import com.timxs.watermarktoolkit.config.FormatOptions;
import com.timxs.watermarktoolkit.config.NamingOptions;
import com.timxs.watermarktoolkit.config.ProcessingSettings;
import com.timxs.watermarktoolkit.config.WatermarkConfig;

import java.nio.file.Path;
import java.util.List;

/**
 * 批处理任务
 * 开始处理时创建，只使用一次，不持久化
 *
 * @param inputs          输入文件（按处理顺序）
 * @param watermarkPath   水印图片路径
 * @param config          水印配置
 * @param format          输出格式
 * @param formatOptions   编码参数
 * @param outputDirectory 输出目录
 * @param naming          命名规则
 * @param workers         并行处理的文件数
 */
public record BatchJob(
    List<Path> inputs,
    Path watermarkPath,
    WatermarkConfig config,
    OutputFormat format,
    FormatOptions formatOptions,
    Path outputDirectory,
    NamingOptions naming,
    int workers
) {
    public BatchJob {
        if (inputs == null) {
            throw new IllegalArgumentException("Inputs cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("Watermark config cannot be null");
        }
        if (format == null) {
            throw new IllegalArgumentException("Output format cannot be null");
        }
        inputs = List.copyOf(inputs);
        if (formatOptions == null) {
            formatOptions = FormatOptions.defaults();
        }
        if (naming == null) {
            naming = NamingOptions.ORIGINAL;
        }
        workers = Math.max(1, Math.min(Runtime.getRuntime().availableProcessors(), workers));
    }

    /**
     * 根据处理设置和输入文件创建任务
     *
     * @param settings 处理设置
     * @param inputs   输入文件
     * @return 批处理任务
     */
    public static BatchJob from(ProcessingSettings settings, List<Path> inputs) {
        String watermarkPath = settings.getWatermark().getImagePath();
        String outputDirectory = settings.getOutput().getDirectory();
        return new BatchJob(
            inputs,
            watermarkPath == null || watermarkPath.isBlank() ? null : Path.of(watermarkPath),
            WatermarkConfig.from(settings.getWatermark(), settings.getOutput()),
            settings.getOutput().getFormat(),
            FormatOptions.from(settings.getFormats(), settings.getOutput().getDpi()),
            outputDirectory == null || outputDirectory.isBlank() ? null : Path.of(outputDirectory),
            NamingOptions.from(settings.getOutput()),
            settings.getWorkers()
        );
    }
}
