package com.timxs.watermarktoolkit.service;

import com.timxs.watermarktoolkit.config.ProcessingSettings;
import reactor.core.publisher.Mono;

import java.nio.file.Path;

/**
 * 设置管理器接口
 * 负责设置文件的读取和保存，只在调用方明确要求时读写
 */
public interface SettingsManager {

    /**
     * 读取设置文件
     * 以 application.yml 中的默认值为基础，用文件中的值覆盖
     * 文件不存在或无法解析时返回默认值
     *
     * @param file 设置文件路径
     * @return 处理设置（每次调用返回新的实例）
     */
    Mono<ProcessingSettings> load(Path file);

    /**
     * 保存设置到文件
     * 父目录不存在时自动创建
     *
     * @param file     设置文件路径
     * @param settings 处理设置
     * @return 完成信号；写入失败时以 WatermarkException 结束
     */
    Mono<Void> save(Path file, ProcessingSettings settings);

    /**
     * 获取默认设置的副本
     *
     * @return 处理设置
     */
    ProcessingSettings defaults();
}
