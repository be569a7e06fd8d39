package com.timxs.watermarktoolkit.service;

import java.nio.file.Path;
import java.util.List;

/**
 * 输入文件扫描器
 * 把输入目录或文件列表展开为按处理顺序排列的图片文件
 */
public interface ImageFileScanner {

    /**
     * 扫描输入
     * 目录只扫描第一层并按文件名排序；文件按给定顺序保留
     * 只接受 jpg、jpeg、png（不区分大小写），其余文件跳过
     *
     * @param inputs 目录或文件
     * @return 候选图片文件
     * @throws com.timxs.watermarktoolkit.exception.WatermarkException 输入不存在或目录无法读取时抛出
     */
    List<Path> scan(List<Path> inputs);

    /**
     * 判断文件扩展名是否受支持
     *
     * @param file 文件
     * @return 是否为 jpg、jpeg 或 png
     */
    boolean isSupported(Path file);
}
