package com.timxs.watermarktoolkit.service.impl;

import com.timxs.watermarktoolkit.config.NamingOptions;
import com.timxs.watermarktoolkit.exception.WatermarkException;
import com.timxs.watermarktoolkit.model.OutputFormat;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * 输出文件路径分配器
 * 每个批处理任务一个实例；同名时在文件名主体后追加 _1、_2 ...，不覆盖已有文件
 */
class OutputPathAllocator {

    private final Path directory;

    private final OutputFormat format;

    private final NamingOptions naming;

    /**
     * 本次任务已分配的文件名（小写，兼容大小写不敏感的文件系统）
     */
    private final Set<String> allocated = new HashSet<>();

    OutputPathAllocator(Path directory, OutputFormat format, NamingOptions naming) {
        this.directory = directory;
        this.format = format;
        this.naming = naming;
    }

    /**
     * 为输入文件分配输出路径
     *
     * @param input 输入文件
     * @param index 文件序号（从 1 开始）
     * @return 未被占用的输出路径
     * @throws WatermarkException 文件名不合法或不在输出目录内时抛出
     */
    synchronized Path allocate(Path input, int index) {
        String stem = naming.stem(baseName(input), index);
        String extension = "." + format.getExtension();

        String candidate = stem + extension;
        int suffix = 1;
        while (isTaken(candidate)) {
            candidate = stem + "_" + suffix + extension;
            suffix++;
        }
        Path output = resolve(candidate);
        allocated.add(candidate.toLowerCase());
        return output;
    }

    private boolean isTaken(String filename) {
        return allocated.contains(filename.toLowerCase()) || Files.exists(resolve(filename));
    }

    /**
     * 解析输出路径，结果必须直接位于输出目录下
     */
    private Path resolve(String filename) {
        Path output;
        try {
            output = directory.resolve(filename);
        } catch (InvalidPathException e) {
            throw WatermarkException.invalidConfig("输出文件名不合法: " + e.getMessage());
        }
        Path relative = directory.relativize(output);
        if (relative.getNameCount() != 1 || !filename.equals(relative.toString())) {
            throw WatermarkException.invalidConfig("输出文件不在输出目录内: " + filename);
        }
        return output;
    }

    /**
     * 提取不含扩展名的文件名
     */
    static String baseName(Path input) {
        String filename = input.getFileName().toString();
        int lastDotIndex = filename.lastIndexOf('.');
        return lastDotIndex > 0 ? filename.substring(0, lastDotIndex) : filename;
    }
}
