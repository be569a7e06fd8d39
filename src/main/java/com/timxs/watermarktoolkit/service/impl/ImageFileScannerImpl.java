package com.timxs.watermarktoolkit.service.impl;

import com.timxs.watermarktoolkit.exception.WatermarkException;
import com.timxs.watermarktoolkit.service.ImageFileScanner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * 输入文件扫描器实现
 */
@Slf4j
@Service
public class ImageFileScannerImpl implements ImageFileScanner {

    /**
     * 支持的输入扩展名
     */
    private static final Set<String> SUPPORTED_EXTENSIONS = Set.of("jpg", "jpeg", "png");

    @Override
    public List<Path> scan(List<Path> inputs) {
        if (inputs == null || inputs.isEmpty()) {
            throw WatermarkException.invalidConfig("未指定输入目录或文件");
        }
        List<Path> files = new ArrayList<>();
        for (Path input : inputs) {
            if (Files.isDirectory(input)) {
                files.addAll(listDirectory(input));
            } else if (Files.isRegularFile(input)) {
                if (isSupported(input)) {
                    files.add(input);
                } else {
                    log.warn("跳过不支持的文件: {}", input);
                }
            } else {
                throw WatermarkException.filesystemError("输入不存在: " + input, null);
            }
        }
        log.debug("扫描到 {} 个图片文件", files.size());
        return files;
    }

    @Override
    public boolean isSupported(Path file) {
        String extension = getExtension(file);
        return extension != null && SUPPORTED_EXTENSIONS.contains(extension);
    }

    /**
     * 列出目录第一层的图片文件，按文件名排序
     */
    private List<Path> listDirectory(Path directory) {
        List<Path> files = new ArrayList<>();
        try (Stream<Path> stream = Files.list(directory)) {
            stream.filter(Files::isRegularFile)
                .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                .forEach(path -> {
                    if (isSupported(path)) {
                        files.add(path);
                    } else {
                        log.warn("跳过不支持的文件: {}", path.getFileName());
                    }
                });
        } catch (IOException e) {
            throw WatermarkException.filesystemError("无法读取输入目录: " + directory, e);
        }
        return files;
    }

    /**
     * 获取小写扩展名
     *
     * @return 扩展名，没有扩展名时返回 null
     */
    private String getExtension(Path file) {
        Path fileName = file.getFileName();
        if (fileName == null) {
            return null;
        }
        String name = fileName.toString();
        int lastDotIndex = name.lastIndexOf('.');
        if (lastDotIndex < 0 || lastDotIndex == name.length() - 1) {
            return null;
        }
        return name.substring(lastDotIndex + 1).toLowerCase();
    }
}
