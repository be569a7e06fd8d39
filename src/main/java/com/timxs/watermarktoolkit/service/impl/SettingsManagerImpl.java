package com.timxs.watermarktoolkit.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.timxs.watermarktoolkit.config.FormatSettings;
import com.timxs.watermarktoolkit.config.OutputSettings;
import com.timxs.watermarktoolkit.config.ProcessingSettings;
import com.timxs.watermarktoolkit.config.WatermarkSettings;
import com.timxs.watermarktoolkit.exception.WatermarkException;
import com.timxs.watermarktoolkit.model.ChromaSubsampling;
import com.timxs.watermarktoolkit.model.OutputFormat;
import com.timxs.watermarktoolkit.model.ScaleBasis;
import com.timxs.watermarktoolkit.model.TiffCompression;
import com.timxs.watermarktoolkit.model.WatermarkPosition;
import com.timxs.watermarktoolkit.service.SettingsManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 设置管理器实现
 * 读取 JSON 设置文件，转换为 ProcessingSettings 对象
 * 同时兼容旧版本的扁平结构（input_folder、opacity、jpeg_quality ...）
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SettingsManagerImpl implements SettingsManager {

    /**
     * application.yml 绑定的默认设置，只读
     */
    private final ProcessingSettings defaultSettings;

    /**
     * JSON 解析器
     */
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    /**
     * 旧版本中表示“不使用前缀”的名称
     */
    private static final String LEGACY_DEFAULT_NAME = "watermarked_image";

    private static final String LEGACY_DEFAULT_PREFIX = "watermarked";

    @Override
    public ProcessingSettings defaults() {
        return OBJECT_MAPPER.convertValue(defaultSettings, ProcessingSettings.class);
    }

    @Override
    public Mono<ProcessingSettings> load(Path file) {
        return Mono.fromCallable(() -> readSettings(file))
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorResume(e -> {
                log.warn("Failed to load settings from {}, using defaults: {}", file, e.getMessage());
                return Mono.just(defaults());
            });
    }

    @Override
    public Mono<Void> save(Path file, ProcessingSettings settings) {
        return Mono.fromRunnable(() -> writeSettings(file, settings))
            .subscribeOn(Schedulers.boundedElastic())
            .then();
    }

    /**
     * 读取设置文件（同步方法）
     */
    private ProcessingSettings readSettings(Path file) throws IOException {
        ProcessingSettings settings = defaults();
        if (file == null || !Files.isRegularFile(file)) {
            log.info("设置文件不存在，使用默认设置: {}", file);
            return settings;
        }

        JsonNode root = OBJECT_MAPPER.readTree(Files.readString(file, StandardCharsets.UTF_8));
        if (root == null || !root.isObject()) {
            log.warn("设置文件格式无效，使用默认设置: {}", file);
            return settings;
        }

        if (root.has("watermark") || root.has("output") || root.has("formats")) {
            // 新的嵌套结构
            applyNested(root, settings);
        } else {
            // 兼容旧的扁平结构
            applyLegacy(root, settings);
        }
        log.debug("已读取设置文件: {}", file);
        return settings;
    }

    /**
     * 写入设置文件（同步方法）
     */
    private void writeSettings(Path file, ProcessingSettings settings) {
        if (file == null || settings == null) {
            throw WatermarkException.invalidConfig("设置文件路径和设置内容不能为空");
        }
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            String json = OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(settings);
            Files.writeString(file, json, StandardCharsets.UTF_8);
            log.info("设置已保存: {}", file);
        } catch (JsonProcessingException e) {
            throw WatermarkException.invalidConfig("设置无法序列化: " + e.getOriginalMessage());
        } catch (IOException e) {
            throw WatermarkException.filesystemError("无法保存设置文件: " + file, e);
        }
    }

    // ========== 嵌套结构 ==========

    /**
     * 读取嵌套结构
     * 缺失或类型错误的字段保留默认值
     *
     * @param root     JSON 根节点
     * @param settings 设置对象（会被修改）
     */
    private void applyNested(JsonNode root, ProcessingSettings settings) {
        settings.setInputDirectory(getString(root, "inputDirectory", settings.getInputDirectory()));
        settings.setWorkers(getInt(root, "workers", settings.getWorkers()));

        // 水印设置（嵌套在 watermark 下）
        JsonNode watermarkNode = root.get("watermark");
        WatermarkSettings watermark = settings.getWatermark();
        if (watermarkNode != null && watermarkNode.isObject()) {
            watermark.setImagePath(getString(watermarkNode, "imagePath", watermark.getImagePath()));
            watermark.setOpacity((float) getDouble(watermarkNode, "opacity", watermark.getOpacity()));
            watermark.setScale((float) getDouble(watermarkNode, "scale", watermark.getScale()));
            watermark.setScaleBasis(parseScaleBasis(getString(watermarkNode, "scaleBasis", null),
                watermark.getScaleBasis()));
            watermark.setPosition(parsePosition(getString(watermarkNode, "position", null),
                watermark.getPosition()));
            // 边距是百分比（0-50）
            watermark.setMarginX(getDouble(watermarkNode, "marginX", watermark.getMarginX()));
            watermark.setMarginY(getDouble(watermarkNode, "marginY", watermark.getMarginY()));
            watermark.setUpscale(getBoolean(watermarkNode, "upscale", watermark.isUpscale()));
        }

        // 输出设置（嵌套在 output 下）
        JsonNode outputNode = root.get("output");
        OutputSettings output = settings.getOutput();
        if (outputNode != null && outputNode.isObject()) {
            output.setDirectory(getString(outputNode, "directory", output.getDirectory()));
            output.setFormat(parseFormat(getString(outputNode, "format", null), output.getFormat()));
            output.setMaxWidth(getInt(outputNode, "maxWidth", output.getMaxWidth()));
            output.setMaxHeight(getInt(outputNode, "maxHeight", output.getMaxHeight()));
            output.setDpi(getInt(outputNode, "dpi", output.getDpi()));
            output.setNamePrefix(getString(outputNode, "namePrefix", output.getNamePrefix()));
            output.setKeepOriginalName(getBoolean(outputNode, "keepOriginalName", output.isKeepOriginalName()));
        }

        // 格式参数（嵌套在 formats 下）
        JsonNode formatsNode = root.get("formats");
        if (formatsNode != null && formatsNode.isObject()) {
            applyFormats(formatsNode, settings.getFormats());
        }
    }

    private void applyFormats(JsonNode formatsNode, FormatSettings formats) {
        JsonNode jpegNode = formatsNode.get("jpeg");
        if (jpegNode != null) {
            FormatSettings.Jpeg jpeg = formats.getJpeg();
            jpeg.setQuality(getInt(jpegNode, "quality", jpeg.getQuality()));
            jpeg.setProgressive(getBoolean(jpegNode, "progressive", jpeg.isProgressive()));
            jpeg.setSubsampling(getSubsampling(jpegNode, "subsampling", jpeg.getSubsampling()));
            jpeg.setOptimize(getBoolean(jpegNode, "optimize", jpeg.isOptimize()));
        }

        JsonNode pngNode = formatsNode.get("png");
        if (pngNode != null) {
            FormatSettings.Png png = formats.getPng();
            png.setCompressionLevel(getInt(pngNode, "compressionLevel", png.getCompressionLevel()));
            png.setOptimize(getBoolean(pngNode, "optimize", png.isOptimize()));
            png.setTransparency(getBoolean(pngNode, "transparency", png.isTransparency()));
        }

        JsonNode tiffNode = formatsNode.get("tiff");
        if (tiffNode != null) {
            FormatSettings.Tiff tiff = formats.getTiff();
            tiff.setCompression(parseTiffCompression(getString(tiffNode, "compression", null),
                tiff.getCompression()));
        }

        JsonNode webpNode = formatsNode.get("webp");
        if (webpNode != null) {
            FormatSettings.Webp webp = formats.getWebp();
            webp.setQuality(getInt(webpNode, "quality", webp.getQuality()));
            webp.setLossless(getBoolean(webpNode, "lossless", webp.isLossless()));
        }
    }

    // ========== 旧版扁平结构 ==========

    /**
     * 读取旧版本的扁平结构
     * target_width 映射为最大输出宽度，jpeg_quality 同时用于 WebP，jpeg_qtables 不再支持，忽略
     *
     * @param root     JSON 根节点
     * @param settings 设置对象（会被修改）
     */
    private void applyLegacy(JsonNode root, ProcessingSettings settings) {
        settings.setInputDirectory(getString(root, "input_folder", settings.getInputDirectory()));

        WatermarkSettings watermark = settings.getWatermark();
        watermark.setOpacity((float) getDouble(root, "opacity", watermark.getOpacity()));
        watermark.setScale((float) getDouble(root, "watermark_ratio", watermark.getScale()));
        watermark.setPosition(parsePosition(getString(root, "position", null), watermark.getPosition()));

        OutputSettings output = settings.getOutput();
        output.setDirectory(getString(root, "output_folder", output.getDirectory()));
        output.setFormat(parseFormat(getString(root, "output_format", null), output.getFormat()));
        output.setMaxWidth(getInt(root, "target_width", output.getMaxWidth()));
        output.setDpi(getInt(root, "dpi", output.getDpi()));
        output.setKeepOriginalName(getBoolean(root, "keep_original_name", output.isKeepOriginalName()));
        String customName = getString(root, "custom_name", null);
        if (customName != null) {
            if (LEGACY_DEFAULT_NAME.equals(customName.trim())) {
                // 默认名称总是输出 watermarked_原文件名
                output.setNamePrefix(LEGACY_DEFAULT_PREFIX);
                output.setKeepOriginalName(true);
            } else {
                output.setNamePrefix(customName);
            }
        }

        FormatSettings formats = settings.getFormats();
        FormatSettings.Jpeg jpeg = formats.getJpeg();
        jpeg.setQuality(getInt(root, "jpeg_quality", jpeg.getQuality()));
        jpeg.setSubsampling(getSubsampling(root, "jpeg_subsampling", jpeg.getSubsampling()));
        jpeg.setProgressive(getBoolean(root, "jpeg_progressive", jpeg.isProgressive()));

        FormatSettings.Png png = formats.getPng();
        png.setCompressionLevel(getInt(root, "compression_level", png.getCompressionLevel()));
        png.setOptimize(getBoolean(root, "png_optimize", png.isOptimize()));
        png.setTransparency(getBoolean(root, "png_transparency", png.isTransparency()));

        FormatSettings.Tiff tiff = formats.getTiff();
        tiff.setCompression(parseTiffCompression(getString(root, "tiff_compression", null), tiff.getCompression()));

        // 旧版 WebP 与 JPEG 共用 jpeg_quality
        FormatSettings.Webp webp = formats.getWebp();
        webp.setQuality(getInt(root, "jpeg_quality", webp.getQuality()));
        webp.setLossless(getBoolean(root, "webp_lossless", webp.isLossless()));

        log.info("已读取旧版本设置文件格式");
    }

    // ========== 枚举解析 ==========

    private WatermarkPosition parsePosition(String value, WatermarkPosition defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        try {
            return WatermarkPosition.parse(value);
        } catch (IllegalArgumentException e) {
            log.warn("无法识别的水印位置: {}，使用 {}", value, defaultValue);
            return defaultValue;
        }
    }

    private ScaleBasis parseScaleBasis(String value, ScaleBasis defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        try {
            return ScaleBasis.valueOf(value.trim().toUpperCase().replace('-', '_'));
        } catch (IllegalArgumentException e) {
            log.warn("无法识别的缩放基准: {}，使用 {}", value, defaultValue);
            return defaultValue;
        }
    }

    private OutputFormat parseFormat(String value, OutputFormat defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        try {
            return OutputFormat.fromName(value);
        } catch (IllegalArgumentException e) {
            log.warn("无法识别的输出格式: {}，使用 {}", value, defaultValue);
            return defaultValue;
        }
    }

    private TiffCompression parseTiffCompression(String value, TiffCompression defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        try {
            return TiffCompression.parse(value);
        } catch (IllegalArgumentException e) {
            log.warn("无法识别的 TIFF 压缩算法: {}，使用 {}", value, defaultValue);
            return defaultValue;
        }
    }

    /**
     * 读取色度子采样
     * 支持枚举名（S420）和旧版本数值（0、1、2）
     */
    private ChromaSubsampling getSubsampling(JsonNode node, String key, ChromaSubsampling defaultValue) {
        JsonNode value = node.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value.isNumber()) {
            return ChromaSubsampling.fromCode(value.asInt());
        }
        if (value.isTextual()) {
            String text = value.asText().trim();
            try {
                return ChromaSubsampling.fromCode(Integer.parseInt(text));
            } catch (NumberFormatException e) {
                try {
                    return ChromaSubsampling.valueOf(text.toUpperCase());
                } catch (IllegalArgumentException ex) {
                    log.warn("无法识别的色度子采样: {}，使用 {}", text, defaultValue);
                }
            }
        }
        return defaultValue;
    }

    // ========== JsonNode 辅助方法 ==========

    /**
     * 从 JsonNode 获取布尔值
     * 支持布尔类型和 "true"/"false" 字符串
     */
    private boolean getBoolean(JsonNode node, String key, boolean defaultValue) {
        JsonNode value = node.get(key);
        if (value != null) {
            if (value.isBoolean()) {
                return value.asBoolean();
            }
            if (value.isTextual()) {
                String text = value.asText().trim();
                if ("true".equalsIgnoreCase(text)) {
                    return true;
                }
                if ("false".equalsIgnoreCase(text)) {
                    return false;
                }
            }
        }
        return defaultValue;
    }

    /**
     * 从 JsonNode 获取整数值
     * 支持数字类型和字符串类型
     */
    private int getInt(JsonNode node, String key, int defaultValue) {
        JsonNode value = node.get(key);
        if (value != null) {
            if (value.isNumber()) {
                return value.asInt();
            }
            if (value.isTextual()) {
                try {
                    return Integer.parseInt(value.asText().trim());
                } catch (NumberFormatException e) {
                    return defaultValue;
                }
            }
        }
        return defaultValue;
    }

    /**
     * 从 JsonNode 获取双精度浮点值
     * 支持数字类型和字符串类型
     */
    private double getDouble(JsonNode node, String key, double defaultValue) {
        JsonNode value = node.get(key);
        if (value != null) {
            if (value.isNumber()) {
                return value.asDouble();
            }
            if (value.isTextual()) {
                try {
                    return Double.parseDouble(value.asText().trim());
                } catch (NumberFormatException e) {
                    return defaultValue;
                }
            }
        }
        return defaultValue;
    }

    /**
     * 从 JsonNode 获取字符串值
     */
    private String getString(JsonNode node, String key, String defaultValue) {
        JsonNode value = node.get(key);
        if (value != null && value.isTextual()) {
            return value.asText();
        }
        return defaultValue;
    }
}
