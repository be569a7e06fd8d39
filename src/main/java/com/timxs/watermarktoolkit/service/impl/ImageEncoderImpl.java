package com.timxs.watermarktoolkit.service.impl;

import com.luciad.imageio.webp.WebPWriteParam;
import com.timxs.watermarktoolkit.config.EncodeOptions;
import com.timxs.watermarktoolkit.config.FormatOptions;
import com.timxs.watermarktoolkit.config.JpegOptions;
import com.timxs.watermarktoolkit.config.PngOptions;
import com.timxs.watermarktoolkit.config.TiffOptions;
import com.timxs.watermarktoolkit.config.WebpOptions;
import com.timxs.watermarktoolkit.exception.WatermarkException;
import com.timxs.watermarktoolkit.model.ChromaSubsampling;
import com.timxs.watermarktoolkit.model.OutputFormat;
import com.timxs.watermarktoolkit.service.ImageEncoder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOInvalidTreeException;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataFormatImpl;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.plugins.jpeg.JPEGImageWriteParam;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * 图片编码器实现
 * 使用 ImageIO 写入器编码 JPEG/PNG/TIFF，使用 WebP ImageIO 库编码 WebP
 */
@Slf4j
@Service
public class ImageEncoderImpl implements ImageEncoder {

    /**
     * JDK JPEG 写入器的原生元数据格式名
     */
    private static final String JPEG_NATIVE_FORMAT = "javax_imageio_jpeg_image_1.0";

    private static final double MM_PER_INCH = 25.4;

    /**
     * 编码图片
     *
     * @param image   图片
     * @param format  输出格式
     * @param options 编码参数
     * @return 编码后的字节数组
     * @throws IllegalArgumentException 图片或格式为空时抛出
     * @throws WatermarkException       编码失败时抛出
     */
    @Override
    public byte[] encode(BufferedImage image, OutputFormat format, FormatOptions options) {
        if (image == null) {
            throw new IllegalArgumentException("Image cannot be null");
        }
        if (format == null) {
            throw new IllegalArgumentException("Output format cannot be null");
        }
        FormatOptions formatOptions = options != null ? options : FormatOptions.defaults();
        EncodeOptions encodeOptions = formatOptions.forFormat(format);

        BufferedImage prepared = prepare(image, encodeOptions);

        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format.getFormatName());
        if (!writers.hasNext()) {
            throw WatermarkException.encodeError("No appropriate writer found for format: " + format, null);
        }

        ImageWriter writer = writers.next();
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(outputStream)) {
            writer.setOutput(ios);

            ImageWriteParam param = writer.getDefaultWriteParam();
            configure(param, encodeOptions);
            IIOMetadata metadata = buildMetadata(writer, prepared, param, encodeOptions, formatOptions.dpi());

            writer.write(null, new IIOImage(prepared, null, metadata), param);
        } catch (IOException e) {
            log.error("Failed to encode image to {}", format, e);
            throw WatermarkException.encodeError("编码 " + format + " 失败: " + e.getMessage(), e);
        } catch (LinkageError e) {
            // WebP 依赖 native 库，当前平台缺少时在这里失败
            log.error("{} 编码器不可用，系统架构: {} {}", format,
                System.getProperty("os.name"), System.getProperty("os.arch"), e);
            throw WatermarkException.encodeError(format + " 编码器不可用: " + e.getMessage(), e);
        } finally {
            writer.dispose();
        }

        log.debug("Encoded image to {} ({}x{}), size: {} KB", format, prepared.getWidth(), prepared.getHeight(),
            String.format("%.2f", outputStream.size() / 1024.0));
        return outputStream.toByteArray();
    }

    /**
     * 检查当前环境是否有指定格式的写入器
     *
     * @param format 输出格式
     * @return 是否支持
     */
    @Override
    public boolean supportsFormat(OutputFormat format) {
        if (format == null) {
            return false;
        }
        return ImageIO.getImageWritersByFormatName(format.getFormatName()).hasNext();
    }

    /**
     * 按格式准备像素数据
     * JPEG 和 WebP 统一转换为 RGB，PNG 在不保留透明通道时转换为 RGB
     */
    private BufferedImage prepare(BufferedImage image, EncodeOptions options) {
        if (options instanceof JpegOptions || options instanceof WebpOptions) {
            return ImageSupport.toRgb(image);
        }
        if (options instanceof PngOptions png && !png.transparency()) {
            return ImageSupport.toRgb(image);
        }
        return image;
    }

    /**
     * 设置压缩参数
     *
     * @param param   写入参数
     * @param options 编码参数
     */
    private void configure(ImageWriteParam param, EncodeOptions options) {
        if (options instanceof JpegOptions jpeg) {
            useExplicitCompression(param, null);
            param.setCompressionQuality(jpeg.quality() / 100.0f);
            if (jpeg.progressive() && param.canWriteProgressive()) {
                param.setProgressiveMode(ImageWriteParam.MODE_DEFAULT);
            }
            if (param instanceof JPEGImageWriteParam jpegParam) {
                jpegParam.setOptimizeHuffmanTables(jpeg.optimize());
            }
            log.debug("JPEG 参数 - 质量: {}, 渐进式: {}, 子采样: {}", jpeg.quality(), jpeg.progressive(),
                jpeg.subsampling());
        } else if (options instanceof PngOptions png) {
            if (param.canWriteCompressed()) {
                useExplicitCompression(param, null);
                // JDK PNG 写入器按 9 × (1 - quality) 计算 deflate 级别
                float quality = 1.0f - (png.effectiveCompressionLevel() + 0.25f) / 9.0f;
                param.setCompressionQuality(Math.max(0.0f, Math.min(1.0f, quality)));
            }
            log.debug("PNG 参数 - 压缩级别: {}, 保留透明: {}", png.effectiveCompressionLevel(), png.transparency());
        } else if (options instanceof TiffOptions tiff) {
            if (param.canWriteCompressed()) {
                if (tiff.compression().getCompressionType() == null) {
                    param.setCompressionMode(ImageWriteParam.MODE_DISABLED);
                } else {
                    useExplicitCompression(param, tiff.compression().getCompressionType());
                }
            }
            log.debug("TIFF 参数 - 压缩: {}", tiff.compression());
        } else if (options instanceof WebpOptions webp) {
            configureWebp(param, webp);
        }
    }

    /**
     * 设置 WebP 压缩参数
     * 先设置压缩类型（有损/无损），有损模式再设置质量
     */
    private void configureWebp(ImageWriteParam param, WebpOptions webp) {
        if (!param.canWriteCompressed()) {
            return;
        }
        String compressionType = null;
        if (param instanceof WebPWriteParam webpParam) {
            String[] types = webpParam.getCompressionTypes();
            int index = webp.lossless() ? WebPWriteParam.LOSSLESS_COMPRESSION : WebPWriteParam.LOSSY_COMPRESSION;
            compressionType = types[index];
        }
        useExplicitCompression(param, compressionType);
        if (!webp.lossless()) {
            param.setCompressionQuality(webp.quality() / 100.0f);
        }
        log.debug("WebP 参数 - 质量: {}, 无损: {}", webp.quality(), webp.lossless());
    }

    private void useExplicitCompression(ImageWriteParam param, String compressionType) {
        param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        if (compressionType != null) {
            param.setCompressionType(compressionType);
            return;
        }
        String[] compressionTypes = param.getCompressionTypes();
        if (param.getCompressionType() == null && compressionTypes != null && compressionTypes.length > 0) {
            param.setCompressionType(compressionTypes[0]);
        }
    }

    /**
     * 构建图片元数据，写入 JPEG 子采样和 DPI
     * 元数据设置失败只记录警告，不影响编码
     *
     * @return 元数据，写入器不提供默认元数据时返回 null
     */
    private IIOMetadata buildMetadata(ImageWriter writer, BufferedImage image, ImageWriteParam param,
                                      EncodeOptions options, int dpi) {
        IIOMetadata metadata = writer.getDefaultImageMetadata(
            ImageTypeSpecifier.createFromRenderedImage(image), param);
        if (metadata == null || metadata.isReadOnly()) {
            return metadata;
        }
        if (options instanceof JpegOptions jpeg) {
            applyChromaSubsampling(metadata, jpeg.subsampling());
        }
        if (dpi > 0) {
            applyDpi(metadata, dpi);
        }
        return metadata;
    }

    /**
     * 修改 SOF 段中各分量的采样因子
     * 亮度分量使用子采样模式的因子，色度分量固定为 1
     */
    private void applyChromaSubsampling(IIOMetadata metadata, ChromaSubsampling subsampling) {
        try {
            IIOMetadataNode root = (IIOMetadataNode) metadata.getAsTree(JPEG_NATIVE_FORMAT);
            NodeList sofNodes = root.getElementsByTagName("sof");
            if (sofNodes.getLength() == 0) {
                log.warn("JPEG 元数据中没有 SOF 段，跳过子采样设置");
                return;
            }
            NodeList components = sofNodes.item(0).getChildNodes();
            for (int i = 0; i < components.getLength(); i++) {
                Node component = components.item(i);
                if (component instanceof IIOMetadataNode componentSpec) {
                    boolean luminance = i == 0;
                    componentSpec.setAttribute("HsamplingFactor",
                        String.valueOf(luminance ? subsampling.getHorizontalFactor() : 1));
                    componentSpec.setAttribute("VsamplingFactor",
                        String.valueOf(luminance ? subsampling.getVerticalFactor() : 1));
                }
            }
            metadata.setFromTree(JPEG_NATIVE_FORMAT, root);
        } catch (IIOInvalidTreeException | RuntimeException e) {
            log.warn("设置 JPEG 子采样 {} 失败: {}", subsampling, e.getMessage());
        }
    }

    /**
     * 通过标准元数据格式写入 DPI
     * PNG 写入 pHYs，JPEG 写入 JFIF 密度，TIFF 写入分辨率字段
     */
    private void applyDpi(IIOMetadata metadata, int dpi) {
        if (!metadata.isStandardMetadataFormatSupported()) {
            return;
        }
        String pixelSize = Double.toString(MM_PER_INCH / dpi);
        IIOMetadataNode horizontal = new IIOMetadataNode("HorizontalPixelSize");
        horizontal.setAttribute("value", pixelSize);
        IIOMetadataNode vertical = new IIOMetadataNode("VerticalPixelSize");
        vertical.setAttribute("value", pixelSize);

        IIOMetadataNode dimension = new IIOMetadataNode("Dimension");
        dimension.appendChild(horizontal);
        dimension.appendChild(vertical);

        IIOMetadataNode root = new IIOMetadataNode(IIOMetadataFormatImpl.standardMetadataFormatName);
        root.appendChild(dimension);
        try {
            metadata.mergeTree(IIOMetadataFormatImpl.standardMetadataFormatName, root);
        } catch (IIOInvalidTreeException | RuntimeException e) {
            log.warn("写入 DPI {} 失败: {}", dpi, e.getMessage());
        }
    }
}
