package com.timxs.watermarktoolkit.service.impl;

import com.timxs.watermarktoolkit.config.FormatOptions;
import com.timxs.watermarktoolkit.config.FormatSettings;
import com.timxs.watermarktoolkit.model.ChromaSubsampling;
import com.timxs.watermarktoolkit.model.OutputFormat;
import com.timxs.watermarktoolkit.model.TiffCompression;
import org.junit.jupiter.api.Test;
import org.w3c.dom.NodeList;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataFormatImpl;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class ImageEncoderImplTest {

    private final ImageEncoderImpl encoder = new ImageEncoderImpl();

    private static BufferedImage gradient(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int alpha = 50 + (x * 205 / width);
                int red = (x * 255) / width;
                int green = (y * 255) / height;
                int blue = (x + y) % 256;
                image.setRGB(x, y, (alpha << 24) | (red << 16) | (green << 8) | blue);
            }
        }
        return image;
    }

    private static BufferedImage decode(byte[] data) throws IOException {
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(data));
        assertNotNull(image);
        return image;
    }

    private static IIOMetadata readMetadata(byte[] data) throws IOException {
        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(data))) {
            ImageReader reader = ImageIO.getImageReaders(in).next();
            try {
                reader.setInput(in);
                return reader.getImageMetadata(0);
            } finally {
                reader.dispose();
            }
        }
    }

    private static BufferedImage opaque(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.setRGB(x, y, ((x * 255) / width << 16) | ((y * 255) / height << 8) | ((x + y) % 256));
            }
        }
        return image;
    }

    private void assumeWebpAvailable() {
        assumeTrue(encoder.supportsFormat(OutputFormat.WEBP), "WebP writer not available");
        assumeTrue(ImageIO.getImageReadersByFormatName("webp").hasNext(), "WebP reader not available");
    }

    private static FormatOptions options(FormatSettings settings, int dpi) {
        return FormatOptions.from(settings, dpi);
    }

    @Test
    void pngRoundTripIsPixelIdentical() throws IOException {
        BufferedImage image = gradient(64, 48);

        BufferedImage decoded = decode(encoder.encode(image, OutputFormat.PNG, FormatOptions.defaults()));

        assertEquals(64, decoded.getWidth());
        assertEquals(48, decoded.getHeight());
        for (int y = 0; y < 48; y++) {
            for (int x = 0; x < 64; x++) {
                assertEquals(image.getRGB(x, y), decoded.getRGB(x, y), "pixel " + x + "," + y);
            }
        }
    }

    @Test
    void pngWithoutTransparencyDropsAlpha() throws IOException {
        FormatSettings settings = new FormatSettings();
        settings.getPng().setTransparency(false);

        BufferedImage decoded = decode(encoder.encode(gradient(20, 10), OutputFormat.PNG, options(settings, 0)));

        assertFalse(decoded.getColorModel().hasAlpha());
    }

    @Test
    void pngWritesDpi() throws IOException {
        byte[] data = encoder.encode(gradient(20, 10), OutputFormat.PNG, options(new FormatSettings(), 300));

        IIOMetadataNode root = (IIOMetadataNode) readMetadata(data)
            .getAsTree(IIOMetadataFormatImpl.standardMetadataFormatName);
        NodeList sizes = root.getElementsByTagName("HorizontalPixelSize");
        assertEquals(1, sizes.getLength());
        double pixelSize = Double.parseDouble(((IIOMetadataNode) sizes.item(0)).getAttribute("value"));
        assertEquals(25.4 / 300, pixelSize, 0.001);
    }

    @Test
    void jpegKeepsDimensions() throws IOException {
        BufferedImage decoded = decode(encoder.encode(gradient(123, 45), OutputFormat.JPEG,
            options(new FormatSettings(), 300)));

        assertEquals(123, decoded.getWidth());
        assertEquals(45, decoded.getHeight());
    }

    @Test
    void jpegUsesConfiguredChromaSubsampling() throws IOException {
        assertEquals("2", lumaSamplingFactor(ChromaSubsampling.S420));
        assertEquals("1", lumaSamplingFactor(ChromaSubsampling.S444));
    }

    private String lumaSamplingFactor(ChromaSubsampling subsampling) throws IOException {
        FormatSettings settings = new FormatSettings();
        settings.getJpeg().setSubsampling(subsampling);
        byte[] data = encoder.encode(gradient(32, 32), OutputFormat.JPEG, options(settings, 0));

        IIOMetadataNode root = (IIOMetadataNode) readMetadata(data).getAsTree("javax_imageio_jpeg_image_1.0");
        NodeList components = root.getElementsByTagName("componentSpec");
        assertTrue(components.getLength() >= 1);
        return ((IIOMetadataNode) components.item(0)).getAttribute("HsamplingFactor");
    }

    @Test
    void progressiveJpegDecodes() throws IOException {
        FormatSettings settings = new FormatSettings();
        settings.getJpeg().setProgressive(true);
        settings.getJpeg().setQuality(60);

        BufferedImage decoded = decode(encoder.encode(gradient(50, 40), OutputFormat.JPEG, options(settings, 0)));

        assertEquals(50, decoded.getWidth());
    }

    @Test
    void tiffKeepsDimensions() throws IOException {
        for (TiffCompression compression : new TiffCompression[] {TiffCompression.LZW, TiffCompression.NONE}) {
            FormatSettings settings = new FormatSettings();
            settings.getTiff().setCompression(compression);

            BufferedImage decoded = decode(encoder.encode(gradient(30, 20), OutputFormat.TIFF,
                options(settings, 0)));

            assertEquals(30, decoded.getWidth());
            assertEquals(20, decoded.getHeight());
        }
    }

    @Test
    void lossyWebpKeepsDimensions() throws IOException {
        assumeWebpAvailable();
        FormatSettings settings = new FormatSettings();
        settings.getWebp().setQuality(60);

        byte[] data = encoder.encode(gradient(50, 30), OutputFormat.WEBP, options(settings, 0));
        BufferedImage decoded = decode(data);

        assertTrue(data.length > 0);
        assertEquals(50, decoded.getWidth());
        assertEquals(30, decoded.getHeight());
    }

    @Test
    void losslessWebpIsPixelIdentical() throws IOException {
        assumeWebpAvailable();
        FormatSettings settings = new FormatSettings();
        settings.getWebp().setLossless(true);
        BufferedImage image = opaque(40, 24);

        BufferedImage decoded = decode(encoder.encode(image, OutputFormat.WEBP, options(settings, 0)));

        assertEquals(40, decoded.getWidth());
        assertEquals(24, decoded.getHeight());
        for (int y = 0; y < 24; y++) {
            for (int x = 0; x < 40; x++) {
                assertEquals(image.getRGB(x, y) & 0xFFFFFF, decoded.getRGB(x, y) & 0xFFFFFF, "pixel " + x + "," + y);
            }
        }
    }

    @Test
    void reportsBuiltInWriters() {
        assertTrue(encoder.supportsFormat(OutputFormat.JPEG));
        assertTrue(encoder.supportsFormat(OutputFormat.PNG));
        assertTrue(encoder.supportsFormat(OutputFormat.TIFF));
        assertFalse(encoder.supportsFormat(null));
    }

    @Test
    void rejectsNullImage() {
        assertThrows(IllegalArgumentException.class,
            () -> encoder.encode(null, OutputFormat.PNG, FormatOptions.defaults()));
    }
}
