package com.timxs.watermarktoolkit.service.impl;

import com.timxs.watermarktoolkit.exception.ErrorReason;
import com.timxs.watermarktoolkit.exception.WatermarkException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ImageLoaderImplTest {

    @TempDir
    Path tempDir;

    private final ImageLoaderImpl loader = new ImageLoaderImpl();

    @Test
    void loadsPng() throws IOException {
        Path file = tempDir.resolve("image.png");
        ImageIO.write(new BufferedImage(40, 30, BufferedImage.TYPE_INT_ARGB), "png", file.toFile());

        BufferedImage image = loader.load(file);

        assertEquals(40, image.getWidth());
        assertEquals(30, image.getHeight());
    }

    @Test
    void loadsJpegWithUpperCaseExtension() throws IOException {
        Path file = tempDir.resolve("IMAGE.JPG");
        ImageIO.write(new BufferedImage(16, 8, BufferedImage.TYPE_INT_RGB), "jpeg", file.toFile());

        assertEquals(16, loader.load(file).getWidth());
    }

    @Test
    void missingFileIsDecodeError() {
        WatermarkException e = assertThrows(WatermarkException.class,
            () -> loader.load(tempDir.resolve("missing.png")));

        assertEquals(ErrorReason.DECODE_ERROR, e.getReason());
    }

    @Test
    void corruptFileIsDecodeError() throws IOException {
        Path file = tempDir.resolve("broken.jpg");
        Files.writeString(file, "this is not an image", StandardCharsets.UTF_8);

        WatermarkException e = assertThrows(WatermarkException.class, () -> loader.load(file));

        assertEquals(ErrorReason.DECODE_ERROR, e.getReason());
    }

    @Test
    void nullPathIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> loader.load(null));
    }
}
