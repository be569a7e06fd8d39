package com.timxs.watermarktoolkit.service.impl;

import com.timxs.watermarktoolkit.config.ResizeTarget;
import com.timxs.watermarktoolkit.config.WatermarkConfig;
import com.timxs.watermarktoolkit.exception.ErrorReason;
import com.timxs.watermarktoolkit.exception.WatermarkException;
import com.timxs.watermarktoolkit.model.ScaleBasis;
import com.timxs.watermarktoolkit.model.WatermarkPlacement;
import com.timxs.watermarktoolkit.model.WatermarkPosition;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.Transparency;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ComponentColorModel;
import java.awt.image.DataBuffer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WatermarkCompositorImplTest {

    private final WatermarkCompositorImpl compositor = new WatermarkCompositorImpl();

    private static WatermarkConfig config(float opacity, float scale, WatermarkPosition position) {
        return new WatermarkConfig(opacity, scale, ScaleBasis.WIDTH, position, 2, 2, true, ResizeTarget.NONE);
    }

    private static BufferedImage solid(int width, int height, int type, Color color) {
        BufferedImage image = new BufferedImage(width, height, type);
        Graphics2D g = image.createGraphics();
        g.setColor(color);
        g.fillRect(0, 0, width, height);
        g.dispose();
        return image;
    }

    private static int red(BufferedImage image, int x, int y) {
        return (image.getRGB(x, y) >> 16) & 0xFF;
    }

    @Test
    void placesScaledWatermarkAtBottomRight() {
        WatermarkPlacement placement = compositor.place(1000, 800, 200, 100,
            config(0.5f, 0.25f, WatermarkPosition.BOTTOM_RIGHT));

        assertEquals(new WatermarkPlacement(730, 659, 250, 125), placement);
    }

    @Test
    void blendsWatermarkAtHalfOpacity() {
        BufferedImage source = solid(1000, 800, BufferedImage.TYPE_INT_RGB, Color.BLACK);
        BufferedImage watermark = solid(200, 100, BufferedImage.TYPE_INT_ARGB, Color.WHITE);

        BufferedImage result = compositor.compose(source, watermark,
            config(0.5f, 0.25f, WatermarkPosition.BOTTOM_RIGHT));

        assertEquals(1000, result.getWidth());
        assertEquals(800, result.getHeight());
        int blended = red(result, 730 + 125, 659 + 62);
        assertTrue(Math.abs(blended - 128) <= 2, "blended value was " + blended);
        assertEquals(0, red(result, 10, 10));
        assertEquals(0, red(result, 729, 700));
    }

    @Test
    void sourceIsNotModified() {
        BufferedImage source = solid(300, 200, BufferedImage.TYPE_INT_RGB, Color.BLACK);
        BufferedImage watermark = solid(50, 50, BufferedImage.TYPE_INT_ARGB, Color.WHITE);

        BufferedImage result = compositor.compose(source, watermark, config(1.0f, 0.5f, WatermarkPosition.CENTER));

        assertNotSame(source, result);
        assertEquals(BufferedImage.TYPE_INT_RGB, source.getType());
        assertEquals(0, red(source, 150, 100));
        assertTrue(red(result, 150, 100) >= 250);
    }

    @Test
    void everyAnchorStaysInsideSourceAndMargins() {
        int marginX = 20;
        int marginY = 16;
        for (WatermarkPosition position : WatermarkPosition.values()) {
            WatermarkPlacement p = compositor.place(1000, 800, 200, 100, config(0.5f, 0.25f, position));

            assertTrue(p.x() >= 0 && p.x() + p.width() <= 1000, position + " x out of bounds");
            assertTrue(p.y() >= 0 && p.y() + p.height() <= 800, position + " y out of bounds");
            switch (position) {
                case TOP_LEFT -> {
                    assertEquals(marginX, p.x());
                    assertEquals(marginY, p.y());
                }
                case TOP_RIGHT -> {
                    assertEquals(1000 - marginX, p.x() + p.width());
                    assertEquals(marginY, p.y());
                }
                case BOTTOM_LEFT -> {
                    assertEquals(marginX, p.x());
                    assertEquals(800 - marginY, p.y() + p.height());
                }
                case BOTTOM_RIGHT -> {
                    assertEquals(1000 - marginX, p.x() + p.width());
                    assertEquals(800 - marginY, p.y() + p.height());
                }
                case CENTER -> {
                    assertEquals((1000 - p.width()) / 2, p.x());
                    assertEquals((800 - p.height()) / 2, p.y());
                }
            }
        }
    }

    @Test
    void keepsWatermarkAspectRatio() {
        WatermarkPlacement p = compositor.place(1234, 567, 333, 77, config(0.5f, 0.37f, WatermarkPosition.TOP_LEFT));

        double expected = 333.0 / 77.0;
        double actual = (double) p.width() / p.height();
        assertTrue(Math.abs(actual - expected) < 0.05, "aspect ratio was " + actual);
    }

    @Test
    void shrinksWatermarkToFitInsideMargins() {
        WatermarkPlacement p = compositor.place(200, 800, 1000, 100, config(0.5f, 1.0f, WatermarkPosition.TOP_LEFT));

        assertEquals(192, p.width());
        assertEquals(19, p.height());
        assertEquals(4, p.x());
    }

    @Test
    void doesNotUpscaleWhenDisabled() {
        WatermarkConfig config = new WatermarkConfig(0.5f, 0.5f, ScaleBasis.WIDTH, WatermarkPosition.TOP_LEFT,
            2, 2, false, ResizeTarget.NONE);

        WatermarkPlacement p = compositor.place(1000, 800, 100, 50, config);

        assertEquals(100, p.width());
        assertEquals(50, p.height());
    }

    @Test
    void usesShorterSideAsBasis() {
        WatermarkConfig config = new WatermarkConfig(0.5f, 0.5f, ScaleBasis.SHORTER_SIDE, WatermarkPosition.TOP_LEFT,
            0, 0, true, ResizeTarget.NONE);

        WatermarkPlacement p = compositor.place(1000, 400, 100, 100, config);

        assertEquals(200, p.width());
        assertEquals(200, p.height());
    }

    @Test
    void opaqueWatermarkGetsUniformOpacity() {
        BufferedImage source = solid(400, 400, BufferedImage.TYPE_INT_RGB, Color.BLACK);
        BufferedImage watermark = solid(100, 100, BufferedImage.TYPE_INT_RGB, Color.WHITE);

        BufferedImage result = compositor.compose(source, watermark, config(0.5f, 0.5f, WatermarkPosition.CENTER));

        int blended = red(result, 200, 200);
        assertTrue(Math.abs(blended - 128) <= 2, "blended value was " + blended);
    }

    @Test
    void acceptsGrayscaleSource() {
        BufferedImage source = solid(200, 100, BufferedImage.TYPE_BYTE_GRAY, Color.GRAY);
        BufferedImage watermark = solid(20, 10, BufferedImage.TYPE_INT_ARGB, Color.WHITE);

        BufferedImage result = compositor.compose(source, watermark, config(0.5f, 0.2f, WatermarkPosition.TOP_LEFT));

        assertEquals(BufferedImage.TYPE_INT_ARGB, result.getType());
        assertEquals(200, result.getWidth());
    }

    @Test
    void appliesResizeTargetAfterCompositing() {
        BufferedImage source = solid(1000, 800, BufferedImage.TYPE_INT_RGB, Color.BLACK);
        BufferedImage watermark = solid(200, 100, BufferedImage.TYPE_INT_ARGB, Color.WHITE);
        WatermarkConfig config = new WatermarkConfig(0.5f, 0.25f, ScaleBasis.WIDTH, WatermarkPosition.BOTTOM_RIGHT,
            2, 2, true, new ResizeTarget(500, 0));

        BufferedImage result = compositor.compose(source, watermark, config);

        assertEquals(500, result.getWidth());
        assertEquals(400, result.getHeight());
    }

    @Test
    void rejectsMissingImages() {
        BufferedImage image = solid(10, 10, BufferedImage.TYPE_INT_RGB, Color.BLACK);
        WatermarkConfig config = config(0.5f, 0.5f, WatermarkPosition.CENTER);

        WatermarkException e = assertThrows(WatermarkException.class, () -> compositor.compose(null, image, config));
        assertEquals(ErrorReason.INVALID_CONFIG, e.getReason());
        assertThrows(WatermarkException.class, () -> compositor.compose(image, null, config));
    }

    @Test
    void rejectsZeroSizedWatermark() {
        WatermarkException e = assertThrows(WatermarkException.class,
            () -> compositor.place(100, 100, 0, 10, config(0.5f, 0.5f, WatermarkPosition.CENTER)));

        assertEquals(ErrorReason.INVALID_CONFIG, e.getReason());
    }

    @Test
    void rejectsCmykSource() {
        ComponentColorModel colorModel = new ComponentColorModel(new CmykColorSpace(), false, false,
            Transparency.OPAQUE, DataBuffer.TYPE_BYTE);
        BufferedImage cmyk = new BufferedImage(colorModel, colorModel.createCompatibleWritableRaster(10, 10),
            false, null);
        BufferedImage watermark = solid(5, 5, BufferedImage.TYPE_INT_ARGB, Color.WHITE);

        WatermarkException e = assertThrows(WatermarkException.class,
            () -> compositor.compose(cmyk, watermark, config(0.5f, 0.5f, WatermarkPosition.CENTER)));

        assertEquals(ErrorReason.UNSUPPORTED_COLOR_MODE, e.getReason());
    }

    /**
     * 最简单的 CMYK 色彩空间，只用于构造不支持的图片
     */
    private static final class CmykColorSpace extends ColorSpace {

        private CmykColorSpace() {
            super(ColorSpace.TYPE_CMYK, 4);
        }

        @Override
        public float[] toRGB(float[] value) {
            return new float[] {
                (1 - value[0]) * (1 - value[3]),
                (1 - value[1]) * (1 - value[3]),
                (1 - value[2]) * (1 - value[3])
            };
        }

        @Override
        public float[] fromRGB(float[] rgb) {
            float k = 1 - Math.max(rgb[0], Math.max(rgb[1], rgb[2]));
            if (k >= 1) {
                return new float[] {0, 0, 0, 1};
            }
            return new float[] {
                (1 - rgb[0] - k) / (1 - k),
                (1 - rgb[1] - k) / (1 - k),
                (1 - rgb[2] - k) / (1 - k),
                k
            };
        }

        @Override
        public float[] toCIEXYZ(float[] value) {
            return ColorSpace.getInstance(ColorSpace.CS_sRGB).toCIEXYZ(toRGB(value));
        }

        @Override
        public float[] fromCIEXYZ(float[] value) {
            return fromRGB(ColorSpace.getInstance(ColorSpace.CS_sRGB).fromCIEXYZ(value));
        }
    }
}
