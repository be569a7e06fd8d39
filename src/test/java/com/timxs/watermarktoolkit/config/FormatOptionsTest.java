package com.timxs.watermarktoolkit.config;

import com.timxs.watermarktoolkit.model.ChromaSubsampling;
import com.timxs.watermarktoolkit.model.OutputFormat;
import com.timxs.watermarktoolkit.model.TiffCompression;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

class FormatOptionsTest {

    @Test
    void selectsOptionsForFormat() {
        FormatOptions options = FormatOptions.defaults();

        assertInstanceOf(JpegOptions.class, options.forFormat(OutputFormat.JPEG));
        assertInstanceOf(PngOptions.class, options.forFormat(OutputFormat.PNG));
        assertInstanceOf(TiffOptions.class, options.forFormat(OutputFormat.TIFF));
        assertInstanceOf(WebpOptions.class, options.forFormat(OutputFormat.WEBP));
        assertEquals(OutputFormat.WEBP, options.forFormat(OutputFormat.WEBP).format());
    }

    @Test
    void copiesSettings() {
        FormatSettings settings = new FormatSettings();
        settings.getJpeg().setQuality(150);
        settings.getJpeg().setSubsampling(ChromaSubsampling.S420);
        settings.getPng().setCompressionLevel(12);
        settings.getTiff().setCompression(TiffCompression.DEFLATE);

        FormatOptions options = FormatOptions.from(settings, -1);

        assertEquals(100, options.jpeg().quality());
        assertEquals(ChromaSubsampling.S420, options.jpeg().subsampling());
        assertEquals(9, options.png().compressionLevel());
        assertEquals(TiffCompression.DEFLATE, options.tiff().compression());
        assertEquals(0, options.dpi());
    }

    @Test
    void pngOptimizeUsesHighestLevel() {
        assertEquals(9, new PngOptions(3, true, true).effectiveCompressionLevel());
        assertEquals(3, new PngOptions(3, false, true).effectiveCompressionLevel());
    }
}
