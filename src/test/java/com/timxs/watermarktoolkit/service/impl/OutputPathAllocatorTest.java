package com.timxs.watermarktoolkit.service.impl;

import com.timxs.watermarktoolkit.config.NamingOptions;
import com.timxs.watermarktoolkit.exception.ErrorReason;
import com.timxs.watermarktoolkit.exception.WatermarkException;
import com.timxs.watermarktoolkit.model.OutputFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class OutputPathAllocatorTest {

    @TempDir
    Path outputDir;

    @Test
    void replacesExtensionWithOutputFormat() {
        OutputPathAllocator allocator = new OutputPathAllocator(outputDir, OutputFormat.JPEG, NamingOptions.ORIGINAL);

        assertEquals(outputDir.resolve("holiday.jpg"), allocator.allocate(Path.of("in", "holiday.PNG"), 1));
    }

    @Test
    void suffixesNamesAllocatedInSameBatch() {
        OutputPathAllocator allocator = new OutputPathAllocator(outputDir, OutputFormat.PNG, NamingOptions.ORIGINAL);

        assertEquals(outputDir.resolve("a.png"), allocator.allocate(Path.of("a.jpg"), 1));
        assertEquals(outputDir.resolve("a_1.png"), allocator.allocate(Path.of("a.png"), 2));
        assertEquals(outputDir.resolve("A_2.png"), allocator.allocate(Path.of("A.jpeg"), 3));
    }

    @Test
    void skipsNamesAlreadyOnDisk() throws IOException {
        Files.createFile(outputDir.resolve("wm_001.webp"));
        OutputPathAllocator allocator = new OutputPathAllocator(outputDir, OutputFormat.WEBP,
            new NamingOptions("wm", false));

        assertEquals(outputDir.resolve("wm_001_1.webp"), allocator.allocate(Path.of("x.jpg"), 1));
        assertEquals(outputDir.resolve("wm_002.webp"), allocator.allocate(Path.of("y.jpg"), 2));
    }

    @Test
    void refusesPathOutsideOutputDirectory() throws IOException {
        Path nested = Files.createDirectories(outputDir.resolve("out"));
        OutputPathAllocator allocator = new OutputPathAllocator(nested, OutputFormat.PNG,
            new NamingOptions("../escaped", true));

        WatermarkException e = assertThrows(WatermarkException.class, () -> allocator.allocate(Path.of("a.jpg"), 1));

        assertEquals(ErrorReason.INVALID_CONFIG, e.getReason());
        assertFalse(Files.exists(outputDir.resolve("escaped_a.png")));
    }

    @Test
    void refusesNameTheFilesystemRejects() {
        OutputPathAllocator allocator = new OutputPathAllocator(outputDir, OutputFormat.PNG,
            new NamingOptions("x\u0000y", true));

        WatermarkException e = assertThrows(WatermarkException.class, () -> allocator.allocate(Path.of("a.jpg"), 1));

        assertEquals(ErrorReason.INVALID_CONFIG, e.getReason());
    }

    @Test
    void keepsDoubleDotsInsideInputNames() {
        OutputPathAllocator allocator = new OutputPathAllocator(outputDir, OutputFormat.PNG, NamingOptions.ORIGINAL);

        assertEquals(outputDir.resolve("a..b.png"), allocator.allocate(Path.of("a..b.jpg"), 1));
    }

    @Test
    void baseNameKeepsLeadingDotFiles() {
        assertEquals("photo.final", OutputPathAllocator.baseName(Path.of("photo.final.jpg")));
        assertEquals(".hidden", OutputPathAllocator.baseName(Path.of(".hidden")));
    }
}
