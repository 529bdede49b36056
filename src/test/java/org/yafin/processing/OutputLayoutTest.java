package org.yafin.processing;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.yafin.config.OutputFormat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class OutputLayoutTest {

    @TempDir
    Path tempDir;

    @Test
    void testPaths_mirrorRelativeInputPath() {
        OutputLayout layout = new OutputLayout(Paths.get("out"), OutputFormat.PNG);
        Path rel = Paths.get("sub", "dir", "scan.001.tiff");

        assertEquals(Paths.get("out", "processed_images", "sub", "dir", "scan.001.png"), layout.outputImagePath(rel));
        assertEquals(Paths.get("out", "input_histograms", "sub", "dir", "scan.001_input_histogram.png"),
                layout.inputHistogramPath(rel, true));
        assertEquals(Paths.get("out", "input_histograms", "sub", "dir", "scan.001_histogram.png"),
                layout.inputHistogramPath(rel, false));
        assertEquals(Paths.get("out", "output_histograms", "sub", "dir", "scan.001_output_histogram.png"),
                layout.outputHistogramPath(rel));
    }

    @Test
    void testReset_removesStaleContentAndIsIdempotent() throws IOException {
        Path root = tempDir.resolve("out");
        Path stale = root.resolve("processed_images/old/stale.tif");
        Files.createDirectories(stale.getParent());
        Files.writeString(stale, "stale");
        Files.writeString(root.resolve("notes.txt"), "x");

        OutputLayout layout = new OutputLayout(root, OutputFormat.TIF);
        layout.reset(true, true);
        layout.reset(true, true);

        assertFalse(Files.exists(stale), "Stale outputs should be removed.");
        assertFalse(Files.exists(root.resolve("notes.txt")));
        assertTrue(Files.isDirectory(layout.processedDir()));
        assertTrue(Files.isDirectory(layout.inputHistogramDir()));
        assertTrue(Files.isDirectory(layout.outputHistogramDir()));
        try (var entries = Files.list(layout.processedDir())) {
            assertEquals(0, entries.count());
        }
    }

    @Test
    void testReset_onlyCreatesEnabledHistogramDirs() throws IOException {
        OutputLayout layout = new OutputLayout(tempDir.resolve("out"), OutputFormat.TIF);
        layout.reset(false, true);

        assertTrue(Files.isDirectory(layout.processedDir()));
        assertFalse(Files.exists(layout.inputHistogramDir()));
        assertTrue(Files.isDirectory(layout.outputHistogramDir()));
    }
}
