package org.yafin;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.yafin.util.TestImageGenerator;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class YAFINTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int execute(String... args) {
        YAFIN app = new YAFIN(new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
        return new CommandLine(app).execute(args);
    }

    @Test
    void testMissingConfigExitsWithError() {
        int exitCode = execute("--config", tempDir.resolve("absent.yaml").toString());

        assertEquals(1, exitCode);
        assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("Error: Config file not found at"));
    }

    @Test
    void testRunPrintsSummary() throws Exception {
        Path in = Files.createDirectories(tempDir.resolve("in"));
        Path outDir = tempDir.resolve("out");
        TestImageGenerator.writeGray16(in.resolve("a.png"), 4, 4, TestImageGenerator.uniformRamp(16, 0, 40000), "png");
        Files.writeString(in.resolve("notes.txt"), "x");
        Path config = Files.writeString(tempDir.resolve("config.yaml"),
                "input_folder: " + in.toAbsolutePath() + "\n"
                        + "output_folder: " + outDir.toAbsolutePath() + "\n"
                        + "output_format: png\n"
                        + "save_input_histogram: false\n"
                        + "save_output_histogram: false\n");

        int exitCode = execute("--config", config.toString());

        assertEquals(0, exitCode);
        String stdout = out.toString(StandardCharsets.UTF_8);
        assertTrue(stdout.contains("--- Processing Summary ---"));
        assertTrue(stdout.contains("Processed: 1"));
        assertTrue(stdout.contains("Skipped: 1"));
        assertTrue(Files.exists(outDir.resolve("processed_images/a.png")));
    }
}
