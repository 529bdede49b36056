package org.yafin.processing;

import org.yafin.config.OutputFormat;
import org.yafin.util.FileUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Output tree of a run. Paths mirror the input file's relative path:
 * <pre>
 * &lt;root&gt;/processed_images/&lt;rel&gt;.&lt;format&gt;
 * &lt;root&gt;/input_histograms/&lt;rel&gt;_input_histogram.png   (normalized files)
 * &lt;root&gt;/input_histograms/&lt;rel&gt;_histogram.png         (8-bit files kept as is)
 * &lt;root&gt;/output_histograms/&lt;rel&gt;_output_histogram.png
 * </pre>
 */
public class OutputLayout {

    private static final Logger LOGGER = Logger.getLogger(OutputLayout.class.getName());

    public static final String PROCESSED_DIR = "processed_images";
    public static final String INPUT_HISTOGRAM_DIR = "input_histograms";
    public static final String OUTPUT_HISTOGRAM_DIR = "output_histograms";

    private final Path root;
    private final OutputFormat format;

    public OutputLayout(Path root, OutputFormat format) {
        this.root = Objects.requireNonNull(root, "root");
        this.format = Objects.requireNonNull(format, "format");
    }

    /**
     * Removes the whole output root and recreates the directories the run writes to. Calling it again
     * gives the same empty tree.
     */
    public void reset(boolean inputHistograms, boolean outputHistograms) throws IOException {
        if (Files.exists(root)) {
            LOGGER.log(Level.INFO, "Removing existing output folder {0}", root);
            FileUtils.deleteRecursively(root);
        }
        Files.createDirectories(processedDir());
        if (inputHistograms) Files.createDirectories(inputHistogramDir());
        if (outputHistograms) Files.createDirectories(outputHistogramDir());
    }

    public Path root() {
        return root;
    }

    public Path processedDir() {
        return root.resolve(PROCESSED_DIR);
    }

    public Path inputHistogramDir() {
        return root.resolve(INPUT_HISTOGRAM_DIR);
    }

    public Path outputHistogramDir() {
        return root.resolve(OUTPUT_HISTOGRAM_DIR);
    }

    public Path outputImagePath(Path relativePath) {
        return processedDir().resolve(FileUtils.baseName(relativePath) + "." + format.extension());
    }

    public Path inputHistogramPath(Path relativePath, boolean normalized) {
        String suffix = normalized ? "_input_histogram.png" : "_histogram.png";
        return inputHistogramDir().resolve(FileUtils.baseName(relativePath) + suffix);
    }

    public Path outputHistogramPath(Path relativePath) {
        return outputHistogramDir().resolve(FileUtils.baseName(relativePath) + "_output_histogram.png");
    }
}
