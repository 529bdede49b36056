package org.yafin.processing;

import org.yafin.config.AppConfig;
import org.yafin.histogram.HistogramReporter;
import org.yafin.histogram.JFreeChartHistogramRenderer;
import org.yafin.image.ImageDecodeException;
import org.yafin.image.ImageIODecoder;
import org.yafin.image.ImageIOEncoder;
import org.yafin.image.ImageWriteException;
import org.yafin.image.PixelBuffer;
import org.yafin.metrics.BatchReport;
import org.yafin.metrics.FailureKind;
import org.yafin.metrics.FileOutcome;
import org.yafin.normalize.ChannelNormalizer;
import org.yafin.normalize.ChannelResult;
import org.yafin.normalize.PercentileNormalizer;
import org.yafin.plugin.HistogramRenderer;
import org.yafin.plugin.ImageDecoder;
import org.yafin.plugin.ImageEncoder;
import org.yafin.util.FileUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Walks the input tree and converts every supported image, one file at a time:
 * extension check, decode, channel normalization, output write, histograms. Every per-file error
 * ends up in the {@link BatchReport}; only output-area preparation and the walk itself can fail the run.
 */
public class BatchPipeline {

    private static final Logger LOGGER = Logger.getLogger(BatchPipeline.class.getName());

    public static final Set<String> SUPPORTED_EXTENSIONS = Set.of(".tif", ".tiff", ".png", ".jpg", ".jpeg");

    static final String INPUT_TITLE_NORMALIZED = "Input Histogram (Original)";
    static final String INPUT_TITLE_PLAIN = "Image Histogram";
    static final String OUTPUT_TITLE = "Output Histogram (Normalized)";

    private final AppConfig config;
    private final Path inputRoot;
    private final OutputLayout layout;
    private final ImageDecoder decoder;
    private final ImageEncoder encoder;
    private final ChannelNormalizer channelNormalizer;
    private final HistogramReporter histogramReporter;

    public BatchPipeline(AppConfig config) {
        this(config, new ImageIODecoder(), new ImageIOEncoder(), new JFreeChartHistogramRenderer());
    }

    public BatchPipeline(AppConfig config, ImageDecoder decoder, ImageEncoder encoder, HistogramRenderer renderer) {
        this.config = Objects.requireNonNull(config, "config");
        this.inputRoot = config.inputFolder();
        this.layout = new OutputLayout(config.outputFolder(), config.format());
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.channelNormalizer = new ChannelNormalizer(new PercentileNormalizer(
                config.downsamplePercentileLow(), config.downsamplePercentileHigh(), config.policy()));
        this.histogramReporter = new HistogramReporter(renderer);
    }

    /**
     * Resets the output area, processes every file under the input root and returns the report.
     *
     * @throws IOException if the input folder is missing, checked before the output area is touched, or if
     *                     the output area or the input tree cannot be accessed
     */
    public BatchReport run() throws IOException {
        final Instant start = Instant.now();
        if (!Files.isDirectory(inputRoot)) {
            throw new IOException("Input folder not found at " + inputRoot);
        }
        layout.reset(config.saveInputHistogram(), config.saveOutputHistogram());

        final List<Path> files = FileUtils.findFiles(inputRoot);
        LOGGER.log(Level.INFO, "Found {0} file(s) under {1}", new Object[]{files.size(), inputRoot});

        final BatchReport report = new BatchReport();
        for (Path file : files) {
            report.record(processFile(file, report));
        }
        LOGGER.log(Level.INFO, "Run finished in {0} ms", Duration.between(start, Instant.now()).toMillis());
        return report;
    }

    /**
     * Runs one file through the state machine. Histogram problems are added to {@code report} as
     * warnings; the returned outcome is the file's only entry.
     */
    FileOutcome processFile(Path file, BatchReport report) {
        if (!SUPPORTED_EXTENSIONS.contains(FileUtils.extensionOf(file))) {
            return FileOutcome.skipped(file.toString());
        }
        final Path relativePath = inputRoot.relativize(file);
        final String rel = relativePath.toString().replace('\\', '/');
        LOGGER.log(Level.INFO, "Processing: {0}", rel);

        try {
            final PixelBuffer original;
            try {
                original = decoder.decode(file);
            } catch (ImageDecodeException e) {
                LOGGER.log(Level.WARNING, "  Error loading original image {0}: {1}", new Object[]{rel, e.getMessage()});
                return FileOutcome.failed(rel, FailureKind.DECODE, e.getMessage());
            }

            final ChannelResult result = channelNormalizer.normalize(original);
            if (!result.isSupported()) {
                return FileOutcome.failed(rel, FailureKind.UNSUPPORTED_SHAPE, result.reason());
            }
            final boolean normalized = result.wasNormalized();
            if (normalized) {
                LOGGER.log(Level.INFO, "  Type: {0}. Converted to 8-bit via {1}.",
                        new Object[]{original.type(), result.conversion()});
            }

            if (config.saveInputHistogram()) {
                String title = normalized ? INPUT_TITLE_NORMALIZED : INPUT_TITLE_PLAIN;
                saveHistogram(original, title, layout.inputHistogramPath(relativePath, normalized), report);
            }

            if (!normalized) {
                LOGGER.info("  Type: 8-bit image. No normalization needed, image file not saved.");
                return FileOutcome.processed(rel, false);
            }

            final Path outputPath = layout.outputImagePath(relativePath);
            try {
                encoder.encode(result.buffer(), outputPath, config.format());
            } catch (ImageWriteException e) {
                LOGGER.log(Level.WARNING, "  Error saving image ''{0}'': {1}", new Object[]{outputPath, e.getMessage()});
                return FileOutcome.failed(outputPath.toString(), FailureKind.WRITE, e.getMessage());
            }

            if (config.saveOutputHistogram()) {
                saveHistogram(result.buffer(), OUTPUT_TITLE, layout.outputHistogramPath(relativePath), report);
            }
            return FileOutcome.processed(rel, true);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "  Unexpected error processing " + rel, e);
            return FileOutcome.failed(rel, FailureKind.INTERNAL, String.valueOf(e.getMessage()));
        }
    }

    private void saveHistogram(PixelBuffer buffer, String title, Path target, BatchReport report) {
        try {
            histogramReporter.report(buffer, title, target);
            LOGGER.log(Level.INFO, "  Histogram saved to: {0}", target);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "  Error saving histogram " + target, e);
            report.warn(target + " (histogram plot failed: " + e.getMessage() + ")");
        }
    }

    public OutputLayout layout() {
        return layout;
    }
}
