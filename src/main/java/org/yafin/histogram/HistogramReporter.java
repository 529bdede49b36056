package org.yafin.histogram;

import org.yafin.image.PixelBuffer;
import org.yafin.plugin.HistogramRenderer;

import java.awt.Color;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Computes frequency distributions of a buffer and hands them to a {@link HistogramRenderer}.
 * <p>
 * The range comes from the element type: uint8 {@code [0, 256)}, uint16 {@code [0, 65536)},
 * uint32 {@code [0, 2^32)}, anything else {@code [min, max + 1)} over the finite samples. Buffers with
 * 3 or 4 channels get one line per color channel; everything else is a single binned distribution
 * over all samples.
 */
public class HistogramReporter {

    private static final Logger LOGGER = Logger.getLogger(HistogramReporter.class.getName());

    public static final int BINS = 256;
    public static final String Y_LABEL = "Frequency";

    private static final Color[] CHANNEL_COLORS = {Color.RED, Color.GREEN, Color.BLUE};

    private final HistogramRenderer renderer;

    public HistogramReporter(HistogramRenderer renderer) {
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    /**
     * Computes and renders the histogram of {@code buffer} to {@code target}.
     */
    public HistogramData report(PixelBuffer buffer, String title, Path target) throws IOException {
        HistogramData data = compute(buffer, title);
        renderer.render(data, target);
        LOGGER.log(Level.FINE, "Histogram ''{0}'' saved to {1}", new Object[]{title, target});
        return data;
    }

    public static HistogramData compute(PixelBuffer buffer, String title) {
        final double[] range = rangeOf(buffer);
        final String xLabel = "Pixel Value (" + bitDepthLabel(buffer) + ")";
        final List<HistogramSeries> series = new ArrayList<>();

        if (buffer.hasChannelAxis() && (buffer.channels() == 3 || buffer.channels() == 4)) {
            for (int c = 0; c < CHANNEL_COLORS.length; c++) {
                long[] counts = count(buffer.channel(c), range[0], range[1]);
                series.add(new HistogramSeries("Channel " + c, CHANNEL_COLORS[c], counts));
            }
            return new HistogramData(title, xLabel, Y_LABEL, range[0], range[1], PlotStyle.LINES, series);
        }
        series.add(new HistogramSeries("All", Color.BLACK, count(buffer.samples(), range[0], range[1])));
        return new HistogramData(title, xLabel, Y_LABEL, range[0], range[1], PlotStyle.BARS, series);
    }

    /**
     * {@code [low, high)} bin range for the buffer's element type.
     */
    public static double[] rangeOf(PixelBuffer buffer) {
        switch (buffer.type()) {
            case UINT8:
                return new double[]{0, 256};
            case UINT16:
                return new double[]{0, 65536};
            case UINT32:
                return new double[]{0, Math.pow(2, 32)};
            default:
                double min = Double.POSITIVE_INFINITY;
                double max = Double.NEGATIVE_INFINITY;
                for (int i = 0; i < buffer.sampleCount(); i++) {
                    double v = buffer.sample(i);
                    if (Double.isFinite(v)) {
                        min = Math.min(min, v);
                        max = Math.max(max, v);
                    }
                }
                if (min > max) {
                    // no finite sample
                    return new double[]{0, 1};
                }
                return min == max ? new double[]{min, min + 1} : new double[]{min, max + 1};
        }
    }

    private static String bitDepthLabel(PixelBuffer buffer) {
        switch (buffer.type()) {
            case UINT8:
                return "8-bit";
            case UINT16:
                return "16-bit";
            case UINT32:
                return "32-bit";
            default:
                return buffer.type().label();
        }
    }

    /**
     * Counts samples into {@link #BINS} equal bins over {@code [low, high)}; samples outside the range
     * and NaNs are not counted.
     */
    static long[] count(double[] samples, double low, double high) {
        final long[] counts = new long[BINS];
        final double scale = BINS / (high - low);
        for (double v : samples) {
            if (!(v >= low && v < high)) continue;
            int bin = (int) ((v - low) * scale);
            counts[Math.min(bin, BINS - 1)]++;
        }
        return counts;
    }
}
