package org.yafin.normalize;

import org.yafin.image.PixelBuffer;
import org.yafin.image.PixelType;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Brings a freshly decoded buffer into the canonical (H, W, 3) uint8 layout.
 * <ul>
 *     <li>single channel, 8-bit: replicated into 3 channels</li>
 *     <li>2 channels, 8-bit: gray plus alpha, alpha dropped and gray replicated</li>
 *     <li>single channel, wider integer: percentile normalized, then replicated</li>
 *     <li>3 channels, 8-bit: returned unchanged</li>
 *     <li>4 channels, 8-bit: alpha dropped</li>
 *     <li>3 or 4 channels, wider integer: unsupported</li>
 *     <li>floating point, 1/3/4 channels: min/max range mapped to [0, 255]</li>
 * </ul>
 * Unsupported layouts are reported through {@link ChannelResult#unsupported(String)}, never thrown.
 */
public class ChannelNormalizer {

    private static final Logger LOGGER = Logger.getLogger(ChannelNormalizer.class.getName());

    private final PercentileNormalizer percentileNormalizer;

    public ChannelNormalizer(PercentileNormalizer percentileNormalizer) {
        this.percentileNormalizer = Objects.requireNonNull(percentileNormalizer, "percentileNormalizer");
    }

    public ChannelResult normalize(PixelBuffer raw) {
        final PixelType type = raw.type();
        final int channels = raw.channels();

        if (type.isFloatingPoint()) {
            if (channels == 1 || channels == 3 || channels == 4) {
                LOGGER.log(Level.FINE, "Range mapping {0} buffer {1}", new Object[]{type, raw.shapeString()});
                return ChannelResult.of(toRgb(rangeMap(raw)), Conversion.RANGE_MAPPED);
            }
            return unsupported(raw);
        }

        if (type == PixelType.UINT8) {
            if (channels == 3 && raw.hasChannelAxis()) {
                return ChannelResult.of(raw, Conversion.PASSTHROUGH);
            }
            if (channels == 1 || channels == 2 || channels == 4) {
                return ChannelResult.of(toRgb(raw), Conversion.PASSTHROUGH);
            }
            return unsupported(raw);
        }

        if (channels == 1) {
            return ChannelResult.of(toRgb(percentileNormalizer.normalize(raw)), Conversion.PERCENTILE);
        }
        return unsupported(raw);
    }

    private static ChannelResult unsupported(PixelBuffer raw) {
        String reason = "Unsupported image type with shape " + raw.shapeString() + " and dtype " + raw.type();
        LOGGER.log(Level.WARNING, "{0}. Skipping.", reason);
        return ChannelResult.unsupported(reason);
    }

    /**
     * Replicates a single channel, keeps 3 channels, or drops the alpha channel of a gray+alpha or
     * RGBA 8-bit buffer.
     */
    static PixelBuffer toRgb(PixelBuffer buffer) {
        final int channels = buffer.channels();
        if (channels == 3) {
            return buffer;
        }
        final int pixels = buffer.pixelCount();
        final double[] out = new double[pixels * 3];
        for (int i = 0; i < pixels; i++) {
            int src = i * channels;
            int dst = i * 3;
            if (channels <= 2) {
                double v = buffer.sample(src);
                out[dst] = v;
                out[dst + 1] = v;
                out[dst + 2] = v;
            } else {
                out[dst] = buffer.sample(src);
                out[dst + 1] = buffer.sample(src + 1);
                out[dst + 2] = buffer.sample(src + 2);
            }
        }
        return PixelBuffer.wrap(PixelType.UINT8, buffer.height(), buffer.width(), 3, true, out);
    }

    /**
     * Maps a floating point buffer from its finite [min, max] onto [0, 255], truncating. Alpha of a
     * 4-channel buffer is ignored when finding the range. Constant buffers and NaN samples map to 0.
     */
    static PixelBuffer rangeMap(PixelBuffer buffer) {
        final int channels = buffer.channels();
        final int colorChannels = channels == 4 ? 3 : channels;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < buffer.sampleCount(); i++) {
            if (i % channels >= colorChannels) continue;
            double v = buffer.sample(i);
            if (Double.isFinite(v)) {
                min = Math.min(min, v);
                max = Math.max(max, v);
            }
        }
        final double[] out = new double[buffer.sampleCount()];
        if (max > min) {
            final double factor = 255.0 / (max - min);
            for (int i = 0; i < out.length; i++) {
                double v = buffer.sample(i);
                if (Double.isNaN(v)) continue;
                double clipped = Math.min(Math.max(v, min), max);
                out[i] = Math.min(255, (int) ((clipped - min) * factor));
            }
        }
        return PixelBuffer.wrap(PixelType.UINT8, buffer.height(), buffer.width(), channels,
                buffer.hasChannelAxis(), out);
    }
}
