package org.yafin.normalize;

import org.yafin.config.DegeneratePolicy;
import org.yafin.image.PixelBuffer;
import org.yafin.image.PixelType;

import java.util.Arrays;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Compresses a wide unsigned integer buffer into 8 bits: samples are clipped to the
 * {@code [p_low, p_high]} percentile values and mapped linearly onto {@code [0, 255]},
 * truncating toward zero. The output keeps the input's shape.
 */
public class PercentileNormalizer {

    private static final Logger LOGGER = Logger.getLogger(PercentileNormalizer.class.getName());

    private final double lowPercentile;
    private final double highPercentile;
    private final DegeneratePolicy degeneratePolicy;

    /**
     * @param lowPercentile    lower clipping percentile in [0, 100]
     * @param highPercentile   upper clipping percentile in [0, 100]; ordering against the lower one is not checked
     * @param degeneratePolicy output used when the percentile values coincide or invert
     */
    public PercentileNormalizer(double lowPercentile, double highPercentile, DegeneratePolicy degeneratePolicy) {
        if (lowPercentile < 0 || lowPercentile > 100 || highPercentile < 0 || highPercentile > 100) {
            throw new IllegalArgumentException("Percentiles must be within [0, 100]: "
                    + lowPercentile + ", " + highPercentile);
        }
        this.lowPercentile = lowPercentile;
        this.highPercentile = highPercentile;
        this.degeneratePolicy = Objects.requireNonNull(degeneratePolicy, "degeneratePolicy");
    }

    public PercentileNormalizer(double lowPercentile, double highPercentile) {
        this(lowPercentile, highPercentile, DegeneratePolicy.ZERO);
    }

    /**
     * Normalizes the buffer. 8-bit buffers are returned as is.
     *
     * @throws IllegalArgumentException for floating point buffers, which have no percentile normalization
     */
    public PixelBuffer normalize(PixelBuffer input) {
        if (input.type() == PixelType.UINT8) {
            return input;
        }
        if (!input.type().isWideInteger()) {
            throw new IllegalArgumentException("Percentile normalization is not defined for " + input.type());
        }
        final double[] bounds = clipBounds(input);
        final double pLow = bounds[0];
        final double pHigh = bounds[1];

        final int n = input.sampleCount();
        final double[] out = new double[n];
        if (pHigh <= pLow) {
            int fill = degeneratePolicy.fillValue(pHigh);
            LOGGER.log(Level.FINE, "Degenerate percentiles p_low={0} p_high={1}, filling with {2}",
                    new Object[]{pLow, pHigh, fill});
            if (fill != 0) {
                Arrays.fill(out, fill);
            }
        } else {
            LOGGER.log(Level.FINE, "Downsampling {0} using p_low={1} p_high={2}",
                    new Object[]{input.type(), pLow, pHigh});
            for (int i = 0; i < n; i++) {
                out[i] = scale(input.sample(i), pLow, pHigh);
            }
        }
        return PixelBuffer.wrap(PixelType.UINT8, input.height(), input.width(), input.channels(),
                input.hasChannelAxis(), out);
    }

    /**
     * The {@code (p_low, p_high)} values this normalizer clips the buffer to.
     */
    public double[] clipBounds(PixelBuffer input) {
        return Percentiles.compute(input, lowPercentile, highPercentile);
    }

    /**
     * Maps one sample; requires {@code pHigh > pLow}.
     */
    public static int scale(double value, double pLow, double pHigh) {
        double clipped = Math.min(Math.max(value, pLow), pHigh);
        int scaled = (int) ((clipped - pLow) * 255.0 / (pHigh - pLow));
        return Math.min(Math.max(scaled, 0), 255);
    }

    public double lowPercentile() {
        return lowPercentile;
    }

    public double highPercentile() {
        return highPercentile;
    }

    public DegeneratePolicy degeneratePolicy() {
        return degeneratePolicy;
    }
}
