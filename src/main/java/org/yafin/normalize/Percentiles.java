package org.yafin.normalize;

import org.yafin.image.PixelBuffer;
import org.yafin.image.PixelType;

import java.util.Arrays;

/**
 * Percentiles over all samples of a buffer, with linear interpolation between order statistics
 * (rank {@code p / 100 * (n - 1)}).
 */
public final class Percentiles {

    private Percentiles() {
    }

    /**
     * Computes one value per requested percentile. 8- and 16-bit buffers are counted into a
     * histogram instead of being sorted.
     */
    public static double[] compute(PixelBuffer buffer, double... percentiles) {
        for (double p : percentiles) {
            if (Double.isNaN(p) || p < 0 || p > 100) {
                throw new IllegalArgumentException("Percentile must be within [0, 100]: " + p);
            }
        }
        PixelType type = buffer.type();
        if (type == PixelType.UINT8 || type == PixelType.UINT16) {
            return fromCounts(buffer, (int) type.maxValue() + 1, percentiles);
        }
        return fromSorted(buffer.samples(), percentiles);
    }

    static double[] fromSorted(double[] samples, double... percentiles) {
        Arrays.sort(samples);
        final int n = samples.length;
        double[] result = new double[percentiles.length];
        for (int i = 0; i < percentiles.length; i++) {
            double rank = percentiles[i] / 100.0 * (n - 1);
            int lo = (int) Math.floor(rank);
            int hi = Math.min(lo + 1, n - 1);
            result[i] = interpolate(samples[lo], samples[hi], rank - lo);
        }
        return result;
    }

    private static double[] fromCounts(PixelBuffer buffer, int bins, double... percentiles) {
        final long[] counts = new long[bins];
        final int n = buffer.sampleCount();
        for (int i = 0; i < n; i++) {
            counts[(int) buffer.sample(i)]++;
        }
        // cumulative counts: cdf[v] = number of samples <= v
        final long[] cdf = new long[bins];
        long cum = 0;
        for (int v = 0; v < bins; v++) {
            cum += counts[v];
            cdf[v] = cum;
        }
        double[] result = new double[percentiles.length];
        for (int i = 0; i < percentiles.length; i++) {
            double rank = percentiles[i] / 100.0 * (n - 1);
            long lo = (long) Math.floor(rank);
            long hi = Math.min(lo + 1, n - 1);
            result[i] = interpolate(orderStatistic(cdf, lo), orderStatistic(cdf, hi), rank - lo);
        }
        return result;
    }

    /**
     * Value of the k-th smallest sample (0-based).
     */
    private static double orderStatistic(long[] cdf, long k) {
        int lo = 0;
        int hi = cdf.length - 1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (cdf[mid] > k) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo;
    }

    private static double interpolate(double a, double b, double fraction) {
        return fraction == 0 ? a : a + (b - a) * fraction;
    }
}
