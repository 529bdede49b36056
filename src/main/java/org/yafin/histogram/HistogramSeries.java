package org.yafin.histogram;

import java.awt.Color;

/**
 * Bin counts of one channel (or of the whole buffer for single distributions).
 */
public record HistogramSeries(String label, Color color, long[] counts) {

    public long total() {
        long total = 0;
        for (long c : counts) {
            total += c;
        }
        return total;
    }

    public long maxCount() {
        long max = 0;
        for (long c : counts) {
            max = Math.max(max, c);
        }
        return max;
    }
}
