package org.yafin.config;

import java.util.Locale;

/**
 * Output for percentile normalization when {@code p_high <= p_low}, where linear rescaling is undefined.
 */
public enum DegeneratePolicy {
    /** Every output sample is 0. */
    ZERO,
    /** Every output sample is 255 when the upper percentile value is positive, 0 otherwise. */
    SATURATE_NONZERO;

    public int fillValue(double pHigh) {
        return this == SATURATE_NONZERO && pHigh > 0 ? 255 : 0;
    }

    public static DegeneratePolicy fromName(String name) {
        if (name == null || name.isBlank()) {
            return ZERO;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown degenerate policy: " + name, e);
        }
    }
}
