package org.yafin.normalize;

/**
 * How a raw buffer was brought into the canonical 3-channel 8-bit layout.
 */
public enum Conversion {
    /** Already 8-bit; channels replicated, kept or alpha dropped. */
    PASSTHROUGH,
    /** Wide integer single-channel buffer, percentile normalized then replicated. */
    PERCENTILE,
    /** Floating point buffer mapped from its min/max range. */
    RANGE_MAPPED,
    /** Layout or sample type has no defined conversion. */
    UNSUPPORTED
}
