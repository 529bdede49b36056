package org.yafin.metrics;

/**
 * Final state of one input file.
 */
public enum Status {
    PROCESSED, // decoded and normalized; output written when needed
    SKIPPED,   // extension not supported, never opened
    FAILED     // see FailureKind
}
