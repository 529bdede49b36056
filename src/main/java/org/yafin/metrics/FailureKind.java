package org.yafin.metrics;

/**
 * Why a file ended up {@link Status#FAILED}.
 */
public enum FailureKind {
    DECODE,
    UNSUPPORTED_SHAPE,
    WRITE,
    INTERNAL
}
