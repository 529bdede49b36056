package org.yafin.metrics;

import java.util.Objects;

/**
 * Outcome of one input file, created once during the walk and never changed.
 *
 * @param path          relative path for processed/failed files, full path for skipped ones, output
 *                      path for write failures
 * @param status        final state
 * @param wasNormalized whether the bit depth was reduced (only meaningful when processed)
 * @param failureKind   set when failed
 * @param reason        failure or skip reason, may be null
 */
public record FileOutcome(String path, Status status, boolean wasNormalized, FailureKind failureKind, String reason) {

    public FileOutcome {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(status, "status");
        if ((status == Status.FAILED) != (failureKind != null)) {
            throw new IllegalArgumentException("failureKind must be set exactly for FAILED outcomes");
        }
    }

    public static FileOutcome processed(String path, boolean wasNormalized) {
        return new FileOutcome(path, Status.PROCESSED, wasNormalized, null, null);
    }

    public static FileOutcome skipped(String path) {
        return new FileOutcome(path, Status.SKIPPED, false, null, "unsupported extension");
    }

    public static FileOutcome failed(String path, FailureKind kind, String reason) {
        return new FileOutcome(path, Status.FAILED, false, Objects.requireNonNull(kind, "kind"), reason);
    }

    public boolean isUnsupportedShape() {
        return failureKind == FailureKind.UNSUPPORTED_SHAPE;
    }
}
