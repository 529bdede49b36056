package org.yafin.metrics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only accumulator of one batch run. Owned by a single run, not thread safe.
 */
public final class BatchReport {

    private final List<FileOutcome> processed = new ArrayList<>();
    private final List<FileOutcome> failed = new ArrayList<>();
    private final List<FileOutcome> skipped = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public BatchReport record(FileOutcome outcome) {
        switch (outcome.status()) {
            case PROCESSED:
                processed.add(outcome);
                break;
            case FAILED:
                failed.add(outcome);
                break;
            case SKIPPED:
                skipped.add(outcome);
                break;
            default:
                throw new IllegalStateException("Unknown status " + outcome.status());
        }
        return this;
    }

    /**
     * Non-fatal problems, e.g. a histogram that could not be rendered.
     */
    public BatchReport warn(String message) {
        warnings.add(message);
        return this;
    }

    public List<FileOutcome> processed() {
        return Collections.unmodifiableList(processed);
    }

    public List<FileOutcome> failed() {
        return Collections.unmodifiableList(failed);
    }

    public List<FileOutcome> skipped() {
        return Collections.unmodifiableList(skipped);
    }

    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    public int processedCount() {
        return processed.size();
    }

    public int failedCount() {
        return failed.size();
    }

    public int skippedCount() {
        return skipped.size();
    }

    public int total() {
        return processed.size() + failed.size() + skipped.size();
    }
}
