package org.yafin.metrics;

import java.io.PrintStream;

/**
 * Prints the end-of-run summary: counts, then the failed and skipped paths.
 */
public final class SummaryPrinter {

    private SummaryPrinter() {
    }

    public static void print(BatchReport report, PrintStream out) {
        out.printf("%n--- Processing Summary ---%n");
        out.printf("Processed: %d%n", report.processedCount());
        out.printf("Failed: %d%n", report.failedCount());
        out.printf("Skipped: %d%n", report.skippedCount());

        if (!report.failed().isEmpty()) {
            out.printf("%nFailed Files:%n");
            for (FileOutcome f : report.failed()) {
                out.printf("  - %s%s%n", f.path(), describe(f));
            }
        }
        if (!report.skipped().isEmpty()) {
            out.printf("%nSkipped Files (unsupported extensions):%n");
            for (FileOutcome f : report.skipped()) {
                out.printf("  - %s%n", f.path());
            }
        }
        if (!report.warnings().isEmpty()) {
            out.printf("%nWarnings:%n");
            for (String w : report.warnings()) {
                out.printf("  - %s%n", w);
            }
        }
    }

    private static String describe(FileOutcome f) {
        switch (f.failureKind()) {
            case WRITE:
                return " (save failed)";
            case UNSUPPORTED_SHAPE:
                return " (unsupported: " + f.reason() + ")";
            default:
                return f.reason() == null ? "" : " (" + f.reason() + ")";
        }
    }
}
