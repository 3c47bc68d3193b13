package com.parallel.reduction;

import java.io.PrintStream;
import java.util.Locale;
import java.util.Map;

/**
 * Line-per-sample console rendering.
 */
public final class ConsoleReport {

    private ConsoleReport() {
    }

    public static String format(TimingSample sample) {
        if (sample.failed()) {
            return String.format(Locale.ROOT, "  %-26s %12.6f s  FAILED: %s",
                    sample.strategy(), sample.elapsedSeconds(), sample.failure());
        }
        return String.format(Locale.ROOT, "  %-26s %12.6f s  total=%d%s",
                sample.strategy(), sample.elapsedSeconds(), sample.total(),
                sample.verified() ? "" : "  (MISMATCH)");
    }

    public static void printSummary(PrintStream out, Report report) {
        Map<String, Double> means = report.meanSecondsByStrategy();
        if (means.isEmpty()) {
            return;
        }
        out.println("\nMean elapsed time:");
        means.forEach((strategy, seconds) ->
                out.println(String.format(Locale.ROOT, "  %-26s %12.6f s", strategy, seconds)));
    }
}
