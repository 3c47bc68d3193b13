package com.parallel.reduction;

/**
 * Outcome of a single timed reduction run.
 *
 * @param verified whether {@code total} matches the dataset's sequential reference sum
 * @param failure  reason the run failed, {@code null} when it completed
 */
public record TimingSample(
        String strategy,
        int workers,
        int datasetLength,
        long elapsedNanos,
        long total,
        boolean verified,
        String failure) {

    public static TimingSample completed(String strategy, int workers, int datasetLength,
                                         long elapsedNanos, long total, long reference) {
        return new TimingSample(strategy, workers, datasetLength, elapsedNanos, total, total == reference, null);
    }

    public static TimingSample failed(String strategy, int workers, int datasetLength,
                                      long elapsedNanos, String failure) {
        return new TimingSample(strategy, workers, datasetLength, elapsedNanos, 0L, false, failure);
    }

    public boolean failed() {
        return failure != null;
    }

    public double elapsedSeconds() {
        return elapsedNanos / 1_000_000_000.0;
    }
}
