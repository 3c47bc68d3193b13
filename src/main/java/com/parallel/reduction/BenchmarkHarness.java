package com.parallel.reduction;

import com.parallel.reduction.strategy.ReductionException;
import com.parallel.reduction.strategy.ReductionStrategy;

import java.util.List;
import java.util.function.Consumer;

/**
 * Runs strategies one at a time over the same dataset and partitioning, timing only the reduction.
 */
public final class BenchmarkHarness {

    private BenchmarkHarness() {
    }

    public static TimingSample run(ReductionStrategy strategy, Dataset dataset, int workerCount) {
        List<Partition> partitions = Partitioner.partition(dataset.length(), workerCount);
        return timed(strategy, dataset, partitions, dataset.sequentialSum());
    }

    /**
     * Repeats every strategy {@code runs} times, in order, and hands each sample to {@code listener}
     * as soon as it is available. Arguments are validated before the first run starts.
     */
    public static Report runAll(List<ReductionStrategy> strategies, Dataset dataset, int workerCount, int runs,
                                Consumer<TimingSample> listener) {
        if (runs < 1) {
            throw new IllegalArgumentException("Runs must be at least 1: " + runs);
        }
        if (strategies.isEmpty()) {
            throw new IllegalArgumentException("No strategy selected");
        }
        List<Partition> partitions = Partitioner.partition(dataset.length(), workerCount);
        long reference = dataset.sequentialSum();

        Report report = new Report();
        for (ReductionStrategy strategy : strategies) {
            for (int run = 0; run < runs; run++) {
                TimingSample sample = timed(strategy, dataset, partitions, reference);
                report.add(sample);
                listener.accept(sample);
            }
        }
        return report;
    }

    private static TimingSample timed(ReductionStrategy strategy, Dataset dataset, List<Partition> partitions,
                                      long reference) {
        int workers = partitions.size();
        long start = System.nanoTime();
        try {
            long total = strategy.reduce(dataset, partitions);
            long elapsed = System.nanoTime() - start;
            return TimingSample.completed(strategy.name(), workers, dataset.length(), elapsed, total, reference);
        } catch (ReductionException e) {
            long elapsed = System.nanoTime() - start;
            return TimingSample.failed(strategy.name(), workers, dataset.length(), elapsed, e.getMessage());
        }
    }
}
