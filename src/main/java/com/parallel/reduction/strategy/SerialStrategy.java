package com.parallel.reduction.strategy;

import com.parallel.reduction.Dataset;
import com.parallel.reduction.Partition;

import java.util.List;

/**
 * Single-threaded scan of every partition on the calling thread; the baseline for the parallel variants.
 */
public class SerialStrategy implements ReductionStrategy {

    private final String name;

    public SerialStrategy(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public long reduce(Dataset dataset, List<Partition> partitions) {
        long total = 0;
        for (Partition partition : partitions) {
            total += dataset.sum(partition);
        }
        return total;
    }
}
