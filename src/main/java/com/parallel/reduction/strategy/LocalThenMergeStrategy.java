package com.parallel.reduction.strategy;

import com.parallel.reduction.Dataset;
import com.parallel.reduction.Partition;
import com.parallel.reduction.sync.SharedTotal;

import java.util.List;
import java.util.function.Supplier;

/**
 * Workers scan into a stack-local sum without synchronization and merge it into the shared total once.
 */
public class LocalThenMergeStrategy implements ReductionStrategy {

    private final String name;
    private final Supplier<SharedTotal> totals;

    public LocalThenMergeStrategy(String name, Supplier<SharedTotal> totals) {
        this.name = name;
        this.totals = totals;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public long reduce(Dataset dataset, List<Partition> partitions) throws ReductionException {
        SharedTotal total = totals.get();
        WorkerGroup.start(name, partitions, (worker, partition) -> {
            long local = 0;
            for (int i = partition.begin(); i < partition.end(); i++) {
                local += dataset.get(i);
            }
            total.add(local);
        }).join();
        return total.sum();
    }
}
