package com.parallel.reduction.strategy;

import com.parallel.reduction.Dataset;
import com.parallel.reduction.Partition;
import com.parallel.reduction.sync.SharedTotal;

import java.util.List;
import java.util.function.Supplier;

/**
 * Every worker adds each element of its partition straight into one shared total,
 * paying one synchronized operation per element.
 */
public class SharedTotalStrategy implements ReductionStrategy {

    private final String name;
    private final Supplier<SharedTotal> totals;

    public SharedTotalStrategy(String name, Supplier<SharedTotal> totals) {
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
            for (int i = partition.begin(); i < partition.end(); i++) {
                total.add(dataset.get(i));
            }
        }).join();
        return total.sum();
    }
}
