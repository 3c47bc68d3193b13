package com.parallel.reduction.strategy;

import com.parallel.reduction.Dataset;
import com.parallel.reduction.Partition;
import com.parallel.reduction.sync.SharedTotal;
import com.parallel.reduction.sync.WorkerLocal;

import java.util.List;
import java.util.function.Supplier;

/**
 * Same shape as {@link LocalThenMergeStrategy}, but the private sum lives in storage bound
 * to the worker thread instead of a local variable.
 */
public class ThreadLocalStrategy implements ReductionStrategy {

    private final String name;
    private final Supplier<SharedTotal> totals;

    public ThreadLocalStrategy(String name, Supplier<SharedTotal> totals) {
        this.name = name;
        this.totals = totals;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public long reduce(Dataset dataset, List<Partition> partitions) throws ReductionException {
        return reduce(dataset, partitions, new WorkerLocal());
    }

    long reduce(Dataset dataset, List<Partition> partitions, WorkerLocal storage) throws ReductionException {
        SharedTotal total = totals.get();
        WorkerGroup.start(name, partitions, (worker, partition) -> {
            try {
                WorkerLocal.Cell cell = storage.cell();
                for (int i = partition.begin(); i < partition.end(); i++) {
                    cell.add(dataset.get(i));
                }
            } catch (RuntimeException | Error e) {
                storage.release();
                throw e;
            }
            total.add(storage.release());
        }).join();
        return total.sum();
    }
}
