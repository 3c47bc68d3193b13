package com.parallel.reduction.strategy;

import com.parallel.reduction.Dataset;
import com.parallel.reduction.Partition;
import com.parallel.reduction.sync.OneShotSlot;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;

/**
 * Workers keep no shared state at all: each publishes its private total to its own one-shot slot
 * and the calling thread sums the slots.
 */
public class TaskFuturesStrategy implements ReductionStrategy {

    private final String name;

    public TaskFuturesStrategy(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public long reduce(Dataset dataset, List<Partition> partitions) throws ReductionException {
        List<OneShotSlot<Long>> slots = new ArrayList<>(partitions.size());
        for (int i = 0; i < partitions.size(); i++) {
            slots.add(new OneShotSlot<>());
        }
        WorkerGroup workers = WorkerGroup.start(name, partitions, (worker, partition) -> {
            OneShotSlot<Long> slot = slots.get(worker);
            try {
                slot.set(dataset.sum(partition));
            } catch (RuntimeException | Error e) {
                slot.fail(e);
                throw e;
            }
        });

        long total = 0;
        try {
            for (OneShotSlot<Long> slot : slots) {
                total += slot.take();
            }
        } catch (ExecutionException e) {
            workers.join();
            throw new ReductionException(name + ": worker failed: " + e.getCause(), e.getCause());
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
            throw new ReductionException(name + ": interrupted while waiting for results", e);
        }
        workers.join();
        return total;
    }
}
