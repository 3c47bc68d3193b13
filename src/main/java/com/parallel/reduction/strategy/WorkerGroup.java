package com.parallel.reduction.strategy;

import com.parallel.reduction.Partition;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One dedicated thread per partition, started together and joined together.
 *
 * <p>The pool is sized to the partition count, so each submitted task starts its own
 * thread and every worker scans exactly one partition.
 */
public final class WorkerGroup {

    private final String name;
    private final ExecutorService executor;
    private final List<Future<?>> futures;

    private WorkerGroup(String name, ExecutorService executor, List<Future<?>> futures) {
        this.name = name;
        this.executor = executor;
        this.futures = futures;
    }

    public static WorkerGroup start(String name, List<Partition> partitions, PartitionTask task) {
        if (partitions.isEmpty()) {
            throw new IllegalArgumentException("At least one partition is required");
        }
        AtomicInteger sequence = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(partitions.size(), r -> {
            Thread t = new Thread(r, name + "-worker-" + sequence.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        List<Future<?>> futures = new ArrayList<>(partitions.size());
        for (int i = 0; i < partitions.size(); i++) {
            int workerIndex = i;
            Partition partition = partitions.get(i);
            futures.add(executor.submit(() -> {
                task.run(workerIndex, partition);
                return null;
            }));
        }
        return new WorkerGroup(name, executor, futures);
    }

    public int size() {
        return futures.size();
    }

    /**
     * Waits until every worker has finished, failed ones included. Any worker failure fails the
     * whole group, reported with the first failure seen.
     */
    public void join() throws ReductionException {
        Throwable failure = null;
        try {
            for (Future<?> future : futures) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    if (failure == null) {
                        failure = e.getCause();
                    }
                }
            }
            executor.shutdown();
        } catch (InterruptedException e) {
            shutdownNow();
            Thread.currentThread().interrupt();
            throw new ReductionException(name + ": interrupted while joining workers", e);
        }
        if (failure != null) {
            throw new ReductionException(name + ": worker failed: " + failure, failure);
        }
    }

    /**
     * Abandons the group without waiting. Workers still scanning finish their partition and exit.
     */
    public void shutdownNow() {
        executor.shutdownNow();
    }
}
