package com.parallel.reduction.sync;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-use hand-off between one producer and one consumer.
 *
 * <p>The slot is completed at most once, either with a value or with the failure that
 * kept the producer from computing it, and read at most once. {@link #take()} blocks
 * until completion; the latch gives the reader visibility of everything the producer
 * wrote before completing.
 */
public final class OneShotSlot<T> {

    private final CountDownLatch completed = new CountDownLatch(1);
    private final AtomicBoolean written = new AtomicBoolean(false);
    private final AtomicBoolean taken = new AtomicBoolean(false);

    private T value;
    private Throwable failure;

    public void set(T value) {
        claimWrite();
        this.value = value;
        completed.countDown();
    }

    public void fail(Throwable cause) {
        claimWrite();
        this.failure = cause;
        completed.countDown();
    }

    public T take() throws InterruptedException, ExecutionException {
        if (!taken.compareAndSet(false, true)) {
            throw new IllegalStateException("Slot has already been read");
        }
        completed.await();
        if (failure != null) {
            throw new ExecutionException(failure);
        }
        return value;
    }

    public boolean isCompleted() {
        return completed.getCount() == 0;
    }

    private void claimWrite() {
        if (!written.compareAndSet(false, true)) {
            throw new IllegalStateException("Slot has already been written");
        }
    }
}
