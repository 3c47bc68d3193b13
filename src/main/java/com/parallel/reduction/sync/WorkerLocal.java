package com.parallel.reduction.sync;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Accumulator storage bound to the calling worker thread.
 *
 * <p>A worker asks for its {@link Cell} with {@link #cell()}; the cell is created at zero on
 * first request from that thread and dropped by {@link #release()} when the worker ends.
 */
public final class WorkerLocal {

    private final AtomicInteger liveCells = new AtomicInteger();
    private final ThreadLocal<Cell> cells = ThreadLocal.withInitial(() -> {
        liveCells.incrementAndGet();
        return new Cell();
    });

    public Cell cell() {
        return cells.get();
    }

    /**
     * Discards the calling thread's cell and returns its final value.
     */
    public long release() {
        Cell cell = cells.get();
        cells.remove();
        liveCells.decrementAndGet();
        return cell.value;
    }

    /** Number of cells created and not yet released. */
    public int liveCells() {
        return liveCells.get();
    }

    public static final class Cell {
        private long value;

        public void add(long delta) {
            value += delta;
        }

        public long value() {
            return value;
        }
    }
}
