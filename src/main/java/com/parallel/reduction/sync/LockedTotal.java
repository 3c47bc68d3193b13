package com.parallel.reduction.sync;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Total guarded by a mutual-exclusion lock: every add is a critical section.
 */
public final class LockedTotal implements SharedTotal {

    private final ReentrantLock lock = new ReentrantLock();
    private long total;

    @Override
    public void add(long delta) {
        lock.lock();
        try {
            total += delta;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long sum() {
        lock.lock();
        try {
            return total;
        } finally {
            lock.unlock();
        }
    }
}
