package com.parallel.reduction.sync;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.Objects;

/**
 * Lock-free total updated with an atomic fetch-and-add of the configured ordering.
 */
public final class AtomicTotal implements SharedTotal {

    private final MemoryOrdering ordering;
    private long total;

    public AtomicTotal(MemoryOrdering ordering) {
        this.ordering = Objects.requireNonNull(ordering, "ordering");
    }

    public MemoryOrdering ordering() {
        return ordering;
    }

    @Override
    public void add(long delta) {
        if (ordering == MemoryOrdering.SEQ_CST) {
            TOTAL.getAndAdd(this, delta);
        } else {
            addRelaxed(delta);
        }
    }

    private void addRelaxed(long delta) {
        long current;
        do {
            current = (long) TOTAL.getOpaque(this);
        } while (!TOTAL.weakCompareAndSetPlain(this, current, current + delta));
    }

    @Override
    public long sum() {
        return ordering == MemoryOrdering.SEQ_CST
                ? (long) TOTAL.getVolatile(this)
                : (long) TOTAL.getOpaque(this);
    }

    private static final VarHandle TOTAL;
    static {
        try {
            MethodHandles.Lookup l = MethodHandles.lookup();
            TOTAL = l.findVarHandle(AtomicTotal.class, "total", long.class);
        } catch (ReflectiveOperationException e) {
            throw new ExceptionInInitializerError(e);
        }
    }
}
