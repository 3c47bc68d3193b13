package com.parallel.reduction.sync;

/**
 * Backend used to combine contributions into a shared total.
 */
public enum TotalKind {
    LOCK,
    ATOMIC_SEQ_CST,
    ATOMIC_RELAXED;

    public SharedTotal newTotal() {
        return switch (this) {
            case LOCK -> new LockedTotal();
            case ATOMIC_SEQ_CST -> new AtomicTotal(MemoryOrdering.SEQ_CST);
            case ATOMIC_RELAXED -> new AtomicTotal(MemoryOrdering.RELAXED);
        };
    }
}
