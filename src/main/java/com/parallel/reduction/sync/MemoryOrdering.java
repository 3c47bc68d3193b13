package com.parallel.reduction.sync;

/**
 * Ordering strength of an atomic read-modify-write on a shared total.
 */
public enum MemoryOrdering {
    /** Volatile access: all such operations fall into one global order. */
    SEQ_CST,
    /** Atomic only; no ordering with respect to other memory operations. */
    RELAXED
}
