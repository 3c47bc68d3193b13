package com.parallel.reduction.sync;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;

public class AtomicTotalTest {

    @Test
    public void kindsMapToBackends() {
        assertThat(TotalKind.LOCK.newTotal(), instanceOf(LockedTotal.class));
        assertThat(((AtomicTotal) TotalKind.ATOMIC_SEQ_CST.newTotal()).ordering(), equalTo(MemoryOrdering.SEQ_CST));
        assertThat(((AtomicTotal) TotalKind.ATOMIC_RELAXED.newTotal()).ordering(), equalTo(MemoryOrdering.RELAXED));
    }

    @Test
    public void requiresOrdering() {
        Assertions.assertThrows(NullPointerException.class, () -> new AtomicTotal(null));
    }
}
