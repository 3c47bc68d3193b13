package com.parallel.reduction.sync;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;

public class OneShotSlotTest {

    @Test
    public void readerBlocksUntilValueIsPublished() throws Exception {
        OneShotSlot<Long> slot = new OneShotSlot<>();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Long> reader = executor.submit(slot::take);
            Thread.sleep(50);
            assertThat(reader.isDone(), is(false));
            assertThat(slot.isCompleted(), is(false));

            slot.set(42L);

            assertThat(reader.get(10, TimeUnit.SECONDS), equalTo(42L));
            assertThat(slot.isCompleted(), is(true));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void valueIsWrittenOnlyOnce() {
        OneShotSlot<Long> slot = new OneShotSlot<>();
        slot.set(1L);

        Assertions.assertThrows(IllegalStateException.class, () -> slot.set(2L));
        Assertions.assertThrows(IllegalStateException.class, () -> slot.fail(new RuntimeException()));
    }

    @Test
    public void valueIsReadOnlyOnce() throws Exception {
        OneShotSlot<Long> slot = new OneShotSlot<>();
        slot.set(7L);

        assertThat(slot.take(), equalTo(7L));
        Assertions.assertThrows(IllegalStateException.class, slot::take);
    }

    @Test
    public void failureIsHandedToReader() {
        OneShotSlot<Long> slot = new OneShotSlot<>();
        slot.fail(new OutOfMemoryError("no room"));

        ExecutionException e = Assertions.assertThrows(ExecutionException.class, slot::take);
        assertThat(e.getCause(), instanceOf(OutOfMemoryError.class));
    }
}
