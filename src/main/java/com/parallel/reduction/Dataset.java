package com.parallel.reduction;

import java.util.Arrays;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Immutable sequence of integers shared read-only by every worker of a run.
 */
public final class Dataset {

    private final int[] values;

    private Dataset(int[] values) {
        this.values = values;
    }

    /**
     * Fills a buffer of {@code length} values drawn uniformly from {@code [min, max]}.
     */
    public static Dataset generate(int length, int min, int max) {
        if (length < 0) {
            throw new IllegalArgumentException("Dataset length must not be negative: " + length);
        }
        if (min > max) {
            throw new IllegalArgumentException("Invalid value range [" + min + ", " + max + "]");
        }
        int[] values = new int[length];
        ThreadLocalRandom random = ThreadLocalRandom.current();
        long bound = (long) max + 1;
        for (int i = 0; i < length; i++) {
            values[i] = (int) random.nextLong(min, bound);
        }
        return new Dataset(values);
    }

    public static Dataset of(int... values) {
        return new Dataset(Arrays.copyOf(values, values.length));
    }

    public int length() {
        return values.length;
    }

    public int get(int index) {
        return values[index];
    }

    /**
     * Plain single-threaded sum, used as the reference every strategy must match.
     */
    public long sequentialSum() {
        long sum = 0;
        for (int value : values) {
            sum += value;
        }
        return sum;
    }

    /**
     * Sums {@code [begin, end)} into a private accumulator.
     */
    public long sum(Partition partition) {
        long sum = 0;
        for (int i = partition.begin(); i < partition.end(); i++) {
            sum += values[i];
        }
        return sum;
    }
}
