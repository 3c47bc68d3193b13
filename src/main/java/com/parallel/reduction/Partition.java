package com.parallel.reduction;

/**
 * Half-open index range {@code [begin, end)} of a dataset assigned to one worker.
 */
public record Partition(int begin, int end) {

    public Partition {
        if (begin < 0 || end < begin) {
            throw new IllegalArgumentException("Invalid partition [" + begin + ", " + end + ")");
        }
    }

    public int size() {
        return end - begin;
    }
}
