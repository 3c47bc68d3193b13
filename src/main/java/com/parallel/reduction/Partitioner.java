package com.parallel.reduction;

import java.util.ArrayList;
import java.util.List;

/**
 * Static equal-sized split of a dataset index range.
 */
public final class Partitioner {

    private Partitioner() {
    }

    /**
     * Splits {@code [0, datasetLength)} into {@code workerCount} contiguous, non-empty ranges.
     * Every range holds {@code datasetLength / workerCount} indices; the last one also takes the remainder.
     */
    public static List<Partition> partition(int datasetLength, int workerCount) {
        if (workerCount <= 0) {
            throw new IllegalArgumentException("Worker count must be positive: " + workerCount);
        }
        if (datasetLength <= 0) {
            throw new IllegalArgumentException("Dataset must not be empty: " + datasetLength);
        }
        if (datasetLength < workerCount) {
            throw new IllegalArgumentException("Dataset length " + datasetLength
                    + " is smaller than worker count " + workerCount);
        }
        int chunkSize = datasetLength / workerCount;
        List<Partition> partitions = new ArrayList<>(workerCount);
        for (int i = 0; i < workerCount; i++) {
            int begin = i * chunkSize;
            int end = i == workerCount - 1 ? datasetLength : begin + chunkSize;
            partitions.add(new Partition(begin, end));
        }
        return List.copyOf(partitions);
    }
}
