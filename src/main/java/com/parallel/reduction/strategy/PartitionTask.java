package com.parallel.reduction.strategy;

import com.parallel.reduction.Partition;

/**
 * Body executed by one worker over its partition.
 */
@FunctionalInterface
public interface PartitionTask {
    void run(int workerIndex, Partition partition) throws Exception;
}
