package com.parallel.reduction.strategy;

import com.parallel.reduction.Dataset;
import com.parallel.reduction.Partition;

import java.util.List;

/**
 * Base contract for summation strategies.
 *
 * <p>Each call works on fresh accumulator state, so consecutive runs never share a total.
 */
public interface ReductionStrategy {
    String name();

    long reduce(Dataset dataset, List<Partition> partitions) throws ReductionException;
}
