package com.parallel.reduction.strategy;

import com.parallel.reduction.Dataset;
import com.parallel.reduction.Partition;
import com.parallel.reduction.Partitioner;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;

public class ReductionStrategyTest {

    @ParameterizedTest
    @EnumSource(StrategyKind.class)
    public void sumsOneToTenWithTwoWorkers(StrategyKind kind) throws Exception {
        Dataset dataset = Dataset.of(1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
        List<Partition> partitions = Partitioner.partition(dataset.length(), 2);

        assertThat(kind.create().reduce(dataset, partitions), equalTo(55L));
    }

    @ParameterizedTest
    @EnumSource(StrategyKind.class)
    public void matchesSequentialReference(StrategyKind kind) throws Exception {
        Dataset dataset = Dataset.generate(200_003, 1, 10);
        long reference = dataset.sequentialSum();

        for (int workers : new int[]{1, 2, 3, 4, 7, 16}) {
            List<Partition> partitions = Partitioner.partition(dataset.length(), workers);
            assertThat(kind + " with " + workers + " workers",
                    kind.create().reduce(dataset, partitions), equalTo(reference));
        }
    }

    @ParameterizedTest
    @EnumSource(StrategyKind.class)
    public void handlesNegativeAndExtremeValues(StrategyKind kind) throws Exception {
        Dataset dataset = Dataset.of(Integer.MAX_VALUE, Integer.MIN_VALUE, -1, Integer.MAX_VALUE, 42, Integer.MAX_VALUE);
        List<Partition> partitions = Partitioner.partition(dataset.length(), 3);

        assertThat(kind.create().reduce(dataset, partitions), equalTo(dataset.sequentialSum()));
    }

    @ParameterizedTest
    @EnumSource(StrategyKind.class)
    public void repeatedRunsAgree(StrategyKind kind) throws Exception {
        Dataset dataset = Dataset.generate(50_000, 1, 10);
        List<Partition> partitions = Partitioner.partition(dataset.length(), 4);
        ReductionStrategy strategy = kind.create();

        long first = strategy.reduce(dataset, partitions);
        long second = strategy.reduce(dataset, partitions);

        assertThat(second, equalTo(first));
        assertThat(first, equalTo(dataset.sequentialSum()));
    }

    @ParameterizedTest
    @EnumSource(StrategyKind.class)
    public void singleWorkerMatchesReference(StrategyKind kind) throws Exception {
        Dataset dataset = Dataset.generate(1_000, -10, 10);

        assertThat(kind.create().reduce(dataset, Partitioner.partition(dataset.length(), 1)),
                equalTo(dataset.sequentialSum()));
    }
}
