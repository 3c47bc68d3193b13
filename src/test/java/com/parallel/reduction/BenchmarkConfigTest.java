package com.parallel.reduction;

import com.parallel.reduction.strategy.StrategyKind;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Arrays;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

public class BenchmarkConfigTest {

    @Test
    public void defaultsSelectEveryStrategy() {
        BenchmarkConfig config = BenchmarkConfig.fromArgs(new String[0]);

        assertThat(config.strategies(), equalTo(Arrays.asList(StrategyKind.values())));
        assertThat(config.size(), equalTo(BenchmarkConfig.DEFAULT_SIZE));
        assertThat(config.workers(), equalTo(4));
        assertThat(config.min(), equalTo(1));
        assertThat(config.max(), equalTo(10));
        assertThat(config.runs(), equalTo(1));
        assertThat(config.csvOutput(), nullValue());
        assertThat(config.chartOutput(), nullValue());
        assertThat(config.help(), is(false));
    }

    @Test
    public void parsesEveryOption() {
        BenchmarkConfig config = BenchmarkConfig.fromArgs(new String[]{
                "--strategy", "locked,futures",
                "--size", "1_000",
                "--workers", "8",
                "--min", "-5",
                "--max", "5",
                "--runs", "3",
                "--csv", "out/samples.csv",
                "--chart", "out/chart.png"});

        assertThat(config.strategies(), contains(StrategyKind.SHARED_LOCKED, StrategyKind.TASK_FUTURES));
        assertThat(config.size(), equalTo(1000));
        assertThat(config.workers(), equalTo(8));
        assertThat(config.min(), equalTo(-5));
        assertThat(config.max(), equalTo(5));
        assertThat(config.runs(), equalTo(3));
        assertThat(config.csvOutput(), equalTo(Paths.get("out/samples.csv")));
        assertThat(config.chartOutput(), equalTo(Paths.get("out/chart.png")));
        config.validate();
    }

    @Test
    public void rejectsMalformedArguments() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> BenchmarkConfig.fromArgs(new String[]{"--bogus"}));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> BenchmarkConfig.fromArgs(new String[]{"--size"}));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> BenchmarkConfig.fromArgs(new String[]{"--workers", "four"}));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> BenchmarkConfig.fromArgs(new String[]{"--strategy", "nope"}));
    }

    @Test
    public void validationRejectsImpossibleRuns() {
        assertInvalid("--size", "0");
        assertInvalid("--workers", "0");
        assertInvalid("--size", "3", "--workers", "4");
        assertInvalid("--runs", "0");
        assertInvalid("--min", "10", "--max", "1");
    }

    @Test
    public void widestRangeStillFitsTheTotal() {
        BenchmarkConfig config = BenchmarkConfig.fromArgs(new String[]{
                "--size", String.valueOf(Integer.MAX_VALUE),
                "--min", String.valueOf(Integer.MIN_VALUE),
                "--max", String.valueOf(Integer.MAX_VALUE)});
        config.validate();
    }

    private static void assertInvalid(String... args) {
        BenchmarkConfig config = BenchmarkConfig.fromArgs(args);
        Assertions.assertThrows(IllegalArgumentException.class, config::validate);
    }
}
