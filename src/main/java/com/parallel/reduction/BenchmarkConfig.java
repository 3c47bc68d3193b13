package com.parallel.reduction;

import com.parallel.reduction.strategy.StrategyKind;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Command-line settings of one benchmark invocation.
 */
public record BenchmarkConfig(
        List<StrategyKind> strategies,
        int size,
        int workers,
        int min,
        int max,
        int runs,
        Path csvOutput,
        Path chartOutput,
        boolean help) {

    public static final int DEFAULT_SIZE = 100_000_000;
    public static final int DEFAULT_WORKERS = 4;
    public static final int DEFAULT_MIN = 1;
    public static final int DEFAULT_MAX = 10;

    public static BenchmarkConfig fromArgs(String[] args) {
        List<StrategyKind> strategies = null;
        int size = DEFAULT_SIZE;
        int workers = DEFAULT_WORKERS;
        int min = DEFAULT_MIN;
        int max = DEFAULT_MAX;
        int runs = 1;
        Path csv = null;
        Path chart = null;
        boolean help = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--strategy" -> strategies = StrategyKind.parseSelection(valueAt(args, ++i));
                case "--size" -> size = parseInt(args, ++i);
                case "--workers" -> workers = parseInt(args, ++i);
                case "--min" -> min = parseInt(args, ++i);
                case "--max" -> max = parseInt(args, ++i);
                case "--runs" -> runs = parseInt(args, ++i);
                case "--csv" -> csv = Paths.get(valueAt(args, ++i));
                case "--chart" -> chart = Paths.get(valueAt(args, ++i));
                case "--help" -> help = true;
                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        if (strategies == null) {
            strategies = StrategyKind.parseSelection(StrategyKind.ALL);
        }
        return new BenchmarkConfig(strategies, size, workers, min, max, runs, csv, chart, help);
    }

    /**
     * Rejects settings no run could honour, before any dataset is generated.
     */
    public void validate() {
        if (size <= 0) {
            throw new IllegalArgumentException("Dataset size must be positive: " + size);
        }
        if (workers <= 0) {
            throw new IllegalArgumentException("Worker count must be positive: " + workers);
        }
        if (size < workers) {
            throw new IllegalArgumentException("Dataset size " + size + " is smaller than worker count " + workers);
        }
        if (runs <= 0) {
            throw new IllegalArgumentException("Runs must be positive: " + runs);
        }
        if (min > max) {
            throw new IllegalArgumentException("Invalid value range [" + min + ", " + max + "]");
        }
        long magnitude = Math.max(Math.abs((long) min), Math.abs((long) max));
        try {
            Math.multiplyExact((long) size, magnitude);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Summing " + size + " values bounded by " + magnitude
                    + " would overflow the total", e);
        }
    }

    private static String valueAt(String[] args, int idx) {
        if (idx >= args.length) {
            throw new IllegalArgumentException("Value expected after " + args[idx - 1]);
        }
        return args[idx];
    }

    private static int parseInt(String[] args, int idx) {
        String raw = valueAt(args, idx);
        try {
            return Integer.parseInt(raw.trim().replace("_", ""));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected an integer after " + args[idx - 1] + ": " + raw, e);
        }
    }
}
