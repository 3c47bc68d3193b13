package com.parallel.reduction;

import com.parallel.reduction.strategy.ReductionStrategy;
import com.parallel.reduction.strategy.StrategyKind;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

/**
 * Simple CLI runner for benchmarking the reduction strategies.
 */
public class BenchmarkRunner {

    static final int EXIT_OK = 0;
    static final int EXIT_RUN_FAILED = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        BenchmarkConfig config;
        try {
            config = BenchmarkConfig.fromArgs(args);
            if (config.help()) {
                printUsage(out);
                return EXIT_OK;
            }
            config.validate();
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            printUsage(err);
            return EXIT_USAGE;
        }

        List<ReductionStrategy> strategies = config.strategies().stream()
                .map(StrategyKind::create)
                .toList();

        out.println("Generating " + config.size() + " values in [" + config.min() + ", " + config.max() + "]...");
        Dataset dataset = Dataset.generate(config.size(), config.min(), config.max());
        out.println("Dataset: " + dataset.length() + " values | workers: " + config.workers()
                + " | runs: " + config.runs());

        Report report = BenchmarkHarness.runAll(strategies, dataset, config.workers(), config.runs(),
                sample -> out.println(ConsoleReport.format(sample)));
        if (config.runs() > 1) {
            ConsoleReport.printSummary(out, report);
        }

        int exported = export(report, config.csvOutput(), config.chartOutput(), out, err);
        if (exported != EXIT_OK) {
            return exported;
        }

        if (report.hasFailures()) {
            err.println("One or more runs failed or did not match the sequential reference.");
            return EXIT_RUN_FAILED;
        }
        return EXIT_OK;
    }

    static int export(Report report, Path csvOutput, Path chartOutput, PrintStream out, PrintStream err) {
        try {
            if (csvOutput != null) {
                CsvExporter.write(csvOutput, report.samples());
                out.println("\nCSV saved to: " + csvOutput.toAbsolutePath());
            }
            if (chartOutput != null) {
                if (ChartGenerator.exportMeanDurationChart(report, chartOutput)) {
                    out.println("Chart saved to: " + chartOutput.toAbsolutePath());
                } else {
                    err.println("Chart skipped: no run completed.");
                }
            }
        } catch (IOException e) {
            err.println("Could not write report: " + e.getMessage());
            return EXIT_RUN_FAILED;
        }
        return EXIT_OK;
    }

    private static void printUsage(PrintStream out) {
        out.println("""
                Usage:
                  java -jar target/reduction-parallel-1.0.0-jar-with-dependencies.jar
                      [--strategy all|<id>[,<id>...]] [--size 100000000] [--workers 4]
                      [--min 1] [--max 10] [--runs 1] [--csv results/out.csv] [--chart results/out.png]

                Options:
                  --strategy <list>    Strategies to run, comma separated, or "all" (default: all)
                  --size <n>           Number of values in the dataset (default: 100000000)
                  --workers <n>        Worker threads per run (default: 4)
                  --min <n>            Smallest generated value (default: 1)
                  --max <n>            Largest generated value (default: 10)
                  --runs <n>           Repetitions of each strategy (default: 1)
                  --csv <file>         Write every sample to a CSV file (optional)
                  --chart <file>       Write a PNG chart of mean times (optional)
                  --help               Show this message

                Strategies:
                  %s
                """.formatted(StrategyKind.ids()));
    }
}
