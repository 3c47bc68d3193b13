package com.parallel.reduction;

import org.knowm.xchart.BitmapEncoder;
import org.knowm.xchart.CategoryChart;
import org.knowm.xchart.CategoryChartBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class ChartGenerator {

    private ChartGenerator() {
    }

    /**
     * Writes a PNG bar chart with the mean elapsed seconds of every strategy in the report.
     * Nothing is written when no run completed.
     *
     * @return whether the chart file was written
     */
    public static boolean exportMeanDurationChart(Report report, Path outputFile) throws IOException {
        Map<String, Double> means = report.meanSecondsByStrategy();
        if (means.isEmpty()) {
            return false;
        }
        if (outputFile.getParent() != null) {
            Files.createDirectories(outputFile.getParent());
        }

        TimingSample first = report.samples().get(0);
        CategoryChart chart = new CategoryChartBuilder()
                .width(1100)
                .height(650)
                .title("Mean reduction time (" + first.datasetLength() + " values, "
                        + first.workers() + " workers)")
                .xAxisTitle("Strategy")
                .yAxisTitle("Time (s)")
                .build();

        chart.getStyler().setLegendVisible(false);
        chart.getStyler().setAvailableSpaceFill(0.8);
        chart.getStyler().setXAxisLabelRotation(30);

        List<String> strategies = new ArrayList<>(means.keySet());
        List<Double> seconds = new ArrayList<>(means.values());
        chart.addSeries("mean", strategies, seconds);

        BitmapEncoder.saveBitmap(chart, outputFile.toString(), BitmapEncoder.BitmapFormat.PNG);
        return true;
    }
}
