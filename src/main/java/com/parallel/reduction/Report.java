package com.parallel.reduction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Timing samples in the order they were produced.
 */
public final class Report {

    private final List<TimingSample> samples = new ArrayList<>();

    public void add(TimingSample sample) {
        samples.add(sample);
    }

    public List<TimingSample> samples() {
        return Collections.unmodifiableList(samples);
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    public boolean hasFailures() {
        return samples.stream().anyMatch(s -> s.failed() || !s.verified());
    }

    /**
     * Mean elapsed seconds of the completed samples, per strategy, in first-seen order.
     */
    public Map<String, Double> meanSecondsByStrategy() {
        Map<String, Stats> aggregated = new LinkedHashMap<>();
        for (TimingSample s : samples) {
            if (!s.failed()) {
                aggregated.computeIfAbsent(s.strategy(), k -> new Stats()).add(s.elapsedSeconds());
            }
        }
        Map<String, Double> means = new LinkedHashMap<>();
        aggregated.forEach((strategy, stats) -> means.put(strategy, stats.average()));
        return means;
    }

    private static class Stats {
        private double total = 0;
        private int count = 0;

        void add(double value) {
            total += value;
            count++;
        }

        double average() {
            return count == 0 ? 0 : total / count;
        }
    }
}
