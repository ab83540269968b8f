package com.qa.trust.engine;

import com.qa.trust.model.DurationStats;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class DurationStatistics {

    private DurationStatistics() {}

    /**
     * @return summary statistics, or {@code null} for an empty sample
     */
    public static DurationStats summarize(List<Double> durations) {
        if (durations.isEmpty()) {
            return null;
        }
        List<Double> sorted = new ArrayList<>(durations);
        Collections.sort(sorted);

        double mean = mean(durations);
        int n = sorted.size();
        double median = n % 2 == 1
                ? sorted.get(n / 2)
                : (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0;

        double stdDev = 0.0;
        if (n > 1) {
            double sumSq = 0.0;
            for (double d : durations) {
                sumSq += (d - mean) * (d - mean);
            }
            stdDev = Math.sqrt(sumSq / (n - 1));
        }

        return DurationStats.builder()
                .samples(n)
                .mean(round4(mean))
                .median(round4(median))
                .stdDev(round4(stdDev))
                .min(sorted.get(0))
                .max(sorted.get(n - 1))
                .build();
    }

    public static double mean(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    private static double round4(double value) {
        return Math.round(value * 10000.0) / 10000.0;
    }
}
