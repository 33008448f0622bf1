package com.star.pglogstats.analytics;

import com.star.pglogstats.entity.DurationMetrics;
import com.star.pglogstats.exception.ConfigurationException;

import java.util.Arrays;
import java.util.List;

/**
 * Nearest-rank percentiles: the value at index {@code floor(n * p)} of the
 * ascending samples, clamped to the last index. No interpolation.
 */
public final class Percentiles {

    private Percentiles() {
    }

    /**
     * @param sortedSamples samples in ascending order
     * @param p             percentile in (0, 1]
     * @return the nearest-rank value, {@code 0.0} for no samples
     * @throws ConfigurationException if {@code p} is outside (0, 1]
     */
    public static double nearestRank(double[] sortedSamples, double p) {
        if (!(p > 0.0 && p <= 1.0)) {
            throw ConfigurationException.invalidPercentile(p);
        }
        if (sortedSamples.length == 0) {
            return 0.0;
        }
        int index = (int) Math.floor(sortedSamples.length * p);
        return sortedSamples[Math.min(index, sortedSamples.length - 1)];
    }

    public static DurationMetrics metrics(List<Double> samples) {
        if (samples == null || samples.isEmpty()) {
            return DurationMetrics.empty();
        }

        double[] sorted = samples.stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(sorted);

        double total = sum(sorted);

        return DurationMetrics.builder()
                .count(sorted.length)
                .totalMs(total)
                .averageMs(total / sorted.length)
                .minMs(sorted[0])
                .maxMs(sorted[sorted.length - 1])
                .p95Ms(nearestRank(sorted, 0.95))
                .p99Ms(nearestRank(sorted, 0.99))
                .build();
    }

    /**
     * Sums ascending samples so the result does not depend on encounter order.
     */
    static double sum(double[] sortedSamples) {
        double total = 0.0;
        for (double sample : sortedSamples) {
            total += sample;
        }
        return total;
    }
}
