package com.star.pglogstats.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Summary statistics over a list of duration samples, in milliseconds.
 * Every field is {@code 0} for an empty sample list.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DurationMetrics {

    private long count;

    private double totalMs;

    private double averageMs;

    private double minMs;

    private double maxMs;

    private double p95Ms;

    private double p99Ms;

    public static DurationMetrics empty() {
        return DurationMetrics.builder().build();
    }
}
