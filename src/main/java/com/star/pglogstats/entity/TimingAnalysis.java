package com.star.pglogstats.entity;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Time-of-day view of the query load: response time percentiles, duration
 * sums per hour and per weekday, connection activity and the busiest hour.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TimingAnalysis {

    double averageResponseTimeMs;

    double p95ResponseTimeMs;

    double p99ResponseTimeMs;

    /** hour of day (0-23) to summed query duration */
    Map<Integer, Double> hourlyPatterns;

    /** ISO day of week (1 = Monday) to summed query duration */
    Map<Integer, Double> dailyPatterns;

    Map<Integer, Long> connectionsByHour;

    /** slot start ({@code HH:mm}) to query count, slot width is the configured bucket size */
    Map<String, Long> intervalBuckets;

    int bucketMinutes;

    Integer peakHour;
}
