package com.star.pglogstats.entity;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Consolidated analytics over one set of log records. Immutable once built:
 * collections are unmodifiable copies made by the aggregator.
 */
@Value
@Builder
public class AnalysisResult {

    long totalRecords;

    long totalQueries;

    double totalDurationMs;

    double averageDurationMs;

    double minDurationMs;

    double maxDurationMs;

    double p95DurationMs;

    double p99DurationMs;

    Map<QueryType, Long> queryTypeCounts;

    List<SlowQuery> slowestQueries;

    List<FrequentQuery> mostFrequentQueries;

    long errorCount;

    double errorRate;

    long connectionCount;

    Map<Integer, HourlyBucket> hourlyBuckets;
}
