package com.star.pglogstats.analytics;

import com.star.pglogstats.entity.AnalysisResult;
import com.star.pglogstats.entity.DurationMetrics;
import com.star.pglogstats.entity.FrequentQuery;
import com.star.pglogstats.entity.HourlyBucket;
import com.star.pglogstats.entity.LogRecord;
import com.star.pglogstats.entity.QueryType;
import com.star.pglogstats.entity.SlowQuery;
import com.star.pglogstats.sql.LiteralNormalizer;
import com.star.pglogstats.sql.QueryClassifier;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Computes query counts, duration percentiles, slow and frequent query rankings
 * and hour-of-day buckets over a set of log records in one pass.
 *
 * <p>Only {@code statement:} records count as queries. A statement without a
 * known duration contributes a {@code 0} ms sample. Rankings are stable: equal
 * durations or counts keep the order in which they were first seen.
 *
 * <p>Instances are immutable and can be shared; every call to
 * {@link #analyze(List)} works on its own state.
 */
@Slf4j
public class AnalyticsAggregator {

    @Getter
    private final AnalyticsConfig config;

    private final QueryClassifier classifier;

    private final LiteralNormalizer normalizer;

    public AnalyticsAggregator() {
        this(AnalyticsConfig.defaults());
    }

    public AnalyticsAggregator(AnalyticsConfig config) {
        this(config, new QueryClassifier(), new LiteralNormalizer());
    }

    /**
     * @throws com.star.pglogstats.exception.ConfigurationException if the config is invalid
     */
    public AnalyticsAggregator(AnalyticsConfig config, QueryClassifier classifier, LiteralNormalizer normalizer) {
        config.validate();
        this.config = config.toBuilder().build();
        this.classifier = classifier;
        this.normalizer = normalizer;
    }

    public AnalysisResult analyze(List<LogRecord> records) {
        Accumulator acc = new Accumulator();
        for (LogRecord record : records) {
            acc.add(record);
        }

        AnalysisResult result = acc.toResult();
        log.debug("Analyzed {} records: {} queries, {} errors, {} slow candidates",
                result.getTotalRecords(), result.getTotalQueries(), result.getErrorCount(), acc.slowCandidates.size());
        return result;
    }

    private class Accumulator {

        private long totalRecords;
        private long errorCount;
        private long connectionCount;

        private final Map<QueryType, Long> typeCounts = new EnumMap<>(QueryType.class);
        private final Map<String, Long> frequencies = new LinkedHashMap<>();
        private final List<Double> samples = new ArrayList<>();
        private final List<SlowQuery> slowCandidates = new ArrayList<>();
        private final Map<Integer, BucketState> buckets = new TreeMap<>();

        void add(LogRecord record) {
            totalRecords++;

            if (record.isStatement()) {
                addStatement(record);
            }
            if (record.isError()) {
                errorCount++;
            }
            if (record.getMessage() != null
                    && record.getMessage().toLowerCase(Locale.ROOT).contains("connection")) {
                connectionCount++;
            }
        }

        private void addStatement(LogRecord record) {
            String sql = statementText(record);
            QueryType type = classifier.classify(sql);
            String normalized = normalizer.normalize(sql);
            double duration = record.getDurationMs() != null ? record.getDurationMs() : 0.0;

            typeCounts.merge(type, 1L, Long::sum);
            frequencies.merge(normalized, 1L, Long::sum);
            samples.add(duration);

            if (record.getTimestamp() != null) {
                int hour = record.getTimestamp().atZone(ZoneOffset.UTC).getHour();
                buckets.computeIfAbsent(hour, BucketState::new).add(record.getTimestamp(), duration);
            }

            if (duration > config.getSlowQueryThresholdMs()) {
                slowCandidates.add(new SlowQuery(normalized, duration));
            }
        }

        AnalysisResult toResult() {
            DurationMetrics metrics = Percentiles.metrics(samples);

            List<SlowQuery> slowest = slowCandidates.stream()
                    .sorted(Comparator.comparingDouble(SlowQuery::getDurationMs).reversed())
                    .limit(config.getMaxSlowQueries())
                    .collect(Collectors.toList());

            List<FrequentQuery> mostFrequent = frequencies.entrySet().stream()
                    .map(e -> new FrequentQuery(e.getKey(), e.getValue()))
                    .sorted(Comparator.comparingLong(FrequentQuery::getCount).reversed())
                    .limit(config.getMaxFrequentQueries())
                    .collect(Collectors.toList());

            Map<Integer, HourlyBucket> hourly = new TreeMap<>();
            buckets.forEach((hour, state) -> hourly.put(hour, state.toBucket()));

            return AnalysisResult.builder()
                    .totalRecords(totalRecords)
                    .totalQueries(metrics.getCount())
                    .totalDurationMs(metrics.getTotalMs())
                    .averageDurationMs(metrics.getAverageMs())
                    .minDurationMs(metrics.getMinMs())
                    .maxDurationMs(metrics.getMaxMs())
                    .p95DurationMs(metrics.getP95Ms())
                    .p99DurationMs(metrics.getP99Ms())
                    .queryTypeCounts(Collections.unmodifiableMap(new EnumMap<>(typeCounts)))
                    .slowestQueries(List.copyOf(slowest))
                    .mostFrequentQueries(List.copyOf(mostFrequent))
                    .errorCount(errorCount)
                    .errorRate(totalRecords > 0 ? (double) errorCount / totalRecords : 0.0)
                    .connectionCount(connectionCount)
                    .hourlyBuckets(Collections.unmodifiableMap(hourly))
                    .build();
        }
    }

    static String statementText(LogRecord record) {
        if (record.getStatement() != null) {
            return record.getStatement();
        }
        String message = record.getMessage() != null ? record.getMessage() : "";
        return message.startsWith("statement: ") ? message.substring("statement: ".length()) : message;
    }

    private static class BucketState {

        private final int hour;
        private long count;
        private double totalDurationMs;
        private Instant first;
        private Instant last;

        BucketState(int hour) {
            this.hour = hour;
        }

        void add(Instant timestamp, double durationMs) {
            count++;
            totalDurationMs += durationMs;
            if (first == null || timestamp.isBefore(first)) {
                first = timestamp;
            }
            if (last == null || timestamp.isAfter(last)) {
                last = timestamp;
            }
        }

        HourlyBucket toBucket() {
            double qps = 0.0;
            if (count >= 2) {
                double spanSeconds = Duration.between(first, last).toNanos() / 1_000_000_000.0;
                if (spanSeconds > 0) {
                    qps = count / spanSeconds;
                }
            }
            return HourlyBucket.builder()
                    .hour(hour)
                    .queryCount(count)
                    .totalDurationMs(totalDurationMs)
                    .queriesPerSecond(qps)
                    .build();
        }
    }
}
