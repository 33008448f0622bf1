package com.star.pglogstats.analytics;

import com.star.pglogstats.entity.DurationMetrics;
import com.star.pglogstats.entity.LogRecord;
import com.star.pglogstats.entity.TimingAnalysis;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Time-of-day view of a set of log records. All calendar fields are taken in UTC.
 *
 * <p>Durations come from statement records, so link them first when the log
 * reports durations on separate lines.
 */
public class TimingAnalyzer {

    private final int bucketMinutes;

    public TimingAnalyzer() {
        this(AnalyticsConfig.defaults());
    }

    public TimingAnalyzer(AnalyticsConfig config) {
        config.validate();
        this.bucketMinutes = config.getHourlyBucketMinutes();
    }

    public TimingAnalysis analyze(List<LogRecord> records) {
        List<Double> samples = new ArrayList<>();
        Map<Integer, Double> hourly = new TreeMap<>();
        Map<Integer, Double> daily = new TreeMap<>();
        Map<Integer, Long> queriesByHour = new TreeMap<>();
        Map<Integer, Long> connectionsByHour = new TreeMap<>();
        Map<String, Long> intervals = new TreeMap<>();

        for (LogRecord record : records) {
            if (record.getTimestamp() == null) {
                continue;
            }
            ZonedDateTime time = record.getTimestamp().atZone(ZoneOffset.UTC);

            if (isConnectionEvent(record)) {
                connectionsByHour.merge(time.getHour(), 1L, Long::sum);
            }

            if (!record.isStatement()) {
                continue;
            }

            double duration = record.getDurationMs() != null ? record.getDurationMs() : 0.0;
            samples.add(duration);
            hourly.merge(time.getHour(), duration, Double::sum);
            daily.merge(time.getDayOfWeek().getValue(), duration, Double::sum);
            queriesByHour.merge(time.getHour(), 1L, Long::sum);
            intervals.merge(intervalKey(time), 1L, Long::sum);
        }

        DurationMetrics metrics = Percentiles.metrics(samples);

        return TimingAnalysis.builder()
                .averageResponseTimeMs(metrics.getAverageMs())
                .p95ResponseTimeMs(metrics.getP95Ms())
                .p99ResponseTimeMs(metrics.getP99Ms())
                .hourlyPatterns(Collections.unmodifiableMap(hourly))
                .dailyPatterns(Collections.unmodifiableMap(daily))
                .connectionsByHour(Collections.unmodifiableMap(connectionsByHour))
                .intervalBuckets(Collections.unmodifiableMap(intervals))
                .bucketMinutes(bucketMinutes)
                .peakHour(peakHour(queriesByHour))
                .build();
    }

    String intervalKey(ZonedDateTime time) {
        int slot = (time.getMinute() / bucketMinutes) * bucketMinutes;
        return String.format("%02d:%02d", time.getHour(), slot);
    }

    // Lowest hour wins ties; iteration is in ascending hour order.
    static Integer peakHour(Map<Integer, Long> queriesByHour) {
        Integer peak = null;
        long best = 0;
        for (Map.Entry<Integer, Long> entry : queriesByHour.entrySet()) {
            if (entry.getValue() > best) {
                best = entry.getValue();
                peak = entry.getKey();
            }
        }
        return peak;
    }

    private static boolean isConnectionEvent(LogRecord record) {
        return record.getMessage() != null
                && record.getMessage().toLowerCase(Locale.ROOT).contains("connection");
    }
}
