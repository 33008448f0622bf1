package com.star.pglogstats.analytics;

import com.star.pglogstats.entity.LogLevel;
import com.star.pglogstats.entity.LogRecord;

import java.time.Instant;

final class AnalyticsTestRecords {

    private AnalyticsTestRecords() {
    }

    static LogRecord statement(String sql, Double durationMs, String timestamp) {
        return LogRecord.builder()
                .timestamp(timestamp != null ? Instant.parse(timestamp) : null)
                .processId("100")
                .level(LogLevel.STATEMENT)
                .message("statement: " + sql)
                .statement(sql)
                .durationMs(durationMs)
                .build();
    }

    static LogRecord statement(String sql, double durationMs) {
        return statement(sql, durationMs, "2024-01-15T10:00:00Z");
    }

    static LogRecord duration(String processId, double durationMs) {
        return LogRecord.builder()
                .timestamp(Instant.parse("2024-01-15T10:00:01Z"))
                .processId(processId)
                .level(LogLevel.DURATION)
                .message("duration: " + durationMs + " ms")
                .durationMs(durationMs)
                .build();
    }

    static LogRecord event(LogLevel level, String message, String timestamp) {
        return LogRecord.builder()
                .timestamp(Instant.parse(timestamp))
                .processId("100")
                .level(level)
                .message(message)
                .build();
    }
}
