package com.star.pglogstats.parser;

import java.util.Locale;

/**
 * Line prefix layout produced by the server's {@code log_line_prefix} setting.
 * The two layouts cannot be told apart reliably, so the caller picks one.
 */
public enum LogPrefixFormat {

    /**
     * {@code 2024-01-15 10:30:45.123 UTC [1234] alice@shop psql: LOG:  message}
     */
    STDERR,

    /**
     * {@code 2024-01-15 10:30:45 UTC [1234]: [1-1] user=alice,db=shop,app=psql,client=10.0.0.5:5432 LOG:  message}
     */
    KEY_VALUE;

    public static LogPrefixFormat fromString(String value) {
        if (value == null || value.isBlank()) {
            return STDERR;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (LogPrefixFormat format : values()) {
            if (format.name().equals(normalized)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown log prefix format: " + value);
    }
}
