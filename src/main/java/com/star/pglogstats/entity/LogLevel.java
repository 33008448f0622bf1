package com.star.pglogstats.entity;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Locale;

/**
 * Kind of a PostgreSQL log event.
 *
 * <p>Known severities and the two message kinds the analytics care about
 * ({@code statement:} and {@code duration:}) are shared constants. Any other
 * label is kept verbatim as an {@link Kind#UNKNOWN} level so diagnostics never
 * lose the original text.
 */
@Getter
@EqualsAndHashCode
public final class LogLevel {

    public enum Kind {
        ERROR,
        WARNING,
        INFO,
        DEBUG,
        NOTICE,
        LOG,
        STATEMENT,
        DURATION,
        FATAL,
        PANIC,
        UNKNOWN
    }

    public static final LogLevel ERROR = new LogLevel(Kind.ERROR, "ERROR");
    public static final LogLevel WARNING = new LogLevel(Kind.WARNING, "WARNING");
    public static final LogLevel INFO = new LogLevel(Kind.INFO, "INFO");
    public static final LogLevel DEBUG = new LogLevel(Kind.DEBUG, "DEBUG");
    public static final LogLevel NOTICE = new LogLevel(Kind.NOTICE, "NOTICE");
    public static final LogLevel LOG = new LogLevel(Kind.LOG, "LOG");
    public static final LogLevel STATEMENT = new LogLevel(Kind.STATEMENT, "STATEMENT");
    public static final LogLevel DURATION = new LogLevel(Kind.DURATION, "DURATION");
    public static final LogLevel FATAL = new LogLevel(Kind.FATAL, "FATAL");
    public static final LogLevel PANIC = new LogLevel(Kind.PANIC, "PANIC");

    private final Kind kind;

    private final String label;

    private LogLevel(Kind kind, String label) {
        this.kind = kind;
        this.label = label;
    }

    /**
     * Resolves the severity label of a log line prefix.
     *
     * <p>{@code STATEMENT} and {@code DURATION} are message kinds, not
     * severities: a {@code STATEMENT:} label is the error-context echo of a
     * failed query and resolves to an unknown level.
     */
    public static LogLevel fromSeverity(String label) {
        if (label == null || label.isBlank()) {
            return unknown("");
        }

        String upper = label.trim().toUpperCase(Locale.ROOT);
        switch (upper) {
            case "ERROR":
                return ERROR;
            case "WARNING":
                return WARNING;
            case "INFO":
                return INFO;
            case "NOTICE":
                return NOTICE;
            case "LOG":
                return LOG;
            case "FATAL":
                return FATAL;
            case "PANIC":
                return PANIC;
            case "DEBUG":
            case "DEBUG1":
            case "DEBUG2":
            case "DEBUG3":
            case "DEBUG4":
            case "DEBUG5":
                return DEBUG;
            default:
                return unknown(label.trim());
        }
    }

    public static LogLevel unknown(String label) {
        return new LogLevel(Kind.UNKNOWN, label);
    }

    public boolean is(Kind other) {
        return kind == other;
    }

    public boolean isUnknown() {
        return kind == Kind.UNKNOWN;
    }

    @JsonValue
    @Override
    public String toString() {
        return label;
    }
}
