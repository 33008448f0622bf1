package com.star.pglogstats.exception;

import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Failure to turn log text into records. Holds a single failure when thrown by
 * the line parser, or every failing line of a stream when a strict parse
 * reports them together.
 */
@Getter
public class LogParseException extends RuntimeException {

    private final List<ParseFailure> failures;

    public LogParseException(long lineNumber, String rawLine, String reason) {
        this(lineNumber, rawLine, reason, null);
    }

    public LogParseException(long lineNumber, String rawLine, String reason, Throwable cause) {
        super(String.format("Line %d: %s", lineNumber, reason), cause);
        this.failures = List.of(new ParseFailure(lineNumber, rawLine, reason));
    }

    private LogParseException(List<ParseFailure> failures) {
        super(String.format("Failed to parse %d lines: %s",
                failures.size(),
                failures.stream().map(ParseFailure::toString).collect(Collectors.joining("; "))));
        this.failures = List.copyOf(failures);
    }

    public static LogParseException aggregate(List<ParseFailure> failures) {
        if (failures == null || failures.isEmpty()) {
            throw new IllegalArgumentException("At least one parse failure is required");
        }
        return new LogParseException(failures);
    }

    public ParseFailure getFirstFailure() {
        return failures.get(0);
    }
}
