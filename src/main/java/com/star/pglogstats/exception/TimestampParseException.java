package com.star.pglogstats.exception;

import com.star.pglogstats.entity.LogRecord;
import lombok.Getter;
import lombok.Setter;

/**
 * A header line whose timestamp matches none of the supported layouts.
 *
 * <p>The header still ends the statement that was collecting continuation
 * lines; that statement is attached as {@link #getClosedStatement()} so the
 * caller can keep it.
 */
@Getter
public class TimestampParseException extends LogParseException {

    private final String timestamp;

    @Setter
    private transient LogRecord closedStatement;

    public TimestampParseException(long lineNumber, String rawLine, String timestamp) {
        super(lineNumber, rawLine, String.format("Failed to parse timestamp '%s'", timestamp));
        this.timestamp = timestamp;
    }
}
