package com.star.pglogstats.parser;

import com.star.pglogstats.entity.LogRecord;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * Outcome of feeding one line to {@link LogLineParser}.
 *
 * <p>A header line that closes an open statement produces two records: the
 * finished statement first, then the header's own record. Opening a statement
 * produces no record of its own because the SQL may still continue.
 */
@Getter
@Builder
public class ParseResult {

    public enum Status {
        RECORD,
        BUFFERED,
        SKIPPED,
        FAILED
    }

    private final Status status;

    @Builder.Default
    private final List<LogRecord> records = List.of();

    private final String errorMessage;
    private final long lineNumber;
    private final String rawLine;

    public static ParseResult records(long lineNumber, List<LogRecord> records) {
        return ParseResult.builder()
                .status(Status.RECORD)
                .records(List.copyOf(records))
                .lineNumber(lineNumber)
                .build();
    }

    public static ParseResult buffered(long lineNumber, String rawLine) {
        return ParseResult.builder()
                .status(Status.BUFFERED)
                .lineNumber(lineNumber)
                .rawLine(rawLine)
                .build();
    }

    public static ParseResult skipped(long lineNumber, String reason) {
        return ParseResult.builder()
                .status(Status.SKIPPED)
                .lineNumber(lineNumber)
                .errorMessage(reason)
                .build();
    }

    public static ParseResult failed(long lineNumber, String rawLine, String errorMessage) {
        return ParseResult.builder()
                .status(Status.FAILED)
                .lineNumber(lineNumber)
                .rawLine(rawLine)
                .errorMessage(errorMessage)
                .build();
    }

    public boolean isBuffered() {
        return status == Status.BUFFERED;
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    @Override
    public String toString() {
        return String.format("ParseResult{status=%s, line=%d, records=%d, error='%s'}",
                status, lineNumber, records.size(), errorMessage != null ? errorMessage : "none");
    }
}
