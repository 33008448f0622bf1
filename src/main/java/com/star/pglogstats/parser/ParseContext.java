package com.star.pglogstats.parser;

import com.star.pglogstats.entity.PendingStatement;
import lombok.Data;

/**
 * Configuration and mutable state of one parse over one log stream.
 *
 * <p>The context owns the statement that is still collecting continuation
 * lines and the per-stream counters. It must not be shared between streams
 * parsed concurrently; use {@link #copyWithFreshState()} to get an independent
 * context with the same settings.
 */
@Data
public class ParseContext {

    public static final int DEFAULT_MAX_LINE_LENGTH = 100_000;

    private LogPrefixFormat prefixFormat = LogPrefixFormat.STDERR;

    private boolean strictMode = false;

    private int maxLineLength = DEFAULT_MAX_LINE_LENGTH;

    private String sourceName;

    private PendingStatement pendingStatement;

    private long totalLinesProcessed = 0;

    private long successfulLines = 0;

    private long failedLines = 0;

    private long skippedLines = 0;

    private long multiLineEntries = 0;

    public ParseContext() {
    }

    public ParseContext(LogPrefixFormat prefixFormat) {
        this.prefixFormat = prefixFormat != null ? prefixFormat : LogPrefixFormat.STDERR;
    }

    public boolean hasPendingStatement() {
        return pendingStatement != null;
    }

    public void openStatement(PendingStatement statement) {
        this.pendingStatement = statement;
    }

    /**
     * Removes and returns the pending statement, or {@code null} when none is open.
     */
    public PendingStatement takePendingStatement() {
        PendingStatement statement = pendingStatement;
        pendingStatement = null;
        if (statement != null && statement.isMultiLine()) {
            multiLineEntries++;
        }
        return statement;
    }

    public void recordSuccess() {
        totalLinesProcessed++;
        successfulLines++;
    }

    public void recordFailure() {
        totalLinesProcessed++;
        failedLines++;
    }

    public void recordSkipped() {
        totalLinesProcessed++;
        skippedLines++;
    }

    public double getSuccessRate() {
        if (totalLinesProcessed == 0) return 0;
        return (successfulLines * 100.0) / totalLinesProcessed;
    }

    public ParseContext copyWithFreshState() {
        ParseContext copy = new ParseContext(prefixFormat);
        copy.setStrictMode(strictMode);
        copy.setMaxLineLength(maxLineLength);
        copy.setSourceName(sourceName);
        return copy;
    }

    public static class Builder {
        private LogPrefixFormat prefixFormat = LogPrefixFormat.STDERR;
        private boolean strictMode = false;
        private int maxLineLength = DEFAULT_MAX_LINE_LENGTH;
        private String sourceName;

        public Builder prefixFormat(LogPrefixFormat format) {
            this.prefixFormat = format;
            return this;
        }

        public Builder strictMode(boolean strict) {
            this.strictMode = strict;
            return this;
        }

        public Builder maxLineLength(int maxLength) {
            this.maxLineLength = maxLength;
            return this;
        }

        public Builder sourceName(String sourceName) {
            this.sourceName = sourceName;
            return this;
        }

        public ParseContext build() {
            ParseContext ctx = new ParseContext(prefixFormat);
            ctx.setStrictMode(strictMode);
            ctx.setMaxLineLength(maxLineLength);
            ctx.setSourceName(sourceName);
            return ctx;
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}
