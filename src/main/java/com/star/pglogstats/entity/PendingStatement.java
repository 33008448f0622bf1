package com.star.pglogstats.entity;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/**
 * A {@code statement:} message whose SQL may still continue on the following
 * prefix-less lines. Owned by the parse context until the next header line or
 * the end of input closes it.
 */
@Getter
@Builder
public class PendingStatement {

    private final Instant timestamp;

    private final String processId;

    private final String user;

    private final String database;

    private final String clientHost;

    private final String applicationName;

    private final long lineNumber;

    @Builder.Default
    private final StringBuilder queryText = new StringBuilder();

    @Builder.Default
    private int continuationLines = 0;

    /**
     * Appends SQL from the line that opened the statement.
     */
    public void appendText(String text) {
        append(text);
    }

    /**
     * Appends the SQL of a prefix-less continuation line.
     */
    public void appendContinuation(String text) {
        if (append(text)) {
            continuationLines++;
        }
    }

    private boolean append(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return false;
        }
        if (queryText.length() > 0) {
            queryText.append(' ');
        }
        queryText.append(trimmed);
        return true;
    }

    public String getQueryText() {
        return queryText.toString().trim();
    }

    public boolean isMultiLine() {
        return continuationLines > 0;
    }
}
