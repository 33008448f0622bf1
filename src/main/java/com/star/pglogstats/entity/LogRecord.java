package com.star.pglogstats.entity;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * One semantically meaningful event of a PostgreSQL server log.
 *
 * <p>{@code statement} and {@code queries} are only set for
 * {@link LogLevel.Kind#STATEMENT} records and {@code durationMs} only for
 * {@link LogLevel.Kind#DURATION} records. The only exception is a statement
 * record enriched by {@code StatementDurationLinker}, which takes the duration
 * from the line that followed it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LogRecord {

    private Instant timestamp;

    private String processId;

    private String user;

    private String database;

    private String clientHost;

    private String applicationName;

    private LogLevel level;

    private String message;

    private String statement;

    private List<Query> queries;

    private Double durationMs;

    private long lineNumber;

    public boolean isStatement() {
        return level != null && level.is(LogLevel.Kind.STATEMENT);
    }

    public boolean isDuration() {
        return level != null && level.is(LogLevel.Kind.DURATION);
    }

    public boolean isError() {
        return level != null && level.is(LogLevel.Kind.ERROR);
    }
}
