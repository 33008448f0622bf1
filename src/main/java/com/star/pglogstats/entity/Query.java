package com.star.pglogstats.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One classified SQL statement taken from a {@code statement:} log message.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Query {

    private String rawSql;

    private QueryType queryType;

    private String normalizedSql;
}
