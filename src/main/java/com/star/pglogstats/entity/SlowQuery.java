package com.star.pglogstats.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SlowQuery {

    private String normalizedSql;

    private double durationMs;
}
