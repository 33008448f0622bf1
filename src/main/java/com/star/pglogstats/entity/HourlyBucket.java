package com.star.pglogstats.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HourlyBucket {

    private int hour;

    private long queryCount;

    private double totalDurationMs;

    private double queriesPerSecond;
}
