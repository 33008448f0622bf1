package com.star.pglogstats.analytics;

import com.star.pglogstats.exception.ConfigurationException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Settings of one aggregation run.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AnalyticsConfig {

    public static final double DEFAULT_SLOW_QUERY_THRESHOLD_MS = 1000.0;
    public static final int DEFAULT_MAX_SLOW_QUERIES = 10;
    public static final int DEFAULT_MAX_FREQUENT_QUERIES = 20;
    public static final int DEFAULT_HOURLY_BUCKET_MINUTES = 60;

    @Builder.Default
    private double slowQueryThresholdMs = DEFAULT_SLOW_QUERY_THRESHOLD_MS;

    @Builder.Default
    private int maxSlowQueries = DEFAULT_MAX_SLOW_QUERIES;

    @Builder.Default
    private int maxFrequentQueries = DEFAULT_MAX_FREQUENT_QUERIES;

    @Builder.Default
    private int hourlyBucketMinutes = DEFAULT_HOURLY_BUCKET_MINUTES;

    public static AnalyticsConfig defaults() {
        return AnalyticsConfig.builder().build();
    }

    /**
     * @throws ConfigurationException naming the first invalid field
     */
    public void validate() {
        if (!(slowQueryThresholdMs > 0) || Double.isInfinite(slowQueryThresholdMs)) {
            throw ConfigurationException.invalidField("slowQueryThresholdMs", slowQueryThresholdMs,
                    "must be a positive number");
        }
        if (maxSlowQueries < 0) {
            throw ConfigurationException.invalidField("maxSlowQueries", maxSlowQueries, "must not be negative");
        }
        if (maxFrequentQueries < 0) {
            throw ConfigurationException.invalidField("maxFrequentQueries", maxFrequentQueries, "must not be negative");
        }
        if (hourlyBucketMinutes < 1 || hourlyBucketMinutes > 60 || 60 % hourlyBucketMinutes != 0) {
            throw ConfigurationException.invalidField("hourlyBucketMinutes", hourlyBucketMinutes,
                    "must be between 1 and 60 and divide 60");
        }
    }
}
