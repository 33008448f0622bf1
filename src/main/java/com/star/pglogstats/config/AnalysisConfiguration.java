package com.star.pglogstats.config;

import com.star.pglogstats.analytics.AnalyticsConfig;
import com.star.pglogstats.parser.LogPrefixFormat;
import com.star.pglogstats.parser.ParseContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Service-wide defaults for parsing and aggregation, read from
 * {@code app.analysis.*}. Requests may override them one by one.
 */
@Configuration
@Slf4j
public class AnalysisConfiguration {

    @Value("${app.analysis.slow-query-threshold-ms:1000.0}")
    private double slowQueryThresholdMs;

    @Value("${app.analysis.max-slow-queries:10}")
    private int maxSlowQueries;

    @Value("${app.analysis.max-frequent-queries:20}")
    private int maxFrequentQueries;

    @Value("${app.analysis.hourly-bucket-minutes:60}")
    private int hourlyBucketMinutes;

    @Value("${app.analysis.prefix-format:STDERR}")
    private String prefixFormat;

    @Value("${app.analysis.strict-parsing:false}")
    private boolean strictParsing;

    @Value("${app.analysis.max-line-length:100000}")
    private int maxLineLength;

    @Bean
    public AnalyticsConfig analyticsConfig() {
        AnalyticsConfig config = AnalyticsConfig.builder()
                .slowQueryThresholdMs(slowQueryThresholdMs)
                .maxSlowQueries(maxSlowQueries)
                .maxFrequentQueries(maxFrequentQueries)
                .hourlyBucketMinutes(hourlyBucketMinutes)
                .build();
        config.validate();
        log.info("Analytics defaults: slow threshold {} ms, top {} slow, top {} frequent, {} minute buckets",
                slowQueryThresholdMs, maxSlowQueries, maxFrequentQueries, hourlyBucketMinutes);
        return config;
    }

    @Bean
    public ParseContext defaultParseContext() {
        return ParseContext.builder()
                .prefixFormat(LogPrefixFormat.fromString(prefixFormat))
                .strictMode(strictParsing)
                .maxLineLength(maxLineLength)
                .build();
    }
}
