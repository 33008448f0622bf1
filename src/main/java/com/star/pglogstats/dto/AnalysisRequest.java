package com.star.pglogstats.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-request options of a log analysis. Unset fields fall back to the
 * {@code app.analysis.*} defaults.
 *
 * <p>Example: {@code POST /analysis?format=text&slowQueryThresholdMs=250&prefixFormat=KEY_VALUE}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Log analysis options")
public class AnalysisRequest {

    @Pattern(regexp = "(?i)json|text|csv", message = "Format must be one of json, text, csv")
    @Schema(description = "Report format", defaultValue = "json", example = "text")
    @Builder.Default
    private String format = "json";

    @Pattern(regexp = "(?i)stderr|key_value|key-value", message = "Prefix format must be STDERR or KEY_VALUE")
    @Schema(description = "Log line prefix layout", example = "STDERR")
    private String prefixFormat;

    @Positive(message = "Slow query threshold must be positive")
    @Schema(description = "Duration above which a query counts as slow, in ms", example = "1000")
    private Double slowQueryThresholdMs;

    @Min(value = 0, message = "Slow query limit cannot be negative")
    @Max(value = 1000, message = "Slow query limit cannot exceed 1000")
    @Schema(description = "Number of slow queries to report", example = "10")
    private Integer maxSlowQueries;

    @Min(value = 0, message = "Frequent query limit cannot be negative")
    @Max(value = 1000, message = "Frequent query limit cannot exceed 1000")
    @Schema(description = "Number of frequent queries to report", example = "20")
    private Integer maxFrequentQueries;

    @Min(value = 1, message = "Bucket size must be at least 1 minute")
    @Max(value = 60, message = "Bucket size cannot exceed 60 minutes")
    @Schema(description = "Width of the interval buckets in minutes, must divide 60", example = "15")
    private Integer hourlyBucketMinutes;

    @Schema(description = "Fail the request when any line cannot be parsed")
    private Boolean strict;

    @Schema(description = "Attach duration lines to the statements they belong to")
    private Boolean linkDurations;

    @Min(value = 1, message = "Sample size must be at least 1 line")
    @Schema(description = "Only analyze the first N lines", example = "10000")
    private Long sampleSize;
}
