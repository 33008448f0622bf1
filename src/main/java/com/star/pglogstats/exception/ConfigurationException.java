package com.star.pglogstats.exception;

import lombok.Getter;

@Getter
public class ConfigurationException extends RuntimeException {

    private final String field;
    private final Object invalidValue;

    public ConfigurationException(String message) {
        super(message);
        this.field = null;
        this.invalidValue = null;
    }

    public ConfigurationException(String field, Object invalidValue, String message) {
        super(message);
        this.field = field;
        this.invalidValue = invalidValue;
    }

    public static ConfigurationException invalidField(String field, Object value, String reason) {
        return new ConfigurationException(
                field,
                value,
                String.format("Invalid value '%s' for '%s': %s", value, field, reason)
        );
    }

    public static ConfigurationException invalidPercentile(double percentile) {
        return new ConfigurationException(
                "percentile",
                percentile,
                String.format("Percentile must be in (0, 1], got %s", percentile)
        );
    }
}
