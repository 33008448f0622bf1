package com.star.pglogstats.exception;

import lombok.Getter;

@Getter
public class NormalizationException extends RuntimeException {

    private final String sql;

    public NormalizationException(String sql, String message, Throwable cause) {
        super(message, cause);
        this.sql = sql;
    }
}
