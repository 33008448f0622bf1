package com.star.pglogstats.output;

import java.util.Locale;

public enum ReportFormat {
    JSON("application/json", "json"),
    TEXT("text/plain", "txt"),
    CSV("text/csv", "csv");

    private final String contentType;
    private final String fileExtension;

    ReportFormat(String contentType, String fileExtension) {
        this.contentType = contentType;
        this.fileExtension = fileExtension;
    }

    public String getContentType() {
        return contentType;
    }

    public String getFileExtension() {
        return fileExtension;
    }

    public static ReportFormat fromString(String value) {
        if (value == null || value.isBlank()) {
            return JSON;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown report format: " + value, e);
        }
    }
}
