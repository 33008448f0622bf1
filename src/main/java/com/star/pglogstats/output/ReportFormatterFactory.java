package com.star.pglogstats.output;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
public class ReportFormatterFactory {

    private final Map<ReportFormat, ReportFormatter> formatters = new EnumMap<>(ReportFormat.class);

    public ReportFormatterFactory(List<ReportFormatter> formatters) {
        for (ReportFormatter formatter : formatters) {
            this.formatters.put(formatter.getFormat(), formatter);
        }
        log.info("ReportFormatterFactory initialized with formats: {}", this.formatters.keySet());
    }

    public ReportFormatter getFormatter(ReportFormat format) {
        ReportFormatter formatter = formatters.get(format);
        if (formatter == null) {
            throw new IllegalArgumentException("No formatter registered for " + format);
        }
        return formatter;
    }

    public ReportFormatter getFormatter(String format) {
        return getFormatter(ReportFormat.fromString(format));
    }
}
