package com.star.pglogstats.output;

import com.star.pglogstats.dto.AnalysisReport;

/**
 * Renders an {@link AnalysisReport}. Implementations are pure functions of the
 * report and hold no per-call state.
 */
public interface ReportFormatter {

    String format(AnalysisReport report);

    ReportFormat getFormat();

    default String getContentType() {
        return getFormat().getContentType();
    }
}
