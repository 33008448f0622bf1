package com.star.pglogstats.output;

import com.star.pglogstats.dto.AnalysisReport;
import com.star.pglogstats.dto.ParseSummary;
import com.star.pglogstats.entity.AnalysisResult;
import com.star.pglogstats.entity.FrequentQuery;
import com.star.pglogstats.entity.HourlyBucket;
import com.star.pglogstats.entity.QueryType;
import com.star.pglogstats.entity.SlowQuery;
import com.star.pglogstats.entity.TimingAnalysis;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Human-readable report for terminals and e-mails.
 */
@Component
public class TextReportFormatter implements ReportFormatter {

    static final int MAX_SQL_WIDTH = 100;

    @Override
    public String format(AnalysisReport report) {
        StringBuilder out = new StringBuilder();
        AnalysisResult analysis = report.getAnalysis();

        heading(out, "PostgreSQL Log Analysis: " + report.getSource());
        ParseSummary parse = report.getParseSummary();
        if (parse != null) {
            line(out, "Lines read: %d (%d skipped, %d failed)",
                    parse.getTotalLines(), parse.getSkippedLines(), parse.getFailedLines());
            line(out, "Records: %d (%d multi-line statements)", parse.getRecords(), parse.getMultiLineStatements());
        }
        out.append('\n');

        heading(out, "Query Summary");
        line(out, "Total queries: %d", analysis.getTotalQueries());
        line(out, "Total duration: %.2f ms", analysis.getTotalDurationMs());
        line(out, "Average duration: %.2f ms", analysis.getAverageDurationMs());
        line(out, "Min / max duration: %.2f / %.2f ms", analysis.getMinDurationMs(), analysis.getMaxDurationMs());
        line(out, "95th percentile: %.2f ms", analysis.getP95DurationMs());
        line(out, "99th percentile: %.2f ms", analysis.getP99DurationMs());
        line(out, "Errors: %d (%.2f%% of records)", analysis.getErrorCount(), analysis.getErrorRate() * 100);
        line(out, "Connection events: %d", analysis.getConnectionCount());

        if (!analysis.getQueryTypeCounts().isEmpty()) {
            out.append('\n');
            heading(out, "Query Types");
            for (Map.Entry<QueryType, Long> entry : analysis.getQueryTypeCounts().entrySet()) {
                line(out, "  %-8s %d", entry.getKey().getLabel(), entry.getValue());
            }
        }

        List<SlowQuery> slowest = analysis.getSlowestQueries();
        if (!slowest.isEmpty()) {
            out.append('\n');
            heading(out, "Slowest Queries");
            for (int i = 0; i < slowest.size(); i++) {
                line(out, "%2d. %10.2f ms  %s", i + 1, slowest.get(i).getDurationMs(),
                        abbreviate(slowest.get(i).getNormalizedSql()));
            }
        }

        List<FrequentQuery> frequent = analysis.getMostFrequentQueries();
        if (!frequent.isEmpty()) {
            out.append('\n');
            heading(out, "Most Frequent Queries");
            for (int i = 0; i < frequent.size(); i++) {
                line(out, "%2d. %8dx  %s", i + 1, frequent.get(i).getCount(),
                        abbreviate(frequent.get(i).getNormalizedSql()));
            }
        }

        if (!analysis.getHourlyBuckets().isEmpty()) {
            out.append('\n');
            heading(out, "Hourly Activity (UTC)");
            for (HourlyBucket bucket : analysis.getHourlyBuckets().values()) {
                line(out, "  %02d:00  %6d queries  %10.2f ms  %.3f q/s",
                        bucket.getHour(), bucket.getQueryCount(),
                        bucket.getTotalDurationMs(), bucket.getQueriesPerSecond());
            }
        }

        TimingAnalysis timing = report.getTiming();
        if (timing != null) {
            out.append('\n');
            heading(out, "Timing");
            line(out, "Average response time: %.2f ms", timing.getAverageResponseTimeMs());
            line(out, "95th percentile: %.2f ms", timing.getP95ResponseTimeMs());
            line(out, "99th percentile: %.2f ms", timing.getP99ResponseTimeMs());
            line(out, "Peak hour: %s", timing.getPeakHour() != null
                    ? String.format(Locale.ROOT, "%02d:00", timing.getPeakHour())
                    : "n/a");
        }

        return out.toString();
    }

    @Override
    public ReportFormat getFormat() {
        return ReportFormat.TEXT;
    }

    static String abbreviate(String sql) {
        if (sql == null) {
            return "";
        }
        return sql.length() > MAX_SQL_WIDTH ? sql.substring(0, MAX_SQL_WIDTH - 3) + "..." : sql;
    }

    private static void heading(StringBuilder out, String title) {
        out.append(title).append('\n');
        out.append("=".repeat(title.length())).append('\n');
    }

    private static void line(StringBuilder out, String format, Object... args) {
        out.append(String.format(Locale.ROOT, format, args)).append('\n');
    }
}
