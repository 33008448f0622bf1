package com.star.pglogstats.output;

import com.opencsv.CSVWriter;
import com.star.pglogstats.dto.AnalysisReport;
import com.star.pglogstats.entity.AnalysisResult;
import com.star.pglogstats.entity.FrequentQuery;
import com.star.pglogstats.entity.SlowQuery;
import com.star.pglogstats.exception.LogProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;

/**
 * Writes the ranked queries as CSV, one row per query:
 * {@code category,rank,normalized_sql,duration_ms,count}.
 */
@Component
@Slf4j
public class CsvReportFormatter implements ReportFormatter {

    static final String[] HEADERS = {"category", "rank", "normalized_sql", "duration_ms", "count"};

    @Override
    public String format(AnalysisReport report) {
        AnalysisResult analysis = report.getAnalysis();

        StringWriter out = new StringWriter();
        try (CSVWriter writer = new CSVWriter(
                out,
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END
        )) {
            writer.writeNext(HEADERS);

            List<SlowQuery> slowest = analysis.getSlowestQueries();
            for (int i = 0; i < slowest.size(); i++) {
                SlowQuery query = slowest.get(i);
                writer.writeNext(new String[]{
                        "slow", String.valueOf(i + 1), query.getNormalizedSql(),
                        String.valueOf(query.getDurationMs()), ""
                });
            }

            List<FrequentQuery> frequent = analysis.getMostFrequentQueries();
            for (int i = 0; i < frequent.size(); i++) {
                FrequentQuery query = frequent.get(i);
                writer.writeNext(new String[]{
                        "frequent", String.valueOf(i + 1), query.getNormalizedSql(),
                        "", String.valueOf(query.getCount())
                });
            }

            writer.flush();
        } catch (IOException e) {
            log.error("Failed to write CSV report for {}", report.getSource(), e);
            throw new LogProcessingException("Failed to write CSV report: " + e.getMessage(), e);
        }
        return out.toString();
    }

    @Override
    public ReportFormat getFormat() {
        return ReportFormat.CSV;
    }
}
