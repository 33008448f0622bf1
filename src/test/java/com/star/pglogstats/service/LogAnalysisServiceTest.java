package com.star.pglogstats.service;

import com.star.pglogstats.analytics.AnalyticsConfig;
import com.star.pglogstats.analytics.StatementDurationLinker;
import com.star.pglogstats.dto.AnalysisReport;
import com.star.pglogstats.dto.AnalysisRequest;
import com.star.pglogstats.entity.AnalysisResult;
import com.star.pglogstats.entity.QueryType;
import com.star.pglogstats.exception.ConfigurationException;
import com.star.pglogstats.exception.LogParseException;
import com.star.pglogstats.exception.LogProcessingException;
import com.star.pglogstats.output.CsvReportFormatter;
import com.star.pglogstats.output.JsonReportFormatter;
import com.star.pglogstats.output.ReportFormatterFactory;
import com.star.pglogstats.output.TextReportFormatter;
import com.star.pglogstats.parser.LogPrefixFormat;
import com.star.pglogstats.parser.LogStreamParser;
import com.star.pglogstats.parser.ParseContext;
import com.star.pglogstats.sql.QueryExtractor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LogAnalysisServiceTest {

    private LogAnalysisService service;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        service = new LogAnalysisService(
                new LogStreamParser(),
                new StatementDurationLinker(),
                new QueryExtractor(),
                new ReportFormatterFactory(List.of(
                        new JsonReportFormatter(), new TextReportFormatter(), new CsvReportFormatter())),
                AnalyticsConfig.defaults(),
                new ParseContext());
    }

    private AnalysisReport analyzeFixture(String name, AnalysisRequest request) throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/logs/" + name)) {
            assertNotNull(in, "missing fixture " + name);
            return service.analyzeStream(name, in, request);
        }
    }

    @Nested
    @DisplayName("Stderr Sample Tests")
    class StderrSampleTests {

        @Test
        @DisplayName("Should analyze the sample log end to end")
        void shouldAnalyzeSample() throws IOException {
            AnalysisReport report = analyzeFixture("sample-stderr.log", null);
            AnalysisResult analysis = report.getAnalysis();

            assertEquals("sample-stderr.log", report.getSource());
            assertEquals(12, analysis.getTotalRecords());
            assertEquals(4, analysis.getTotalQueries());
            assertEquals(2L, analysis.getQueryTypeCounts().get(QueryType.SELECT));
            assertEquals(1L, analysis.getQueryTypeCounts().get(QueryType.INSERT));
            assertEquals(1L, analysis.getQueryTypeCounts().get(QueryType.DDL));
            assertEquals(4024.75, analysis.getTotalDurationMs(), 1e-9);
            assertEquals(2500.0, analysis.getP95DurationMs());
            assertEquals(1, analysis.getErrorCount());
            assertEquals(1.0 / 12, analysis.getErrorRate(), 1e-9);
            assertEquals(2, analysis.getConnectionCount());

            assertEquals(2, analysis.getSlowestQueries().size());
            assertEquals(2500.0, analysis.getSlowestQueries().get(0).getDurationMs());
            assertEquals(1500.25, analysis.getSlowestQueries().get(1).getDurationMs());
            assertEquals(2, analysis.getMostFrequentQueries().get(0).getCount());

            assertEquals(3, analysis.getHourlyBuckets().get(10).getQueryCount());
            assertEquals(1, analysis.getHourlyBuckets().get(11).getQueryCount());

            assertEquals(14, report.getParseSummary().getTotalLines());
            assertEquals(1, report.getParseSummary().getMultiLineStatements());
            assertEquals(10, report.getTiming().getPeakHour());
        }

        @Test
        @DisplayName("Should leave statement durations empty without linking")
        void shouldSkipLinking() throws IOException {
            AnalysisRequest request = AnalysisRequest.builder().linkDurations(false).build();

            AnalysisResult analysis = analyzeFixture("sample-stderr.log", request).getAnalysis();

            assertEquals(4, analysis.getTotalQueries());
            assertEquals(0.0, analysis.getTotalDurationMs());
            assertTrue(analysis.getSlowestQueries().isEmpty());
        }

        @Test
        @DisplayName("Should apply per-request thresholds")
        void shouldApplyRequestOptions() throws IOException {
            AnalysisRequest request = AnalysisRequest.builder()
                    .slowQueryThresholdMs(10.0)
                    .maxSlowQueries(3)
                    .build();

            AnalysisResult analysis = analyzeFixture("sample-stderr.log", request).getAnalysis();

            assertEquals(3, analysis.getSlowestQueries().size());
            assertEquals(20.0, analysis.getSlowestQueries().get(2).getDurationMs());
        }

        @Test
        @DisplayName("Should only read the sampled lines")
        void shouldSampleLines() throws IOException {
            AnalysisRequest request = AnalysisRequest.builder().sampleSize(5L).build();

            AnalysisReport report = analyzeFixture("sample-stderr.log", request);

            assertEquals(5, report.getParseSummary().getTotalLines());
            assertEquals(3, report.getAnalysis().getTotalRecords());
            assertEquals(1, report.getAnalysis().getTotalQueries());
        }
    }

    @Test
    @DisplayName("Should analyze key value logs when requested")
    void shouldAnalyzeKeyValueLog() throws IOException {
        AnalysisRequest request = AnalysisRequest.builder().prefixFormat("key-value").build();

        AnalysisReport report = analyzeFixture("sample-key-value.log", request);

        assertEquals(LogPrefixFormat.KEY_VALUE.name(), report.getParseSummary().getPrefixFormat());
        assertEquals(2, report.getAnalysis().getTotalQueries());
        assertEquals(2.579, report.getAnalysis().getTotalDurationMs(), 1e-9);
    }

    @Test
    @DisplayName("Should analyze a file on disk")
    void shouldAnalyzeFile() throws IOException {
        Path file = tempDir.resolve("pg.log");
        Files.writeString(file, String.join("\n",
                "2024-01-15 10:00:00 UTC [7] app@db api: LOG:  statement: SELECT 1",
                "2024-01-15 10:00:00.002 UTC [7] app@db api: LOG:  duration: 2.000 ms"), StandardCharsets.UTF_8);

        AnalysisReport report = service.analyzeFile(file, new AnalysisRequest());

        assertEquals("pg.log", report.getSource());
        assertEquals(2.0, report.getAnalysis().getTotalDurationMs());
    }

    @Test
    @DisplayName("Should fail for an unreadable file")
    void shouldFailForMissingFile() {
        assertThrows(LogProcessingException.class,
                () -> service.analyzeFile(tempDir.resolve("missing.log"), null));
    }

    @Test
    @DisplayName("Should analyze lines held in memory")
    void shouldAnalyzeLines() {
        AnalysisReport report = service.analyzeLines("inline", List.of(
                "2024-01-15 10:00:00 UTC [7] app@db api: LOG:  statement: DELETE FROM t WHERE id = 1",
                "2024-01-15 10:00:01 UTC [7] app@db api: ERROR:  permission denied for table t"), null);

        assertEquals(1, report.getAnalysis().getQueryTypeCounts().get(QueryType.DELETE));
        assertEquals(1, report.getAnalysis().getErrorCount());
    }

    @Nested
    @DisplayName("Failure Tests")
    class FailureTests {

        private final List<String> badLines = List.of(
                "2024-01-15 10:00:00 UTC [7] app@db api: LOG:  statement: SELECT 1",
                "2024-01-15 77:00:00 UTC [7] app@db api: LOG:  duration: 2.000 ms");

        @Test
        @DisplayName("Lenient analysis should report failed lines in the summary")
        void lenientShouldSummarizeFailures() {
            AnalysisReport report = service.analyzeLines("bad", badLines, null);

            assertEquals(1, report.getParseSummary().getFailedLines());
            assertEquals(2, report.getParseSummary().getFailures().get(0).getLineNumber());
            assertEquals(1, report.getAnalysis().getTotalQueries());
        }

        @Test
        @DisplayName("Strict analysis should fail")
        void strictShouldFail() {
            AnalysisRequest request = AnalysisRequest.builder().strict(true).build();

            assertThrows(LogParseException.class, () -> service.analyzeLines("bad", badLines, request));
        }

        @Test
        @DisplayName("Should reject bucket sizes that do not divide an hour")
        void shouldRejectInvalidBucketSize() {
            AnalysisRequest request = AnalysisRequest.builder().hourlyBucketMinutes(7).build();

            ConfigurationException ex = assertThrows(ConfigurationException.class,
                    () -> service.analyzeLines("x", List.of(), request));
            assertEquals("hourlyBucketMinutes", ex.getField());
        }

        @Test
        @DisplayName("Should reject unknown prefix formats")
        void shouldRejectUnknownPrefix() {
            AnalysisRequest request = AnalysisRequest.builder().prefixFormat("csvlog").build();

            ConfigurationException ex = assertThrows(ConfigurationException.class,
                    () -> service.resolveContext(request, "x"));
            assertEquals("prefixFormat", ex.getField());
        }
    }

    @Test
    @DisplayName("Should render the report in the requested format")
    void shouldRender() throws IOException {
        AnalysisReport report = analyzeFixture("sample-stderr.log", null);

        assertTrue(service.render(report, "text").contains("Total queries: 4"));
        assertTrue(service.render(report, "csv").startsWith("\"category\""));
        assertTrue(service.render(report, null).contains("\"total_queries\""));
    }

    @Test
    @DisplayName("Should extract queries from SQL text")
    void shouldExtractQueries() {
        assertEquals(2, service.extractQueries("SELECT 1; UPDATE t SET a = 2").size());
    }
}
