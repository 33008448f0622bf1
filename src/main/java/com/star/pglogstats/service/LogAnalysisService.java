package com.star.pglogstats.service;

import com.star.pglogstats.analytics.AnalyticsAggregator;
import com.star.pglogstats.analytics.AnalyticsConfig;
import com.star.pglogstats.analytics.StatementDurationLinker;
import com.star.pglogstats.analytics.TimingAnalyzer;
import com.star.pglogstats.dto.AnalysisReport;
import com.star.pglogstats.dto.AnalysisRequest;
import com.star.pglogstats.dto.ParseSummary;
import com.star.pglogstats.entity.AnalysisResult;
import com.star.pglogstats.entity.LogRecord;
import com.star.pglogstats.entity.Query;
import com.star.pglogstats.entity.TimingAnalysis;
import com.star.pglogstats.exception.ConfigurationException;
import com.star.pglogstats.exception.LogProcessingException;
import com.star.pglogstats.output.ReportFormatterFactory;
import com.star.pglogstats.parser.LogPrefixFormat;
import com.star.pglogstats.parser.LogStreamParser;
import com.star.pglogstats.parser.ParseContext;
import com.star.pglogstats.processor.FileStreamProcessor;
import com.star.pglogstats.sql.QueryExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Runs the analysis pipeline for one log source: read lines, parse them into
 * records, optionally link durations to statements, then aggregate.
 *
 * <p>Each call gets its own parse context and aggregator, so concurrent
 * requests never share state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LogAnalysisService {

    private final LogStreamParser streamParser;
    private final StatementDurationLinker durationLinker;
    private final QueryExtractor queryExtractor;
    private final ReportFormatterFactory formatterFactory;
    private final AnalyticsConfig analyticsConfig;
    private final ParseContext defaultParseContext;

    @Value("${app.analysis.link-durations:true}")
    private boolean linkDurations = true;

    @Value("${app.analysis.sample-size:0}")
    private long sampleSize = 0;

    @Value("${app.processing.buffer-size:8192}")
    private int bufferSize = 8192;

    public AnalysisReport analyzeFile(Path file, AnalysisRequest options) {
        if (!Files.isReadable(file)) {
            throw new LogProcessingException("Log file not readable: " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            return analyzeStream(file.getFileName().toString(), in, options);
        } catch (IOException e) {
            log.error("Failed to read log file {}: {}", file, e.getMessage());
            throw new LogProcessingException("Failed to read log file: " + file, e);
        }
    }

    public AnalysisReport analyzeStream(String source, InputStream in, AnalysisRequest options) {
        long startTime = System.currentTimeMillis();
        AnalysisRequest request = options != null ? options : new AnalysisRequest();

        AnalyticsConfig config = resolveConfig(request);
        ParseContext context = resolveContext(request, source);
        LogStreamParser.Session session = streamParser.open(context);

        FileStreamProcessor reader = FileStreamProcessor.builder()
                .bufferSize(bufferSize)
                .maxLines(request.getSampleSize() != null ? request.getSampleSize() : sampleSize)
                .build();

        log.info("Analyzing {} ({} prefix, strict={})", source, context.getPrefixFormat(), context.isStrictMode());
        try {
            reader.processStream(in, session::accept);
        } catch (IOException e) {
            log.error("Failed to read {}: {}", source, e.getMessage());
            throw new LogProcessingException("Failed to read log source: " + source, e);
        }

        List<LogRecord> records = session.finish();
        ParseSummary summary = ParseSummary.from(context, records.size(), session.getFailures());
        AnalysisReport report = buildReport(source, records, summary, config, request);
        report.setProcessingTimeMs(System.currentTimeMillis() - startTime);

        log.info("Analysis of {} completed: {} records, {} queries in {} ms",
                source, records.size(), report.getAnalysis().getTotalQueries(), report.getProcessingTimeMs());
        return report;
    }

    public AnalysisReport analyzeLines(String source, List<String> lines, AnalysisRequest options) {
        long startTime = System.currentTimeMillis();
        AnalysisRequest request = options != null ? options : new AnalysisRequest();

        AnalyticsConfig config = resolveConfig(request);
        ParseContext context = resolveContext(request, source);
        LogStreamParser.Session session = streamParser.open(context);

        long limit = request.getSampleSize() != null ? request.getSampleSize() : sampleSize;
        long lineNumber = 0;
        for (String line : lines) {
            if (limit > 0 && lineNumber >= limit) {
                break;
            }
            session.accept(line, ++lineNumber);
        }

        List<LogRecord> records = session.finish();
        ParseSummary summary = ParseSummary.from(context, records.size(), session.getFailures());
        AnalysisReport report = buildReport(source, records, summary, config, request);
        report.setProcessingTimeMs(System.currentTimeMillis() - startTime);
        return report;
    }

    public String render(AnalysisReport report, String format) {
        return formatterFactory.getFormatter(format).format(report);
    }

    public List<Query> extractQueries(String sql) {
        return queryExtractor.extract(sql);
    }

    private AnalysisReport buildReport(String source, List<LogRecord> records, ParseSummary summary,
                                       AnalyticsConfig config, AnalysisRequest request) {
        boolean link = request.getLinkDurations() != null ? request.getLinkDurations() : linkDurations;
        List<LogRecord> analyzed = link ? durationLinker.link(records) : records;

        AnalysisResult analysis = new AnalyticsAggregator(config).analyze(analyzed);
        TimingAnalysis timing = new TimingAnalyzer(config).analyze(analyzed);

        return AnalysisReport.builder()
                .source(source)
                .generatedAt(Instant.now())
                .parseSummary(summary)
                .analysis(analysis)
                .timing(timing)
                .build();
    }

    AnalyticsConfig resolveConfig(AnalysisRequest request) {
        AnalyticsConfig.AnalyticsConfigBuilder builder = analyticsConfig.toBuilder();
        if (request.getSlowQueryThresholdMs() != null) {
            builder.slowQueryThresholdMs(request.getSlowQueryThresholdMs());
        }
        if (request.getMaxSlowQueries() != null) {
            builder.maxSlowQueries(request.getMaxSlowQueries());
        }
        if (request.getMaxFrequentQueries() != null) {
            builder.maxFrequentQueries(request.getMaxFrequentQueries());
        }
        if (request.getHourlyBucketMinutes() != null) {
            builder.hourlyBucketMinutes(request.getHourlyBucketMinutes());
        }
        AnalyticsConfig config = builder.build();
        config.validate();
        return config;
    }

    ParseContext resolveContext(AnalysisRequest request, String source) {
        ParseContext context = defaultParseContext.copyWithFreshState();
        context.setSourceName(source);
        if (request.getPrefixFormat() != null) {
            try {
                context.setPrefixFormat(LogPrefixFormat.fromString(request.getPrefixFormat()));
            } catch (IllegalArgumentException e) {
                throw ConfigurationException.invalidField("prefixFormat", request.getPrefixFormat(), e.getMessage());
            }
        }
        if (request.getStrict() != null) {
            context.setStrictMode(request.getStrict());
        }
        return context;
    }
}
