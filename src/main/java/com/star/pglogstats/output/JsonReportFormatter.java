package com.star.pglogstats.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.star.pglogstats.config.JacksonConfig;
import com.star.pglogstats.dto.AnalysisReport;
import com.star.pglogstats.entity.AnalysisResult;
import com.star.pglogstats.entity.QueryType;
import com.star.pglogstats.exception.LogProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Writes the report as one JSON document with {@code metadata},
 * {@code summary}, {@code query_analysis} and {@code timing_analysis} sections.
 */
@Component
@Slf4j
public class JsonReportFormatter implements ReportFormatter {

    static final String TOOL_NAME = "pg-logstats";

    private final ObjectMapper objectMapper;

    @Autowired
    public JsonReportFormatter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonReportFormatter() {
        this(JacksonConfig.createObjectMapper());
    }

    @Override
    public String format(AnalysisReport report) {
        ObjectNode root = objectMapper.createObjectNode();
        AnalysisResult analysis = report.getAnalysis();

        ObjectNode metadata = root.putObject("metadata");
        metadata.put("tool", TOOL_NAME);
        metadata.put("source", report.getSource());
        if (report.getGeneratedAt() != null) {
            metadata.put("generated_at", report.getGeneratedAt().toString());
        }
        metadata.put("processing_time_ms", report.getProcessingTimeMs());
        if (report.getParseSummary() != null) {
            metadata.set("parse", objectMapper.valueToTree(report.getParseSummary()));
        }

        ObjectNode summary = root.putObject("summary");
        summary.put("total_records", analysis.getTotalRecords());
        summary.put("total_queries", analysis.getTotalQueries());
        summary.put("total_duration_ms", analysis.getTotalDurationMs());
        summary.put("average_duration_ms", analysis.getAverageDurationMs());
        summary.put("min_duration_ms", analysis.getMinDurationMs());
        summary.put("max_duration_ms", analysis.getMaxDurationMs());
        summary.put("p95_duration_ms", analysis.getP95DurationMs());
        summary.put("p99_duration_ms", analysis.getP99DurationMs());
        summary.put("error_count", analysis.getErrorCount());
        summary.put("error_rate", analysis.getErrorRate());
        summary.put("connection_count", analysis.getConnectionCount());

        ObjectNode queries = root.putObject("query_analysis");
        ObjectNode byType = queries.putObject("by_type");
        for (Map.Entry<QueryType, Long> entry : analysis.getQueryTypeCounts().entrySet()) {
            byType.put(entry.getKey().getLabel(), entry.getValue());
        }
        queries.set("slowest_queries", objectMapper.valueToTree(analysis.getSlowestQueries()));
        queries.set("most_frequent_queries", objectMapper.valueToTree(analysis.getMostFrequentQueries()));
        queries.set("hourly_buckets", objectMapper.valueToTree(analysis.getHourlyBuckets()));

        if (report.getTiming() != null) {
            root.set("timing_analysis", objectMapper.valueToTree(report.getTiming()));
        }

        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            log.error("Failed to write JSON report for {}", report.getSource(), e);
            throw new LogProcessingException("Failed to write JSON report: " + e.getMessage(), e);
        }
    }

    @Override
    public ReportFormat getFormat() {
        return ReportFormat.JSON;
    }
}
