package com.star.pglogstats.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JsonReportFormatterTest {

    private JsonReportFormatter formatter;
    private ObjectMapper reader;

    @BeforeEach
    void setUp() {
        formatter = new JsonReportFormatter();
        reader = new ObjectMapper();
    }

    @Test
    @DisplayName("Should write all report sections")
    void shouldWriteSections() throws Exception {
        JsonNode root = reader.readTree(formatter.format(ReportFixtures.sampleReport()));

        assertEquals("pg-logstats", root.path("metadata").path("tool").asText());
        assertEquals("postgresql.log", root.path("metadata").path("source").asText());
        assertEquals("2024-01-16T00:00:00Z", root.path("metadata").path("generated_at").asText());

        JsonNode summary = root.path("summary");
        assertEquals(4, summary.path("total_records").asLong());
        assertEquals(3, summary.path("total_queries").asLong());
        assertEquals(500.0, summary.path("total_duration_ms").asDouble(), 1e-9);
        assertEquals(1, summary.path("error_count").asLong());
        assertEquals(0.25, summary.path("error_rate").asDouble(), 1e-9);

        JsonNode queries = root.path("query_analysis");
        assertEquals(2, queries.path("by_type").path("SELECT").asLong());
        assertEquals(1, queries.path("by_type").path("INSERT").asLong());
        assertEquals(2, queries.path("slowest_queries").size());
        assertEquals(300.0, queries.path("slowest_queries").get(0).path("duration_ms").asDouble(), 1e-9);
        assertEquals(2, queries.path("most_frequent_queries").get(0).path("count").asLong());
        assertEquals(2, queries.path("hourly_buckets").path("10").path("query_count").asLong());

        JsonNode timing = root.path("timing_analysis");
        assertEquals(10, timing.path("peak_hour").asInt());
        assertTrue(timing.has("p95_response_time_ms"));
    }

    @Test
    @DisplayName("Should write an empty report")
    void shouldWriteEmptyReport() throws Exception {
        JsonNode root = reader.readTree(formatter.format(ReportFixtures.emptyReport()));

        assertEquals(0, root.path("summary").path("total_queries").asLong());
        assertEquals(0, root.path("query_analysis").path("slowest_queries").size());
        assertFalse(root.path("timing_analysis").has("peak_hour"));
    }

    @Test
    @DisplayName("Should report JSON content type")
    void shouldReportContentType() {
        assertEquals(ReportFormat.JSON, formatter.getFormat());
        assertEquals("application/json", formatter.getContentType());
    }
}
