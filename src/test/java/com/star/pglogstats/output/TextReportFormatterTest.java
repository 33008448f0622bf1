package com.star.pglogstats.output;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextReportFormatterTest {

    private final TextReportFormatter formatter = new TextReportFormatter();

    @Test
    @DisplayName("Should write summary and ranking sections")
    void shouldWriteSections() {
        String text = formatter.format(ReportFixtures.sampleReport());

        assertTrue(text.startsWith("PostgreSQL Log Analysis: postgresql.log\n"));
        assertTrue(text.contains("Total queries: 3"));
        assertTrue(text.contains("Total duration: 500.00 ms"));
        assertTrue(text.contains("Errors: 1 (25.00% of records)"));
        assertTrue(text.contains("Slowest Queries\n==============="));
        assertTrue(text.contains("Most Frequent Queries"));
        assertTrue(text.contains("SELECT   2"));
        assertTrue(text.contains("Peak hour: 10:00"));
    }

    @Test
    @DisplayName("Should omit empty sections")
    void shouldOmitEmptySections() {
        String text = formatter.format(ReportFixtures.emptyReport());

        assertTrue(text.contains("Total queries: 0"));
        assertFalse(text.contains("Slowest Queries"));
        assertFalse(text.contains("Query Types"));
        assertTrue(text.contains("Peak hour: n/a"));
    }

    @Test
    @DisplayName("Should abbreviate long SQL")
    void shouldAbbreviateLongSql() {
        String sql = "SELECT " + "column_name, ".repeat(20) + "x FROM t";

        String abbreviated = TextReportFormatter.abbreviate(sql);

        assertEquals(TextReportFormatter.MAX_SQL_WIDTH, abbreviated.length());
        assertTrue(abbreviated.endsWith("..."));
        assertEquals("SELECT 1", TextReportFormatter.abbreviate("SELECT 1"));
        assertEquals("", TextReportFormatter.abbreviate(null));
    }
}
