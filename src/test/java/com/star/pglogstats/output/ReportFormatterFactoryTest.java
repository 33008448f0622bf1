package com.star.pglogstats.output;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReportFormatterFactoryTest {

    private final ReportFormatterFactory factory = new ReportFormatterFactory(List.of(
            new JsonReportFormatter(), new TextReportFormatter(), new CsvReportFormatter()));

    @ParameterizedTest
    @CsvSource({
            "json, JSON",
            "TEXT, TEXT",
            "Csv, CSV",
            "'', JSON"
    })
    @DisplayName("Should resolve formatter by name")
    void shouldResolveByName(String name, ReportFormat expected) {
        assertEquals(expected, factory.getFormatter(name).getFormat());
    }

    @Test
    @DisplayName("Should default to JSON when no format is given")
    void shouldDefaultToJson() {
        assertEquals(ReportFormat.JSON, factory.getFormatter((String) null).getFormat());
    }

    @Test
    @DisplayName("Should reject unknown formats")
    void shouldRejectUnknownFormat() {
        assertThrows(IllegalArgumentException.class, () -> factory.getFormatter("xml"));
    }

    @Test
    @DisplayName("Should fail for formats without a registered formatter")
    void shouldFailForUnregisteredFormat() {
        ReportFormatterFactory jsonOnly = new ReportFormatterFactory(List.of(new JsonReportFormatter()));

        assertThrows(IllegalArgumentException.class, () -> jsonOnly.getFormatter(ReportFormat.CSV));
    }
}
