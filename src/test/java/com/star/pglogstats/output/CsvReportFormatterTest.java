package com.star.pglogstats.output;

import com.opencsv.CSVReader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvReportFormatterTest {

    private final CsvReportFormatter formatter = new CsvReportFormatter();

    private static List<String[]> read(String csv) throws Exception {
        try (CSVReader reader = new CSVReader(new StringReader(csv))) {
            return reader.readAll();
        }
    }

    @Test
    @DisplayName("Should write slow then frequent rows")
    void shouldWriteRankedRows() throws Exception {
        List<String[]> rows = read(formatter.format(ReportFixtures.sampleReport()));

        assertArrayEquals(CsvReportFormatter.HEADERS, rows.get(0));

        assertEquals("slow", rows.get(1)[0]);
        assertEquals("1", rows.get(1)[1]);
        assertEquals("300.0", rows.get(1)[3]);
        assertEquals("", rows.get(1)[4]);
        assertEquals("slow", rows.get(2)[0]);
        assertEquals("150.0", rows.get(2)[3]);

        assertEquals("frequent", rows.get(3)[0]);
        assertEquals("2", rows.get(3)[4]);
        assertEquals("", rows.get(3)[3]);
        assertEquals(5, rows.size());
    }

    @Test
    @DisplayName("Should escape commas and quotes in SQL")
    void shouldEscapeSql() throws Exception {
        List<String[]> rows = read(formatter.format(ReportFixtures.sampleReport()));

        String insert = rows.get(1)[2];
        assertTrue(insert.startsWith("INSERT INTO audit"));
        assertEquals(5, rows.get(1).length);
    }

    @Test
    @DisplayName("Should write only the header for an empty report")
    void shouldWriteHeaderOnly() throws Exception {
        List<String[]> rows = read(formatter.format(ReportFixtures.emptyReport()));

        assertEquals(1, rows.size());
        assertEquals("text/csv", formatter.getContentType());
    }
}
