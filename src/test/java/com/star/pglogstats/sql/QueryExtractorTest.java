package com.star.pglogstats.sql;

import com.star.pglogstats.entity.Query;
import com.star.pglogstats.entity.QueryType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueryExtractorTest {

    private final QueryExtractor extractor = new QueryExtractor();

    @Test
    @DisplayName("Should extract one query per statement")
    void shouldExtractOneQueryPerStatement() {
        List<Query> queries = extractor.extract("BEGIN; UPDATE accounts SET balance = 10 WHERE id = 1; COMMIT;");

        assertEquals(3, queries.size());
        assertEquals(QueryType.OTHER, queries.get(0).getQueryType());
        assertEquals("BEGIN", queries.get(0).getRawSql());
        assertEquals("BEGIN", queries.get(0).getNormalizedSql());
        assertEquals(QueryType.UPDATE, queries.get(1).getQueryType());
        assertEquals("UPDATE accounts SET balance = 10 WHERE id = 1", queries.get(1).getRawSql());
        assertFalse(queries.get(1).getNormalizedSql().contains("10"));
        assertEquals(QueryType.OTHER, queries.get(2).getQueryType());
        assertEquals("COMMIT", queries.get(2).getNormalizedSql());
    }

    @Test
    @DisplayName("Should return no queries for blank SQL")
    void shouldReturnEmptyForBlank() {
        assertTrue(extractor.extract("  ").isEmpty());
    }
}
