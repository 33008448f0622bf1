package com.star.pglogstats.sql;

import com.star.pglogstats.entity.QueryType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class QueryClassifierTest {

    private QueryClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new QueryClassifier();
    }

    @ParameterizedTest
    @CsvSource({
            "'SELECT * FROM users', SELECT",
            "'  select id from t', SELECT",
            "'INSERT INTO users VALUES (1)', INSERT",
            "'update users set name = ''x''', UPDATE",
            "'DELETE FROM users WHERE id = 1', DELETE",
            "'CREATE TABLE t (id int)', DDL",
            "'drop index idx_users', DDL",
            "'ALTER TABLE t ADD COLUMN c int', DDL",
            "'TRUNCATE t', DDL",
            "'GRANT SELECT ON t TO bob', DDL",
            "'REVOKE ALL ON t FROM bob', DDL"
    })
    @DisplayName("Should classify by leading keyword")
    void shouldClassifyByLeadingKeyword(String sql, QueryType expected) {
        assertEquals(expected, classifier.classify(sql));
    }

    @ParameterizedTest
    @ValueSource(strings = {"BEGIN", "COMMIT", "ROLLBACK", "EXPLAIN SELECT 1", "VACUUM users", "", "   ", "(SELECT 1)"})
    @DisplayName("Should classify everything else as OTHER")
    void shouldClassifyOthers(String sql) {
        assertEquals(QueryType.OTHER, classifier.classify(sql));
    }

    @Test
    @DisplayName("Should not match keyword prefixes of longer words")
    void shouldNotMatchKeywordPrefix() {
        assertEquals(QueryType.OTHER, classifier.classify("SELECTED FROM t"));
        assertEquals(QueryType.OTHER, classifier.classify("CREATED"));
    }

    @Test
    @DisplayName("Should handle null input")
    void shouldHandleNull() {
        assertEquals(QueryType.OTHER, classifier.classify(null));
    }

    @Test
    @DisplayName("Should ignore literal values")
    void shouldIgnoreLiteralValues() {
        assertEquals(classifier.classify("SELECT * FROM t WHERE id = 1"),
                classifier.classify("SELECT * FROM t WHERE id = 999"));
    }
}
