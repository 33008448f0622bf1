package com.star.pglogstats.sql;

import com.star.pglogstats.entity.Query;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns the SQL text of a {@code statement:} message into one classified,
 * normalized {@link Query} per top-level statement.
 */
@Component
public class QueryExtractor {

    private final StatementSplitter splitter;
    private final QueryClassifier classifier;
    private final LiteralNormalizer normalizer;

    @Autowired
    public QueryExtractor(StatementSplitter splitter, QueryClassifier classifier, LiteralNormalizer normalizer) {
        this.splitter = splitter;
        this.classifier = classifier;
        this.normalizer = normalizer;
    }

    public QueryExtractor() {
        this(new StatementSplitter(), new QueryClassifier(), new LiteralNormalizer());
    }

    public List<Query> extract(String sql) {
        return splitter.split(sql).stream()
                .map(this::toQuery)
                .collect(Collectors.toList());
    }

    private Query toQuery(String rawSql) {
        return Query.builder()
                .rawSql(rawSql)
                .queryType(classifier.classify(rawSql))
                .normalizedSql(normalizer.normalize(rawSql))
                .build();
    }
}
