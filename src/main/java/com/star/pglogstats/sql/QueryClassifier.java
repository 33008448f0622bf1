package com.star.pglogstats.sql;

import com.star.pglogstats.entity.QueryType;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * Maps SQL text to a {@link QueryType} by its leading keyword.
 */
@Component
public class QueryClassifier {

    private static final Set<String> DDL_KEYWORDS = Set.of(
            "CREATE", "DROP", "ALTER", "TRUNCATE", "GRANT", "REVOKE"
    );

    public QueryType classify(String sql) {
        String keyword = leadingKeyword(sql);

        switch (keyword) {
            case "SELECT":
                return QueryType.SELECT;
            case "INSERT":
                return QueryType.INSERT;
            case "UPDATE":
                return QueryType.UPDATE;
            case "DELETE":
                return QueryType.DELETE;
            default:
                return DDL_KEYWORDS.contains(keyword) ? QueryType.DDL : QueryType.OTHER;
        }
    }

    static String leadingKeyword(String sql) {
        if (sql == null) {
            return "";
        }

        String trimmed = sql.trim();
        int end = 0;
        while (end < trimmed.length() && Character.isLetter(trimmed.charAt(end))) {
            end++;
        }
        return trimmed.substring(0, end).toUpperCase(Locale.ROOT);
    }
}
