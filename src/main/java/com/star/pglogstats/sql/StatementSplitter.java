package com.star.pglogstats.sql;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a SQL script on top-level semicolons.
 *
 * <p>Semicolons inside single-quoted strings, quoted identifiers, dollar-quoted
 * bodies ({@code $$ ... $$}, {@code $fn$ ... $fn$}) and comments do not split.
 * Empty pieces are dropped and the separator itself is never part of a piece.
 */
@Component
public class StatementSplitter {

    public List<String> split(String sql) {
        List<String> statements = new ArrayList<>();
        if (sql == null || sql.isBlank()) {
            return statements;
        }

        int start = 0;
        int i = 0;
        int length = sql.length();

        while (i < length) {
            char c = sql.charAt(i);

            if (c == '\'' || c == '"') {
                i = skipQuoted(sql, i, c);
            } else if (c == '-' && next(sql, i) == '-') {
                i = skipLineComment(sql, i);
            } else if (c == '/' && next(sql, i) == '*') {
                i = skipBlockComment(sql, i);
            } else if (c == '$') {
                i = skipDollarQuoted(sql, i);
            } else if (c == ';') {
                addPiece(statements, sql.substring(start, i));
                start = i + 1;
                i++;
            } else {
                i++;
            }
        }

        addPiece(statements, sql.substring(start));
        return statements;
    }

    private static void addPiece(List<String> statements, String piece) {
        String trimmed = piece.trim();
        if (!trimmed.isEmpty()) {
            statements.add(trimmed);
        }
    }

    private static char next(String sql, int i) {
        return i + 1 < sql.length() ? sql.charAt(i + 1) : '\0';
    }

    // A doubled quote is an escaped quote and keeps the literal open.
    private static int skipQuoted(String sql, int open, char quote) {
        int i = open + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == quote) {
                if (next(sql, i) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return sql.length();
    }

    private static int skipLineComment(String sql, int start) {
        int end = sql.indexOf('\n', start);
        return end < 0 ? sql.length() : end + 1;
    }

    private static int skipBlockComment(String sql, int start) {
        int end = sql.indexOf("*/", start + 2);
        return end < 0 ? sql.length() : end + 2;
    }

    private static int skipDollarQuoted(String sql, int start) {
        int tagEnd = start + 1;
        while (tagEnd < sql.length()) {
            char c = sql.charAt(tagEnd);
            if (c == '$') {
                break;
            }
            boolean valid = Character.isLetter(c) || c == '_' || (tagEnd > start + 1 && Character.isDigit(c));
            if (!valid) {
                // $1 style parameter or a stray dollar sign
                return start + 1;
            }
            tagEnd++;
        }
        if (tagEnd >= sql.length()) {
            return start + 1;
        }

        String tag = sql.substring(start, tagEnd + 1);
        int close = sql.indexOf(tag, tagEnd + 1);
        return close < 0 ? sql.length() : close + tag.length();
    }
}
