package com.star.pglogstats.sql;

import com.alibaba.druid.DbType;
import com.alibaba.druid.sql.SQLUtils;
import com.alibaba.druid.sql.ast.SQLExpr;
import com.alibaba.druid.sql.ast.SQLObject;
import com.alibaba.druid.sql.ast.SQLStatement;
import com.alibaba.druid.sql.ast.expr.SQLBinaryOpExpr;
import com.alibaba.druid.sql.ast.expr.SQLBinaryOperator;
import com.alibaba.druid.sql.ast.expr.SQLIdentifierExpr;
import com.alibaba.druid.sql.ast.expr.SQLLiteralExpr;
import com.alibaba.druid.sql.ast.expr.SQLNullExpr;
import com.alibaba.druid.sql.ast.expr.SQLVariantRefExpr;
import com.alibaba.druid.sql.ast.statement.SQLDeleteStatement;
import com.alibaba.druid.sql.ast.statement.SQLInsertStatement;
import com.alibaba.druid.sql.ast.statement.SQLSelectStatement;
import com.alibaba.druid.sql.ast.statement.SQLUpdateSetItem;
import com.alibaba.druid.sql.ast.statement.SQLUpdateStatement;
import com.alibaba.druid.sql.dialect.postgresql.ast.stmt.PGInsertStatement;
import com.alibaba.druid.sql.dialect.postgresql.visitor.PGASTVisitorAdapter;
import com.star.pglogstats.exception.NormalizationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Canonicalizes SQL so that statements differing only in literal values or
 * whitespace group together.
 *
 * <p>The statement is parsed into a PostgreSQL syntax tree, every numeric,
 * string, boolean and null constant and every positional parameter
 * ({@code $1}, {@code $2}, ...) is replaced by {@value #PLACEHOLDER}, and the
 * tree is printed back with whitespace collapsed to single spaces. Keywords come
 * out upper-case, so {@code select 1} and {@code SELECT 2} share one shape.
 *
 * <p>Only SELECT, INSERT, UPDATE and DELETE are rewritten. Transaction control,
 * DDL and utility commands keep their whitespace-collapsed raw text, as does
 * any statement whose printed form would change on a second pass.
 *
 * <p>{@link #normalize(String)} never throws: SQL the parser rejects is
 * returned as its whitespace-collapsed raw text. The output is stable under
 * re-normalization.
 */
@Component
@Slf4j
public class LiteralNormalizer {

    public static final String PLACEHOLDER = "?";

    private static final StatementSplitter SPLITTER = new StatementSplitter();

    public String normalize(String sql) {
        String collapsed = collapseWhitespace(sql);
        if (collapsed.isEmpty()) {
            return collapsed;
        }

        try {
            return normalizeStrict(collapsed);
        } catch (NormalizationException e) {
            log.debug("Using raw text for SQL that could not be normalized: {}", e.getMessage());
            return collapsed;
        }
    }

    /**
     * Same as {@link #normalize(String)} but reports SQL that cannot be parsed.
     *
     * @throws NormalizationException if the SQL has no structural parse
     */
    public String normalizeStrict(String sql) {
        String collapsed = collapseWhitespace(sql);
        if (collapsed.isEmpty()) {
            return collapsed;
        }

        List<String> pieces = SPLITTER.split(sql);
        if (pieces.isEmpty()) {
            throw new NormalizationException(collapsed, "No SQL statement found", null);
        }

        List<String> rendered = new ArrayList<>(pieces.size());
        for (String piece : pieces) {
            String text = stripTrailingSemicolon(collapseWhitespace(piece));
            try {
                rendered.add(normalizeStatement(text));
            } catch (RuntimeException e) {
                throw new NormalizationException(collapsed, "Failed to parse SQL: " + e.getMessage(), e);
            }
        }
        return String.join("; ", rendered);
    }

    /**
     * Rewrites one statement. Only DML is printed back from the syntax tree,
     * and only when printing the result again yields the same text; anything
     * else keeps its collapsed raw text.
     */
    private static String normalizeStatement(String text) {
        SQLStatement statement = parseSingle(text);
        if (!isRenderable(statement)) {
            return text;
        }

        String once = render(statement);
        try {
            SQLStatement reparsed = parseSingle(once);
            if (isRenderable(reparsed) && once.equals(render(reparsed))) {
                return once;
            }
        } catch (RuntimeException e) {
            log.debug("Rendered SQL does not parse again: {}", once);
        }
        log.debug("Keeping raw text for SQL that does not print back stably: {}", text);
        return text;
    }

    private static SQLStatement parseSingle(String text) {
        List<SQLStatement> statements = SQLUtils.parseStatements(text, DbType.postgresql);
        if (statements.size() != 1) {
            return null;
        }
        return statements.get(0);
    }

    private static boolean isRenderable(SQLStatement statement) {
        return statement instanceof SQLSelectStatement
                || statement instanceof SQLInsertStatement
                || statement instanceof SQLUpdateStatement
                || statement instanceof SQLDeleteStatement;
    }

    private static String render(SQLStatement statement) {
        replaceLiterals(statement);
        return stripTrailingSemicolon(collapseWhitespace(SQLUtils.toSQLString(statement, DbType.postgresql)));
    }

    /**
     * Collapses whitespace runs outside quoted strings and identifiers to one
     * space and trims the result. Quoted text is kept byte for byte.
     */
    public static String collapseWhitespace(String sql) {
        if (sql == null) {
            return "";
        }

        StringBuilder out = new StringBuilder(sql.length());
        char quote = 0;
        boolean pendingSpace = false;

        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);

            if (quote != 0) {
                out.append(c);
                if (c == quote) {
                    quote = 0;
                }
                continue;
            }

            if (Character.isWhitespace(c)) {
                pendingSpace = out.length() > 0;
                continue;
            }

            if (pendingSpace) {
                out.append(' ');
                pendingSpace = false;
            }
            if (c == '\'' || c == '"') {
                quote = c;
            }
            out.append(c);
        }

        return out.toString();
    }

    private static String stripTrailingSemicolon(String sql) {
        String result = sql;
        while (result.endsWith(";")) {
            result = result.substring(0, result.length() - 1).trim();
        }
        return result;
    }

    // Post-order: literals are collected while walking, then swapped in their parents.
    private static void replaceLiterals(SQLStatement statement) {
        LiteralCollector collector = new LiteralCollector();
        statement.accept(collector);

        for (SQLExpr literal : collector.literals) {
            if (!SQLUtils.replaceInParent(literal, new SQLVariantRefExpr(PLACEHOLDER))) {
                log.trace("Literal {} kept, its parent {} does not support replacement",
                        literal, literal.getParent() != null ? literal.getParent().getClass().getSimpleName() : "none");
            }
        }
    }

    private static class LiteralCollector extends PGASTVisitorAdapter {

        private final List<SQLExpr> literals = new ArrayList<>();

        private final Set<SQLExpr> seen = Collections.newSetFromMap(new IdentityHashMap<>());

        // Numbers, strings, booleans, NULL and typed literals such as TIMESTAMP '...'.
        @Override
        public void postVisit(SQLObject x) {
            if (x instanceof SQLLiteralExpr) {
                if (!(x instanceof SQLNullExpr) || !isNullTest((SQLNullExpr) x)) {
                    collect((SQLExpr) x);
                }
            }
        }

        @Override
        public void endVisit(SQLVariantRefExpr x) {
            if (!PLACEHOLDER.equals(x.getName())) {
                collect(x);
            }
        }

        // The PostgreSQL grammar lets TRUE/FALSE through as plain identifiers in some positions.
        @Override
        public void endVisit(SQLIdentifierExpr x) {
            String name = x.getName();
            if ("true".equalsIgnoreCase(name) || "false".equalsIgnoreCase(name)) {
                collect(x);
            }
        }

        // The tree walk skips the DO UPDATE part of ON CONFLICT.
        @Override
        public void endVisit(PGInsertStatement x) {
            if (x.getOnConflictUpdateSetItems() != null) {
                for (SQLUpdateSetItem item : x.getOnConflictUpdateSetItems()) {
                    item.accept(this);
                }
            }
            if (x.getOnConflictUpdateWhere() != null) {
                x.getOnConflictUpdateWhere().accept(this);
            }
            if (x.getOnConflictWhere() != null) {
                x.getOnConflictWhere().accept(this);
            }
        }

        private void collect(SQLExpr literal) {
            if (seen.add(literal)) {
                literals.add(literal);
            }
        }

        // IS [NOT] NULL is a predicate, not a value.
        private static boolean isNullTest(SQLNullExpr x) {
            SQLObject parent = x.getParent();
            if (parent instanceof SQLBinaryOpExpr) {
                SQLBinaryOperator operator = ((SQLBinaryOpExpr) parent).getOperator();
                return operator == SQLBinaryOperator.Is || operator == SQLBinaryOperator.IsNot;
            }
            return false;
        }
    }
}
