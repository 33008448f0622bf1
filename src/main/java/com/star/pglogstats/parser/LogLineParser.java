package com.star.pglogstats.parser;

import com.star.pglogstats.entity.LogLevel;
import com.star.pglogstats.entity.LogRecord;
import com.star.pglogstats.entity.PendingStatement;
import com.star.pglogstats.exception.TimestampParseException;
import com.star.pglogstats.sql.QueryExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.format.TextStyle;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for PostgreSQL server log lines written to stderr.
 *
 * <p>A line starting with a digit is a header line and must match the prefix
 * grammar selected in the {@link ParseContext}. Any other non-blank line
 * continues the SQL of the last {@code statement:} message. The SQL of a
 * statement is only complete once the next header line arrives, so a statement
 * record is emitted one header late, ahead of the record that closed it.
 *
 * <p>Supported prefixes:
 * <ul>
 *   <li>{@code 2024-01-15 10:30:45.123 UTC [1234] alice@shop psql: LOG:  statement: SELECT 1}</li>
 *   <li>{@code 2024-01-15 10:30:45 UTC [1234]: [1-1] user=alice,db=shop,app=psql,client=10.0.0.5:5432 LOG:  duration: 1.5 ms}</li>
 * </ul>
 *
 * <p>The parser keeps no state of its own; everything that spans lines lives in
 * the context.
 */
@Component
@Slf4j
public class LogLineParser {

    static final String STATEMENT_MARKER = "statement: ";
    static final String DURATION_MARKER = "duration: ";

    private static final String TIMESTAMP = "(?<timestamp>\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}(?:\\.\\d+)?)";

    /**
     * {@code %m %t [%p] %u@%d %a: } style prefix.
     */
    private static final Pattern STDERR_PATTERN = Pattern.compile(
            "^" + TIMESTAMP + " (?<zone>\\w+) \\[(?<pid>\\d+)\\] " +
            "(?<user>[^@]+)@(?<database>\\S+) (?<app>[^:]+): " +
            "(?<level>\\w+):\\s*(?<message>.+)$"
    );

    /**
     * {@code %m %t [%p]: [%l-1] user=%u,db=%d,app=%a,client=%h } style prefix.
     */
    private static final Pattern KEY_VALUE_PATTERN = Pattern.compile(
            "^" + TIMESTAMP + " (?<zone>\\w+) \\[(?<pid>\\d+)\\]: \\[(?<session>\\d+)-(?<sub>\\d+)\\] " +
            "user=(?<user>[^,]+),db=(?<database>[^,]+),app=(?<app>[^,]+),client=(?<client>[^:]+):\\d+ " +
            "(?<level>\\w+):\\s*(?<message>.+)$"
    );

    private static final Pattern DURATION_PATTERN = Pattern.compile("duration: ([\\d.]+) ms");

    private static final DateTimeFormatter FRACTIONAL_ZONED = timestampFormatter(true, true);
    private static final DateTimeFormatter WHOLE_ZONED = timestampFormatter(false, true);
    private static final DateTimeFormatter FRACTIONAL_LOCAL = timestampFormatter(true, false);
    private static final DateTimeFormatter WHOLE_LOCAL = timestampFormatter(false, false);

    private final QueryExtractor queryExtractor;

    @Autowired
    public LogLineParser(QueryExtractor queryExtractor) {
        this.queryExtractor = queryExtractor;
    }

    public LogLineParser() {
        this(new QueryExtractor());
    }

    /**
     * Feeds one line to the parser.
     *
     * @param line       raw line without its terminator
     * @param lineNumber 1-based position of the line in its stream
     * @param context    per-stream state, updated in place
     * @throws TimestampParseException if a header line carries a timestamp in
     *                                 none of the supported layouts; the
     *                                 statement that header closed travels
     *                                 with the exception
     */
    public ParseResult parseLine(String line, long lineNumber, ParseContext context) {
        if (line == null || line.isBlank()) {
            context.recordSkipped();
            return ParseResult.skipped(lineNumber, "Empty line");
        }

        if (line.length() > context.getMaxLineLength()) {
            context.recordFailure();
            return ParseResult.failed(lineNumber, truncate(line),
                    String.format("Line exceeds maximum length of %d characters", context.getMaxLineLength()));
        }

        if (isContinuationLine(line)) {
            return handleContinuation(line, lineNumber, context);
        }

        Matcher matcher = patternFor(context.getPrefixFormat()).matcher(line);
        if (!matcher.matches()) {
            context.recordSkipped();
            return ParseResult.skipped(lineNumber, "Line does not match the " + context.getPrefixFormat() + " prefix");
        }

        // A header closes the open statement even when its own timestamp is unreadable.
        PendingStatement finished = context.takePendingStatement();
        Instant timestamp;
        try {
            timestamp = parseTimestamp(matcher.group("timestamp"), matcher.group("zone"), lineNumber, line);
        } catch (TimestampParseException e) {
            if (finished != null) {
                e.setClosedStatement(toStatementRecord(finished));
            }
            throw e;
        }

        List<LogRecord> records = new ArrayList<>(2);
        if (finished != null) {
            records.add(toStatementRecord(finished));
        }

        String message = matcher.group("message");
        if (message.startsWith(STATEMENT_MARKER)) {
            context.openStatement(PendingStatement.builder()
                    .timestamp(timestamp)
                    .processId(matcher.group("pid"))
                    .user(matcher.group("user"))
                    .database(matcher.group("database"))
                    .clientHost(clientHost(matcher, context.getPrefixFormat()))
                    .applicationName(matcher.group("app"))
                    .lineNumber(lineNumber)
                    .build());
            context.getPendingStatement().appendText(message.substring(STATEMENT_MARKER.length()));

            context.recordSuccess();
            return records.isEmpty()
                    ? ParseResult.buffered(lineNumber, line)
                    : ParseResult.records(lineNumber, records);
        }

        LogRecord.LogRecordBuilder record = LogRecord.builder()
                .timestamp(timestamp)
                .processId(matcher.group("pid"))
                .user(matcher.group("user"))
                .database(matcher.group("database"))
                .clientHost(clientHost(matcher, context.getPrefixFormat()))
                .applicationName(matcher.group("app"))
                .message(message)
                .lineNumber(lineNumber);

        if (message.startsWith(DURATION_MARKER)) {
            record.level(LogLevel.DURATION).durationMs(extractDuration(message));
        } else {
            record.level(LogLevel.fromSeverity(matcher.group("level")));
        }
        records.add(record.build());

        context.recordSuccess();
        return ParseResult.records(lineNumber, records);
    }

    /**
     * Closes the statement still open at the end of the stream.
     *
     * @return the statement record, or {@code null} when nothing was pending
     */
    public LogRecord finish(ParseContext context) {
        PendingStatement finished = context.takePendingStatement();
        return finished != null ? toStatementRecord(finished) : null;
    }

    static boolean isContinuationLine(String line) {
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (!Character.isWhitespace(c)) {
                return c < '0' || c > '9';
            }
        }
        return false;
    }

    static Double extractDuration(String message) {
        Matcher matcher = DURATION_PATTERN.matcher(message);
        if (!matcher.find()) {
            return null;
        }
        try {
            return Double.parseDouble(matcher.group(1));
        } catch (NumberFormatException e) {
            log.debug("Unreadable duration value '{}'", matcher.group(1));
            return null;
        }
    }

    /**
     * Tries, in order, fractional and whole seconds with the zone token, then
     * both without it. Zone-less timestamps are read as UTC.
     */
    static Instant parseTimestamp(String timestamp, String zone, long lineNumber, String rawLine) {
        if (zone != null) {
            String zoned = timestamp + " " + zone;
            for (DateTimeFormatter formatter : List.of(FRACTIONAL_ZONED, WHOLE_ZONED)) {
                Instant parsed = tryParse(zoned, formatter, true);
                if (parsed != null) {
                    return parsed;
                }
            }
        }

        for (DateTimeFormatter formatter : List.of(FRACTIONAL_LOCAL, WHOLE_LOCAL)) {
            Instant parsed = tryParse(timestamp, formatter, false);
            if (parsed != null) {
                return parsed;
            }
        }

        throw new TimestampParseException(lineNumber, rawLine, timestamp);
    }

    private static Instant tryParse(String text, DateTimeFormatter formatter, boolean zoned) {
        try {
            return zoned
                    ? ZonedDateTime.parse(text, formatter).toInstant()
                    : LocalDateTime.parse(text, formatter).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private ParseResult handleContinuation(String line, long lineNumber, ParseContext context) {
        PendingStatement pending = context.getPendingStatement();
        if (pending == null) {
            context.recordSkipped();
            return ParseResult.skipped(lineNumber, "Continuation line without an open statement");
        }
        pending.appendContinuation(line);
        context.recordSuccess();
        return ParseResult.buffered(lineNumber, line);
    }

    private LogRecord toStatementRecord(PendingStatement pending) {
        String sql = pending.getQueryText();
        return LogRecord.builder()
                .timestamp(pending.getTimestamp())
                .processId(pending.getProcessId())
                .user(pending.getUser())
                .database(pending.getDatabase())
                .clientHost(pending.getClientHost())
                .applicationName(pending.getApplicationName())
                .level(LogLevel.STATEMENT)
                .message(STATEMENT_MARKER + sql)
                .statement(sql)
                .queries(queryExtractor.extract(sql))
                .lineNumber(pending.getLineNumber())
                .build();
    }

    private static Pattern patternFor(LogPrefixFormat format) {
        return format == LogPrefixFormat.KEY_VALUE ? KEY_VALUE_PATTERN : STDERR_PATTERN;
    }

    private static String clientHost(Matcher matcher, LogPrefixFormat format) {
        return format == LogPrefixFormat.KEY_VALUE ? matcher.group("client") : null;
    }

    private static DateTimeFormatter timestampFormatter(boolean fractional, boolean zoned) {
        DateTimeFormatterBuilder builder = new DateTimeFormatterBuilder()
                .appendPattern("uuuu-MM-dd HH:mm:ss");
        if (fractional) {
            builder.appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true);
        }
        if (zoned) {
            builder.appendLiteral(' ').appendZoneText(TextStyle.SHORT);
        }
        return builder.toFormatter(Locale.ROOT).withResolverStyle(ResolverStyle.STRICT);
    }

    private static String truncate(String line) {
        return line.length() > 200 ? line.substring(0, 200) + "..." : line;
    }
}
