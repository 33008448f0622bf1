package com.star.pglogstats.parser;

import com.star.pglogstats.entity.LogRecord;
import com.star.pglogstats.exception.LogParseException;
import com.star.pglogstats.exception.ParseFailure;
import com.star.pglogstats.exception.TimestampParseException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Drives {@link LogLineParser} over the lines of one log stream.
 *
 * <p>Records come out in the order of the header lines that produced them.
 * Failing lines are skipped by default; with
 * {@link ParseContext#isStrictMode() strict mode} every failure of the stream is
 * collected and reported in one {@link LogParseException} once all lines have
 * been read.
 */
@Component
@Slf4j
public class LogStreamParser {

    /**
     * Failures kept for reporting in lenient mode. Strict mode keeps all of them.
     */
    static final int MAX_REPORTED_FAILURES = 100;

    private final LogLineParser lineParser;

    @Autowired
    public LogStreamParser(LogLineParser lineParser) {
        this.lineParser = lineParser;
    }

    public LogStreamParser() {
        this(new LogLineParser());
    }

    public List<LogRecord> parseLines(List<String> lines) {
        return parseLines(lines, new ParseContext());
    }

    /**
     * Parses a complete stream. The settings of {@code settings} are used on a
     * fresh copy, so one settings object can serve many streams.
     *
     * @throws LogParseException in strict mode when any line failed
     */
    public List<LogRecord> parseLines(List<String> lines, ParseContext settings) {
        Session session = open(settings.copyWithFreshState());
        long lineNumber = 0;
        for (String line : lines) {
            session.accept(line, ++lineNumber);
        }
        return session.finish();
    }

    /**
     * Starts an incremental parse that reads state and counters from
     * {@code context}. Use this when lines arrive one at a time.
     */
    public Session open(ParseContext context) {
        return new Session(context);
    }

    public class Session {

        @Getter
        private final ParseContext context;

        private final List<LogRecord> records = new ArrayList<>();

        private final List<ParseFailure> failures = new ArrayList<>();

        private boolean finished = false;

        private Session(ParseContext context) {
            this.context = context;
        }

        public void accept(String line, long lineNumber) {
            if (finished) {
                throw new IllegalStateException("Parse session already finished");
            }

            try {
                ParseResult result = lineParser.parseLine(line, lineNumber, context);
                switch (result.getStatus()) {
                    case RECORD -> records.addAll(result.getRecords());
                    case FAILED -> addFailure(new ParseFailure(lineNumber, result.getRawLine(), result.getErrorMessage()));
                    case BUFFERED, SKIPPED -> log.trace("Line {}: {}", lineNumber, result.getStatus());
                }
            } catch (TimestampParseException e) {
                if (e.getClosedStatement() != null) {
                    records.add(e.getClosedStatement());
                }
                context.recordFailure();
                e.getFailures().forEach(this::addFailure);
            } catch (LogParseException e) {
                context.recordFailure();
                e.getFailures().forEach(this::addFailure);
            }
        }

        /**
         * Flushes the statement still open and returns every record of the stream.
         *
         * @throws LogParseException in strict mode when any line failed
         */
        public List<LogRecord> finish() {
            if (!finished) {
                finished = true;
                LogRecord last = lineParser.finish(context);
                if (last != null) {
                    records.add(last);
                }
                log.debug("Parsed {} records from {} lines of {} ({} failed, {} skipped)",
                        records.size(), context.getTotalLinesProcessed(),
                        context.getSourceName() != null ? context.getSourceName() : "<stream>",
                        context.getFailedLines(), context.getSkippedLines());
            }

            if (context.isStrictMode() && !failures.isEmpty()) {
                throw LogParseException.aggregate(failures);
            }
            return Collections.unmodifiableList(records);
        }

        public List<ParseFailure> getFailures() {
            return Collections.unmodifiableList(failures);
        }

        private void addFailure(ParseFailure failure) {
            log.debug("Parse failed at {}:{}: {}", context.getSourceName(), failure.getLineNumber(), failure.getReason());
            if (context.isStrictMode() || failures.size() < MAX_REPORTED_FAILURES) {
                failures.add(failure);
            }
        }
    }
}
