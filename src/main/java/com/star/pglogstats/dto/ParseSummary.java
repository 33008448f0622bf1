package com.star.pglogstats.dto;

import com.star.pglogstats.exception.ParseFailure;
import com.star.pglogstats.parser.ParseContext;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Line counters of one parse, with the first failures for diagnosis.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParseSummary {

    private String prefixFormat;

    private long totalLines;

    private long successfulLines;

    private long failedLines;

    private long skippedLines;

    private long multiLineStatements;

    private long records;

    private double successRate;

    private List<ParseFailure> failures;

    public static ParseSummary from(ParseContext context, long records, List<ParseFailure> failures) {
        return ParseSummary.builder()
                .prefixFormat(context.getPrefixFormat().name())
                .totalLines(context.getTotalLinesProcessed())
                .successfulLines(context.getSuccessfulLines())
                .failedLines(context.getFailedLines())
                .skippedLines(context.getSkippedLines())
                .multiLineStatements(context.getMultiLineEntries())
                .records(records)
                .successRate(context.getSuccessRate())
                .failures(List.copyOf(failures))
                .build();
    }
}
