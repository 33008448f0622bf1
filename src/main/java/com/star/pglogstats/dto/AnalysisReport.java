package com.star.pglogstats.dto;

import com.star.pglogstats.entity.AnalysisResult;
import com.star.pglogstats.entity.TimingAnalysis;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Everything produced for one analyzed log source. This is the input of every
 * report formatter.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisReport {

    private String source;

    private Instant generatedAt;

    private long processingTimeMs;

    private ParseSummary parseSummary;

    private AnalysisResult analysis;

    private TimingAnalysis timing;
}
