package com.di.medallion.pipeline;

import com.di.medallion.quality.QualityReport;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one completed phase.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PhaseResult {

    private String phase;
    private long   durationMs;

    /** Dataset name → rows written. */
    @Builder.Default
    private Map<String, Integer> rowsWritten = new LinkedHashMap<>();

    /** Timestamped files written by the phase. */
    @Builder.Default
    private List<String> files = new ArrayList<>();

    /** Analytic tables not produced, with the missing columns. */
    @Builder.Default
    private Map<String, List<String>> skippedTables = new LinkedHashMap<>();

    /** Quality Gate report per dataset written, keyed like {@link #rowsWritten}. */
    @Builder.Default
    private Map<String, QualityReport> qualityReports = new LinkedHashMap<>();

    /** Advisory quality issues across every dataset the phase evaluated. */
    private int qualityIssues;

    @Builder.Default
    private List<String> warnings = new ArrayList<>();
}
