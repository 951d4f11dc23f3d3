package com.di.medallion.pipeline;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Returned by {@link PipelineOrchestrator#run()} and written as
 * {@code run_summary_latest.json} under the data directory.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunSummary {

    private String        pipelineName;
    private String        runId;
    private RunStatus     status;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private Double        durationSeconds;

    /** Fatal errors in the order they occurred; at most one under fail-fast. */
    @Builder.Default
    private List<PhaseError> errors = new ArrayList<>();

    /** Names of phases that finished, in order. */
    @Builder.Default
    private List<String> completedPhases = new ArrayList<>();

    @Builder.Default
    private List<PhaseResult> phaseResults = new ArrayList<>();

    public int exitCode() {
        return status == null ? 1 : status.exitCode();
    }
}
