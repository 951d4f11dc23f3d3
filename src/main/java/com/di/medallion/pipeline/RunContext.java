package com.di.medallion.pipeline;

import java.time.LocalDateTime;

/**
 * Per-run values handed to every phase.
 *
 * @param runId     correlation id, also put in the logging MDC
 * @param startedAt wall-clock start of the run, from the pipeline clock
 */
public record RunContext(String runId, LocalDateTime startedAt) {
}
