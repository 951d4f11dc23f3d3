package com.di.medallion.pipeline;

import com.di.medallion.config.PipelineProperties;
import com.di.medallion.exception.ErrorCategory;
import com.di.medallion.exception.PipelineException;
import com.di.medallion.extract.SourceConnectionChecker;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Runs the medallion pipeline end to end.
 *
 * <pre>
 * ┌──────────────────────────────────────────────────────────────┐
 * │  PRE-FLIGHT   SELECT 1 against the source                     │
 * │               failure → FAILED, no phase attempted            │
 * ├──────────────────────────────────────────────────────────────┤
 * │  EXTRACT      source tables → data/bronze                     │
 * ├──────────────────────────────────────────────────────────────┤
 * │  TRANSFORM    bronze dimemployee_latest → data/silver         │
 * ├──────────────────────────────────────────────────────────────┤
 * │  LOAD         silver employees_latest → data/gold             │
 * └──────────────────────────────────────────────────────────────┘
 * </pre>
 *
 * <p>Phases run one at a time in that order. The first phase that throws stops
 * the run (fail-fast); its error is recorded with the phase name and an
 * {@link ErrorCategory} and the status becomes {@link RunStatus#FAILED}.
 * Quality findings never stop a run.
 */
@Slf4j
@Service
public class PipelineOrchestrator {

    public static final String PREFLIGHT_PHASE = "Connection";
    public static final String MDC_RUN_ID      = "runId";

    private static final DateTimeFormatter DISPLAY = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String            RULE    = "=".repeat(60);

    private final String                  pipelineName;
    private final SourceConnectionChecker connectionChecker;
    private final List<PipelinePhase>     phases;
    private final RunSummaryWriter        summaryWriter;
    private final Clock                   clock;

    @Autowired
    public PipelineOrchestrator(PipelineProperties      properties,
                                SourceConnectionChecker connectionChecker,
                                ExtractPhase            extract,
                                TransformPhase          transform,
                                LoadPhase               load,
                                RunSummaryWriter        summaryWriter,
                                Clock                   clock) {
        this(properties.getName(), connectionChecker, List.of(extract, transform, load), summaryWriter, clock);
    }

    public PipelineOrchestrator(String                  pipelineName,
                                SourceConnectionChecker connectionChecker,
                                List<PipelinePhase>     phases,
                                RunSummaryWriter        summaryWriter,
                                Clock                   clock) {
        this.pipelineName      = pipelineName;
        this.connectionChecker = connectionChecker;
        this.phases            = List.copyOf(phases);
        this.summaryWriter     = summaryWriter;
        this.clock             = clock;
    }

    /* ==================================================================== */
    /* Entry point                                                           */
    /* ==================================================================== */

    /**
     * Runs every phase synchronously and returns the terminal summary. Fatal
     * errors are caught here and reported in the summary, never rethrown.
     */
    public RunSummary run() {
        String runId = UUID.randomUUID().toString();
        MDC.put(MDC_RUN_ID, runId);
        try {
            return doRun(runId);
        } finally {
            MDC.remove(MDC_RUN_ID);
        }
    }

    /* ==================================================================== */
    /* Internal                                                              */
    /* ==================================================================== */

    private RunSummary doRun(String runId) {
        RunSummary summary = RunSummary.builder()
                .pipelineName(pipelineName)
                .runId(runId)
                .status(RunStatus.NOT_STARTED)
                .build();

        LocalDateTime start = LocalDateTime.now(clock);
        summary.setStartTime(start);
        summary.setStatus(RunStatus.RUNNING);

        log.info(RULE);
        log.info("[PIPELINE] STARTING PIPELINE: {} runId={}", pipelineName, runId);
        log.info("[PIPELINE] Start Time: {}", start.format(DISPLAY));
        log.info(RULE);

        if (preflight(summary)) {
            RunContext context = new RunContext(runId, start);
            for (PipelinePhase phase : phases) {
                if (!runPhase(phase, context, summary)) {
                    break;
                }
            }
            if (summary.getErrors().isEmpty()) {
                summary.setStatus(RunStatus.COMPLETED_SUCCESSFULLY);
            }
        }

        if (summary.getStatus() != RunStatus.COMPLETED_SUCCESSFULLY) {
            summary.setStatus(RunStatus.FAILED);
        }
        finish(summary);
        return summary;
    }

    /** @return false when the source is unreachable; the error is already recorded */
    private boolean preflight(RunSummary summary) {
        try {
            connectionChecker.verify();
            return true;
        } catch (RuntimeException e) {
            log.error("[PIPELINE] Pipeline aborted: database connection failed: {}", e.getMessage());
            recordError(summary, PREFLIGHT_PHASE, e);
            return false;
        }
    }

    /** @return false when the phase failed and the run must stop */
    private boolean runPhase(PipelinePhase phase, RunContext context, RunSummary summary) {
        log.info(RULE);
        log.info("[PIPELINE] PHASE {}: {}", summary.getCompletedPhases().size() + 1, phase.name().toUpperCase());
        log.info(RULE);
        try {
            PhaseResult result = phase.execute(context);
            summary.getCompletedPhases().add(phase.name());
            summary.getPhaseResults().add(result);
            result.getSkippedTables().forEach((table, missing) ->
                    log.warn("[PIPELINE] {} skipped: missing {}", table, missing));
            log.info("[PIPELINE] {} phase completed in {} ms ({} quality issues)",
                    phase.name(), result.getDurationMs(), result.getQualityIssues());
            return true;
        } catch (RuntimeException e) {
            if (e instanceof PipelineException) {
                log.error("[PIPELINE] {} phase failed: {}", phase.name(), e.getMessage());
            } else {
                log.error("[PIPELINE] {} phase failed", phase.name(), e);
            }
            recordError(summary, phase.name(), e);
            log.error("[PIPELINE] Pipeline failed at {} phase", phase.name());
            return false;
        }
    }

    private static void recordError(RunSummary summary, String phase, RuntimeException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        summary.getErrors().add(new PhaseError(phase, String.valueOf(e.getMessage()), category));
        summary.setStatus(RunStatus.FAILED);
    }

    private void finish(RunSummary summary) {
        LocalDateTime end = LocalDateTime.now(clock);
        summary.setEndTime(end);
        summary.setDurationSeconds(Duration.between(summary.getStartTime(), end).toMillis() / 1000.0);
        logSummary(summary);
        try {
            summaryWriter.write(summary);
        } catch (RuntimeException e) {
            log.warn("[PIPELINE] Could not persist run summary: {}", e.getMessage());
        }
    }

    private void logSummary(RunSummary summary) {
        log.info(RULE);
        log.info("[SUMMARY] PIPELINE EXECUTION SUMMARY");
        log.info(RULE);
        log.info("[SUMMARY] Pipeline Name: {}", summary.getPipelineName());
        log.info("[SUMMARY] Status: {}", summary.getStatus().getLabel());
        log.info("[SUMMARY] Start Time: {}", summary.getStartTime().format(DISPLAY));
        log.info("[SUMMARY] End Time: {}", summary.getEndTime().format(DISPLAY));
        log.info("[SUMMARY] Duration: {} seconds", String.format(Locale.ROOT, "%.2f", summary.getDurationSeconds()));
        if (summary.getErrors().isEmpty()) {
            log.info("[SUMMARY] No errors encountered");
        } else {
            log.info("[SUMMARY] Errors encountered:");
            for (PhaseError error : summary.getErrors()) {
                log.info("[SUMMARY]   - {} [{}]", error, error.category());
            }
        }
        log.info(RULE);
        if (summary.getStatus() == RunStatus.COMPLETED_SUCCESSFULLY) {
            log.info("[SUMMARY] PIPELINE COMPLETED SUCCESSFULLY");
        } else {
            log.error("[SUMMARY] PIPELINE FAILED");
        }
    }
}
