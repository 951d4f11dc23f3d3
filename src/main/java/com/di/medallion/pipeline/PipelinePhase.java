package com.di.medallion.pipeline;

/**
 * One step of the run. A phase reads its input from the previous phase's layer
 * and writes its output to its own; any exception it throws is fatal for the run.
 */
public interface PipelinePhase {

    /** Name used in logs and in the run summary's error list. */
    String name();

    PhaseResult execute(RunContext context);
}
