package com.di.medallion.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of one pipeline run.
 *
 * <pre>NOT_STARTED → RUNNING → COMPLETED_SUCCESSFULLY | FAILED</pre>
 */
public enum RunStatus {

    NOT_STARTED("Not Started"),
    RUNNING("Running"),
    COMPLETED_SUCCESSFULLY("Completed Successfully"),
    FAILED("Failed");

    private final String label;

    RunStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /** Process exit code: 0 only for a successful run. */
    public int exitCode() {
        return this == COMPLETED_SUCCESSFULLY ? 0 : 1;
    }
}
