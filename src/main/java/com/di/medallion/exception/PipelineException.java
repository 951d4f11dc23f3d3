package com.di.medallion.exception;

/**
 * Base type of every fatal pipeline error. A fatal error aborts the current
 * phase and, because phases run fail-fast, the rest of the run.
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
