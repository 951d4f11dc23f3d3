package com.di.medallion.exception;

/**
 * An extraction adapter could not return a complete dataset. Partial results are
 * never returned alongside this error.
 */
public class ExtractionException extends PipelineException {

    private final String entity;

    public ExtractionException(String entity, String message, Throwable cause) {
        super("Failed to extract " + entity + ": " + message, cause);
        this.entity = entity;
    }

    public String getEntity() {
        return entity;
    }
}
