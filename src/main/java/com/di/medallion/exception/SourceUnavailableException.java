package com.di.medallion.exception;

/** The source database could not be reached. */
public class SourceUnavailableException extends PipelineException {

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
