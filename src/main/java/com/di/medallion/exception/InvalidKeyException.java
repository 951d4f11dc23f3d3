package com.di.medallion.exception;

/** A required key column is missing from the schema or holds an unparseable value. */
public class InvalidKeyException extends PipelineException {

    public InvalidKeyException(String message) {
        super(message);
    }
}
