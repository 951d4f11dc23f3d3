package com.di.medallion.exception;

/** Reading or writing a layer file failed. */
public class StorageException extends PipelineException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
