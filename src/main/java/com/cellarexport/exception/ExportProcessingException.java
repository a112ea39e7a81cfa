package com.cellarexport.exception;

/**
 * Failure that ends the current export attempt. The job is marked failed with
 * {@link #getMessage()} and is only ever retried by the stuck-export sweep.
 */
public abstract class ExportProcessingException extends RuntimeException {

    protected ExportProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
