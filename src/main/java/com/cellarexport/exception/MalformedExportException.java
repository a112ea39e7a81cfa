package com.cellarexport.exception;

/**
 * A {@code storage_exports} row whose export type or filters cannot be read.
 */
public class MalformedExportException extends RuntimeException {

    public MalformedExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
