package com.cellarexport.exception;

/**
 * Writing or draining the ZIP stream failed.
 */
public class ArchiveException extends ExportProcessingException {

    public ArchiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
