package com.cellarexport.exception;

/**
 * The finished archive could not be written to R2.
 */
public class UploadException extends ExportProcessingException {

    public UploadException(String message, Throwable cause) {
        super(message, cause);
    }
}
