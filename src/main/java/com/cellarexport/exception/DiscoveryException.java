package com.cellarexport.exception;

/**
 * The paginated file query could not be executed.
 */
public class DiscoveryException extends ExportProcessingException {

    public DiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
