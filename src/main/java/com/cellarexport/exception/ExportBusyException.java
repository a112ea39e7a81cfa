package com.cellarexport.exception;

/**
 * A start request arrived while the export's mailbox was still working.
 */
public class ExportBusyException extends RuntimeException {

    public ExportBusyException(String message) {
        super(message);
    }
}
