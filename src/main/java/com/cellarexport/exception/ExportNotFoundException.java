package com.cellarexport.exception;

public class ExportNotFoundException extends RuntimeException {

    public ExportNotFoundException(String exportId) {
        super("Export " + exportId + " not found");
    }
}
