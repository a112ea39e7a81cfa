package com.cellarexport.service;

import org.springframework.stereotype.Service;

import java.util.regex.Pattern;

@Service
public class ValidationService {

    private static final Pattern VALID_EXPORT_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9_\\-]+$");

    private static final int MAX_EXPORT_ID_LENGTH = 128;

    /**
     * Validates export ids before they reach SQL parameters, object keys and log lines
     */
    public void validateExportId(String exportId) {
        if (exportId == null || exportId.isEmpty()) {
            throw new IllegalArgumentException("Export ID cannot be null or empty");
        }

        if (exportId.length() > MAX_EXPORT_ID_LENGTH) {
            throw new IllegalArgumentException("Export ID exceeds maximum length");
        }

        if (!VALID_EXPORT_ID_PATTERN.matcher(exportId).matches()) {
            throw new IllegalArgumentException("Export ID contains invalid characters");
        }
    }
}
