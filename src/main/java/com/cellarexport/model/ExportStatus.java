package com.cellarexport.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of an export job as stored in {@code storage_exports.status}.
 */
public enum ExportStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    ExportStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public static ExportStatus fromValue(String value) {
        for (ExportStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown export status: " + value);
    }
}
