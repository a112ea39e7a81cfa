package com.cellarexport.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Row of {@code storage_files}. Read-only from the exporter's point of view.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileRecord {
    private String id;
    private String r2Key;
    private String filename;
    private long sizeBytes;
    private String mimeType;
    private String product;
    private String category;
    private Instant createdAt;
}
