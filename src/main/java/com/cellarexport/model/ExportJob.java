package com.cellarexport.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExportJob {
    private String id;
    private String userId;
    private ExportType exportType;
    private Map<String, String> filterParams; // null when the export has no filters
    private ExportStatus status;
    private String r2Key; // set only once completed
    private Integer fileCount;
    private Long sizeBytes;
    private Instant expiresAt;
    private String errorMessage; // set only once failed
    private int attempts;
    private Instant createdAt;
    private Instant updatedAt;
}
