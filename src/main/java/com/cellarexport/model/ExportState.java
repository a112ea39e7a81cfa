package com.cellarexport.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Working set of one in-flight export. Serialized after every alarm so processing can resume
 * on any node; deleted as soon as the job reaches a terminal status.
 */
@Data
@NoArgsConstructor
public class ExportState {
    private String exportId;
    private String userId;
    private ExportType exportType;
    private Map<String, String> filterParams;
    private long currentOffset;
    private List<ProcessedFile> processedFiles = new ArrayList<>();
    private List<String> missingFiles = new ArrayList<>();
    private long totalSize;
    private String r2Key;
    private Instant createdAt;

    public static ExportState start(ExportJob job, Instant now) {
        ExportState state = new ExportState();
        state.setExportId(job.getId());
        state.setUserId(job.getUserId());
        state.setExportType(job.getExportType());
        state.setFilterParams(job.getFilterParams());
        state.setR2Key(archiveKey(job.getUserId(), job.getId(), now));
        state.setCreatedAt(now);
        return state;
    }

    /**
     * Target object key of the archive. The millisecond timestamp keeps restarted attempts from
     * overwriting each other.
     */
    public static String archiveKey(String userId, String exportId, Instant now) {
        return "exports/" + userId + "/" + exportId + "/" + now.toEpochMilli() + "-export.zip";
    }

    public void addProcessed(ProcessedFile file) {
        processedFiles.add(file);
        totalSize += file.getSizeBytes();
    }

    public void addMissing(String r2Key) {
        missingFiles.add(r2Key);
    }
}
