package com.cellarexport.service;

import com.cellarexport.exception.ArchiveException;
import com.cellarexport.exception.UploadException;
import com.cellarexport.model.ExportState;
import com.cellarexport.repository.ExportJobRepository;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the archive of a fully discovered export, uploads it to R2 and marks the job
 * completed.
 */
@Service
@Slf4j
public class ExportFinalizer {

    static final String CONTENT_TYPE = "application/zip";

    private final ZipArchiveBuilder archiveBuilder;
    private final CloudflareR2Service r2Service;
    private final ExportJobRepository jobRepository;
    private final Clock clock;
    private final int partSizeBytes;
    private final Duration retention;

    public ExportFinalizer(ZipArchiveBuilder archiveBuilder,
                           CloudflareR2Service r2Service,
                           ExportJobRepository jobRepository,
                           Clock clock,
                           @Value("${export.upload.part-size-bytes:8388608}") int partSizeBytes,
                           @Value("${export.retention-days:7}") int retentionDays) {
        this.archiveBuilder = archiveBuilder;
        this.r2Service = r2Service;
        this.jobRepository = jobRepository;
        this.clock = clock;
        this.partSizeBytes = partSizeBytes;
        this.retention = Duration.ofDays(retentionDays);
    }

    public void finalizeExport(ExportState state) {
        log.info("Export {}: finalizing, creating ZIP with {} files", state.getExportId(),
                state.getProcessedFiles().size());

        long archiveBytes;
        try (ArchiveStream archive = archiveBuilder.open(state)) {
            archiveBytes = upload(state, archive);
        } catch (IOException e) {
            throw new ArchiveException("Failed to read archive for export " + state.getExportId()
                    + ": " + e.getMessage(), e);
        }

        Instant now = clock.instant();
        jobRepository.markCompleted(state.getExportId(), state.getR2Key(),
                state.getProcessedFiles().size(), state.getTotalSize(), now.plus(retention), now);

        log.info("Export {} completed: {} files, {} bytes, archive {} ({} bytes)", state.getExportId(),
                state.getProcessedFiles().size(), state.getTotalSize(), state.getR2Key(), archiveBytes);
    }

    /**
     * Drain the archive part by part. One part or less goes up as a single object, anything
     * larger as a multipart upload. The writer's outcome is checked before the object is
     * committed, so a truncated archive is never stored.
     */
    private long upload(ExportState state, ArchiveStream archive) throws IOException {
        Map<String, String> metadata = metadata(state);
        byte[] part = new byte[partSizeBytes];

        int read = IOUtils.read(archive, part);
        if (read < partSizeBytes) {
            archive.awaitCompletion();
            byte[] data = Arrays.copyOf(part, read);
            try {
                r2Service.putObject(state.getR2Key(), data, CONTENT_TYPE, metadata);
            } catch (RuntimeException e) {
                throw new UploadException("Failed to upload archive " + state.getR2Key() + ": " + e.getMessage(), e);
            }
            return read;
        }

        String uploadId;
        try {
            uploadId = r2Service.createMultipartUpload(state.getR2Key(), CONTENT_TYPE, metadata);
        } catch (RuntimeException e) {
            throw new UploadException("Failed to start upload of " + state.getR2Key() + ": " + e.getMessage(), e);
        }

        long total = 0;
        List<String> eTags = new ArrayList<>();
        try {
            while (read > 0) {
                eTags.add(uploadPart(state, uploadId, eTags.size() + 1, part, read));
                total += read;
                read = IOUtils.read(archive, part);
            }
            archive.awaitCompletion();
            r2Service.completeMultipartUpload(state.getR2Key(), uploadId, eTags);
            return total;
        } catch (IOException | RuntimeException e) {
            abortQuietly(state.getR2Key(), uploadId);
            throw e;
        }
    }

    private String uploadPart(ExportState state, String uploadId, int partNumber, byte[] part, int length) {
        try {
            return r2Service.uploadPart(state.getR2Key(), uploadId, partNumber, part, length);
        } catch (RuntimeException e) {
            throw new UploadException("Failed to upload part " + partNumber + " of " + state.getR2Key()
                    + ": " + e.getMessage(), e);
        }
    }

    private void abortQuietly(String objectKey, String uploadId) {
        try {
            r2Service.abortMultipartUpload(objectKey, uploadId);
        } catch (RuntimeException e) {
            log.warn("Could not abort multipart upload {} of {}: {}", uploadId, objectKey, e.getMessage());
        }
    }

    static Map<String, String> metadata(ExportState state) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("export-id", state.getExportId());
        metadata.put("user-id", state.getUserId());
        metadata.put("export-type", state.getExportType().getValue());
        metadata.put("file-count", String.valueOf(state.getProcessedFiles().size()));
        metadata.put("total-size", String.valueOf(state.getTotalSize()));
        return metadata;
    }
}
