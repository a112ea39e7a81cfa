package com.cellarexport.service;

import com.cellarexport.exception.DiscoveryException;
import com.cellarexport.model.ExportState;
import com.cellarexport.model.FileQuery;
import com.cellarexport.model.FileRecord;
import com.cellarexport.model.ProcessedFile;
import com.cellarexport.repository.StorageFileRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Discovers the files of an export one page at a time and checks that their content is
 * still in R2.
 */
@Service
@Slf4j
public class ChunkDiscoveryService {

    private final StorageFileRepository fileRepository;
    private final CloudflareR2Service r2Service;
    private final Executor probeExecutor;
    private final int chunkFileLimit;
    private final long chunkSizeBytes;
    private final int probeBatchSize;

    public ChunkDiscoveryService(StorageFileRepository fileRepository,
                                 CloudflareR2Service r2Service,
                                 @Qualifier("blobProbeExecutor") Executor probeExecutor,
                                 @Value("${export.chunk.file-limit:100}") int chunkFileLimit,
                                 @Value("${export.chunk.size-bytes:52428800}") long chunkSizeBytes,
                                 @Value("${export.probe.batch-size:10}") int probeBatchSize) {
        this.fileRepository = fileRepository;
        this.r2Service = r2Service;
        this.probeExecutor = probeExecutor;
        this.chunkFileLimit = chunkFileLimit;
        this.chunkSizeBytes = chunkSizeBytes;
        this.probeBatchSize = probeBatchSize;
    }

    /**
     * Process the next page of files for an export, updating {@code state} in place.
     *
     * @return true if another chunk should be processed
     */
    public boolean processChunk(ExportState state) {
        FileQuery query = StorageFileRepository.buildQuery(
                state.getExportType(), state.getFilterParams(), state.getUserId());

        List<FileRecord> files;
        try {
            files = fileRepository.findPage(query, chunkFileLimit, state.getCurrentOffset());
        } catch (DataAccessException e) {
            throw new DiscoveryException("File query failed at offset " + state.getCurrentOffset()
                    + ": " + e.getMessage(), e);
        }

        if (files.isEmpty()) {
            return false;
        }

        int missingBefore = state.getMissingFiles().size();
        for (int i = 0; i < files.size(); i += probeBatchSize) {
            probeBatch(state, files.subList(i, Math.min(i + probeBatchSize, files.size())));
        }

        int missingNow = state.getMissingFiles().size() - missingBefore;
        if (missingNow > 0) {
            log.info("Export {}: {} of {} files missing in R2 (total missing {})",
                    state.getExportId(), missingNow, files.size(), state.getMissingFiles().size());
        }
        log.info("Export {}: chunk at offset {} returned {} files, {} processed, {} bytes so far",
                state.getExportId(), state.getCurrentOffset(), files.size(),
                state.getProcessedFiles().size(), state.getTotalSize());

        if (state.getTotalSize() >= chunkSizeBytes) {
            state.setCurrentOffset(state.getCurrentOffset() + files.size());
            return true;
        }

        if (files.size() < chunkFileLimit) {
            return false;
        }

        state.setCurrentOffset(state.getCurrentOffset() + files.size());
        return true;
    }

    /**
     * Probe every file of the batch concurrently, then record the outcomes in row order.
     */
    private void probeBatch(ExportState state, List<FileRecord> batch) {
        List<CompletableFuture<Boolean>> probes = new ArrayList<>(batch.size());
        for (FileRecord file : batch) {
            probes.add(CompletableFuture.supplyAsync(() -> probe(state.getExportId(), file), probeExecutor));
        }
        CompletableFuture.allOf(probes.toArray(new CompletableFuture[0])).join();

        for (int i = 0; i < batch.size(); i++) {
            FileRecord file = batch.get(i);
            if (probes.get(i).join()) {
                state.addProcessed(ProcessedFile.from(file));
            } else {
                state.addMissing(file.getR2Key());
            }
        }
    }

    private boolean probe(String exportId, FileRecord file) {
        try {
            return r2Service.objectExists(file.getR2Key());
        } catch (Exception e) {
            log.warn("Export {}: failed to check file {}: {}", exportId, file.getR2Key(), e.getMessage());
            return false;
        }
    }
}
