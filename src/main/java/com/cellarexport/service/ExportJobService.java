package com.cellarexport.service;

import com.cellarexport.exception.DiscoveryException;
import com.cellarexport.exception.ExportBusyException;
import com.cellarexport.exception.ExportNotFoundException;
import com.cellarexport.exception.MalformedExportException;
import com.cellarexport.model.ExportJob;
import com.cellarexport.model.ExportState;
import com.cellarexport.model.ExportStatus;
import com.cellarexport.queue.ExportJobQueue;
import com.cellarexport.repository.ExportJobRepository;
import com.cellarexport.repository.ExportStateRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives one export from start to a terminal status.
 * <p>
 * {@link #start} and {@link #onAlarm} must only run on the export's mailbox in
 * {@link ExportJobQueue}; {@link #trigger} and {@link #restartIfStuck} take care of that.
 * Nothing is kept in memory between alarms: every alarm reloads the persisted
 * {@link ExportState} before touching it.
 */
@Service
@Slf4j
public class ExportJobService {

    private static final int MAX_ERROR_LENGTH = 2000;

    private final ExportJobRepository jobRepository;
    private final ExportStateRepository stateRepository;
    private final ChunkDiscoveryService discoveryService;
    private final ExportFinalizer finalizer;
    private final ExportJobQueue queue;
    private final Clock clock;
    private final Duration initialDelay;
    private final Duration chunkDelay;
    private final int maxAttempts;
    private final Duration triggerTimeout;

    public ExportJobService(ExportJobRepository jobRepository,
                            ExportStateRepository stateRepository,
                            ChunkDiscoveryService discoveryService,
                            ExportFinalizer finalizer,
                            ExportJobQueue queue,
                            Clock clock,
                            @Value("${export.alarm.initial-delay-ms:1000}") long initialDelayMs,
                            @Value("${export.alarm.chunk-delay-ms:2000}") long chunkDelayMs,
                            @Value("${export.sweep.max-attempts:3}") int maxAttempts,
                            @Value("${export.trigger.timeout-ms:10000}") long triggerTimeoutMs) {
        this.jobRepository = jobRepository;
        this.stateRepository = stateRepository;
        this.discoveryService = discoveryService;
        this.finalizer = finalizer;
        this.queue = queue;
        this.clock = clock;
        this.initialDelay = Duration.ofMillis(initialDelayMs);
        this.chunkDelay = Duration.ofMillis(chunkDelayMs);
        this.maxAttempts = maxAttempts;
        this.triggerTimeout = Duration.ofMillis(triggerTimeoutMs);
    }

    /**
     * Start an export on its mailbox and wait until the first alarm is armed.
     *
     * @throws ExportNotFoundException if no such export exists
     * @throws ExportBusyException if the export's mailbox is already working, or the start did
     *                             not run within the trigger timeout (it then stays queued)
     */
    public void trigger(String exportId) {
        if (queue.isBusy(exportId)) {
            throw new ExportBusyException("Export " + exportId + " is busy, try again later");
        }
        try {
            queue.submit(exportId, () -> start(exportId))
                    .get(triggerTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("Failed to start export " + exportId, e.getCause());
        } catch (TimeoutException e) {
            throw new ExportBusyException("Export " + exportId + " did not start within "
                    + triggerTimeout.toMillis() + " ms; the start stays queued");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while starting export " + exportId, e);
        }
    }

    /**
     * Begin a new attempt: fresh state from offset 0, job marked processing, first alarm armed.
     * Replaces any state a previous attempt left behind. A record whose type or filters cannot
     * be read uses up the attempt and ends {@code failed}.
     */
    public void start(String exportId) {
        log.info("Starting export {}", exportId);
        Instant now = clock.instant();
        ExportJob job;
        try {
            job = jobRepository.findById(exportId)
                    .orElseThrow(() -> new ExportNotFoundException(exportId));
        } catch (MalformedExportException e) {
            jobRepository.markProcessing(exportId, now);
            fail(exportId, e);
            throw new DiscoveryException(e.getMessage(), e);
        }

        ExportState state = ExportState.start(job, now);
        stateRepository.save(state);

        jobRepository.markProcessing(exportId, now);
        log.info("Export {} ({}, user {}) is processing; archive will be written to {}",
                exportId, job.getExportType().getValue(), job.getUserId(), state.getR2Key());

        queue.setAlarm(exportId, initialDelay, () -> onAlarm(exportId));
    }

    /**
     * Alarm handler: process one chunk, then either re-arm or finalize.
     */
    public void onAlarm(String exportId) {
        Optional<ExportState> loaded;
        try {
            loaded = stateRepository.find(exportId);
        } catch (IllegalStateException e) {
            fail(exportId, e);
            return;
        }
        if (loaded.isEmpty()) {
            log.warn("Alarm for export {} without export state, ignoring", exportId);
            return;
        }

        ExportState state = loaded.get();
        log.info("Processing chunk for export {} at offset {}", exportId, state.getCurrentOffset());

        try {
            boolean hasMoreChunks = discoveryService.processChunk(state);
            stateRepository.save(state);
            jobRepository.touch(exportId, clock.instant());

            if (hasMoreChunks) {
                queue.setAlarm(exportId, chunkDelay, () -> onAlarm(exportId));
                return;
            }

            finalizer.finalizeExport(state);
            stateRepository.delete(exportId);
        } catch (Exception e) {
            fail(exportId, e);
        }
    }

    /**
     * Sweep entry point. Re-checks the job on its mailbox, because it may have finished between
     * the sweep's query and now, and restarts it otherwise.
     */
    public CompletableFuture<Void> restartIfStuck(String exportId) {
        CompletableFuture<Void> restart = queue.submit(exportId, () -> {
            Optional<ExportJob> job = jobRepository.findSummary(exportId);
            if (job.isEmpty()) {
                log.info("Export {} disappeared before restart, skipping", exportId);
                return;
            }
            ExportStatus status = job.get().getStatus();
            if (status == ExportStatus.COMPLETED) {
                log.info("Export {} completed before restart, skipping", exportId);
                return;
            }
            if (status == ExportStatus.FAILED && job.get().getAttempts() >= maxAttempts) {
                log.info("Export {} has no attempts left, leaving it failed", exportId);
                return;
            }
            log.info("Restarting stuck export {} (status {}, attempt {})", exportId, status.getValue(),
                    job.get().getAttempts() + 1);
            start(exportId);
        });
        restart.whenComplete((ignored, ex) -> {
            if (ex != null) {
                log.error("Failed to restart export {}", exportId, ex);
            }
        });
        return restart;
    }

    private void fail(String exportId, Exception error) {
        log.error("Export {} failed", exportId, error);
        queue.cancelAlarm(exportId);
        try {
            jobRepository.markFailed(exportId, errorMessage(error), clock.instant());
        } finally {
            stateRepository.delete(exportId);
        }
    }

    private static String errorMessage(Exception error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }
}
