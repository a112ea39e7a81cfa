package com.cellarexport.worker;

import com.cellarexport.model.ExportJob;
import com.cellarexport.repository.ExportJobRepository;
import com.cellarexport.service.ExportJobService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Recovery task: finds exports whose mailbox has gone quiet (never started, stalled between
 * alarms, lost with a restarted node, or failed with attempts left) and restarts them from
 * the first chunk.
 */
@Component
@Slf4j
public class StuckExportSweeper {

    private final ExportJobRepository jobRepository;
    private final ExportJobService exportJobService;
    private final Clock clock;
    private final Duration stuckThreshold;
    private final int maxAttempts;
    private final int batchSize;

    public StuckExportSweeper(ExportJobRepository jobRepository,
                              ExportJobService exportJobService,
                              Clock clock,
                              @Value("${export.sweep.stuck-threshold-ms:120000}") long stuckThresholdMs,
                              @Value("${export.sweep.max-attempts:3}") int maxAttempts,
                              @Value("${export.sweep.batch-size:50}") int batchSize) {
        this.jobRepository = jobRepository;
        this.exportJobService = exportJobService;
        this.clock = clock;
        this.stuckThreshold = Duration.ofMillis(stuckThresholdMs);
        this.maxAttempts = maxAttempts;
        this.batchSize = batchSize;
    }

    @Scheduled(fixedDelayString = "${export.sweep.interval-ms:60000}",
            initialDelayString = "${export.sweep.initial-delay-ms:30000}")
    public void recoverStuckExports() {
        Instant idleBefore = clock.instant().minus(stuckThreshold);
        List<ExportJob> stuckJobs = jobRepository.findStuck(idleBefore, maxAttempts, batchSize);

        if (stuckJobs.isEmpty()) {
            return;
        }

        log.info("Found {} stuck exports idle since before {}. Restarting them.", stuckJobs.size(), idleBefore);
        for (ExportJob job : stuckJobs) {
            try {
                exportJobService.restartIfStuck(job.getId());
            } catch (Exception e) {
                log.error("Failed to schedule restart of export {}", job.getId(), e);
            }
        }
    }
}
