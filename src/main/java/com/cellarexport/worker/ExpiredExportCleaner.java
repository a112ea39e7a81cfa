package com.cellarexport.worker;

import com.cellarexport.model.ExportJob;
import com.cellarexport.repository.ExportJobRepository;
import com.cellarexport.service.CloudflareR2Service;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Daily removal of export archives past their retention window, together with their job
 * records.
 */
@Component
@Slf4j
public class ExpiredExportCleaner {

    private final ExportJobRepository jobRepository;
    private final CloudflareR2Service r2Service;
    private final Clock clock;
    private final int batchSize;

    public ExpiredExportCleaner(ExportJobRepository jobRepository,
                                CloudflareR2Service r2Service,
                                Clock clock,
                                @Value("${export.cleanup.batch-size:500}") int batchSize) {
        this.jobRepository = jobRepository;
        this.r2Service = r2Service;
        this.clock = clock;
        this.batchSize = batchSize;
    }

    @Scheduled(cron = "${export.cleanup.cron:0 0 3 * * *}", zone = "UTC")
    public void cleanupExpiredExports() {
        List<ExportJob> expired = jobRepository.findExpired(clock.instant(), batchSize);
        if (expired.isEmpty()) {
            return;
        }

        log.info("Cleaning up {} expired exports", expired.size());
        int removed = 0;
        for (ExportJob job : expired) {
            try {
                // archive first so a failed delete leaves the record for the next run
                r2Service.deleteObject(job.getR2Key());
                jobRepository.delete(job.getId());
                removed++;
            } catch (Exception e) {
                log.error("Failed to clean up expired export {}, will retry next run", job.getId(), e);
            }
        }
        log.info("Removed {} of {} expired exports", removed, expired.size());
    }
}
