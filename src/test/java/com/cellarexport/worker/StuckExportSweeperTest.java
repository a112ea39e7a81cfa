package com.cellarexport.worker;

import com.cellarexport.model.ExportJob;
import com.cellarexport.model.ExportStatus;
import com.cellarexport.repository.ExportJobRepository;
import com.cellarexport.service.ExportJobService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StuckExportSweeperTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private ExportJobRepository jobRepository;

    @Mock
    private ExportJobService exportJobService;

    private StuckExportSweeper sweeper;

    @BeforeEach
    void setup() {
        sweeper = new StuckExportSweeper(jobRepository, exportJobService, Clock.fixed(NOW, ZoneOffset.UTC),
                120_000, 3, 50);
    }

    @Test
    void queriesWithThresholdAndRestartsEveryStuckJob() {
        when(jobRepository.findStuck(NOW.minus(Duration.ofMinutes(2)), 3, 50))
                .thenReturn(List.of(job("e1"), job("e2")));
        when(exportJobService.restartIfStuck(anyString())).thenReturn(CompletableFuture.completedFuture(null));

        sweeper.recoverStuckExports();

        verify(exportJobService).restartIfStuck("e1");
        verify(exportJobService).restartIfStuck("e2");
    }

    @Test
    void oneBadJobDoesNotStopTheSweep() {
        when(jobRepository.findStuck(NOW.minus(Duration.ofMinutes(2)), 3, 50))
                .thenReturn(List.of(job("e1"), job("e2")));
        when(exportJobService.restartIfStuck("e1")).thenThrow(new IllegalStateException("rejected"));
        when(exportJobService.restartIfStuck("e2")).thenReturn(CompletableFuture.completedFuture(null));

        sweeper.recoverStuckExports();

        verify(exportJobService).restartIfStuck("e2");
    }

    @Test
    void nothingStuckNothingRestarted() {
        when(jobRepository.findStuck(NOW.minus(Duration.ofMinutes(2)), 3, 50)).thenReturn(List.of());

        sweeper.recoverStuckExports();

        verifyNoInteractions(exportJobService);
    }

    private static ExportJob job(String id) {
        return ExportJob.builder().id(id).status(ExportStatus.PROCESSING).attempts(1).build();
    }
}
