package com.cellarexport.repository;

import com.cellarexport.exception.MalformedExportException;
import com.cellarexport.model.ExportJob;
import com.cellarexport.model.ExportStatus;
import com.cellarexport.model.ExportType;
import com.cellarexport.support.TestDatabase;
import com.cellarexport.support.TestObjects;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExportJobRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final Instant LONG_AGO = NOW.minus(Duration.ofMinutes(10));
    private static final Instant THRESHOLD = NOW.minus(Duration.ofMinutes(2));

    private TestDatabase db;
    private ExportJobRepository repository;

    @BeforeEach
    void setup() {
        db = new TestDatabase();
        repository = new ExportJobRepository(db.jdbc(), TestObjects.objectMapper());
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void readsJobWithFilters() {
        db.insertExport("e1", "alice", ExportType.CATEGORY, "{\"category\":\"images\"}",
                ExportStatus.PENDING, 0, NOW, NOW);

        ExportJob job = repository.findById("e1").orElseThrow();

        assertEquals("alice", job.getUserId());
        assertEquals(ExportType.CATEGORY, job.getExportType());
        assertEquals(Map.of("category", "images"), job.getFilterParams());
        assertEquals(ExportStatus.PENDING, job.getStatus());
        assertNull(job.getFileCount());
        assertNull(job.getSizeBytes());
        assertTrue(repository.findById("missing").isEmpty());
    }

    @Test
    void completedAndFailedNeverCarryBothResultAndError() {
        db.insertExport("e1", "alice", ExportType.FULL, null, ExportStatus.PENDING, 0, NOW, NOW);

        repository.markProcessing("e1", NOW);
        repository.markFailed("e1", "boom", NOW);
        ExportJob failed = repository.findById("e1").orElseThrow();
        assertEquals(ExportStatus.FAILED, failed.getStatus());
        assertEquals("boom", failed.getErrorMessage());
        assertNull(failed.getR2Key());
        assertEquals(1, failed.getAttempts());

        repository.markProcessing("e1", NOW);
        ExportJob retried = repository.findById("e1").orElseThrow();
        assertEquals(ExportStatus.PROCESSING, retried.getStatus());
        assertNull(retried.getErrorMessage());
        assertEquals(2, retried.getAttempts());

        Instant expiresAt = NOW.plus(Duration.ofDays(7));
        repository.markCompleted("e1", "exports/alice/e1/1-export.zip", 3, 300L, expiresAt, NOW);
        ExportJob completed = repository.findById("e1").orElseThrow();
        assertEquals(ExportStatus.COMPLETED, completed.getStatus());
        assertEquals("exports/alice/e1/1-export.zip", completed.getR2Key());
        assertEquals(3, completed.getFileCount());
        assertEquals(300L, completed.getSizeBytes());
        assertEquals(expiresAt, completed.getExpiresAt());
        assertNull(completed.getErrorMessage());
    }

    @Test
    void findsStuckJobsOnly() {
        db.insertExport("pending-old", "u", ExportType.FULL, null, ExportStatus.PENDING, 0, LONG_AGO, LONG_AGO);
        db.insertExport("pending-new", "u", ExportType.FULL, null, ExportStatus.PENDING, 0, NOW, NOW);
        db.insertExport("processing-idle", "u", ExportType.FULL, null, ExportStatus.PROCESSING, 1, LONG_AGO, LONG_AGO);
        db.insertExport("processing-busy", "u", ExportType.FULL, null, ExportStatus.PROCESSING, 1, LONG_AGO, NOW);
        db.insertExport("failed-retryable", "u", ExportType.FULL, null, ExportStatus.FAILED, 1, LONG_AGO, LONG_AGO);
        db.insertExport("failed-exhausted", "u", ExportType.FULL, null, ExportStatus.FAILED, 3, LONG_AGO, LONG_AGO);
        db.insertExport("completed", "u", ExportType.FULL, null, ExportStatus.COMPLETED, 1, LONG_AGO, LONG_AGO);

        List<String> stuck = repository.findStuck(THRESHOLD, 3, 50).stream().map(ExportJob::getId).toList();

        assertEquals(3, stuck.size());
        assertTrue(stuck.containsAll(List.of("pending-old", "processing-idle", "failed-retryable")));
    }

    @Test
    void unreadableRowDoesNotBreakStuckSelection() {
        db.insertExport("bad-filter", "u", ExportType.FULL, "{not json", ExportStatus.PENDING, 0, LONG_AGO, LONG_AGO);
        db.insertExport("good", "u", ExportType.FULL, null, ExportStatus.PENDING, 0, LONG_AGO, LONG_AGO);
        insertUnknownType("bad-type", LONG_AGO);

        List<ExportJob> stuck = repository.findStuck(THRESHOLD, 3, 50);

        assertEquals(List.of("bad-filter", "bad-type", "good"),
                stuck.stream().map(ExportJob::getId).sorted().toList());
        assertTrue(stuck.stream().allMatch(job -> job.getStatus() == ExportStatus.PENDING));
    }

    @Test
    void unreadableRowIsReportedOnFullRead() {
        db.insertExport("bad-filter", "u", ExportType.FULL, "{not json", ExportStatus.PENDING, 0, NOW, NOW);
        insertUnknownType("bad-type", NOW);

        assertThrows(MalformedExportException.class, () -> repository.findById("bad-filter"));
        MalformedExportException e = assertThrows(MalformedExportException.class,
                () -> repository.findById("bad-type"));
        assertTrue(e.getMessage().contains("video"));

        ExportJob summary = repository.findSummary("bad-filter").orElseThrow();
        assertEquals(ExportStatus.PENDING, summary.getStatus());
        assertNull(summary.getExportType());
    }

    @Test
    void touchOnlyRefreshesProcessingJobs() {
        db.insertExport("e1", "u", ExportType.FULL, null, ExportStatus.PROCESSING, 1, LONG_AGO, LONG_AGO);
        db.insertExport("e2", "u", ExportType.FULL, null, ExportStatus.FAILED, 1, LONG_AGO, LONG_AGO);

        repository.touch("e1", NOW);
        repository.touch("e2", NOW);

        assertEquals(NOW, repository.findById("e1").orElseThrow().getUpdatedAt());
        assertEquals(LONG_AGO, repository.findById("e2").orElseThrow().getUpdatedAt());
    }

    @Test
    void findsExpiredCompletedJobs() {
        db.insertExport("old", "u", ExportType.FULL, null, ExportStatus.PENDING, 0, LONG_AGO, LONG_AGO);
        db.insertExport("fresh", "u", ExportType.FULL, null, ExportStatus.PENDING, 0, LONG_AGO, LONG_AGO);
        repository.markCompleted("old", "exports/u/old/1-export.zip", 1, 1L, NOW.minusSeconds(1), LONG_AGO);
        repository.markCompleted("fresh", "exports/u/fresh/1-export.zip", 1, 1L, NOW.plusSeconds(60), LONG_AGO);

        List<ExportJob> expired = repository.findExpired(NOW, 10);

        assertEquals(List.of("old"), expired.stream().map(ExportJob::getId).toList());

        repository.delete("old");
        assertTrue(repository.findById("old").isEmpty());
    }

    private void insertUnknownType(String id, Instant at) {
        db.jdbc().update("INSERT INTO storage_exports (id, user_id, export_type, status, attempts, created_at, updated_at)"
                + " VALUES (?, 'u', 'video', 'pending', 0, ?, ?)", id, Timestamp.from(at), Timestamp.from(at));
    }
}
