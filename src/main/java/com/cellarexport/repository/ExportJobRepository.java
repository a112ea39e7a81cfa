package com.cellarexport.repository;

import com.cellarexport.exception.MalformedExportException;
import com.cellarexport.model.ExportJob;
import com.cellarexport.model.ExportStatus;
import com.cellarexport.model.ExportType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC repository for the {@code storage_exports} table.
 */
@Repository
@Slf4j
public class ExportJobRepository {

    private static final TypeReference<Map<String, String>> FILTER_TYPE = new TypeReference<>() {};

    private static final String COLUMNS = """
            id, user_id, export_type, filter_params, status, r2_key, file_count, size_bytes,
            expires_at, error_message, attempts, created_at, updated_at
            """;

    /**
     * Lifecycle columns only. Selections that scan many rows use these, so one row with an
     * unreadable export type or filter cannot break the whole result.
     */
    private static final String SUMMARY_COLUMNS = """
            id, user_id, status, r2_key, expires_at, attempts, created_at, updated_at
            """;

    private final JdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final RowMapper<ExportJob> rowMapper = this::mapRow;
    private final RowMapper<ExportJob> summaryMapper = ExportJobRepository::mapSummary;

    public ExportJobRepository(JdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    /**
     * @throws MalformedExportException if the row's export type or filters cannot be read
     */
    public Optional<ExportJob> findById(String id) {
        List<ExportJob> rows = jdbc.query(
                "SELECT " + COLUMNS + " FROM storage_exports WHERE id = ?", rowMapper, id);
        return rows.stream().findFirst();
    }

    /**
     * Lifecycle view of a job: export type and filters are left unset.
     */
    public Optional<ExportJob> findSummary(String id) {
        List<ExportJob> rows = jdbc.query(
                "SELECT " + SUMMARY_COLUMNS + " FROM storage_exports WHERE id = ?", summaryMapper, id);
        return rows.stream().findFirst();
    }

    /**
     * Jobs the sweep should restart: pending jobs nobody picked up, processing jobs whose
     * heartbeat went quiet, and failed jobs that still have attempts left. All of them must
     * have been idle since {@code idleBefore}. Rows come back as summaries.
     */
    public List<ExportJob> findStuck(Instant idleBefore, int maxAttempts, int limit) {
        Timestamp threshold = Timestamp.from(idleBefore);
        return jdbc.query("SELECT " + SUMMARY_COLUMNS + """
                  FROM storage_exports
                 WHERE (status = 'pending' AND created_at < ?)
                    OR (status = 'processing' AND r2_key IS NULL AND updated_at < ?)
                    OR (status = 'failed' AND attempts < ? AND updated_at < ?)
                 ORDER BY created_at
                 LIMIT ?
                """, summaryMapper, threshold, threshold, maxAttempts, threshold, limit);
    }

    public List<ExportJob> findExpired(Instant now, int limit) {
        return jdbc.query("SELECT " + SUMMARY_COLUMNS + """
                  FROM storage_exports
                 WHERE status = 'completed' AND expires_at < ?
                 ORDER BY expires_at
                 LIMIT ?
                """, summaryMapper, Timestamp.from(now), limit);
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    /**
     * Starts a new attempt. Clears whatever a previous attempt left behind so the record never
     * carries both result and failure fields.
     */
    public void markProcessing(String id, Instant now) {
        jdbc.update("""
                UPDATE storage_exports
                   SET status = 'processing', attempts = attempts + 1, error_message = NULL,
                       r2_key = NULL, file_count = NULL, size_bytes = NULL, expires_at = NULL,
                       updated_at = ?
                 WHERE id = ?
                """, Timestamp.from(now), id);
    }

    /**
     * Heartbeat for a job that is still being driven.
     */
    public void touch(String id, Instant now) {
        jdbc.update("UPDATE storage_exports SET updated_at = ? WHERE id = ? AND status = 'processing'",
                Timestamp.from(now), id);
    }

    public void markCompleted(String id, String r2Key, int fileCount, long sizeBytes,
                              Instant expiresAt, Instant now) {
        jdbc.update("""
                UPDATE storage_exports
                   SET status = 'completed', r2_key = ?, file_count = ?, size_bytes = ?,
                       expires_at = ?, error_message = NULL, updated_at = ?
                 WHERE id = ?
                """, r2Key, fileCount, sizeBytes, Timestamp.from(expiresAt), Timestamp.from(now), id);
    }

    public void markFailed(String id, String errorMessage, Instant now) {
        jdbc.update("""
                UPDATE storage_exports
                   SET status = 'failed', error_message = ?, r2_key = NULL, file_count = NULL,
                       size_bytes = NULL, expires_at = NULL, updated_at = ?
                 WHERE id = ?
                """, errorMessage, Timestamp.from(now), id);
    }

    public void delete(String id) {
        jdbc.update("DELETE FROM storage_exports WHERE id = ?", id);
    }

    // ------------------------------------------------------------------
    // Mapping
    // ------------------------------------------------------------------

    private ExportJob mapRow(ResultSet rs, int rowNum) throws SQLException {
        ExportJob job = mapSummary(rs, rowNum);
        job.setExportType(parseType(job.getId(), rs.getString("export_type")));
        job.setFilterParams(parseFilters(job.getId(), rs.getString("filter_params")));
        int fileCount = rs.getInt("file_count");
        job.setFileCount(rs.wasNull() ? null : fileCount);
        long sizeBytes = rs.getLong("size_bytes");
        job.setSizeBytes(rs.wasNull() ? null : sizeBytes);
        job.setErrorMessage(rs.getString("error_message"));
        return job;
    }

    private static ExportJob mapSummary(ResultSet rs, int rowNum) throws SQLException {
        ExportJob job = new ExportJob();
        job.setId(rs.getString("id"));
        job.setUserId(rs.getString("user_id"));
        job.setStatus(ExportStatus.fromValue(rs.getString("status")));
        job.setR2Key(rs.getString("r2_key"));
        job.setExpiresAt(toInstant(rs.getTimestamp("expires_at")));
        job.setAttempts(rs.getInt("attempts"));
        job.setCreatedAt(toInstant(rs.getTimestamp("created_at")));
        job.setUpdatedAt(toInstant(rs.getTimestamp("updated_at")));
        return job;
    }

    private static ExportType parseType(String exportId, String value) {
        try {
            return ExportType.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new MalformedExportException("Unknown export type '" + value + "' on export " + exportId, e);
        }
    }

    private Map<String, String> parseFilters(String exportId, String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, FILTER_TYPE);
        } catch (JsonProcessingException e) {
            throw new MalformedExportException("Malformed filter_params on export " + exportId, e);
        }
    }

    private static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
