package com.cellarexport.repository;

import com.cellarexport.model.ExportState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Durable home of {@link ExportState} between alarms, one JSON document per export.
 * Writes for one export are serialized by its mailbox, so update-then-insert is safe.
 */
@Repository
public class ExportStateRepository {

    private final JdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ExportStateRepository(JdbcTemplate jdbc, ObjectMapper objectMapper, Clock clock) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void save(ExportState state) {
        String json = toJson(state);
        Timestamp now = Timestamp.from(clock.instant());
        int updated = jdbc.update(
                "UPDATE export_job_state SET state_json = ?, updated_at = ? WHERE export_id = ?",
                json, now, state.getExportId());
        if (updated == 0) {
            jdbc.update("INSERT INTO export_job_state (export_id, state_json, updated_at) VALUES (?, ?, ?)",
                    state.getExportId(), json, now);
        }
    }

    public Optional<ExportState> find(String exportId) {
        List<String> rows = jdbc.queryForList(
                "SELECT state_json FROM export_job_state WHERE export_id = ?", String.class, exportId);
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(rows.get(0), ExportState.class));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable export state for " + exportId, e);
        }
    }

    public void delete(String exportId) {
        jdbc.update("DELETE FROM export_job_state WHERE export_id = ?", exportId);
    }

    private String toJson(ExportState state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize export state for " + state.getExportId(), e);
        }
    }
}
