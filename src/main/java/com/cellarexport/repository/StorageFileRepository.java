package com.cellarexport.repository;

import com.cellarexport.model.ExportType;
import com.cellarexport.model.FileQuery;
import com.cellarexport.model.FileRecord;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.Map;

/**
 * Paged, parameterized reads of {@code storage_files}.
 */
@Repository
public class StorageFileRepository {

    private static final String BASE_QUERY = """
            SELECT id, r2_key, filename, size_bytes, mime_type, product, category, created_at
              FROM storage_files
             WHERE user_id = :userId AND deleted_at IS NULL""";

    private static final RowMapper<FileRecord> ROW_MAPPER = (rs, n) -> {
        FileRecord f = new FileRecord();
        f.setId(rs.getString("id"));
        f.setR2Key(rs.getString("r2_key"));
        f.setFilename(rs.getString("filename"));
        f.setSizeBytes(rs.getLong("size_bytes"));
        f.setMimeType(rs.getString("mime_type"));
        f.setProduct(rs.getString("product"));
        f.setCategory(rs.getString("category"));
        Timestamp createdAt = rs.getTimestamp("created_at");
        f.setCreatedAt(createdAt == null ? null : createdAt.toInstant());
        return f;
    };

    private final NamedParameterJdbcTemplate jdbc;

    public StorageFileRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Builds the selection for one export: the owner's live files, narrowed by the export type,
     * newest first.
     */
    public static FileQuery buildQuery(ExportType exportType, Map<String, String> filters, String userId) {
        StringBuilder sql = new StringBuilder(BASE_QUERY);
        MapSqlParameterSource params = new MapSqlParameterSource("userId", userId);
        exportType.appendFilter(sql, params, filters);
        sql.append(" ORDER BY created_at DESC, id DESC");
        return new FileQuery(sql.toString(), params);
    }

    public List<FileRecord> findPage(FileQuery query, int limit, long offset) {
        MapSqlParameterSource params = new MapSqlParameterSource(query.getParams().getValues())
                .addValue("limit", limit)
                .addValue("offset", offset);
        return jdbc.query(query.getSql() + " LIMIT :limit OFFSET :offset", params, ROW_MAPPER);
    }
}
