package com.cellarexport.model;

import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

import java.util.Map;

/**
 * Kind of export requested. Each kind contributes its own restriction to the file query;
 * every value is bound as a parameter, never spliced into the SQL text.
 */
public enum ExportType {

    FULL("full") {
        @Override
        public void appendFilter(StringBuilder sql, MapSqlParameterSource params, Map<String, String> filters) {
            // everything the user owns
        }
    },

    BLOG("blog") {
        @Override
        public void appendFilter(StringBuilder sql, MapSqlParameterSource params, Map<String, String> filters) {
            sql.append(" AND product = :product");
            params.addValue("product", "blog");
        }
    },

    IVY("ivy") {
        @Override
        public void appendFilter(StringBuilder sql, MapSqlParameterSource params, Map<String, String> filters) {
            sql.append(" AND product = :product");
            params.addValue("product", "ivy");
        }
    },

    CATEGORY("category") {
        @Override
        public void appendFilter(StringBuilder sql, MapSqlParameterSource params, Map<String, String> filters) {
            String category = filters != null ? filters.get(CATEGORY_FILTER) : null;
            if (category != null && !category.isBlank()) {
                sql.append(" AND category = :category");
                params.addValue("category", category);
            }
        }
    };

    public static final String CATEGORY_FILTER = "category";

    private final String value;

    ExportType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public abstract void appendFilter(StringBuilder sql, MapSqlParameterSource params, Map<String, String> filters);

    public static ExportType fromValue(String value) {
        for (ExportType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown export type: " + value);
    }
}
