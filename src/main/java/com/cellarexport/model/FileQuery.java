package com.cellarexport.model;

import lombok.Value;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

/**
 * Parameterized file selection for one export, without paging.
 */
@Value
public class FileQuery {
    String sql;
    MapSqlParameterSource params;
}
