package com.williamcallahan.shelf_scan.util;

import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Shared JDBC helper methods for retrieving optional values without repeating
 * boilerplate across repositories.
 */
public final class JdbcUtils {

    private static final Pattern SQL_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private JdbcUtils() {
    }

    /**
     * Validates a configured table name before it is concatenated into SQL.
     *
     * @throws IllegalArgumentException when the name is not a plain (optionally schema-qualified) identifier
     */
    public static String requireSqlIdentifier(String name) {
        if (name == null || !SQL_IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Not a valid SQL identifier: " + name);
        }
        return name;
    }

    /**
     * Query for a single object with a RowMapper, returning Optional.
     * Data access exceptions propagate so callers can decide whether to retry.
     */
    public static <T> Optional<T> queryForOptionalObject(NamedParameterJdbcTemplate jdbc,
                                                         String sql,
                                                         MapSqlParameterSource params,
                                                         RowMapper<T> rowMapper) {
        List<T> results = jdbc.query(sql, params, rowMapper);
        return results.isEmpty() ? Optional.empty() : Optional.ofNullable(results.get(0));
    }

    /**
     * Reads a nullable integer column, mapping SQL NULL to {@code null}.
     */
    public static Integer nullableInt(java.sql.ResultSet rs, String column) throws java.sql.SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }
}
