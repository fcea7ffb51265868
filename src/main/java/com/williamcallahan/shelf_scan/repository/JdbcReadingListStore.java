package com.williamcallahan.shelf_scan.repository;

import com.williamcallahan.shelf_scan.config.RatingStoreProperties;
import com.williamcallahan.shelf_scan.model.ReadingListEntry;
import com.williamcallahan.shelf_scan.util.JdbcUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Reads imported reading-list rows from the same database as the rating store.
 * Data access exceptions propagate; callers decide how to degrade.
 */
@Repository
@ConditionalOnExpression("'${app.rating-store.url:}'.length() > 0")
public class JdbcReadingListStore implements ReadingListStore {

    private static final RowMapper<ReadingListEntry> ROW_MAPPER = (rs, rowNum) -> new ReadingListEntry(
        rs.getString("title"),
        rs.getString("author"),
        rs.getString("isbn"),
        rs.getString("isbn13"),
        rs.getString("exclusive_shelf"),
        JdbcUtils.nullableInt(rs, "my_rating"),
        rs.getString("date_read"),
        rs.getString("date_added")
    );

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final String sql;

    public JdbcReadingListStore(@Qualifier("ratingStoreJdbcTemplate") NamedParameterJdbcTemplate ratingStoreJdbcTemplate, RatingStoreProperties properties) {
        this.jdbcTemplate = ratingStoreJdbcTemplate;
        this.sql = "SELECT title, author, isbn, isbn13, exclusive_shelf, my_rating, date_read, date_added FROM "
            + JdbcUtils.requireSqlIdentifier(properties.getReadingListTable()) + " WHERE user_id = :userId";
    }

    @Override
    public List<ReadingListEntry> findByUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            return List.of();
        }
        return jdbcTemplate.query(sql, new MapSqlParameterSource("userId", userId), ROW_MAPPER);
    }
}
