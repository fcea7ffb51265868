package com.williamcallahan.shelf_scan.repository;

import com.williamcallahan.shelf_scan.config.RatingStoreProperties;
import com.williamcallahan.shelf_scan.model.ReadingListEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.util.List;

import static com.williamcallahan.shelf_scan.testutil.BookFixtures.entry;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JdbcReadingListStoreTest {

    @Mock
    private NamedParameterJdbcTemplate jdbcTemplate;

    @Test
    @SuppressWarnings("unchecked")
    void findByUserId_queriesConfiguredTable() {
        RatingStoreProperties properties = new RatingStoreProperties();
        properties.setReadingListTable("shelves.reading_list");
        JdbcReadingListStore store = new JdbcReadingListStore(jdbcTemplate, properties);
        List<ReadingListEntry> rows = List.of(entry("Dune", "Frank Herbert", null, null, "read"));
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<MapSqlParameterSource> params = ArgumentCaptor.forClass(MapSqlParameterSource.class);
        when(jdbcTemplate.query(sql.capture(), params.capture(), any(RowMapper.class))).thenReturn(rows);

        assertEquals(rows, store.findByUserId("user-42"));
        assertTrue(sql.getValue().endsWith("FROM shelves.reading_list WHERE user_id = :userId"));
        assertEquals("user-42", params.getValue().getValue("userId"));
    }

    @Test
    void findByUserId_blankUserSkipsQuery() {
        JdbcReadingListStore store = new JdbcReadingListStore(jdbcTemplate, new RatingStoreProperties());

        assertTrue(store.findByUserId(" ").isEmpty());
        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    void rejectsUnsafeTableName() {
        RatingStoreProperties properties = new RatingStoreProperties();
        properties.setReadingListTable("reading_list; DROP TABLE users");

        assertThrows(IllegalArgumentException.class, () -> new JdbcReadingListStore(jdbcTemplate, properties));
    }
}
