package com.williamcallahan.shelf_scan.repository;

import com.williamcallahan.shelf_scan.model.ReadingListEntry;

import java.util.Collections;
import java.util.List;

/**
 * Store used when no database is configured; every user has an empty list.
 */
public class EmptyReadingListStore implements ReadingListStore {

    @Override
    public List<ReadingListEntry> findByUserId(String userId) {
        return Collections.emptyList();
    }
}
