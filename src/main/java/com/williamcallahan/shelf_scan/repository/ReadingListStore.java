package com.williamcallahan.shelf_scan.repository;

import com.williamcallahan.shelf_scan.model.ReadingListEntry;

import java.util.List;

/**
 * Read-only access to a user's reading list. The user id is an opaque key issued
 * by the session layer.
 */
public interface ReadingListStore {

    /**
     * @return every entry on the user's list, empty when the user has none
     */
    List<ReadingListEntry> findByUserId(String userId);
}
