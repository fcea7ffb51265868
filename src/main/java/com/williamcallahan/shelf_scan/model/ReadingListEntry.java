package com.williamcallahan.shelf_scan.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Read-only row of a user's reading list, owned by the reading-list store.
 */
public record ReadingListEntry(
    String title,
    String author,
    String isbn,
    String isbn13,
    @JsonProperty("exclusive_shelf") String exclusiveShelf,
    @JsonProperty("my_rating") Integer myRating,
    @JsonProperty("date_read") String dateRead,
    @JsonProperty("date_added") String dateAdded
) {
}
