package com.williamcallahan.shelf_scan.model;

/**
 * Shelf and personal rating metadata copied from the matched reading-list entry.
 */
public record ReadingListMatch(String shelf, Integer myRating, String dateRead, String dateAdded) {

    public static ReadingListMatch from(ReadingListEntry entry) {
        return new ReadingListMatch(entry.exclusiveShelf(), entry.myRating(), entry.dateRead(), entry.dateAdded());
    }
}
