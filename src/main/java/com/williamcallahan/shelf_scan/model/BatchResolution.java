package com.williamcallahan.shelf_scan.model;

import java.util.List;

/**
 * Ranked result of resolving a batch of candidates.
 *
 * @param books          resolved books, best rated first
 * @param totalRequested number of candidates submitted
 * @param totalResolved  number of candidates that resolved to a book
 */
public record BatchResolution(List<MergedBook> books, int totalRequested, int totalResolved) {

    public BatchResolution {
        books = books == null ? List.of() : List.copyOf(books);
    }

    public boolean isEmpty() {
        return books.isEmpty();
    }
}
