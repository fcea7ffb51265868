package com.williamcallahan.shelf_scan.model;

import java.util.Optional;

/**
 * Result of resolving one {@link BookQuery}: either a merged book or an explicit not-found.
 */
public record ResolutionOutcome(BookQuery query, MergedBook book) {

    public static ResolutionOutcome found(BookQuery query, MergedBook book) {
        return new ResolutionOutcome(query, book);
    }

    public static ResolutionOutcome notFound(BookQuery query) {
        return new ResolutionOutcome(query, null);
    }

    public boolean isFound() {
        return book != null;
    }

    public Optional<MergedBook> asOptional() {
        return Optional.ofNullable(book);
    }
}
