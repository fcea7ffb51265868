package com.williamcallahan.shelf_scan.model;

import com.williamcallahan.shelf_scan.util.ValidationUtils;

import java.util.Locale;

/**
 * A loosely-identified book candidate as extracted upstream from a shelf photo.
 *
 * @param title  title as read from the spine, case preserved for display
 * @param author author as read from the spine, case preserved for display
 */
public record BookQuery(String title, String author) {

    public BookQuery {
        if (!ValidationUtils.hasText(title)) {
            throw new IllegalArgumentException("Book query title must not be blank");
        }
        if (!ValidationUtils.hasText(author)) {
            throw new IllegalArgumentException("Book query author must not be blank");
        }
        title = title.trim();
        author = author.trim();
    }

    public String normalizedTitle() {
        return title.toLowerCase(Locale.ROOT);
    }

    public String normalizedAuthor() {
        return author.toLowerCase(Locale.ROOT);
    }

    /**
     * Free-text form used by search-style providers.
     */
    public String searchText() {
        return title + " " + author;
    }
}
