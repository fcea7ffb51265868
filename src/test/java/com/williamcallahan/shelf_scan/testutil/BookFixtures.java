package com.williamcallahan.shelf_scan.testutil;

import com.williamcallahan.shelf_scan.model.MergedBook;
import com.williamcallahan.shelf_scan.model.ProviderRecord;
import com.williamcallahan.shelf_scan.model.ProviderSource;
import com.williamcallahan.shelf_scan.model.ReadingListEntry;

import java.util.List;

/** Shared records for resolution tests. */
public final class BookFixtures {
    private BookFixtures() {}

    public static ProviderRecord googleRecord(String title, String author, double rating, int count, String isbn) {
        return new ProviderRecord(ProviderSource.BIB_A, title, author, rating, count,
            "A Google Books description", "https://books.google.test/thumb.jpg", isbn,
            "https://books.google.test/info", 2001);
    }

    public static ProviderRecord openLibraryRecord(String title, String author, double rating, int count, String isbn) {
        return new ProviderRecord(ProviderSource.BIB_B, title, author, rating, count,
            "Open Library first sentence", "https://covers.openlibrary.org/b/id/1-M.jpg", isbn,
            null, 1999);
    }

    public static MergedBook mergedBook(String title, double rating, int count) {
        return MergedBook.builder()
            .title(title)
            .author("Some Author")
            .rating(rating)
            .ratingsCount(count)
            .ratingSource(rating > 0 ? "Google Books (" + count + " reviews)" : "No ratings available")
            .description("desc")
            .sources(List.of("Google Books"))
            .build();
    }

    public static ReadingListEntry entry(String title, String author, String isbn, String isbn13, String shelf) {
        return new ReadingListEntry(title, author, isbn, isbn13, shelf, 4, "2024/01/02", "2023/12/01");
    }
}
