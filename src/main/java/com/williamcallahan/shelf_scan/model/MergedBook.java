package com.williamcallahan.shelf_scan.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.williamcallahan.shelf_scan.util.ValidationUtils;
import lombok.Builder;

import java.util.List;

/**
 * Single reconciled record built from every provider that answered for one query.
 * Instances are immutable and cached by value; reading-list annotation returns a copy.
 *
 * @param rating          chosen rating; 0 means unknown, never zero stars
 * @param ratingSource    human readable label naming the rating source and its count
 * @param sources         provider display names that returned data, in query order
 * @param inReadingList   set only after reading-list matching ran
 * @param readingListInfo shelf metadata of the matched reading-list entry, if any
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MergedBook(
    String title,
    String author,
    double rating,
    int ratingsCount,
    String ratingSource,
    String description,
    String thumbnail,
    String isbn,
    Integer publishYear,
    String infoLink,
    String goodreadsUrl,
    String amazonUrl,
    List<String> sources,
    Boolean inReadingList,
    ReadingListMatch readingListInfo
) {

    public MergedBook {
        if (rating > 0 && !ValidationUtils.hasText(ratingSource)) {
            throw new IllegalArgumentException("A positive rating requires a rating source");
        }
        ratingsCount = Math.max(ratingsCount, 0);
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    /**
     * Copy of this book carrying the reading-list outcome.
     *
     * @param match matched entry metadata, or {@code null} when the book is not on the list
     */
    public MergedBook withReadingList(ReadingListMatch match) {
        return new MergedBook(title, author, rating, ratingsCount, ratingSource, description, thumbnail,
            isbn, publishYear, infoLink, goodreadsUrl, amazonUrl, sources, match != null, match);
    }
}
