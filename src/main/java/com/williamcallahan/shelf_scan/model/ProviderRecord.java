package com.williamcallahan.shelf_scan.model;

import java.util.Objects;

/**
 * Normalized, immutable result from a single provider adapter.
 *
 * @param source       provider that produced the record
 * @param title        title as reported by the provider
 * @param author       first author as reported by the provider
 * @param rating       average rating in [0, 5]; 0 means unknown
 * @param ratingsCount number of ratings behind {@code rating}
 * @param description  free-text description or first sentence
 * @param thumbnail    cover thumbnail URL
 * @param isbn         sanitized ISBN-10 or ISBN-13
 * @param infoLink     provider deep link
 * @param publishYear  first publication year
 */
public record ProviderRecord(
    ProviderSource source,
    String title,
    String author,
    double rating,
    int ratingsCount,
    String description,
    String thumbnail,
    String isbn,
    String infoLink,
    Integer publishYear
) {

    public ProviderRecord {
        Objects.requireNonNull(source, "source");
        if (Double.isNaN(rating) || rating < 0) {
            rating = 0;
        }
        rating = Math.min(rating, 5.0);
        ratingsCount = Math.max(ratingsCount, 0);
    }

    /**
     * Record carrying only rating data, as returned by the community rating adapter.
     */
    public static ProviderRecord ratingOnly(ProviderSource source, double rating, int ratingsCount) {
        return new ProviderRecord(source, null, null, rating, ratingsCount, null, null, null, null, null);
    }

    public boolean hasRating() {
        return rating > 0;
    }
}
