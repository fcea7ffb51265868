package com.williamcallahan.shelf_scan.model;

/**
 * Community rating row as stored in the rating store and the rating cache.
 *
 * @param rating       average rating
 * @param ratingsCount number of ratings
 */
public record RatingSnapshot(double rating, int ratingsCount) {

    public ProviderRecord toProviderRecord() {
        return ProviderRecord.ratingOnly(ProviderSource.RATINGS, rating, ratingsCount);
    }
}
