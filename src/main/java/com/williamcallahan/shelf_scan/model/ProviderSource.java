package com.williamcallahan.shelf_scan.model;

/**
 * Upstream data sources, declared in merge priority order for bibliographic fields.
 */
public enum ProviderSource {
    BIB_A("Google Books", "reviews"),
    BIB_B("Open Library", "reviews"),
    RATINGS("Goodreads", "ratings");

    private final String displayName;
    private final String countNoun;

    ProviderSource(String displayName, String countNoun) {
        this.displayName = displayName;
        this.countNoun = countNoun;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getCountNoun() {
        return countNoun;
    }
}
