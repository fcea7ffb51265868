package com.williamcallahan.shelf_scan.service.cache;

/**
 * Disjoint key families stored in the cache backend. Each family has its own TTL.
 */
public enum CacheNamespace {
    /** Fully merged books keyed by lower-cased title and author. */
    BOOK("book:"),
    /** Community ratings keyed by one ISBN variant. */
    RATING("rating:");

    private final String prefix;

    CacheNamespace(String prefix) {
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }
}
