package com.williamcallahan.shelf_scan.service.cache;

import com.williamcallahan.shelf_scan.model.BookQuery;
import com.williamcallahan.shelf_scan.util.IsbnUtils;

import java.util.Objects;

/**
 * Typed cache key. Keys from different namespaces can never collide because the
 * namespace prefix is part of the rendered key.
 */
public final class CacheKey {

    private final CacheNamespace namespace;
    private final String value;

    private CacheKey(CacheNamespace namespace, String value) {
        this.namespace = namespace;
        this.value = value;
    }

    /**
     * {@code book:<lower title>:<lower author>}
     */
    public static CacheKey forBook(BookQuery query) {
        Objects.requireNonNull(query, "query");
        return new CacheKey(CacheNamespace.BOOK, query.normalizedTitle() + ":" + query.normalizedAuthor());
    }

    /**
     * {@code rating:<isbn>}
     */
    public static CacheKey forRating(String identifier) {
        String sanitized = IsbnUtils.sanitize(identifier);
        if (sanitized == null) {
            throw new IllegalArgumentException("Rating cache key requires an identifier");
        }
        return new CacheKey(CacheNamespace.RATING, sanitized);
    }

    public CacheNamespace getNamespace() {
        return namespace;
    }

    public String asString() {
        return namespace.getPrefix() + value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CacheKey other)) {
            return false;
        }
        return namespace == other.namespace && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(namespace, value);
    }

    @Override
    public String toString() {
        return asString();
    }
}
