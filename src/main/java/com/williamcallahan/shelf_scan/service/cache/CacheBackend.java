package com.williamcallahan.shelf_scan.service.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value store with per-entry TTL behind the resolution caches.
 *
 * <p>Implementations fail open: when the backend cannot be reached {@link #get} returns
 * empty and {@link #set} does nothing. Neither method throws.</p>
 */
public interface CacheBackend {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    /**
     * Actively checks whether the backend answers right now.
     */
    boolean isAvailable();

    /**
     * Short name used in logs and health details.
     */
    String describe();
}
