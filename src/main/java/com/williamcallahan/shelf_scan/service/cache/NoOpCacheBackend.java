package com.williamcallahan.shelf_scan.service.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Backend used when no Redis server is configured. Every lookup is a miss.
 */
public class NoOpCacheBackend implements CacheBackend {

    @Override
    public Optional<String> get(String key) {
        return Optional.empty();
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        // nothing to write to
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public String describe() {
        return "disabled";
    }
}
