package com.williamcallahan.shelf_scan.testutil;

import com.williamcallahan.shelf_scan.service.cache.CacheBackend;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Map-backed cache that can be switched to behave like an unreachable Redis. */
public class InMemoryCacheBackend implements CacheBackend {

    private final Map<String, String> values = new ConcurrentHashMap<>();
    private final Map<String, Duration> ttls = new ConcurrentHashMap<>();
    private volatile boolean reachable = true;

    @Override
    public Optional<String> get(String key) {
        return reachable ? Optional.ofNullable(values.get(key)) : Optional.empty();
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        if (reachable) {
            values.put(key, value);
            ttls.put(key, ttl);
        }
    }

    @Override
    public boolean isAvailable() {
        return reachable;
    }

    @Override
    public String describe() {
        return "in-memory";
    }

    public void setReachable(boolean reachable) {
        this.reachable = reachable;
    }

    public void putRaw(String key, String value) {
        values.put(key, value);
    }

    public Map<String, String> values() {
        return values;
    }

    public Duration ttlOf(String key) {
        return ttls.get(key);
    }
}
