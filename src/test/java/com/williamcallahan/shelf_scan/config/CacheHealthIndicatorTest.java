package com.williamcallahan.shelf_scan.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.shelf_scan.monitoring.MetricsService;
import com.williamcallahan.shelf_scan.service.cache.CacheBackend;
import com.williamcallahan.shelf_scan.service.cache.NoOpCacheBackend;
import com.williamcallahan.shelf_scan.service.cache.ResolutionCacheService;
import com.williamcallahan.shelf_scan.testutil.InMemoryCacheBackend;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CacheHealthIndicatorTest {

    private static ResolutionCacheService cacheService(CacheBackend backend) {
        return new ResolutionCacheService(backend, new ObjectMapper(), new ResolutionProperties(),
            new MetricsService(new SimpleMeterRegistry()));
    }

    @Test
    void unconfiguredBackendIsUnknown() {
        Health health = new CacheHealthIndicator(cacheService(new NoOpCacheBackend())).health();

        assertEquals(Status.UNKNOWN, health.getStatus());
        assertEquals("not_configured", health.getDetails().get("cache_status"));
    }

    @Test
    void reflectsBackendReachability() {
        InMemoryCacheBackend backend = new InMemoryCacheBackend();
        CacheHealthIndicator indicator = new CacheHealthIndicator(cacheService(backend));

        assertEquals(Status.UP, indicator.health().getStatus());

        backend.setReachable(false);
        indicator.health();
        Health down = indicator.health();

        assertEquals(Status.DOWN, down.getStatus());
        assertEquals(2, down.getDetails().get("consecutive_failures"));
        assertEquals("in-memory", down.getDetails().get("backend"));
    }
}
