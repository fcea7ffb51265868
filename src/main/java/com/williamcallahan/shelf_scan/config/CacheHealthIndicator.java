/**
 * Health indicator for the resolution cache backend
 *
 * @author William Callahan
 *
 * Reports UP while the backend answers a ping, UNKNOWN when no Redis is configured
 */

package com.williamcallahan.shelf_scan.config;

import com.williamcallahan.shelf_scan.service.cache.ResolutionCacheService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

@Component("cacheHealthIndicator")
public class CacheHealthIndicator implements HealthIndicator {

    private final ResolutionCacheService cacheService;

    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final AtomicLong lastSuccessTime = new AtomicLong(0);

    public CacheHealthIndicator(ResolutionCacheService cacheService) {
        this.cacheService = cacheService;
    }

    @Override
    public Health health() {
        if (!cacheService.isBackendConfigured()) {
            return Health.unknown()
                .withDetail("cache_status", "not_configured")
                .build();
        }

        String backend = cacheService.describeBackend();
        if (cacheService.isBackendAvailable()) {
            consecutiveFailures.set(0);
            lastSuccessTime.set(System.currentTimeMillis());
            return Health.up()
                .withDetail("cache_status", "available")
                .withDetail("backend", backend)
                .build();
        }

        int failures = consecutiveFailures.incrementAndGet();
        Health.Builder builder = Health.down()
            .withDetail("cache_status", "unavailable")
            .withDetail("backend", backend)
            .withDetail("consecutive_failures", failures);
        if (lastSuccessTime.get() > 0) {
            builder.withDetail("last_success_ms_ago", System.currentTimeMillis() - lastSuccessTime.get());
        }
        return builder.build();
    }
}
