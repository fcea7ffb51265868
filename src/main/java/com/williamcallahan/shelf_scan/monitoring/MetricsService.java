/**
 * Service for tracking resolution metrics and operational health
 * Provides counters and timers for caches, providers and the rating store
 *
 * @author William Callahan
 */

package com.williamcallahan.shelf_scan.monitoring;

import com.williamcallahan.shelf_scan.model.ProviderSource;
import com.williamcallahan.shelf_scan.service.cache.CacheNamespace;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;

@Service
public class MetricsService {

    private final MeterRegistry meterRegistry;

    // Counters
    private final Counter redisErrors;
    private final Counter apiRateLimits;
    private final Counter ratingStoreFailures;
    private final Counter booksNotFound;
    private final Map<CacheNamespace, Counter> cacheHits = new EnumMap<>(CacheNamespace.class);
    private final Map<CacheNamespace, Counter> cacheMisses = new EnumMap<>(CacheNamespace.class);
    private final Map<ProviderSource, Counter> providerFailures = new EnumMap<>(ProviderSource.class);

    // Timers
    private final Timer resolutionTimer;

    public MetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.redisErrors = Counter.builder("redis.errors")
            .description("Number of Redis operation errors")
            .register(meterRegistry);

        this.apiRateLimits = Counter.builder("api.rate_limits")
            .description("Number of API rate limit hits")
            .register(meterRegistry);

        this.ratingStoreFailures = Counter.builder("rating_store.failures")
            .description("Rating store lookups abandoned after retries")
            .register(meterRegistry);

        this.booksNotFound = Counter.builder("resolution.not_found")
            .description("Queries that no provider could resolve")
            .register(meterRegistry);

        for (CacheNamespace namespace : CacheNamespace.values()) {
            String name = namespace.name().toLowerCase();
            cacheHits.put(namespace, Counter.builder("cache.hits")
                .tag("namespace", name)
                .description("Cache hits per key namespace")
                .register(meterRegistry));
            cacheMisses.put(namespace, Counter.builder("cache.misses")
                .tag("namespace", name)
                .description("Cache misses per key namespace")
                .register(meterRegistry));
        }

        for (ProviderSource source : ProviderSource.values()) {
            providerFailures.put(source, Counter.builder("provider.failures")
                .tag("source", source.name().toLowerCase())
                .description("Provider calls that failed or timed out")
                .register(meterRegistry));
        }

        this.resolutionTimer = Timer.builder("resolution.time")
            .description("Time to resolve a single book query")
            .register(meterRegistry);
    }

    public void incrementRedisError() {
        redisErrors.increment();
    }

    public void incrementApiRateLimit() {
        apiRateLimits.increment();
    }

    public void incrementRatingStoreFailure() {
        ratingStoreFailures.increment();
    }

    public void incrementNotFound() {
        booksNotFound.increment();
    }

    public void recordCacheHit(CacheNamespace namespace) {
        cacheHits.get(namespace).increment();
    }

    public void recordCacheMiss(CacheNamespace namespace) {
        cacheMisses.get(namespace).increment();
    }

    public void incrementProviderFailure(ProviderSource source) {
        providerFailures.get(source).increment();
    }

    public Timer.Sample startResolutionTimer() {
        return Timer.start(meterRegistry);
    }

    public void stopResolutionTimer(Timer.Sample sample) {
        sample.stop(resolutionTimer);
    }
}
