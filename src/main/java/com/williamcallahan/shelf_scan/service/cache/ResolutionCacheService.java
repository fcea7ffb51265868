/**
 * Typed access to the two resolution cache namespaces
 *
 * @author William Callahan
 *
 * Features:
 * - Merged books under book:<title>:<author>, community ratings under rating:<isbn>
 * - JSON values via Jackson; a value that no longer decodes counts as a miss
 * - Rating reads try every ISBN variant, ISBN-13 form first
 * - Blocking backend calls run on boundedElastic with a short timeout
 * - Never errors: any failure degrades to a miss or a skipped write
 */

package com.williamcallahan.shelf_scan.service.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.shelf_scan.config.ResolutionProperties;
import com.williamcallahan.shelf_scan.model.BookQuery;
import com.williamcallahan.shelf_scan.model.MergedBook;
import com.williamcallahan.shelf_scan.model.RatingSnapshot;
import com.williamcallahan.shelf_scan.monitoring.MetricsService;
import com.williamcallahan.shelf_scan.util.ErrorHandlingUtils;
import com.williamcallahan.shelf_scan.util.IsbnUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Optional;

@Service
@Slf4j
public class ResolutionCacheService {

    private final CacheBackend backend;
    private final ObjectMapper objectMapper;
    private final ResolutionProperties properties;
    private final MetricsService metricsService;

    @Autowired
    public ResolutionCacheService(ObjectProvider<CacheBackend> backendProvider,
                                  ObjectMapper objectMapper,
                                  ResolutionProperties properties,
                                  MetricsService metricsService) {
        this(backendProvider.getIfAvailable(NoOpCacheBackend::new), objectMapper, properties, metricsService);
    }

    public ResolutionCacheService(CacheBackend backend,
                                  ObjectMapper objectMapper,
                                  ResolutionProperties properties,
                                  MetricsService metricsService) {
        this.backend = backend;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.metricsService = metricsService;
        log.info("Resolution cache backed by '{}'", backend.describe());
    }

    public Mono<MergedBook> getMergedBook(BookQuery query) {
        return read(CacheKey.forBook(query), MergedBook.class);
    }

    public Mono<Void> putMergedBook(BookQuery query, MergedBook book) {
        return write(CacheKey.forBook(query), book, properties.getCache().getBookTtl());
    }

    /**
     * Looks up a cached rating under each variant of the identifier in turn.
     * Completes empty when no variant is cached or the identifier is not an ISBN.
     */
    public Mono<RatingSnapshot> getRating(String identifier) {
        return Flux.fromIterable(IsbnUtils.variantsOf(identifier))
            .concatMap(variant -> read(CacheKey.forRating(variant), RatingSnapshot.class))
            .next();
    }

    /**
     * Stores a rating under the identifier exactly as it was queried. Other variants are not written.
     */
    public Mono<Void> putRating(String identifier, RatingSnapshot snapshot) {
        if (IsbnUtils.sanitize(identifier) == null) {
            return Mono.empty();
        }
        return write(CacheKey.forRating(identifier), snapshot, properties.getCache().getRatingTtl());
    }

    public boolean isBackendConfigured() {
        return !(backend instanceof NoOpCacheBackend);
    }

    public boolean isBackendAvailable() {
        return backend.isAvailable();
    }

    public String describeBackend() {
        return backend.describe();
    }

    private <T> Mono<T> read(CacheKey key, Class<T> type) {
        return Mono.fromCallable(() -> backend.get(key.asString()))
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(properties.getTimeout().getCache())
            .flatMap(raw -> Mono.justOrEmpty(raw.flatMap(json -> decode(key, json, type))))
            .doOnNext(value -> {
                log.debug("Cache hit for {}", key);
                metricsService.recordCacheHit(key.getNamespace());
            })
            .switchIfEmpty(Mono.defer(() -> {
                log.debug("Cache miss for {}", key);
                metricsService.recordCacheMiss(key.getNamespace());
                return Mono.empty();
            }))
            .onErrorResume(e -> {
                ErrorHandlingUtils.logRecoveredError(log, "cache read " + key, e, metricsService);
                metricsService.recordCacheMiss(key.getNamespace());
                return Mono.empty();
            });
    }

    private Mono<Void> write(CacheKey key, Object value, Duration ttl) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(value))
            .flatMap(json -> Mono.<Void>fromRunnable(() -> backend.set(key.asString(), json, ttl))
                .subscribeOn(Schedulers.boundedElastic()))
            .timeout(properties.getTimeout().getCache())
            .doOnSuccess(ignored -> log.debug("Cached {} for {}", key, ttl))
            .onErrorResume(e -> {
                ErrorHandlingUtils.logRecoveredError(log, "cache write " + key, e, metricsService);
                return Mono.empty();
            })
            .then();
    }

    private <T> Optional<T> decode(CacheKey key, String json, Class<T> type) {
        try {
            return Optional.ofNullable(objectMapper.readValue(json, type));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Discarding undecodable cache value for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }
}
