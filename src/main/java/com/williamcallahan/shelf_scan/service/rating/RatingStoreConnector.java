/**
 * Pooled, retrying client for the relational community-rating dataset
 *
 * @author William Callahan
 *
 * Features:
 * - Identifier-only lookups across both isbn and isbn13 columns
 * - Connection failures retried with escalating backoff, then abandoned
 * - Health flag set by a startup probe and cleared when retries are exhausted
 * - Optional scheduled probe re-enables lookups once the store answers again
 * - Store hits are written to the rating cache under the queried identifier
 */

package com.williamcallahan.shelf_scan.service.rating;

import com.williamcallahan.shelf_scan.config.RatingStoreProperties;
import com.williamcallahan.shelf_scan.model.RatingSnapshot;
import com.williamcallahan.shelf_scan.monitoring.MetricsService;
import com.williamcallahan.shelf_scan.service.cache.ResolutionCacheService;
import com.williamcallahan.shelf_scan.util.IsbnUtils;
import com.williamcallahan.shelf_scan.util.JdbcUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

@Service
public class RatingStoreConnector {

    private static final Logger logger = LoggerFactory.getLogger(RatingStoreConnector.class);

    private static final RowMapper<RatingSnapshot> ROW_MAPPER = (rs, rowNum) ->
        new RatingSnapshot(rs.getDouble("average_rating"), rs.getInt("ratings_count"));

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final RetryTemplate retryTemplate;
    private final RatingStoreProperties properties;
    private final ResolutionCacheService cacheService;
    private final MetricsService metricsService;
    private final String lookupSql;

    private final AtomicBoolean available = new AtomicBoolean(false);

    @Autowired
    public RatingStoreConnector(@Qualifier("ratingStoreJdbcTemplate") ObjectProvider<NamedParameterJdbcTemplate> jdbcTemplateProvider,
                                @Qualifier("ratingStoreRetryTemplate") RetryTemplate retryTemplate,
                                RatingStoreProperties properties,
                                ResolutionCacheService cacheService,
                                MetricsService metricsService) {
        this(jdbcTemplateProvider.getIfAvailable(), retryTemplate, properties, cacheService, metricsService);
    }

    public RatingStoreConnector(NamedParameterJdbcTemplate jdbcTemplate,
                                RetryTemplate retryTemplate,
                                RatingStoreProperties properties,
                                ResolutionCacheService cacheService,
                                MetricsService metricsService) {
        this.jdbcTemplate = jdbcTemplate;
        this.retryTemplate = retryTemplate;
        this.properties = properties;
        this.cacheService = cacheService;
        this.metricsService = metricsService;
        this.lookupSql = "SELECT average_rating, ratings_count FROM "
            + JdbcUtils.requireSqlIdentifier(properties.getTable())
            + " WHERE isbn IN (:ids) OR isbn13 IN (:ids) LIMIT 1";
    }

    @EventListener(ApplicationReadyEvent.class)
    public void probeOnStartup() {
        if (jdbcTemplate == null) {
            logger.info("Rating store not configured; community ratings come from the rating cache only");
            return;
        }
        if (probe()) {
            logger.info("Rating store reachable, table '{}'", properties.getTable());
        } else {
            logger.warn("Rating store unreachable on startup; lookups disabled{}",
                properties.isRecoveryProbeEnabled() ? " until the recovery probe succeeds" : "");
        }
    }

    @Scheduled(initialDelayString = "${app.rating-store.recovery-probe-interval-ms:300000}",
               fixedDelayString = "${app.rating-store.recovery-probe-interval-ms:300000}")
    public void recoveryProbe() {
        if (jdbcTemplate == null || available.get() || !properties.isRecoveryProbeEnabled()) {
            return;
        }
        if (probe()) {
            logger.info("Rating store reachable again, lookups re-enabled");
        } else {
            logger.debug("Rating store still unreachable");
        }
    }

    /**
     * Runs a trivial query and records the result as the current health state.
     *
     * @return whether the store answered
     */
    public boolean probe() {
        if (jdbcTemplate == null) {
            available.set(false);
            return false;
        }
        try {
            jdbcTemplate.queryForObject("SELECT 1", new MapSqlParameterSource(), Integer.class);
            available.set(true);
        } catch (DataAccessException e) {
            logger.debug("Rating store probe failed: {}", e.getMessage());
            available.set(false);
        }
        return available.get();
    }

    public boolean isAvailable() {
        return available.get();
    }

    public boolean isConfigured() {
        return jdbcTemplate != null;
    }

    /**
     * Looks up the community rating for an identifier, matching any of its ISBN variants
     * against either identifier column. Completes empty when the store is unavailable,
     * has no row, or gave up after retries. Never errors.
     */
    public Mono<RatingSnapshot> lookup(String identifier) {
        String queried = IsbnUtils.sanitize(identifier);
        if (queried == null || jdbcTemplate == null) {
            return Mono.empty();
        }
        if (!available.get()) {
            logger.debug("Rating store marked unavailable; skipping lookup for {}", queried);
            return Mono.empty();
        }

        List<String> ids = identifiersFor(queried);
        return Mono.fromCallable(() -> queryWithRetry(queried, ids))
            .subscribeOn(Schedulers.boundedElastic())
            .flatMap(result -> result.map(Mono::just).orElseGet(Mono::empty))
            .flatMap(snapshot -> cacheService.putRating(queried, snapshot).thenReturn(snapshot))
            .onErrorResume(e -> {
                logger.warn("Rating store lookup for {} failed unexpectedly: {}", queried, e.getMessage());
                return Mono.empty();
            });
    }

    private Optional<RatingSnapshot> queryWithRetry(String queried, List<String> ids) {
        MapSqlParameterSource params = new MapSqlParameterSource("ids", ids);
        return retryTemplate.execute(
            context -> {
                if (context.getRetryCount() > 0) {
                    logger.info("Retrying rating store lookup for {} (attempt {})", queried, context.getRetryCount() + 1);
                }
                return JdbcUtils.queryForOptionalObject(jdbcTemplate, lookupSql, params, ROW_MAPPER);
            },
            context -> {
                Throwable last = context.getLastThrowable();
                String reason = last == null ? "unknown" : last.getMessage();
                if (!isConnectionFailure(last)) {
                    logger.warn("Rating store lookup for {} failed: {}", queried, reason);
                    return Optional.empty();
                }
                logger.warn("Rating store lookup for {} abandoned after {} attempt(s), marking store unavailable: {}",
                    queried, context.getRetryCount(), reason);
                available.set(false);
                metricsService.incrementRatingStoreFailure();
                return Optional.empty();
            });
    }

    /**
     * Matches the failures the retry template retries on, anywhere in the cause chain.
     */
    private static boolean isConnectionFailure(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof CannotGetJdbcConnectionException
                || current instanceof TransientDataAccessResourceException
                || current instanceof QueryTimeoutException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }

    private static List<String> identifiersFor(String queried) {
        Set<String> variants = IsbnUtils.variantsOf(queried);
        List<String> ids = new ArrayList<>(variants);
        if (!ids.contains(queried)) {
            ids.add(queried);
        }
        return ids;
    }
}
