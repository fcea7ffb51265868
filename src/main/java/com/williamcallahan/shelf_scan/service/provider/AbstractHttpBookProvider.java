/**
 * Shared call envelope for HTTP bibliographic providers
 *
 * @author William Callahan
 *
 * Features:
 * - Per-provider timeout, counted as a failure by the circuit breaker
 * - Resilience4j circuit breaker per provider; an open circuit reads as "no data"
 * - Every failure is classified, logged through ExternalApiLogger and counted
 * - Subclasses only build the request and map the payload
 */

package com.williamcallahan.shelf_scan.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.shelf_scan.model.BookQuery;
import com.williamcallahan.shelf_scan.model.ProviderRecord;
import com.williamcallahan.shelf_scan.monitoring.MetricsService;
import com.williamcallahan.shelf_scan.util.ErrorHandlingUtils;
import com.williamcallahan.shelf_scan.util.ErrorHandlingUtils.ErrorCategory;
import com.williamcallahan.shelf_scan.util.ExternalApiLogger;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;

public abstract class AbstractHttpBookProvider implements BookMetadataProvider {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final CircuitBreaker circuitBreaker;
    private final Duration timeout;
    private final MetricsService metricsService;

    protected AbstractHttpBookProvider(String circuitBreakerName,
                                       CircuitBreakerRegistry circuitBreakerRegistry,
                                       Duration timeout,
                                       MetricsService metricsService) {
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(circuitBreakerName);
        this.timeout = timeout;
        this.metricsService = metricsService;
    }

    @Override
    public final Mono<ProviderRecord> fetch(BookQuery query) {
        String apiName = source().getDisplayName();
        String queryText = query.searchText();
        return Mono.defer(() -> {
                ExternalApiLogger.logApiCallAttempt(logger, apiName, "search", queryText);
                return doFetch(query);
            })
            .timeout(timeout)
            .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
            .doOnNext(record -> ExternalApiLogger.logApiCallSuccess(logger, apiName, "search", queryText, 1))
            .switchIfEmpty(Mono.defer(() -> {
                ExternalApiLogger.logApiCallSuccess(logger, apiName, "search", queryText, 0);
                return Mono.empty();
            }))
            .onErrorResume(e -> {
                handleFailure(apiName, queryText, e);
                return Mono.empty();
            });
    }

    /**
     * Issues the provider request and maps the first result. Complete empty for "no match";
     * errors are handled by {@link #fetch}.
     */
    protected abstract Mono<ProviderRecord> doFetch(BookQuery query);

    /**
     * Text of a JSON field, or {@code null} when the field is missing, null or blank.
     */
    protected static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    private void handleFailure(String apiName, String queryText, Throwable e) {
        ErrorCategory category = ErrorHandlingUtils.categorizeError(e);
        if (category == ErrorCategory.CIRCUIT_OPEN) {
            ExternalApiLogger.logCircuitBreakerBlocked(logger, apiName, queryText);
            return;
        }
        if (category == ErrorCategory.RATE_LIMIT) {
            metricsService.incrementApiRateLimit();
        }
        metricsService.incrementProviderFailure(source());
        ExternalApiLogger.logApiCallFailure(logger, apiName, "search", queryText,
            category + ": " + e.getMessage());
        if (category == ErrorCategory.GENERAL) {
            logger.debug("Unexpected {} failure", apiName, e);
        }
    }
}
