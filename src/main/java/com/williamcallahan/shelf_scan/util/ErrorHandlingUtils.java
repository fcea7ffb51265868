/**
 * Utility class for standardized error handling across the application
 * Classifies failures from providers, Redis and the rating store so each call site
 * logs at a consistent level and records the matching metric
 *
 * @author William Callahan
 */

package com.williamcallahan.shelf_scan.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.williamcallahan.shelf_scan.monitoring.MetricsService;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import org.slf4j.Logger;
import org.springframework.dao.DataAccessException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import redis.clients.jedis.exceptions.JedisException;

import java.util.concurrent.TimeoutException;

public final class ErrorHandlingUtils {

    private ErrorHandlingUtils() {
    }

    /**
     * Standard error categorization for consistent handling
     */
    public enum ErrorCategory {
        TIMEOUT,
        REDIS_CONNECTION,
        DATABASE,
        UPSTREAM_HTTP,
        CIRCUIT_OPEN,
        RATE_LIMIT,
        SERIALIZATION,
        VALIDATION,
        GENERAL
    }

    /**
     * Categorize an exception into standard error types
     */
    public static ErrorCategory categorizeError(Throwable throwable) {
        if (throwable == null) {
            return ErrorCategory.GENERAL;
        }
        if (throwable instanceof TimeoutException) {
            return ErrorCategory.TIMEOUT;
        } else if (throwable instanceof CallNotPermittedException) {
            return ErrorCategory.CIRCUIT_OPEN;
        } else if (throwable instanceof WebClientResponseException wcre) {
            return wcre.getStatusCode().value() == 429 ? ErrorCategory.RATE_LIMIT : ErrorCategory.UPSTREAM_HTTP;
        } else if (throwable instanceof WebClientRequestException) {
            return ErrorCategory.UPSTREAM_HTTP;
        } else if (throwable instanceof JedisException) {
            return ErrorCategory.REDIS_CONNECTION;
        } else if (throwable instanceof DataAccessException) {
            return ErrorCategory.DATABASE;
        } else if (throwable instanceof JsonProcessingException) {
            return ErrorCategory.SERIALIZATION;
        } else if (throwable instanceof IllegalArgumentException) {
            return ErrorCategory.VALIDATION;
        } else if (throwable.getCause() != null && throwable.getCause() != throwable) {
            // Unwrap CompletionException and friends
            return categorizeError(throwable.getCause());
        }
        return ErrorCategory.GENERAL;
    }

    /**
     * Logs a recovered failure at the level its category warrants.
     * Only unexpected failures carry a stack trace.
     *
     * @return the category, so callers can record source-specific metrics
     */
    public static ErrorCategory logRecoveredError(Logger logger, String operationName, Throwable throwable,
                                                 MetricsService metricsService) {
        ErrorCategory category = categorizeError(throwable);
        String message = throwable == null ? "unknown error" : throwable.getMessage();
        switch (category) {
            case TIMEOUT:
                logger.warn("Operation {} timed out: {}", operationName, message);
                break;
            case CIRCUIT_OPEN:
                logger.info("Operation {} skipped, circuit open: {}", operationName, message);
                break;
            case RATE_LIMIT:
                logger.warn("Rate limit hit in {}: {}", operationName, message);
                if (metricsService != null) {
                    metricsService.incrementApiRateLimit();
                }
                break;
            case UPSTREAM_HTTP:
                logger.warn("Upstream error in {}: {}", operationName, message);
                break;
            case REDIS_CONNECTION:
                logger.warn("Redis error in {}: {}", operationName, message);
                if (metricsService != null) {
                    metricsService.incrementRedisError();
                }
                break;
            case DATABASE:
                logger.warn("Database error in {}: {}", operationName, message);
                break;
            case SERIALIZATION:
            case VALIDATION:
                logger.warn("Unreadable data in {}: {}", operationName, message);
                break;
            default:
                logger.error("Error in {}: {}", operationName, message, throwable);
        }
        return category;
    }
}
