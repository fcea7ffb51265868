package com.williamcallahan.shelf_scan.util;

import org.slf4j.Logger;

/**
 * Centralized logging for external provider calls made while resolving a scan.
 *
 * These logs trace the resolution flow:
 * - merged-book cache
 * - Google Books and Open Library (in parallel)
 * - rating cache, then the Goodreads rating store
 */
public class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";

    private ExternalApiLogger() {
    }

    /**
     * Log an external API call attempt
     */
    public static void logApiCallAttempt(Logger log, String apiName, String operation, String query) {
        log.info("{} [{}] ATTEMPT: {} for query='{}'", PREFIX, apiName, operation, query);
    }

    /**
     * Log an external API call success
     */
    public static void logApiCallSuccess(Logger log, String apiName, String operation, String query, int resultCount) {
        log.info("{} [{}] SUCCESS: {} returned {} result(s) for query='{}'", PREFIX, apiName, operation, resultCount, query);
    }

    /**
     * Log an external API call failure
     */
    public static void logApiCallFailure(Logger log, String apiName, String operation, String query, String reason) {
        log.warn("{} [{}] FAILURE: {} failed for query='{}' - {}", PREFIX, apiName, operation, query, reason);
    }

    /**
     * Log circuit breaker blocking an API call
     */
    public static void logCircuitBreakerBlocked(Logger log, String apiName, String query) {
        log.info("{} [{}] CIRCUIT-BREAKER-OPEN: Skipping call for query='{}'", PREFIX, apiName, query);
    }

    /**
     * Log the start of a resolution
     */
    public static void logResolutionStart(Logger log, String title, String author) {
        log.debug("{} [RESOLVE] START: title='{}', author='{}'", PREFIX, title, author);
    }

    /**
     * Log the completion of a resolution
     */
    public static void logResolutionComplete(Logger log, String title, boolean found, String sources) {
        log.info("{} [RESOLVE] COMPLETE: title='{}', found={}, sources={}", PREFIX, title, found, sources);
    }

    /**
     * Log HTTP response details
     */
    public static void logHttpResponse(Logger log, int statusCode, String url) {
        log.debug("{} [HTTP] Response: status={}, url={}", PREFIX, statusCode, url);
    }
}
