/**
 * Configuration for retry mechanisms around the rating store
 *
 * @author William Callahan
 *
 * Features:
 * - Retries connection acquisition failures against the rating store
 * - Escalating backoff with light jitter, capped so a lookup never stalls long
 * - Non-transient SQL errors are not retried
 */

package com.williamcallahan.shelf_scan.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.util.HashMap;
import java.util.Map;

@Configuration
public class RetryConfig {

    /**
     * Exponential backoff with jitter; the cap applies after jitter
     */
    static class ExponentialBackOffWithJitterPolicy implements BackOffPolicy {
        private static final Logger logger = LoggerFactory.getLogger(ExponentialBackOffWithJitterPolicy.class);
        private long initialInterval = 1000;
        private double multiplier = 2.0;
        private long maxInterval = 3000;
        private double jitterFactor = 0.1;

        public void setInitialInterval(long initialInterval) {
            this.initialInterval = initialInterval;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public void setMaxInterval(long maxInterval) {
            this.maxInterval = maxInterval;
        }

        public void setJitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
        }

        private static class BackOffContextImpl implements BackOffContext {
            long currentInterval;
        }

        @Override
        public BackOffContext start(RetryContext context) {
            BackOffContextImpl ctx = new BackOffContextImpl();
            ctx.currentInterval = this.initialInterval;
            return ctx;
        }

        @Override
        public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
            BackOffContextImpl ctx = (BackOffContextImpl) backOffContext;
            long sleepTime = nextSleep(ctx.currentInterval);
            if (logger.isDebugEnabled()) {
                logger.debug("Backing off for {}ms (with jitter)", sleepTime);
            }
            try {
                Thread.sleep(sleepTime);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BackOffInterruptedException("Thread interrupted while backing off", e);
            }
            long nextInterval = (long) (ctx.currentInterval * multiplier);
            ctx.currentInterval = Math.min(nextInterval, maxInterval);
        }

        long nextSleep(long interval) {
            long jitter = (long) (interval * jitterFactor * (2 * Math.random() - 1));
            return Math.min(maxInterval, Math.max(1, interval + jitter));
        }
    }

    /**
     * Creates the retry template for rating store lookups
     * Only failures to obtain or use a pooled connection are retried
     *
     * @return RetryTemplate for rating store operations
     */
    @Bean("ratingStoreRetryTemplate")
    public RetryTemplate ratingStoreRetryTemplate(RatingStoreProperties properties) {
        RetryTemplate retryTemplate = new RetryTemplate();

        Map<Class<? extends Throwable>, Boolean> retryableExceptions = new HashMap<>();
        retryableExceptions.put(CannotGetJdbcConnectionException.class, true);
        retryableExceptions.put(TransientDataAccessResourceException.class, true);
        retryableExceptions.put(QueryTimeoutException.class, true);

        SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(properties.getMaxAttempts(), retryableExceptions, true);
        retryTemplate.setRetryPolicy(retryPolicy);

        ExponentialBackOffWithJitterPolicy backOffPolicy = new ExponentialBackOffWithJitterPolicy();
        backOffPolicy.setInitialInterval(properties.getInitialBackoff().toMillis());
        backOffPolicy.setMultiplier(properties.getBackoffMultiplier());
        backOffPolicy.setMaxInterval(properties.getMaxBackoff().toMillis());
        retryTemplate.setBackOffPolicy(backOffPolicy);

        return retryTemplate;
    }
}
