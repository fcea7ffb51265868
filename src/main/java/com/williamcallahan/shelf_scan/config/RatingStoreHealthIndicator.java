package com.williamcallahan.shelf_scan.config;

import com.williamcallahan.shelf_scan.service.rating.RatingStoreConnector;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the rating store's health flag. The flag is owned by the connector
 * (startup probe, retry exhaustion, recovery probe); this indicator never queries the store.
 */
@Component("ratingStoreHealthIndicator")
public class RatingStoreHealthIndicator implements HealthIndicator {

    private final RatingStoreConnector connector;

    public RatingStoreHealthIndicator(RatingStoreConnector connector) {
        this.connector = connector;
    }

    @Override
    public Health health() {
        if (!connector.isConfigured()) {
            return Health.unknown().withDetail("rating_store_status", "not_configured").build();
        }
        if (connector.isAvailable()) {
            return Health.up().withDetail("rating_store_status", "available").build();
        }
        return Health.down().withDetail("rating_store_status", "unavailable").build();
    }
}
