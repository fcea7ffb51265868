package com.williamcallahan.shelf_scan.config;

import com.williamcallahan.shelf_scan.repository.EmptyReadingListStore;
import com.williamcallahan.shelf_scan.repository.ReadingListStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration used in absence of a rating store URL
 *
 * @author William Callahan
 *
 * Features:
 * - Activates only when app.rating-store.url is empty
 * - Supplies an empty reading-list store so scans still resolve without annotations
 * - Rating lookups stay on the rating cache; the connector reports itself unavailable
 */
@Configuration
@ConditionalOnExpression("'${app.rating-store.url:}'.length() == 0")
public class NoDatabaseConfig {

    @Bean
    public ReadingListStore readingListStore() {
        return new EmptyReadingListStore();
    }
}
