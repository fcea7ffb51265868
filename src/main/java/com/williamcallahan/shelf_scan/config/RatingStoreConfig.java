/**
 * Relational rating store configuration
 *
 * @author William Callahan
 *
 * Features:
 * - Activates only when app.rating-store.url is configured
 * - Bounded HikariCP pool; the pool size caps concurrent rating lookups
 * - Short acquire timeout so retries, not a hanging pool, handle outages
 * - Does not fail startup when the database is down
 */

package com.williamcallahan.shelf_scan.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import javax.sql.DataSource;

@Slf4j
@Configuration
@ConditionalOnExpression("'${app.rating-store.url:}'.length() > 0")
public class RatingStoreConfig {

    @Bean(destroyMethod = "close")
    public HikariDataSource ratingStoreDataSource(RatingStoreProperties properties) {
        HikariConfig config = new HikariConfig();
        config.setPoolName("rating-store");
        config.setJdbcUrl(properties.getUrl());
        config.setUsername(properties.getUsername());
        config.setPassword(properties.getPassword());
        config.setMaximumPoolSize(properties.getMaxPoolSize());
        config.setMinimumIdle(Math.min(2, properties.getMaxPoolSize()));
        config.setConnectionTimeout(properties.getAcquireTimeout().toMillis());
        config.setReadOnly(true);
        // Start even when the database is unreachable; the startup probe records the state
        config.setInitializationFailTimeout(-1);

        log.info("Configuring rating store pool: url={}, maxPoolSize={}, acquireTimeout={}",
            properties.getUrl().replaceAll("://[^@]+@", "://***:***@"),
            properties.getMaxPoolSize(), properties.getAcquireTimeout());
        return new HikariDataSource(config);
    }

    @Bean
    public NamedParameterJdbcTemplate ratingStoreJdbcTemplate(DataSource ratingStoreDataSource) {
        return new NamedParameterJdbcTemplate(ratingStoreDataSource);
    }
}
