/**
 * Circuit breaker registry shared by the bibliographic providers
 *
 * @author William Callahan
 */

package com.williamcallahan.shelf_scan.config;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class ResilienceConfig {

    @Value("${app.resilience.provider.failure-rate-threshold:50}")
    private float failureRateThreshold;

    @Value("${app.resilience.provider.sliding-window-size:20}")
    private int slidingWindowSize;

    @Value("${app.resilience.provider.minimum-calls:5}")
    private int minimumNumberOfCalls;

    @Value("${app.resilience.provider.open-state-seconds:60}")
    private long openStateSeconds;

    /**
     * One breaker per provider is created lazily from this default config.
     * Timeouts count as failures, so a hanging provider opens its breaker too.
     */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
            .failureRateThreshold(failureRateThreshold)
            .slidingWindowSize(slidingWindowSize)
            .minimumNumberOfCalls(minimumNumberOfCalls)
            .waitDurationInOpenState(Duration.ofSeconds(openStateSeconds))
            .permittedNumberOfCallsInHalfOpenState(2)
            .automaticTransitionFromOpenToHalfOpenEnabled(true)
            .build();
        return CircuitBreakerRegistry.of(config);
    }
}
