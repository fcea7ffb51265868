/**
 * Redis-backed cache store using Jedis directly
 *
 * @author William Callahan
 *
 * Features:
 * - SETEX writes so every entry carries its namespace TTL
 * - Fails open on any Jedis error: reads miss, writes are dropped
 * - Skips Redis for a short window after a connection failure instead of
 *   paying the socket timeout on every call
 */

package com.williamcallahan.shelf_scan.service.cache;

import com.williamcallahan.shelf_scan.config.RedisEnvironmentCondition;
import com.williamcallahan.shelf_scan.monitoring.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Conditional;
import org.springframework.stereotype.Component;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.exceptions.JedisException;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

@Component
@Conditional(RedisEnvironmentCondition.class)
public class RedisCacheBackend implements CacheBackend {

    private static final Logger logger = LoggerFactory.getLogger(RedisCacheBackend.class);
    private static final long UNREACHABLE_RECHECK_MS = 30_000;

    private final JedisPooled jedisPooled;
    private final MetricsService metricsService;

    private final AtomicBoolean reachable = new AtomicBoolean(true);
    private final AtomicLong lastFailureTime = new AtomicLong(0);

    public RedisCacheBackend(JedisPooled jedisPooled, MetricsService metricsService) {
        this.jedisPooled = jedisPooled;
        this.metricsService = metricsService;
    }

    @Override
    public Optional<String> get(String key) {
        if (skipWhileUnreachable()) {
            return Optional.empty();
        }
        try {
            String value = jedisPooled.get(key);
            markReachable();
            return Optional.ofNullable(value);
        } catch (JedisException e) {
            markUnreachable("GET", key, e);
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        if (skipWhileUnreachable()) {
            return;
        }
        try {
            jedisPooled.setex(key, Math.max(1L, ttl.getSeconds()), value);
            markReachable();
        } catch (JedisException e) {
            markUnreachable("SETEX", key, e);
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            boolean pong = "PONG".equalsIgnoreCase(jedisPooled.ping());
            if (pong) {
                markReachable();
            }
            return pong;
        } catch (JedisException e) {
            markUnreachable("PING", "-", e);
            return false;
        }
    }

    @Override
    public String describe() {
        return "redis";
    }

    private boolean skipWhileUnreachable() {
        if (reachable.get()) {
            return false;
        }
        // Let one call through as a probe once the window has elapsed
        return System.currentTimeMillis() - lastFailureTime.get() < UNREACHABLE_RECHECK_MS;
    }

    private void markReachable() {
        if (reachable.compareAndSet(false, true)) {
            logger.info("Redis reachable again, cache reads and writes resumed");
        }
    }

    private void markUnreachable(String command, String key, JedisException e) {
        lastFailureTime.set(System.currentTimeMillis());
        metricsService.incrementRedisError();
        if (reachable.compareAndSet(true, false)) {
            logger.warn("Redis {} failed for key '{}', bypassing cache for {}ms: {}",
                command, key, UNREACHABLE_RECHECK_MS, e.getMessage());
        } else {
            logger.debug("Redis {} failed again for key '{}': {}", command, key, e.getMessage());
        }
    }
}
