/**
 * Custom condition that checks if Redis connection settings are present
 * Enables the Redis cache backend only when a server has been configured; otherwise
 * the resolution caches run against a no-op backend
 *
 * @author William Callahan
 *
 * Features:
 * - Checks REDIS_SERVER and spring.redis.host / spring.redis.port
 * - Logs the detection once per JVM
 */
package com.williamcallahan.shelf_scan.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Condition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.env.Environment;
import org.springframework.core.type.AnnotatedTypeMetadata;
import org.springframework.lang.NonNull;

public class RedisEnvironmentCondition implements Condition {

    private static final Logger logger = LoggerFactory.getLogger(RedisEnvironmentCondition.class);
    private static volatile boolean hasLoggedRedisDetection = false;

    @Override
    public boolean matches(@NonNull ConditionContext context, @NonNull AnnotatedTypeMetadata metadata) {
        return hasRedisConfig(context.getEnvironment());
    }

    static boolean hasRedisConfig(Environment env) {
        boolean hasRedisConfig = hasText(env.getProperty("REDIS_SERVER"))
            || hasText(env.getProperty("spring.redis.host"))
            || hasText(env.getProperty("spring.redis.port"));

        if (hasRedisConfig && !hasLoggedRedisDetection) {
            logger.info("Redis settings detected - enabling Redis cache backend");
            hasLoggedRedisDetection = true;
        }
        return hasRedisConfig;
    }

    private static boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }
}
