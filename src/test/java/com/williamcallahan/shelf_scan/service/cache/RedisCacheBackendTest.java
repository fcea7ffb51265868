package com.williamcallahan.shelf_scan.service.cache;

import com.williamcallahan.shelf_scan.monitoring.MetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.exceptions.JedisConnectionException;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RedisCacheBackendTest {

    @Mock
    private JedisPooled jedisPooled;

    private SimpleMeterRegistry meterRegistry;
    private RedisCacheBackend backend;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        backend = new RedisCacheBackend(jedisPooled, new MetricsService(meterRegistry));
    }

    @Test
    void set_usesSetexWithTtlSeconds() {
        backend.set("book:dune:frank herbert", "{}", Duration.ofDays(30));

        verify(jedisPooled).setex("book:dune:frank herbert", 2_592_000L, "{}");
    }

    @Test
    void get_returnsStoredValue() {
        when(jedisPooled.get("rating:0306406152")).thenReturn("{\"rating\":4.0}");

        assertEquals(Optional.of("{\"rating\":4.0}"), backend.get("rating:0306406152"));
        assertEquals(Optional.empty(), backend.get("rating:missing"));
    }

    @Test
    void connectionFailure_failsOpenAndBypassesRedis() {
        when(jedisPooled.get(anyString())).thenThrow(new JedisConnectionException("Connection refused"));

        assertEquals(Optional.empty(), backend.get("book:a:b"));
        assertEquals(Optional.empty(), backend.get("book:a:b"));
        backend.set("book:a:b", "{}", Duration.ofSeconds(10));

        verify(jedisPooled, times(1)).get(anyString());
        verify(jedisPooled, never()).setex(anyString(), anyLong(), anyString());
        assertEquals(1.0, meterRegistry.get("redis.errors").counter().count());
    }

    @Test
    void ping_reportsAvailability() {
        when(jedisPooled.ping()).thenReturn("PONG");
        assertTrue(backend.isAvailable());

        when(jedisPooled.ping()).thenThrow(new JedisConnectionException("down"));
        assertFalse(backend.isAvailable());
    }
}
