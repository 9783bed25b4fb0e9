package com.genway.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisCounterStoreTest {

    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOps;
    private RedisCounterStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        valueOps = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        store = new RedisCounterStore(redisTemplate);
    }

    @Test
    void testFirstIncrementSetsExpiry() {
        when(valueOps.increment("k", 1L)).thenReturn(1L);

        assertEquals(1, store.incrementBy("k", 1, Duration.ofSeconds(60)));
        verify(redisTemplate).expire("k", Duration.ofSeconds(60));
    }

    @Test
    void testLaterIncrementKeepsExistingExpiry() {
        when(valueOps.increment("k", 1L)).thenReturn(4L);

        assertEquals(4, store.incrementBy("k", 1, Duration.ofSeconds(60)));
        verify(redisTemplate, never()).expire(anyString(), any(Duration.class));
    }

    @Test
    void testGetParsesValue() {
        when(valueOps.get("k")).thenReturn("42");
        when(valueOps.get("missing")).thenReturn(null);
        when(valueOps.get("garbage")).thenReturn("abc");

        assertEquals(42, store.get("k"));
        assertEquals(0, store.get("missing"));
        assertEquals(0, store.get("garbage"));
    }
}
