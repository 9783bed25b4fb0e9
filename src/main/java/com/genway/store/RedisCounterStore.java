package com.genway.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

/**
 * Redis counters shared by every gateway instance.
 * INCRBY and the first EXPIRE are two commands; a crash in between leaves a counter without TTL.
 */
@Slf4j
public class RedisCounterStore implements CounterStore {

    private final StringRedisTemplate redisTemplate;

    public RedisCounterStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public long get(String key) {
        String value = redisTemplate.opsForValue().get(key);
        if (value == null) {
            return 0;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            log.warn("Non-numeric counter value at {}: {}", key, value);
            return 0;
        }
    }

    @Override
    public long incrementBy(String key, long delta, Duration ttl) {
        Long value = redisTemplate.opsForValue().increment(key, delta);
        if (value == null) {
            // Only null inside a pipeline or transaction
            return 0;
        }
        if (value == delta) {
            redisTemplate.expire(key, ttl);
        }
        return value;
    }

    @Override
    public void delete(String key) {
        redisTemplate.delete(key);
    }
}
