package com.genway.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * In-process counters. Increments go through {@code asMap().compute}, which Caffeine
 * runs atomically per key.
 */
public class CaffeineCounterStore implements CounterStore {

    private final Cache<String, Counter> counters;

    public CaffeineCounterStore(Clock clock) {
        this.counters = Caffeine.newBuilder()
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .expireAfter(new CounterExpiry())
                .build();
    }

    @Override
    public long get(String key) {
        Counter counter = counters.getIfPresent(key);
        return counter == null ? 0 : counter.value();
    }

    @Override
    public long incrementBy(String key, long delta, Duration ttl) {
        Counter updated = counters.asMap().compute(key, (k, existing) ->
                existing == null ? new Counter(delta, ttl) : new Counter(existing.value() + delta, existing.ttl()));
        return updated.value();
    }

    @Override
    public void delete(String key) {
        counters.invalidate(key);
    }

    private record Counter(long value, Duration ttl) {
    }

    private static final class CounterExpiry implements Expiry<String, Counter> {

        @Override
        public long expireAfterCreate(String key, Counter counter, long currentTime) {
            return counter.ttl().toNanos();
        }

        // Increments keep the window's first deadline
        @Override
        public long expireAfterUpdate(String key, Counter counter, long currentTime, long currentDuration) {
            return currentDuration;
        }

        @Override
        public long expireAfterRead(String key, Counter counter, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
