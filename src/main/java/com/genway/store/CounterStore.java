package com.genway.store;

import java.time.Duration;

/**
 * Atomic counters with a TTL fixed when the counter is created.
 */
public interface CounterStore {

    /**
     * Current value, 0 when the counter does not exist or has expired.
     */
    long get(String key);

    /**
     * Atomically add {@code delta}, creating the counter with {@code ttl} if absent.
     * Later increments do not extend the TTL.
     *
     * @return value after the increment
     */
    long incrementBy(String key, long delta, Duration ttl);

    void delete(String key);
}
