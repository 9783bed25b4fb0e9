package com.genway.model;

import java.time.Duration;

/**
 * Counter dimensions tracked by the rate limiter.
 */
public enum RateLimitDimension {
    REQUESTS_PER_MINUTE("requests", Duration.ofSeconds(60)),
    TOKENS_PER_MINUTE("tokens", Duration.ofSeconds(60)),
    REQUESTS_PER_DAY("daily", Duration.ofDays(1));

    private final String keySegment;
    private final Duration ttl;

    RateLimitDimension(String keySegment, Duration ttl) {
        this.keySegment = keySegment;
        this.ttl = ttl;
    }

    public String getKeySegment() {
        return keySegment;
    }

    /**
     * TTL applied to a counter when it is first created.
     */
    public Duration getTtl() {
        return ttl;
    }
}
