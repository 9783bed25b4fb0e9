package com.genway.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Outcome of an admission check. Only enforced dimensions appear in the maps.
 */
@Value
@Builder
public class RateLimitDecision {

    boolean allowed;

    @Builder.Default
    Map<RateLimitDimension, Long> remaining = Map.of();

    @Builder.Default
    Map<RateLimitDimension, Long> current = Map.of();

    @Builder.Default
    Map<RateLimitDimension, Long> limits = Map.of();

    Instant resetAt;

    public static RateLimitDecision unlimited(Instant now) {
        return RateLimitDecision.builder().allowed(true).resetAt(now).build();
    }

    public Long remainingFor(RateLimitDimension dimension) {
        return remaining.get(dimension);
    }

    public Long currentFor(RateLimitDimension dimension) {
        return current.get(dimension);
    }
}
