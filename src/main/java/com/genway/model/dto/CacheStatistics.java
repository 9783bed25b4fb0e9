package com.genway.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Response cache counters since process start.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {

    private boolean enabled;

    /**
     * Backing store name ("caffeine", "redis").
     */
    private String backend;

    private Duration ttl;

    private String prefix;

    private long hits;

    private long misses;

    /**
     * Writes skipped or failed because of backend errors.
     */
    private long errors;

    /**
     * Cache hit rate (0.0-1.0).
     */
    private double hitRate;
}
