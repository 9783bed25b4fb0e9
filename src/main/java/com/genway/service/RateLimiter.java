package com.genway.service;

import com.genway.config.GenwayProperties;
import com.genway.config.GenwayProperties.LimitConfig;
import com.genway.model.RateLimitDecision;
import com.genway.model.RateLimitDimension;
import com.genway.model.dto.RateLimitUsage;
import com.genway.store.CounterStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;

/**
 * Fixed-window admission control per (provider, model, caller).
 *
 * Key pattern: {@code genway:rate_limit:{requests|tokens|daily}:{provider}:{model}:{caller}:{window}}
 * where minute windows are {@code floor(epochSeconds / 60)} and the daily window is the calendar
 * date in the clock's zone. {@link #check} only reads; {@link #record} increments.
 * Counter store failures are logged and fail open.
 */
@Slf4j
@Service
public class RateLimiter {

    private static final String KEY_PREFIX = "genway:rate_limit:";
    private static final long WINDOW_SECONDS = 60;

    private final CounterStore counters;
    private final GenwayProperties.RateLimitConfig config;
    private final Clock clock;

    public RateLimiter(CounterStore counters, GenwayProperties properties, Clock clock) {
        this.counters = counters;
        this.config = properties.getRateLimits();
        this.clock = clock;
    }

    public RateLimitDecision check(String provider, String model, int estimatedTokens, String callerId) {
        Instant now = clock.instant();
        if (!config.isEnabled()) {
            return RateLimitDecision.unlimited(now);
        }

        LimitConfig limits = resolveLimits(provider, model);
        Map<RateLimitDimension, Long> remaining = new EnumMap<>(RateLimitDimension.class);
        Map<RateLimitDimension, Long> current = new EnumMap<>(RateLimitDimension.class);
        Map<RateLimitDimension, Long> enforced = new EnumMap<>(RateLimitDimension.class);
        boolean allowed = true;
        boolean dailyDenied = false;

        Integer requestLimit = limits.getRequestsPerMinute();
        if (isEnforced(requestLimit)) {
            long count = read(key(RateLimitDimension.REQUESTS_PER_MINUTE, provider, model, callerId, now));
            current.put(RateLimitDimension.REQUESTS_PER_MINUTE, count);
            remaining.put(RateLimitDimension.REQUESTS_PER_MINUTE, Math.max(0, requestLimit - count));
            enforced.put(RateLimitDimension.REQUESTS_PER_MINUTE, requestLimit.longValue());
            allowed = count < requestLimit;
        }

        Integer tokenLimit = limits.getTokensPerMinute();
        if (isEnforced(tokenLimit) && estimatedTokens > 0) {
            long count = read(key(RateLimitDimension.TOKENS_PER_MINUTE, provider, model, callerId, now));
            current.put(RateLimitDimension.TOKENS_PER_MINUTE, count);
            remaining.put(RateLimitDimension.TOKENS_PER_MINUTE, Math.max(0, tokenLimit - count));
            enforced.put(RateLimitDimension.TOKENS_PER_MINUTE, tokenLimit.longValue());
            allowed = allowed && count + estimatedTokens <= tokenLimit;
        }

        Integer dailyLimit = limits.getRequestsPerDay();
        if (isEnforced(dailyLimit)) {
            long count = read(key(RateLimitDimension.REQUESTS_PER_DAY, provider, model, callerId, now));
            current.put(RateLimitDimension.REQUESTS_PER_DAY, count);
            remaining.put(RateLimitDimension.REQUESTS_PER_DAY, Math.max(0, dailyLimit - count));
            enforced.put(RateLimitDimension.REQUESTS_PER_DAY, dailyLimit.longValue());
            dailyDenied = count >= dailyLimit;
            allowed = allowed && !dailyDenied;
        }

        RateLimitDecision decision = RateLimitDecision.builder()
                .allowed(allowed)
                .remaining(remaining)
                .current(current)
                .limits(enforced)
                .resetAt(dailyDenied ? nextDay(now) : nextMinute(now))
                .build();

        if (!allowed) {
            log.warn("Rate limit hit: provider={}, model={}, caller={}, usage={}, limits={}",
                    provider, model, callerId, current, enforced);
        }
        return decision;
    }

    /**
     * Count one request and its tokens against the current windows.
     */
    public void record(String provider, String model, int actualTokens, String callerId) {
        if (!config.isEnabled()) {
            return;
        }
        Instant now = clock.instant();
        increment(RateLimitDimension.REQUESTS_PER_MINUTE, provider, model, callerId, now, 1);
        if (actualTokens > 0) {
            increment(RateLimitDimension.TOKENS_PER_MINUTE, provider, model, callerId, now, actualTokens);
        }
        increment(RateLimitDimension.REQUESTS_PER_DAY, provider, model, callerId, now, 1);
    }

    public RateLimitUsage getUsage(String provider, String model, String callerId) {
        Instant now = clock.instant();
        return RateLimitUsage.builder()
                .provider(provider)
                .model(model)
                .callerId(callerId)
                .requestsThisMinute(read(key(RateLimitDimension.REQUESTS_PER_MINUTE, provider, model, callerId, now)))
                .tokensThisMinute(read(key(RateLimitDimension.TOKENS_PER_MINUTE, provider, model, callerId, now)))
                .requestsToday(read(key(RateLimitDimension.REQUESTS_PER_DAY, provider, model, callerId, now)))
                .build();
    }

    /**
     * Clear the caller's current windows.
     */
    public void reset(String provider, String model, String callerId) {
        Instant now = clock.instant();
        for (RateLimitDimension dimension : RateLimitDimension.values()) {
            String key = key(dimension, provider, model, callerId, now);
            try {
                counters.delete(key);
            } catch (Exception e) {
                log.warn("Rate limiter reset failed for {}: {}", key, e.getMessage());
            }
        }
    }

    /**
     * The whole limits block from the most specific level that has one: model, provider, default.
     */
    LimitConfig resolveLimits(String provider, String model) {
        LimitConfig modelLimits = config.getModels().get(model);
        if (modelLimits != null) {
            return modelLimits;
        }
        LimitConfig providerLimits = config.getProviders().get(provider);
        if (providerLimits != null) {
            return providerLimits;
        }
        return config.getDefaults() != null ? config.getDefaults() : new LimitConfig();
    }

    String key(RateLimitDimension dimension, String provider, String model, String callerId, Instant now) {
        String window = dimension == RateLimitDimension.REQUESTS_PER_DAY
                ? LocalDate.ofInstant(now, clock.getZone()).toString()
                : Long.toString(Math.floorDiv(now.getEpochSecond(), WINDOW_SECONDS));
        return KEY_PREFIX + dimension.getKeySegment() + ":" + provider + ":" + model + ":" + callerId + ":" + window;
    }

    private static boolean isEnforced(Integer limit) {
        return limit != null && limit > 0;
    }

    private long read(String key) {
        try {
            return counters.get(key);
        } catch (Exception e) {
            log.warn("Rate limiter read failed for {}: {}", key, e.getMessage());
            return 0;
        }
    }

    private void increment(RateLimitDimension dimension, String provider, String model, String callerId,
                           Instant now, long delta) {
        String key = key(dimension, provider, model, callerId, now);
        try {
            counters.incrementBy(key, delta, dimension.getTtl());
        } catch (Exception e) {
            log.warn("Rate limiter increment failed for {}: {}", key, e.getMessage());
        }
    }

    private static Instant nextMinute(Instant now) {
        return Instant.ofEpochSecond((Math.floorDiv(now.getEpochSecond(), WINDOW_SECONDS) + 1) * WINDOW_SECONDS);
    }

    private Instant nextDay(Instant now) {
        return LocalDate.ofInstant(now, clock.getZone()).plusDays(1).atStartOfDay(clock.getZone()).toInstant();
    }
}
