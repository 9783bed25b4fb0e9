package com.genway.service;

import com.genway.exception.ProviderRequestException;
import com.genway.exception.RateLimitExceededException;
import com.genway.exception.RetriesExhaustedException;
import com.genway.model.CachedResponse;
import com.genway.model.ErrorKind;
import com.genway.model.NormalizedResponse;
import com.genway.model.RateLimitDecision;
import com.genway.model.ResolvedConfig;
import com.genway.model.Usage;
import com.genway.provider.ProviderReply;
import com.genway.service.retry.ErrorClassifier;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds {@link NormalizedResponse}s for fresh replies, cache hits and failures,
 * and converts successful responses into cache entries.
 */
@Component
public class ResponseNormalizer {

    private final ErrorClassifier errorClassifier;
    private final Clock clock;

    public ResponseNormalizer(ErrorClassifier errorClassifier, Clock clock) {
        this.errorClassifier = errorClassifier;
        this.clock = clock;
    }

    public NormalizedResponse success(ResolvedConfig config, ProviderReply reply, BigDecimal cost, long responseTimeMs) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("provider", config.getProvider());
        meta.put("model", config.getModel());

        return NormalizedResponse.builder()
                .content(reply.getContent() != null ? reply.getContent() : "")
                .usage(reply.getUsage())
                .cost(cost != null ? cost : BigDecimal.ZERO)
                .meta(Collections.unmodifiableMap(meta))
                .cached(false)
                .responseTimeMs(Math.max(0, responseTimeMs))
                .provider(config.getProvider())
                .model(config.getModel())
                .build();
    }

    public NormalizedResponse fromCache(CachedResponse cached, long responseTimeMs) {
        Map<String, Object> meta = new LinkedHashMap<>();
        if (cached.getMeta() != null) {
            meta.putAll(cached.getMeta());
        }
        if (cached.getCreatedAt() != null) {
            meta.put("cached_at", cached.getCreatedAt().toString());
        }

        return NormalizedResponse.builder()
                .content(cached.getContent() != null ? cached.getContent() : "")
                .usage(cached.getUsage() != null ? cached.getUsage() : Usage.empty())
                .cost(cached.getCost() != null ? cached.getCost() : BigDecimal.ZERO)
                .meta(Collections.unmodifiableMap(meta))
                .cached(true)
                .responseTimeMs(Math.max(0, responseTimeMs))
                .provider(cached.getProvider())
                .model(cached.getModel())
                .build();
    }

    public NormalizedResponse failure(Throwable error, String provider, String model, long responseTimeMs) {
        ErrorKind kind = errorClassifier.classify(error);
        Map<String, Object> meta = new LinkedHashMap<>();
        if (error instanceof RetriesExhaustedException) {
            meta.put("attempts", ((RetriesExhaustedException) error).getAttempts());
        }
        if (error instanceof ProviderRequestException && ((ProviderRequestException) error).getStatusCode() != null) {
            meta.put("status_code", ((ProviderRequestException) error).getStatusCode());
        }
        if (error instanceof RateLimitExceededException && ((RateLimitExceededException) error).getDecision() != null) {
            meta.putAll(describe(((RateLimitExceededException) error).getDecision()));
        }
        String message = error != null && error.getMessage() != null ? error.getMessage() : kind.name();
        return NormalizedResponse.failure(kind, message, provider, model, responseTimeMs,
                Collections.unmodifiableMap(meta));
    }

    public NormalizedResponse rateLimited(RateLimitDecision decision, String provider, String model, long responseTimeMs) {
        return failure(new RateLimitExceededException(decision), provider, model, responseTimeMs);
    }

    /**
     * @throws IllegalArgumentException for failed responses, which are never cached
     */
    public CachedResponse toCacheEntry(NormalizedResponse response) {
        if (!response.isSuccess()) {
            throw new IllegalArgumentException("Failed responses are not cacheable");
        }
        return CachedResponse.builder()
                .content(response.getContent())
                .usage(response.getUsage())
                .cost(response.getCost())
                .meta(new LinkedHashMap<>(response.getMeta()))
                .provider(response.getProvider())
                .model(response.getModel())
                .createdAt(clock.instant())
                .build();
    }

    private static Map<String, Object> describe(RateLimitDecision decision) {
        Map<String, Object> meta = new LinkedHashMap<>();
        decision.getRemaining().forEach((dimension, remaining) ->
                meta.put("remaining_" + dimension.name().toLowerCase(), remaining));
        if (decision.getResetAt() != null) {
            meta.put("reset_at", decision.getResetAt().toString());
        }
        return meta;
    }
}
