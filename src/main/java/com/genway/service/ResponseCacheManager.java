package com.genway.service;

import com.genway.config.GenwayProperties;
import com.genway.model.CachedResponse;
import com.genway.model.NormalizedResponse;
import com.genway.model.ResolvedConfig;
import com.genway.model.dto.CacheStatistics;
import com.genway.service.canonicalization.CacheKeyGenerator;
import com.genway.store.CacheStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Response cache in front of the providers.
 *
 * Backend failures never reach the caller: a failed read is a miss and a failed write is skipped.
 * Only successful responses are stored.
 */
@Slf4j
@Service
public class ResponseCacheManager {

    private final CacheStore store;
    private final CacheKeyGenerator keyGenerator;
    private final ResponseNormalizer normalizer;
    private final GenwayProperties.CacheConfig cacheConfig;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();

    private final Map<String, Mono<?>> inFlight = new ConcurrentHashMap<>();

    public ResponseCacheManager(CacheStore store, CacheKeyGenerator keyGenerator,
                                ResponseNormalizer normalizer, GenwayProperties properties) {
        this.store = store;
        this.keyGenerator = keyGenerator;
        this.normalizer = normalizer;
        this.cacheConfig = properties.getCache();
    }

    public Optional<CachedResponse> get(ResolvedConfig config) {
        return get(config.getProvider(), config.getModel(), config.getPrompt(), config.getSystemPrompt(),
                config.getOptions());
    }

    public Optional<CachedResponse> get(String provider, String model, String prompt, Map<String, Object> options) {
        return get(provider, model, prompt, null, options);
    }

    public Optional<CachedResponse> get(String provider, String model, String prompt, String systemPrompt,
                                        Map<String, Object> options) {
        if (!cacheConfig.isEnabled()) {
            return Optional.empty();
        }

        try {
            String key = keyGenerator.generate(provider, model, prompt, systemPrompt, options);
            Optional<CachedResponse> cached = store.get(key);
            if (cached.isPresent()) {
                hits.incrementAndGet();
                log.debug("Cache hit: {}", key);
            } else {
                misses.incrementAndGet();
                log.debug("Cache miss: {}", key);
            }
            return cached;
        } catch (Exception e) {
            errors.incrementAndGet();
            misses.incrementAndGet();
            log.warn("Cache read failed for {}/{}, treating as miss", provider, model, e);
            return Optional.empty();
        }
    }

    public void put(ResolvedConfig config, NormalizedResponse response) {
        put(config, response, cacheConfig.getTtl());
    }

    public void put(ResolvedConfig config, NormalizedResponse response, Duration ttl) {
        put(config.getProvider(), config.getModel(), config.getPrompt(), config.getSystemPrompt(),
                config.getOptions(), response, ttl);
    }

    public void put(String provider, String model, String prompt, Map<String, Object> options,
                    NormalizedResponse response, Duration ttl) {
        put(provider, model, prompt, null, options, response, ttl);
    }

    public void put(String provider, String model, String prompt, String systemPrompt,
                    Map<String, Object> options, NormalizedResponse response, Duration ttl) {
        if (!cacheConfig.isEnabled() || response == null || !response.isSuccess() || response.isCached()) {
            return;
        }

        try {
            String key = keyGenerator.generate(provider, model, prompt, systemPrompt, options);
            store.put(key, normalizer.toCacheEntry(response), ttl != null ? ttl : cacheConfig.getTtl(),
                    keyGenerator.tags(provider, model));
        } catch (Exception e) {
            errors.incrementAndGet();
            log.warn("Cache write failed for {}/{}, skipping", provider, model, e);
        }
    }

    public void forget(ResolvedConfig config) {
        forget(config.getProvider(), config.getModel(), config.getPrompt(), config.getSystemPrompt(),
                config.getOptions());
    }

    public void forget(String provider, String model, String prompt, String systemPrompt, Map<String, Object> options) {
        try {
            store.delete(keyGenerator.generate(provider, model, prompt, systemPrompt, options));
        } catch (Exception e) {
            errors.incrementAndGet();
            log.warn("Cache delete failed for {}/{}", provider, model, e);
        }
    }

    /**
     * Remove entries carrying the tag, or every entry under the cache prefix when the tag is null.
     *
     * @return entries removed, 0 if the backend failed
     */
    public long invalidate(String tag) {
        try {
            long removed = tag == null
                    ? store.clear(keyGenerator.rootPrefix())
                    : store.invalidateTag(tag);
            log.info("Invalidated {} cache entries ({})", removed, tag == null ? "all" : tag);
            return removed;
        } catch (Exception e) {
            errors.incrementAndGet();
            log.error("Cache invalidation failed for {}", tag == null ? "all" : tag, e);
            return 0;
        }
    }

    public long flushProvider(String provider) {
        return invalidate(keyGenerator.providerTag(provider));
    }

    public long flushModel(String model) {
        return invalidate(keyGenerator.modelTag(model));
    }

    public long flushProviderModel(String provider, String model) {
        return invalidate(keyGenerator.providerModelTag(provider, model));
    }

    /**
     * Share one upstream call between concurrent identical misses when single-flight is on.
     * Followers subscribe to the leader's result, success or failure.
     */
    @SuppressWarnings("unchecked")
    public <T> Mono<T> deduplicate(ResolvedConfig config, Supplier<Mono<T>> upstream) {
        if (!cacheConfig.isEnabled() || !cacheConfig.isSingleFlight()) {
            return Mono.defer(upstream);
        }
        return Mono.defer(() -> {
            String key = keyGenerator.generate(config.getProvider(), config.getModel(), config.getPrompt(),
                    config.getSystemPrompt(), config.getOptions());
            return (Mono<T>) inFlight.computeIfAbsent(key, k -> Mono.defer(upstream)
                    .doFinally(signal -> inFlight.remove(k))
                    .cache());
        });
    }

    public CacheStatistics getStats() {
        long hitCount = hits.get();
        long missCount = misses.get();
        long total = hitCount + missCount;
        return CacheStatistics.builder()
                .enabled(cacheConfig.isEnabled())
                .backend(store.getName())
                .ttl(cacheConfig.getTtl())
                .prefix(cacheConfig.getPrefix())
                .hits(hitCount)
                .misses(missCount)
                .errors(errors.get())
                .hitRate(total == 0 ? 0.0 : (double) hitCount / total)
                .build();
    }

    public double getHitRate() {
        return getStats().getHitRate();
    }
}
