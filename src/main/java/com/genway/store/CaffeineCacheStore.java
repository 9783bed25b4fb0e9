package com.genway.store;

import com.genway.model.CachedResponse;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * In-process response cache on Caffeine. Each entry keeps its own TTL; tags are
 * indexed in a side map that is pruned as entries leave the cache.
 */
@Slf4j
public class CaffeineCacheStore implements CacheStore {

    private final Cache<String, Entry> cache;
    private final Map<String, Set<String>> tagIndex = new ConcurrentHashMap<>();

    public CaffeineCacheStore(long maxSize, Clock clock) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .expireAfter(new EntryExpiry())
                .executor(Runnable::run)
                .removalListener(this::onRemoval)
                .build();
    }

    @Override
    public Optional<CachedResponse> get(String key) {
        Entry entry = cache.getIfPresent(key);
        return entry == null ? Optional.empty() : Optional.of(copy(entry.value()));
    }

    @Override
    public void put(String key, CachedResponse value, Duration ttl, Collection<String> tags) {
        Entry entry = new Entry(copy(value), ttl, tags == null ? List.of() : List.copyOf(tags));
        // Removal of a replaced entry runs inline, so index the new tags afterwards
        cache.put(key, entry);
        for (String tag : entry.tags()) {
            tagIndex.computeIfAbsent(tag, t -> ConcurrentHashMap.newKeySet()).add(key);
        }
    }

    @Override
    public boolean delete(String key) {
        return cache.asMap().remove(key) != null;
    }

    @Override
    public long invalidateTag(String tag) {
        Set<String> keys = tagIndex.remove(tag);
        if (keys == null || keys.isEmpty()) {
            return 0;
        }
        long removed = 0;
        for (String key : keys) {
            if (cache.asMap().remove(key) != null) {
                removed++;
            }
        }
        log.debug("Invalidated {} cache entries for tag {}", removed, tag);
        return removed;
    }

    @Override
    public long clear(String keyPrefix) {
        long removed = 0;
        for (String key : List.copyOf(cache.asMap().keySet())) {
            if (key.startsWith(keyPrefix) && cache.asMap().remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public String getName() {
        return "caffeine";
    }

    // Callers get their own instance; the stored one is never handed out
    private static CachedResponse copy(CachedResponse value) {
        return value.toBuilder()
                .meta(value.getMeta() == null ? null : new LinkedHashMap<>(value.getMeta()))
                .build();
    }

    private void onRemoval(String key, Entry entry, RemovalCause cause) {
        if (key == null || entry == null) {
            return;
        }
        for (String tag : entry.tags()) {
            tagIndex.computeIfPresent(tag, (t, keys) -> {
                keys.remove(key);
                return keys.isEmpty() ? null : keys;
            });
        }
    }

    private record Entry(CachedResponse value, Duration ttl, List<String> tags) {
    }

    private static final class EntryExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
