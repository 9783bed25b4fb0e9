package com.genway.store;

import com.genway.model.CachedResponse;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;

/**
 * Key/value store for cached responses with per-entry TTL and tag-based invalidation.
 * Implementations may throw on backend failure; callers decide whether that is a miss.
 */
public interface CacheStore {

    Optional<CachedResponse> get(String key);

    void put(String key, CachedResponse value, Duration ttl, Collection<String> tags);

    /**
     * @return true if an entry was removed
     */
    boolean delete(String key);

    /**
     * Remove every entry carrying the tag.
     *
     * @return number of entries removed
     */
    long invalidateTag(String tag);

    /**
     * Remove every entry whose key starts with the prefix.
     *
     * @return number of entries removed
     */
    long clear(String keyPrefix);

    /**
     * Backend name reported in cache statistics.
     */
    String getName();
}
