package com.genway.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.genway.model.CachedResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Redis-backed response cache with compression.
 * Values are gzip'd JSON; each tag is a Redis set of cache keys at {@code genway:cache_tag:{tag}}.
 */
@Slf4j
public class RedisCacheStore implements CacheStore {

    static final String TAG_PREFIX = "genway:cache_tag:";

    private final RedisTemplate<String, byte[]> redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisCacheStore(RedisTemplate<String, byte[]> redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<CachedResponse> get(String key) {
        byte[] compressed = redisTemplate.opsForValue().get(key);
        if (compressed == null) {
            return Optional.empty();
        }
        return Optional.of(decompress(compressed));
    }

    @Override
    public void put(String key, CachedResponse value, Duration ttl, Collection<String> tags) {
        byte[] compressed = compress(value);
        redisTemplate.opsForValue().set(key, compressed, ttl);

        if (tags != null) {
            byte[] member = key.getBytes(StandardCharsets.UTF_8);
            for (String tag : tags) {
                String tagKey = TAG_PREFIX + tag;
                redisTemplate.opsForSet().add(tagKey, member);
                // Tag sets live at least as long as their newest entry
                redisTemplate.expire(tagKey, ttl);
            }
        }

        log.debug("Stored in Redis cache: key={}, ttl={}, size={}KB", key, ttl, compressed.length / 1024);
    }

    @Override
    public boolean delete(String key) {
        return Boolean.TRUE.equals(redisTemplate.delete(key));
    }

    @Override
    public long invalidateTag(String tag) {
        String tagKey = TAG_PREFIX + tag;
        Set<byte[]> members = redisTemplate.opsForSet().members(tagKey);
        redisTemplate.delete(tagKey);
        if (members == null || members.isEmpty()) {
            return 0;
        }
        List<String> keys = new ArrayList<>(members.size());
        for (byte[] member : members) {
            keys.add(new String(member, StandardCharsets.UTF_8));
        }
        Long removed = redisTemplate.delete(keys);
        log.debug("Invalidated {} Redis cache entries for tag {}", removed, tag);
        return removed != null ? removed : 0;
    }

    @Override
    public long clear(String keyPrefix) {
        Set<String> keys = redisTemplate.keys(keyPrefix + "*");
        if (keys == null || keys.isEmpty()) {
            return 0;
        }
        Long removed = redisTemplate.delete(keys);
        log.info("Cleared {} entries from Redis cache", removed);
        return removed != null ? removed : 0;
    }

    @Override
    public String getName() {
        return "redis";
    }

    private byte[] compress(CachedResponse cached) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            try (GZIPOutputStream gzipOut = new GZIPOutputStream(baos)) {
                gzipOut.write(objectMapper.writeValueAsBytes(cached));
            }
            return baos.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to compress cache entry", e);
        }
    }

    private CachedResponse decompress(byte[] compressed) {
        try (GZIPInputStream gzipIn = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return objectMapper.readValue(gzipIn.readAllBytes(), CachedResponse.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to decompress cache entry", e);
        }
    }
}
