package com.genway.service.canonicalization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.genway.config.GenwayProperties;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Builds deterministic cache keys and tags.
 *
 * Key: {@code <prefix>:<provider>:<model>:<sha256>} where the hash covers the prompt,
 * the system prompt and the options with transport-only keys removed and every
 * map sorted by key, so option order never changes the key.
 */
@Component
public class CacheKeyGenerator {

    /**
     * Options that change how a call is made, not what it returns.
     */
    static final Set<String> EXCLUDED_OPTIONS = Set.of("stream", "async", "timeout");

    private final ObjectMapper objectMapper;
    private final String prefix;
    private final List<String> baseTags;

    public CacheKeyGenerator(ObjectMapper objectMapper, GenwayProperties properties) {
        this.objectMapper = objectMapper;
        this.prefix = properties.getCache().getPrefix();
        this.baseTags = List.copyOf(properties.getCache().getTags());
    }

    public String generate(String provider, String model, String prompt, String systemPrompt,
                           Map<String, Object> options) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("prompt", prompt);
        if (systemPrompt != null) {
            content.put("system_prompt", systemPrompt);
        }
        content.put("options", normalizeOptions(options));

        String canonical;
        try {
            canonical = objectMapper.writeValueAsString(content);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Options cannot be serialized for a cache key", e);
        }
        return keyPrefix(provider, model) + DigestUtils.sha256Hex(canonical);
    }

    /**
     * Common prefix of every key for the provider and model.
     */
    public String keyPrefix(String provider, String model) {
        return prefix + ":" + provider + ":" + model + ":";
    }

    /**
     * Prefix shared by every key this generator produces.
     */
    public String rootPrefix() {
        return prefix + ":";
    }

    public List<String> tags(String provider, String model) {
        List<String> tags = new ArrayList<>(baseTags);
        tags.add(providerTag(provider));
        tags.add(modelTag(model));
        tags.add(providerModelTag(provider, model));
        return tags;
    }

    public String providerTag(String provider) {
        return "provider:" + provider;
    }

    public String modelTag(String model) {
        return "model:" + model;
    }

    public String providerModelTag(String provider, String model) {
        return "provider-model:" + provider + ":" + model;
    }

    Map<String, Object> normalizeOptions(Map<String, Object> options) {
        Map<String, Object> normalized = new TreeMap<>();
        if (options == null) {
            return normalized;
        }
        options.forEach((key, value) -> {
            if (!EXCLUDED_OPTIONS.contains(key)) {
                normalized.put(key, sortNested(value));
            }
        });
        return normalized;
    }

    @SuppressWarnings("unchecked")
    private Object sortNested(Object value) {
        if (value instanceof Map) {
            Map<String, Object> sorted = new TreeMap<>();
            ((Map<Object, Object>) value).forEach((k, v) -> sorted.put(String.valueOf(k), sortNested(v)));
            return sorted;
        }
        if (value instanceof List) {
            List<Object> list = new ArrayList<>();
            for (Object element : (List<Object>) value) {
                list.add(sortNested(element));
            }
            return list;
        }
        return value;
    }
}
