package com.genway.repository;

import com.genway.config.GenwayProperties;
import com.genway.exception.ConfigurationException;
import com.genway.model.Preset;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Repository;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Presets loaded from YAML files, one preset per file named after the file.
 *
 * <pre>
 * provider: openai
 * model: gpt-4.1-mini
 * system_prompt: You are a helpful assistant.
 * options:
 *   temperature: 0.7
 * </pre>
 *
 * Missing provider or model fall back to {@code genway.defaults}.
 */
@Slf4j
@Repository
public class YamlPresetRepository implements PresetRepository {

    private final String location;
    private final GenwayProperties.DefaultsConfig defaults;
    private final ResourcePatternResolver resolver;
    private final AtomicReference<Map<String, Preset>> presets = new AtomicReference<>(Map.of());

    @Autowired
    public YamlPresetRepository(GenwayProperties properties) {
        this(properties.getPresets().getLocation(), properties.getDefaults(),
                new PathMatchingResourcePatternResolver());
    }

    YamlPresetRepository(String location, GenwayProperties.DefaultsConfig defaults,
                         ResourcePatternResolver resolver) {
        this.location = location;
        this.defaults = defaults;
        this.resolver = resolver;
        reload();
    }

    @Override
    public Optional<Preset> get(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(presets.get().get(name));
    }

    @Override
    public Set<String> names() {
        return presets.get().keySet();
    }

    @Override
    public void reload() {
        Map<String, Preset> loaded = new TreeMap<>();
        Resource[] resources;
        try {
            resources = resolver.getResources(location);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to list presets at " + location, e);
        }

        for (Resource resource : resources) {
            String filename = resource.getFilename();
            if (filename == null || !(filename.endsWith(".yaml") || filename.endsWith(".yml"))) {
                continue;
            }
            String name = filename.substring(0, filename.lastIndexOf('.'));
            loaded.put(name, parse(name, resource));
        }

        presets.set(Collections.unmodifiableMap(loaded));
        log.info("Loaded {} presets from {}", loaded.size(), location);
    }

    @SuppressWarnings("unchecked")
    private Preset parse(String name, Resource resource) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Map<String, Object> data;
        try (InputStream in = resource.getInputStream()) {
            Object root = yaml.load(in);
            data = root instanceof Map ? (Map<String, Object>) root : Map.of();
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read preset " + name, e);
        }

        Object options = data.get("options");
        return Preset.builder()
                .name(name)
                .provider(stringOr(data.get("provider"), defaults.getProvider()))
                .model(stringOr(data.get("model"), defaults.getModel()))
                .systemPrompt(stringOr(data.get("system_prompt"), null))
                .options(options instanceof Map
                        ? Collections.unmodifiableMap(new LinkedHashMap<>((Map<String, Object>) options))
                        : Map.of())
                .build();
    }

    private static String stringOr(Object value, String fallback) {
        if (value == null || value.toString().isBlank()) {
            return fallback;
        }
        return value.toString();
    }
}
