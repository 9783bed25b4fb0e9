package com.genway.repository;

import com.genway.config.GenwayProperties;
import com.genway.exception.ConfigurationException;
import com.genway.model.PricingEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Repository;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pricing catalogue read from a {@code models.yaml} file laid out as
 * {@code provider -> model id -> {type, model, pricing}}.
 * Text pricing has {@code input, output, cached_input, reasoning} per 1M tokens;
 * image pricing is {@code quality -> size -> price}.
 */
@Slf4j
@Repository
public class YamlPricingRegistry implements PricingRegistry {

    private final Map<String, PricingEntry> byId;
    private final Map<String, PricingEntry> byAlias;

    @Autowired
    public YamlPricingRegistry(GenwayProperties properties) {
        this(new DefaultResourceLoader().getResource(properties.getPricing().getCatalogLocation()));
    }

    YamlPricingRegistry(Resource catalog) {
        Map<String, PricingEntry> ids = new LinkedHashMap<>();
        Map<String, PricingEntry> aliases = new LinkedHashMap<>();

        if (!catalog.exists()) {
            log.warn("Pricing catalogue {} not found; every model will cost 0", catalog.getDescription());
        } else {
            load(catalog, ids, aliases);
            log.info("Loaded pricing for {} models from {}", ids.size(), catalog.getDescription());
        }

        this.byId = Collections.unmodifiableMap(ids);
        this.byAlias = Collections.unmodifiableMap(aliases);
    }

    @Override
    public Optional<PricingEntry> find(String model) {
        if (model == null) {
            return Optional.empty();
        }
        PricingEntry entry = byId.get(model);
        return Optional.ofNullable(entry != null ? entry : byAlias.get(model));
    }

    @Override
    public List<PricingEntry> findByProvider(String provider) {
        List<PricingEntry> entries = new ArrayList<>();
        for (PricingEntry entry : byId.values()) {
            if (entry.getProvider().equals(provider)) {
                entries.add(entry);
            }
        }
        return entries;
    }

    @SuppressWarnings("unchecked")
    private static void load(Resource catalog, Map<String, PricingEntry> ids, Map<String, PricingEntry> aliases) {
        Object root;
        try (InputStream in = catalog.getInputStream()) {
            root = new Yaml(new SafeConstructor(new LoaderOptions())).load(in);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read pricing catalogue " + catalog.getDescription(), e);
        }
        if (!(root instanceof Map)) {
            return;
        }

        for (Map.Entry<String, Object> provider : ((Map<String, Object>) root).entrySet()) {
            if (!(provider.getValue() instanceof Map)) {
                continue;
            }
            for (Map.Entry<String, Object> model : ((Map<String, Object>) provider.getValue()).entrySet()) {
                if (!(model.getValue() instanceof Map)) {
                    continue;
                }
                Map<String, Object> data = (Map<String, Object>) model.getValue();
                PricingEntry entry = toEntry(provider.getKey(), model.getKey(), data);
                ids.put(model.getKey(), entry);
                Object alias = data.get("model");
                if (alias != null && !alias.toString().equals(model.getKey())) {
                    aliases.putIfAbsent(alias.toString(), entry);
                }
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static PricingEntry toEntry(String provider, String id, Map<String, Object> data) {
        Map<String, Object> pricing = data.get("pricing") instanceof Map
                ? (Map<String, Object>) data.get("pricing")
                : Map.of();

        boolean image = "image".equalsIgnoreCase(String.valueOf(data.getOrDefault("type", "text")));
        if (!image) {
            return PricingEntry.builder()
                    .model(id)
                    .provider(provider)
                    .type(PricingEntry.ModelType.TEXT)
                    .input(decimal(pricing.get("input")))
                    .output(decimal(pricing.get("output")))
                    .cachedInput(decimal(pricing.get("cached_input")))
                    .reasoning(decimal(pricing.get("reasoning")))
                    .build();
        }

        Map<String, Map<String, BigDecimal>> imagePrices = new LinkedHashMap<>();
        for (Map.Entry<String, Object> quality : pricing.entrySet()) {
            if (!(quality.getValue() instanceof Map)) {
                continue;
            }
            Map<String, BigDecimal> sizes = new LinkedHashMap<>();
            for (Map.Entry<String, Object> size : ((Map<String, Object>) quality.getValue()).entrySet()) {
                sizes.put(size.getKey(), decimal(size.getValue()));
            }
            imagePrices.put(quality.getKey(), sizes);
        }
        return PricingEntry.builder()
                .model(id)
                .provider(provider)
                .type(PricingEntry.ModelType.IMAGE)
                .imagePrices(imagePrices)
                .build();
    }

    private static BigDecimal decimal(Object value) {
        if (value == null) {
            return null;
        }
        return new BigDecimal(value.toString());
    }
}
