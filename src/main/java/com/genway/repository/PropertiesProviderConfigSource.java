package com.genway.repository;

import com.genway.config.GenwayProperties;
import com.genway.config.GenwayProperties.ProviderConfig;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Provider settings from {@code genway.providers.*}.
 */
@Component
public class PropertiesProviderConfigSource implements ProviderConfigSource {

    private final GenwayProperties properties;

    public PropertiesProviderConfigSource(GenwayProperties properties) {
        this.properties = properties;
    }

    @Override
    public Optional<ProviderConfig> find(String provider) {
        return Optional.ofNullable(properties.getProviders().get(provider))
                .filter(ProviderConfig::isEnabled);
    }
}
