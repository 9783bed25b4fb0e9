package com.genway.repository;

import com.genway.config.GenwayProperties.ProviderConfig;

import java.util.Optional;

/**
 * Supplies connection settings per provider name.
 */
public interface ProviderConfigSource {

    /**
     * @return the config, or empty when the provider is not configured or disabled
     */
    Optional<ProviderConfig> find(String provider);
}
