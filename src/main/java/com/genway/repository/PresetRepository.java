package com.genway.repository;

import com.genway.model.Preset;

import java.util.Optional;
import java.util.Set;

/**
 * Read-only source of named presets.
 */
public interface PresetRepository {

    Optional<Preset> get(String name);

    default boolean exists(String name) {
        return get(name).isPresent();
    }

    Set<String> names();

    /**
     * Re-read the backing catalogue.
     */
    void reload();
}
