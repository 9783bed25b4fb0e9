package com.genway.support;

import com.genway.model.Preset;
import com.genway.repository.PresetRepository;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class InMemoryPresetRepository implements PresetRepository {

    private final Map<String, Preset> presets = new LinkedHashMap<>();

    public InMemoryPresetRepository add(Preset preset) {
        presets.put(preset.getName(), preset);
        return this;
    }

    @Override
    public Optional<Preset> get(String name) {
        return Optional.ofNullable(presets.get(name));
    }

    @Override
    public Set<String> names() {
        return presets.keySet();
    }

    @Override
    public void reload() {
    }
}
