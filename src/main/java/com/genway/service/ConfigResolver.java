package com.genway.service;

import com.genway.config.GenwayProperties;
import com.genway.exception.ConfigurationException;
import com.genway.exception.PresetNotFoundException;
import com.genway.model.Preset;
import com.genway.model.RequestSpec;
import com.genway.model.ResolvedConfig;
import com.genway.repository.PresetRepository;
import com.genway.service.canonicalization.PromptRenderer;
import com.genway.service.resolution.ModelFamilyAdjuster;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Merges a request with its preset and the process defaults.
 *
 * Provider, model and system prompt: request, then preset, then defaults.
 * Options: defaults, overridden by the preset, overridden by the request.
 */
@Slf4j
@Service
public class ConfigResolver {

    private final PresetRepository presets;
    private final ModelFamilyAdjuster modelFamilyAdjuster;
    private final PromptRenderer promptRenderer;
    private final GenwayProperties.DefaultsConfig defaults;

    public ConfigResolver(PresetRepository presets, ModelFamilyAdjuster modelFamilyAdjuster,
                          PromptRenderer promptRenderer, GenwayProperties properties) {
        this.presets = presets;
        this.modelFamilyAdjuster = modelFamilyAdjuster;
        this.promptRenderer = promptRenderer;
        this.defaults = properties.getDefaults();
    }

    /**
     * @throws PresetNotFoundException if the named preset does not exist
     * @throws ConfigurationException  if no provider or model can be determined
     */
    public ResolvedConfig resolve(RequestSpec request) {
        if (request.getPrompt() == null) {
            throw new ConfigurationException("Prompt is required");
        }

        Preset preset = findPreset(request.getPresetName());

        String provider = firstNonBlank(request.getProvider(), preset.getProvider(), defaults.getProvider());
        String model = firstNonBlank(request.getModel(), preset.getModel(), defaults.getModel());
        if (provider == null) {
            throw new ConfigurationException("No provider configured for preset '" + preset.getName() + "'");
        }
        if (model == null) {
            throw new ConfigurationException("No model configured for preset '" + preset.getName() + "'");
        }
        String systemPrompt = request.getSystemPrompt() != null ? request.getSystemPrompt() : preset.getSystemPrompt();

        Map<String, Object> options = new LinkedHashMap<>(defaults.getOptions());
        options.putAll(preset.getOptions());
        options.putAll(request.getOptions());

        Map<String, String> vars = request.getVars();

        ResolvedConfig resolved = ResolvedConfig.builder()
                .provider(provider)
                .model(model)
                .prompt(promptRenderer.render(request.getPrompt(), vars))
                .systemPrompt(promptRenderer.render(systemPrompt, vars))
                .options(Collections.unmodifiableMap(modelFamilyAdjuster.adjust(model, options)))
                .vars(vars)
                .stream(request.isStream())
                .build();

        log.debug("Resolved request: preset={}, provider={}, model={}", preset.getName(), provider, model);
        return resolved;
    }

    private Preset findPreset(String name) {
        return presets.get(name).orElseGet(() -> {
            if (!RequestSpec.DEFAULT_PRESET.equals(name)) {
                throw new PresetNotFoundException(name);
            }
            log.debug("No '{}' preset found, using process defaults", name);
            return Preset.builder()
                    .name(name)
                    .provider(defaults.getProvider())
                    .model(defaults.getModel())
                    .build();
        });
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
