package com.genway.repository;

import com.genway.config.GenwayProperties;
import com.genway.model.Preset;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class YamlPresetRepositoryTest {

    @Test
    void testLoadsShippedPresets() {
        YamlPresetRepository repository = new YamlPresetRepository(new GenwayProperties());

        assertTrue(repository.names().containsAll(Set.of("default", "ask", "create", "analyze", "think", "code")));
        Preset think = repository.get("think").orElseThrow();
        assertEquals("openai", think.getProvider());
        assertEquals("o4-mini", think.getModel());
        assertNotNull(think.getSystemPrompt());
    }

    @Test
    void testParsesFieldsAndFallsBackToDefaults() {
        GenwayProperties.DefaultsConfig defaults = new GenwayProperties.DefaultsConfig();
        defaults.setProvider("gemini");
        defaults.setModel("gemini-2.0-flash");
        YamlPresetRepository repository = new YamlPresetRepository(
                "classpath*:test-presets/*.yaml", defaults, new PathMatchingResourcePatternResolver());

        Preset summarize = repository.get("summarize").orElseThrow();
        assertEquals("claude", summarize.getProvider());
        assertEquals("claude-3-5-haiku-20241022", summarize.getModel());
        assertEquals("Summarize {topic} in one paragraph.", summarize.getSystemPrompt());
        assertEquals(0.2, summarize.getOptions().get("temperature"));
        assertEquals(500, summarize.getOptions().get("max_tokens"));

        Preset minimal = repository.get("minimal").orElseThrow();
        assertEquals("gemini", minimal.getProvider());
        assertEquals("gemini-2.0-flash", minimal.getModel());
        assertTrue(minimal.getOptions().isEmpty());
    }

    @Test
    void testUnknownPreset() {
        YamlPresetRepository repository = new YamlPresetRepository(
                "classpath*:test-presets/*.yaml", new GenwayProperties.DefaultsConfig(),
                new PathMatchingResourcePatternResolver());

        assertTrue(repository.get("nope").isEmpty());
        assertFalse(repository.exists("nope"));
        assertTrue(repository.exists("summarize"));
    }
}
