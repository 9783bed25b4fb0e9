package com.genway.service.resolution;

import com.genway.config.GenwayProperties;
import com.genway.config.GenwayProperties.ModelFamilyRule;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelFamilyAdjusterTest {

    private final ModelFamilyAdjuster adjuster = new ModelFamilyAdjuster(new GenwayProperties());

    @Test
    void testReasoningModelsGetCompletionTokens() {
        for (String model : List.of("o1", "o3", "o3-mini", "o4-mini", "gpt-5", "gpt-5-mini")) {
            Map<String, Object> adjusted = adjuster.adjust(model,
                    Map.of("max_tokens", 1000, "temperature", 0.7, "top_p", 0.9, "seed", 1));

            assertEquals(Map.of("max_completion_tokens", 1000, "seed", 1), adjusted, model);
        }
    }

    @Test
    void testOtherModelsUntouched() {
        Map<String, Object> options = Map.of("max_tokens", 1000, "temperature", 0.7);

        for (String model : List.of("gpt-4o", "gpt-4.1-mini", "claude-3-5-sonnet", "gemini-2.0-flash", "omni")) {
            assertEquals(options, adjuster.adjust(model, options), model);
        }
    }

    @Test
    void testCustomRule() {
        ModelFamilyRule rule = new ModelFamilyRule();
        rule.setName("legacy");
        rule.setPatterns(List.of("^legacy-"));
        rule.setRenameOptions(Map.of("max_tokens", "max_length"));
        rule.setRemoveOptions(List.of("top_p"));
        ModelFamilyAdjuster custom = new ModelFamilyAdjuster(List.of(rule));

        assertEquals(Map.of("max_length", 10, "temperature", 0.1),
                custom.adjust("legacy-1", Map.of("max_tokens", 10, "temperature", 0.1, "top_p", 1)));
    }
}
