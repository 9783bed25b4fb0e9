package com.genway.service.resolution;

import com.genway.config.GenwayProperties;
import com.genway.config.GenwayProperties.ModelFamilyRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Rewrites options for model families whose APIs reject the generic parameter names.
 * Rules come from {@code genway.model-families}; without any, the OpenAI reasoning rule applies.
 */
@Slf4j
@Component
public class ModelFamilyAdjuster {

    private final List<CompiledRule> rules;

    @Autowired
    public ModelFamilyAdjuster(GenwayProperties properties) {
        this(properties.getModelFamilies().isEmpty()
                ? List.of(openAiReasoningRule())
                : properties.getModelFamilies());
    }

    ModelFamilyAdjuster(List<ModelFamilyRule> rules) {
        List<CompiledRule> compiled = new ArrayList<>();
        for (ModelFamilyRule rule : rules) {
            List<Pattern> patterns = new ArrayList<>();
            for (String pattern : rule.getPatterns()) {
                patterns.add(Pattern.compile(pattern, Pattern.CASE_INSENSITIVE));
            }
            compiled.add(new CompiledRule(rule, patterns));
        }
        this.rules = List.copyOf(compiled);
    }

    /**
     * o1, o3, o4-mini and gpt-5 take max_completion_tokens and fix temperature/top_p.
     */
    public static ModelFamilyRule openAiReasoningRule() {
        ModelFamilyRule rule = new ModelFamilyRule();
        rule.setName("openai-reasoning");
        rule.setPatterns(new ArrayList<>(List.of("^o[1-9](-|$)", "^gpt-5")));
        rule.setRenameOptions(new LinkedHashMap<>(Map.of("max_tokens", "max_completion_tokens")));
        rule.setRemoveOptions(new ArrayList<>(List.of("temperature", "top_p")));
        return rule;
    }

    /**
     * @return a new map; the input is not modified
     */
    public Map<String, Object> adjust(String model, Map<String, Object> options) {
        Map<String, Object> adjusted = new LinkedHashMap<>(options);
        if (model == null) {
            return adjusted;
        }
        for (CompiledRule rule : rules) {
            if (!rule.matches(model)) {
                continue;
            }
            rule.rule().getRenameOptions().forEach((from, to) -> {
                if (adjusted.containsKey(from)) {
                    Object value = adjusted.remove(from);
                    adjusted.putIfAbsent(to, value);
                }
            });
            rule.rule().getRemoveOptions().forEach(adjusted::remove);
            log.debug("Applied model family rule {} to {}", rule.rule().getName(), model);
        }
        return adjusted;
    }

    private record CompiledRule(ModelFamilyRule rule, List<Pattern> patterns) {

        boolean matches(String model) {
            for (Pattern pattern : patterns) {
                if (pattern.matcher(model).find()) {
                    return true;
                }
            }
            return false;
        }
    }
}
