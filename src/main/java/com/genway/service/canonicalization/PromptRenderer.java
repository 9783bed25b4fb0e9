package com.genway.service.canonicalization;

import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Substitutes {@code {name}} placeholders. Placeholders without a matching variable are left as-is.
 */
@Component
public class PromptRenderer {

    public String render(String template, Map<String, String> vars) {
        if (template == null || vars == null || vars.isEmpty()) {
            return template;
        }
        String rendered = template;
        for (Map.Entry<String, String> var : vars.entrySet()) {
            rendered = rendered.replace("{" + var.getKey() + "}", var.getValue() != null ? var.getValue() : "");
        }
        return rendered;
    }
}
