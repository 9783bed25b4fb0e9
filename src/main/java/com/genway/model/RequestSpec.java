package com.genway.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Caller-supplied generation request.
 * Provider, model and system prompt are optional overrides on top of the named preset.
 */
@Value
@Builder(toBuilder = true)
public class RequestSpec {

    public static final String DEFAULT_PRESET = "default";
    public static final String ANONYMOUS_CALLER = "anonymous";

    String prompt;

    String systemPrompt;

    String provider;

    String model;

    @Singular
    Map<String, Object> options;

    @Singular("variable")
    Map<String, String> vars;

    boolean stream;

    @Builder.Default
    String presetName = DEFAULT_PRESET;

    /**
     * Identity used to scope rate-limit windows.
     */
    @Builder.Default
    String callerId = ANONYMOUS_CALLER;

    public static RequestSpec of(String prompt) {
        return RequestSpec.builder().prompt(prompt).build();
    }

    public String getPresetName() {
        return presetName == null || presetName.isBlank() ? DEFAULT_PRESET : presetName;
    }

    public String getCallerId() {
        return callerId == null || callerId.isBlank() ? ANONYMOUS_CALLER : callerId;
    }
}
