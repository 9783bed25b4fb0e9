package com.genway.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Named bundle of default provider, model, system prompt and options.
 */
@Value
@Builder
public class Preset {

    String name;

    String provider;

    String model;

    String systemPrompt;

    @Builder.Default
    Map<String, Object> options = Map.of();
}
