package com.genway.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Fully merged request configuration, ready to dispatch.
 * Provider and model are never blank once built by the resolver.
 */
@Value
@Builder(toBuilder = true)
public class ResolvedConfig {

    String provider;

    String model;

    String prompt;

    String systemPrompt;

    @Builder.Default
    Map<String, Object> options = Map.of();

    @Builder.Default
    Map<String, String> vars = Map.of();

    boolean stream;
}
