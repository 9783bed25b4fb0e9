package com.genway.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.genway.model.Usage;
import lombok.Builder;
import lombok.Value;

/**
 * Content and usage extracted from a provider's reply, plus the raw body.
 */
@Value
@Builder
public class ProviderReply {

    @Builder.Default
    String content = "";

    @Builder.Default
    Usage usage = Usage.empty();

    JsonNode raw;
}
