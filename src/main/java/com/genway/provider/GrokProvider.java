package com.genway.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * xAI Grok provider. The API is OpenAI-compatible.
 */
@Component
public class GrokProvider extends OpenAIProvider {

    private static final String DEFAULT_BASE_URL = "https://api.x.ai/v1";

    public GrokProvider(WebClient webClient, ObjectMapper objectMapper) {
        super(webClient, objectMapper);
    }

    @Override
    public String getName() {
        return "grok";
    }

    @Override
    protected String defaultBaseUrl() {
        return DEFAULT_BASE_URL;
    }
}
