package com.genway.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.genway.config.GenwayProperties.ProviderConfig;
import com.genway.exception.ProviderRequestException;
import com.genway.model.ResolvedConfig;
import com.genway.model.Usage;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Anthropic (Claude) messages provider.
 */
@Component
public class AnthropicProvider extends AbstractChatProvider {

    private static final String DEFAULT_BASE_URL = "https://api.anthropic.com/v1";
    private static final String ANTHROPIC_VERSION = "2023-06-01";
    private static final int DEFAULT_MAX_TOKENS = 4096;

    public AnthropicProvider(WebClient webClient, ObjectMapper objectMapper) {
        super(webClient, objectMapper);
    }

    @Override
    public String getName() {
        return "claude";
    }

    /**
     * Claude requires {@code max_tokens} on every request.
     */
    @Override
    public Map<String, Object> transformOptions(Map<String, Object> options) {
        Map<String, Object> transformed = new LinkedHashMap<>();
        Object maxTokens = options.get("max_tokens");
        transformed.put("max_tokens", maxTokens != null ? maxTokens : DEFAULT_MAX_TOKENS);
        transformed.putAll(pick(options, "temperature", "top_p"));
        return transformed;
    }

    @Override
    public WireRequest buildRequest(ResolvedConfig config, ProviderConfig providerConfig) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", config.getModel());

        body.putArray("messages")
                .addObject()
                .put("role", "user")
                .put("content", config.getPrompt());

        if (config.getSystemPrompt() != null && !config.getSystemPrompt().isEmpty()) {
            body.put("system", config.getSystemPrompt());
        }

        putAll(body, transformOptions(config.getOptions()));

        return WireRequest.builder()
                .uri(URI.create(baseUrl(providerConfig, DEFAULT_BASE_URL) + "/messages"))
                .headers(headers(providerConfig))
                .body(body)
                .build();
    }

    @Override
    protected Map<String, String> defaultHeaders(ProviderConfig providerConfig) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("x-api-key", providerConfig.getApiKey() != null ? providerConfig.getApiKey() : "");
        headers.put("anthropic-version", ANTHROPIC_VERSION);
        return headers;
    }

    @Override
    public ProviderReply parseResponse(JsonNode body) {
        JsonNode content = body.path("content");
        if (!content.isArray()) {
            throw ProviderRequestException.malformed(getName(), "missing content blocks", body.toString());
        }

        StringBuilder text = new StringBuilder();
        for (JsonNode block : content) {
            if ("text".equals(block.path("type").asText())) {
                text.append(block.path("text").asText());
            }
        }

        JsonNode usage = body.path("usage");
        return ProviderReply.builder()
                .content(text.toString())
                .usage(Usage.of(
                        intAt(usage, "input_tokens"),
                        intAt(usage, "output_tokens"),
                        0,
                        intAt(usage, "cache_read_input_tokens"),
                        0))
                .raw(body)
                .build();
    }
}
