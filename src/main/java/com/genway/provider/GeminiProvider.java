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
import org.springframework.web.util.UriComponentsBuilder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Google Gemini generateContent provider. Authenticates with the {@code key} query parameter.
 */
@Component
public class GeminiProvider extends AbstractChatProvider {

    private static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com/v1beta";

    public GeminiProvider(WebClient webClient, ObjectMapper objectMapper) {
        super(webClient, objectMapper);
    }

    @Override
    public String getName() {
        return "gemini";
    }

    /**
     * Returns the {@code generationConfig} entries.
     */
    @Override
    public Map<String, Object> transformOptions(Map<String, Object> options) {
        Map<String, Object> generationConfig = new LinkedHashMap<>();
        if (options.get("temperature") != null) {
            generationConfig.put("temperature", options.get("temperature"));
        }
        if (options.get("max_tokens") != null) {
            generationConfig.put("maxOutputTokens", options.get("max_tokens"));
        }
        if (options.get("top_p") != null) {
            generationConfig.put("topP", options.get("top_p"));
        }
        return generationConfig;
    }

    @Override
    public WireRequest buildRequest(ResolvedConfig config, ProviderConfig providerConfig) {
        ObjectNode body = objectMapper.createObjectNode();

        ObjectNode user = body.putArray("contents").addObject();
        user.put("role", "user");
        user.putArray("parts").addObject().put("text", config.getPrompt());

        if (config.getSystemPrompt() != null && !config.getSystemPrompt().isEmpty()) {
            body.putObject("systemInstruction")
                    .putArray("parts")
                    .addObject()
                    .put("text", config.getSystemPrompt());
        }

        Map<String, Object> generationConfig = transformOptions(config.getOptions());
        if (!generationConfig.isEmpty()) {
            putAll(body.putObject("generationConfig"), generationConfig);
        }

        return WireRequest.builder()
                .uri(UriComponentsBuilder.fromHttpUrl(baseUrl(providerConfig, DEFAULT_BASE_URL))
                        .path("/models/{model}:generateContent")
                        .queryParam("key", "{key}")
                        .encode()
                        .buildAndExpand(config.getModel(),
                                providerConfig.getApiKey() != null ? providerConfig.getApiKey() : "")
                        .toUri())
                .headers(headers(providerConfig))
                .body(body)
                .build();
    }

    @Override
    protected Map<String, String> defaultHeaders(ProviderConfig providerConfig) {
        return Map.of();
    }

    @Override
    public ProviderReply parseResponse(JsonNode body) {
        JsonNode candidates = body.path("candidates");
        if (!candidates.isArray() || candidates.isEmpty()) {
            throw ProviderRequestException.malformed(getName(), "missing candidates", body.toString());
        }

        StringBuilder text = new StringBuilder();
        for (JsonNode part : candidates.get(0).path("content").path("parts")) {
            // Thinking models return their reasoning as separate parts
            if (!part.path("thought").asBoolean(false)) {
                text.append(part.path("text").asText(""));
            }
        }

        JsonNode usage = body.path("usageMetadata");
        return ProviderReply.builder()
                .content(text.toString())
                .usage(Usage.of(
                        intAt(usage, "promptTokenCount"),
                        intAt(usage, "candidatesTokenCount"),
                        intAt(usage, "totalTokenCount"),
                        intAt(usage, "cachedContentTokenCount"),
                        intAt(usage, "thoughtsTokenCount")))
                .raw(body)
                .build();
    }
}
