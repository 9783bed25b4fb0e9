package com.genway.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.genway.config.GenwayProperties.ProviderConfig;
import com.genway.exception.ProviderRequestException;
import com.genway.model.ResolvedConfig;
import com.genway.model.Usage;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.util.Map;

/**
 * OpenAI chat completions provider.
 */
@Component
public class OpenAIProvider extends AbstractChatProvider {

    private static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";

    private static final String[] SUPPORTED_OPTIONS = {
            "temperature", "max_tokens", "max_completion_tokens", "top_p",
            "frequency_penalty", "presence_penalty"
    };

    public OpenAIProvider(WebClient webClient, ObjectMapper objectMapper) {
        super(webClient, objectMapper);
    }

    @Override
    public String getName() {
        return "openai";
    }

    protected String defaultBaseUrl() {
        return DEFAULT_BASE_URL;
    }

    @Override
    public Map<String, Object> transformOptions(Map<String, Object> options) {
        return pick(options, SUPPORTED_OPTIONS);
    }

    @Override
    public WireRequest buildRequest(ResolvedConfig config, ProviderConfig providerConfig) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", config.getModel());

        ArrayNode messages = body.putArray("messages");
        if (config.getSystemPrompt() != null && !config.getSystemPrompt().isEmpty()) {
            messages.addObject()
                    .put("role", "system")
                    .put("content", config.getSystemPrompt());
        }
        messages.addObject()
                .put("role", "user")
                .put("content", config.getPrompt());

        putAll(body, transformOptions(config.getOptions()));

        return WireRequest.builder()
                .uri(URI.create(baseUrl(providerConfig, defaultBaseUrl()) + "/chat/completions"))
                .headers(headers(providerConfig))
                .body(body)
                .build();
    }

    @Override
    protected Map<String, String> defaultHeaders(ProviderConfig providerConfig) {
        return Map.of(HttpHeaders.AUTHORIZATION, "Bearer " + providerConfig.getApiKey());
    }

    @Override
    public ProviderReply parseResponse(JsonNode body) {
        JsonNode choices = body.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw ProviderRequestException.malformed(getName(), "missing choices", body.toString());
        }

        JsonNode message = choices.get(0).path("message");
        if (message.isMissingNode()) {
            throw ProviderRequestException.malformed(getName(), "missing choices[0].message", body.toString());
        }

        // Content is null when the model answers with tool calls only
        JsonNode content = message.path("content");
        String text = content.isTextual() ? content.asText() : "";

        return ProviderReply.builder()
                .content(text)
                .usage(parseUsage(body.path("usage")))
                .raw(body)
                .build();
    }

    /**
     * Accepts both the chat ({@code prompt_tokens}) and responses ({@code input_tokens}) usage shapes.
     */
    protected Usage parseUsage(JsonNode usage) {
        if (usage.isMissingNode() || usage.isNull()) {
            return Usage.empty();
        }
        JsonNode inputDetails = usage.has("prompt_tokens_details")
                ? usage.path("prompt_tokens_details")
                : usage.path("input_tokens_details");
        JsonNode outputDetails = usage.has("completion_tokens_details")
                ? usage.path("completion_tokens_details")
                : usage.path("output_tokens_details");

        return Usage.of(
                intAt(usage, "prompt_tokens", "input_tokens"),
                intAt(usage, "completion_tokens", "output_tokens"),
                intAt(usage, "total_tokens"),
                intAt(inputDetails, "cached_tokens"),
                intAt(outputDetails, "reasoning_tokens"));
    }
}
