package com.genway.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.genway.config.GenwayProperties.ProviderConfig;
import com.genway.model.ResolvedConfig;
import com.genway.model.Usage;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Local provider that answers without any network call. Used for development and tests.
 */
@Component
public class MockProvider extends AbstractChatProvider {

    private static final URI LOCAL_URI = URI.create("mock://local");
    private static final int OUTPUT_TOKENS = 20;

    public MockProvider(WebClient webClient, ObjectMapper objectMapper) {
        super(webClient, objectMapper);
    }

    @Override
    public String getName() {
        return "mock";
    }

    @Override
    public Map<String, Object> transformOptions(Map<String, Object> options) {
        return options;
    }

    @Override
    public WireRequest buildRequest(ResolvedConfig config, ProviderConfig providerConfig) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", config.getModel());
        body.put("prompt", config.getPrompt());
        if (config.getSystemPrompt() != null) {
            body.put("system", config.getSystemPrompt());
        }
        putAll(body.putObject("options"), transformOptions(config.getOptions()));
        return WireRequest.builder()
                .uri(LOCAL_URI)
                .body(body)
                .build();
    }

    @Override
    protected Map<String, String> defaultHeaders(ProviderConfig providerConfig) {
        return Map.of();
    }

    @Override
    public Mono<ProviderReply> complete(ResolvedConfig config, ProviderConfig providerConfig, Duration timeout) {
        return Mono.fromCallable(() -> parseResponse(respond(buildRequest(config, providerConfig).getBody())));
    }

    @Override
    public ProviderReply parseResponse(JsonNode body) {
        JsonNode usage = body.path("usage");
        return ProviderReply.builder()
                .content(body.path("content").asText(""))
                .usage(Usage.of(intAt(usage, "input_tokens"), intAt(usage, "output_tokens"), 0, 0, 0))
                .raw(body)
                .build();
    }

    private JsonNode respond(ObjectNode request) {
        String prompt = request.path("prompt").asText("");
        String content = "Mock response to: " + prompt;
        if (request.hasNonNull("system")) {
            content += " (System: " + request.path("system").asText() + ")";
        }

        ObjectNode reply = objectMapper.createObjectNode();
        reply.put("model", request.path("model").asText());
        reply.put("content", content);
        reply.putObject("usage")
                .put("input_tokens", prompt.length() / 4)
                .put("output_tokens", OUTPUT_TOKENS);
        return reply;
    }
}
