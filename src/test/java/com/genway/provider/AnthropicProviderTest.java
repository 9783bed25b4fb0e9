package com.genway.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.genway.config.GenwayProperties.ProviderConfig;
import com.genway.config.JacksonConfiguration;
import com.genway.exception.ProviderRequestException;
import com.genway.model.ErrorKind;
import com.genway.model.ResolvedConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatusCode;
import reactor.test.StepVerifier;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AnthropicProviderTest {

    private ObjectMapper objectMapper;
    private StubExchange exchange;
    private AnthropicProvider provider;
    private ProviderConfig providerConfig;

    @BeforeEach
    void setUp() {
        objectMapper = JacksonConfiguration.createObjectMapper();
        exchange = new StubExchange();
        provider = new AnthropicProvider(exchange.webClient(), objectMapper);
        providerConfig = new ProviderConfig();
        providerConfig.setApiKey("sk-ant-test");
    }

    private static ResolvedConfig config(String systemPrompt, Map<String, Object> options) {
        return ResolvedConfig.builder()
                .provider("claude")
                .model("claude-3-5-sonnet-20241022")
                .prompt("Explain recursion.")
                .systemPrompt(systemPrompt)
                .options(options)
                .build();
    }

    @Test
    void testBuildRequestUsesTopLevelSystem() {
        WireRequest request = provider.buildRequest(
                config("You are a tutor.", Map.of("temperature", 0.5, "frequency_penalty", 1)), providerConfig);

        assertEquals(URI.create("https://api.anthropic.com/v1/messages"), request.getUri());
        assertEquals("sk-ant-test", request.getHeaders().get("x-api-key"));
        assertEquals("2023-06-01", request.getHeaders().get("anthropic-version"));

        JsonNode body = request.getBody();
        assertEquals("You are a tutor.", body.path("system").asText());
        assertEquals(1, body.path("messages").size());
        assertEquals("user", body.path("messages").get(0).path("role").asText());
        assertEquals(0.5, body.path("temperature").asDouble());
        assertFalse(body.has("frequency_penalty"));
    }

    @Test
    void testMaxTokensAlwaysSent() {
        assertEquals(4096, provider.buildRequest(config(null, Map.of()), providerConfig)
                .getBody().path("max_tokens").asInt());
        assertEquals(256, provider.buildRequest(config(null, Map.of("max_tokens", 256)), providerConfig)
                .getBody().path("max_tokens").asInt());
        assertFalse(provider.buildRequest(config(null, Map.of()), providerConfig).getBody().has("system"));
    }

    @Test
    void testParseJoinsTextBlocks() throws Exception {
        ProviderReply reply = provider.parseResponse(objectMapper.readTree("""
                {"id":"msg_1","type":"message","role":"assistant",
                 "content":[{"type":"text","text":"A function "},
                            {"type":"tool_use","id":"t1","name":"lookup","input":{}},
                            {"type":"text","text":"that calls itself."}],
                 "usage":{"input_tokens":12,"output_tokens":7,"cache_read_input_tokens":3}}
                """));

        assertEquals("A function that calls itself.", reply.getContent());
        assertEquals(12, reply.getUsage().getInputTokens());
        assertEquals(7, reply.getUsage().getOutputTokens());
        assertEquals(19, reply.getUsage().getTotalTokens());
        assertEquals(3, reply.getUsage().getCachedTokens());
    }

    @Test
    void testMissingContentIsMalformed() {
        ProviderRequestException error = assertThrows(ProviderRequestException.class,
                () -> provider.parseResponse(objectMapper.readTree("{\"type\":\"message\"}")));

        assertEquals(ErrorKind.MALFORMED_RESPONSE, error.getKind());
    }

    @Test
    void testOverloadedStatus() {
        exchange.respond(HttpStatusCode.valueOf(529), "{\"type\":\"error\",\"error\":{\"type\":\"overloaded_error\"}}");

        StepVerifier.create(provider.complete(config(null, Map.of()), providerConfig, Duration.ofSeconds(5)))
                .expectErrorSatisfies(error -> {
                    assertEquals(ErrorKind.SERVER_ERROR, ((ProviderRequestException) error).getKind());
                    assertEquals(529, ((ProviderRequestException) error).getStatusCode());
                })
                .verify();
    }
}
