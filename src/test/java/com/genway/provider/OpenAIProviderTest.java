package com.genway.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.genway.config.GenwayProperties.ProviderConfig;
import com.genway.config.JacksonConfiguration;
import com.genway.exception.ProviderRequestException;
import com.genway.model.ErrorKind;
import com.genway.model.ResolvedConfig;
import com.genway.model.Usage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.test.StepVerifier;

import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OpenAIProviderTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private ObjectMapper objectMapper;
    private StubExchange exchange;
    private OpenAIProvider provider;
    private ProviderConfig providerConfig;

    @BeforeEach
    void setUp() {
        objectMapper = JacksonConfiguration.createObjectMapper();
        exchange = new StubExchange();
        provider = new OpenAIProvider(exchange.webClient(), objectMapper);
        providerConfig = new ProviderConfig();
        providerConfig.setApiKey("sk-test");
    }

    private static ResolvedConfig config(String systemPrompt, Map<String, Object> options) {
        return ResolvedConfig.builder()
                .provider("openai")
                .model("gpt-4o")
                .prompt("Name a prime number.")
                .systemPrompt(systemPrompt)
                .options(options)
                .build();
    }

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    @Test
    void testBuildRequest() {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("temperature", 0.3);
        options.put("max_tokens", 100);
        options.put("stream", true);
        options.put("timeout", 10);
        options.put("unknown_knob", "x");

        WireRequest request = provider.buildRequest(config("Be brief.", options), providerConfig);

        assertEquals(URI.create("https://api.openai.com/v1/chat/completions"), request.getUri());
        assertEquals("Bearer sk-test", request.getHeaders().get(HttpHeaders.AUTHORIZATION));

        JsonNode body = request.getBody();
        assertEquals("gpt-4o", body.path("model").asText());
        assertEquals("system", body.path("messages").get(0).path("role").asText());
        assertEquals("Be brief.", body.path("messages").get(0).path("content").asText());
        assertEquals("user", body.path("messages").get(1).path("role").asText());
        assertEquals("Name a prime number.", body.path("messages").get(1).path("content").asText());
        assertEquals(0.3, body.path("temperature").asDouble());
        assertEquals(100, body.path("max_tokens").asInt());
        assertFalse(body.has("stream"));
        assertFalse(body.has("timeout"));
        assertFalse(body.has("unknown_knob"));
    }

    @Test
    void testNoSystemMessageWhenAbsent() {
        WireRequest request = provider.buildRequest(config(null, Map.of()), providerConfig);

        assertEquals(1, request.getBody().path("messages").size());
        assertEquals("user", request.getBody().path("messages").get(0).path("role").asText());
    }

    @Test
    void testCustomBaseUrlAndHeaders() {
        providerConfig.setBaseUrl("http://localhost:8089/v1/");
        providerConfig.getHeaders().put("X-Proxy-Auth", "token {api_key}");

        WireRequest request = provider.buildRequest(config(null, Map.of()), providerConfig);

        assertEquals(URI.create("http://localhost:8089/v1/chat/completions"), request.getUri());
        assertEquals("token sk-test", request.getHeaders().get("X-Proxy-Auth"));
    }

    @Test
    void testParseChatCompletion() throws Exception {
        ProviderReply reply = provider.parseResponse(json("""
                {"id":"chatcmpl-1","choices":[{"index":0,"message":{"role":"assistant","content":"7"}}],
                 "usage":{"prompt_tokens":14,"completion_tokens":2,"total_tokens":16,
                          "prompt_tokens_details":{"cached_tokens":4},
                          "completion_tokens_details":{"reasoning_tokens":0}}}
                """));

        assertEquals("7", reply.getContent());
        assertEquals(Usage.of(14, 2, 16, 4, 0), reply.getUsage());
        assertNotNull(reply.getRaw());
    }

    @Test
    void testParseResponsesStyleUsage() throws Exception {
        ProviderReply reply = provider.parseResponse(json("""
                {"choices":[{"message":{"content":"ok"}}],
                 "usage":{"input_tokens":30,"output_tokens":50,
                          "output_tokens_details":{"reasoning_tokens":40}}}
                """));

        assertEquals(30, reply.getUsage().getInputTokens());
        assertEquals(80, reply.getUsage().getTotalTokens());
        assertEquals(40, reply.getUsage().getReasoningTokens());
    }

    @Test
    void testNullContentAndMissingUsage() throws Exception {
        ProviderReply reply = provider.parseResponse(json("""
                {"choices":[{"message":{"content":null,"tool_calls":[]}}]}
                """));

        assertEquals("", reply.getContent());
        assertTrue(reply.getUsage().isEmpty());
    }

    @Test
    void testMissingChoicesIsMalformed() {
        ProviderRequestException error = assertThrows(ProviderRequestException.class,
                () -> provider.parseResponse(json("{\"object\":\"error\"}")));

        assertEquals(ErrorKind.MALFORMED_RESPONSE, error.getKind());
        assertEquals("{\"object\":\"error\"}", error.getRawBody());
    }

    @Test
    void testCompleteSendsRequest() {
        exchange.respond(HttpStatus.OK, """
                {"choices":[{"message":{"content":"11"}}],"usage":{"prompt_tokens":5,"completion_tokens":1}}
                """);

        StepVerifier.create(provider.complete(config(null, Map.of()), providerConfig, TIMEOUT))
                .assertNext(reply -> {
                    assertEquals("11", reply.getContent());
                    assertEquals(6, reply.getUsage().getTotalTokens());
                })
                .verifyComplete();

        assertEquals(HttpMethod.POST, exchange.lastRequest().method());
        assertEquals(URI.create("https://api.openai.com/v1/chat/completions"), exchange.lastRequest().url());
        assertEquals("Bearer sk-test", exchange.lastRequest().headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void testServerErrorStatus() {
        exchange.respond(HttpStatus.SERVICE_UNAVAILABLE, "{\"error\":{\"message\":\"overloaded\"}}");

        StepVerifier.create(provider.complete(config(null, Map.of()), providerConfig, TIMEOUT))
                .expectErrorSatisfies(error -> {
                    ProviderRequestException failure = assertInstanceOf(ProviderRequestException.class, error);
                    assertEquals(ErrorKind.SERVER_ERROR, failure.getKind());
                    assertEquals(503, failure.getStatusCode());
                    assertTrue(failure.getRawBody().contains("overloaded"));
                })
                .verify();
    }

    @Test
    void testStatusKinds() {
        exchange.respond(HttpStatus.TOO_MANY_REQUESTS, "{}");
        StepVerifier.create(provider.complete(config(null, Map.of()), providerConfig, TIMEOUT))
                .expectErrorSatisfies(error ->
                        assertEquals(ErrorKind.TOO_MANY_REQUESTS, ((ProviderRequestException) error).getKind()))
                .verify();

        exchange.respond(HttpStatus.UNAUTHORIZED, "{}");
        StepVerifier.create(provider.complete(config(null, Map.of()), providerConfig, TIMEOUT))
                .expectErrorSatisfies(error ->
                        assertEquals(ErrorKind.CLIENT_ERROR, ((ProviderRequestException) error).getKind()))
                .verify();
    }

    @Test
    void testNonJsonBodyIsMalformed() {
        exchange.respond(HttpStatus.OK, "<html>gateway</html>");

        StepVerifier.create(provider.complete(config(null, Map.of()), providerConfig, TIMEOUT))
                .expectErrorSatisfies(error -> {
                    ProviderRequestException failure = assertInstanceOf(ProviderRequestException.class, error);
                    assertEquals(ErrorKind.MALFORMED_RESPONSE, failure.getKind());
                    assertEquals("<html>gateway</html>", failure.getRawBody());
                })
                .verify();
    }

    @Test
    void testTimeout() {
        exchange.hang();

        StepVerifier.create(provider.complete(config(null, Map.of()), providerConfig, Duration.ofMillis(100)))
                .expectErrorSatisfies(error ->
                        assertEquals(ErrorKind.TIMEOUT, ((ProviderRequestException) error).getKind()))
                .verify(TIMEOUT);
    }

    @Test
    void testConnectionFailure() {
        URI uri = URI.create("https://api.openai.com/v1/chat/completions");
        exchange.fail(new WebClientRequestException(new ConnectException("Connection refused"),
                HttpMethod.POST, uri, new HttpHeaders()));

        StepVerifier.create(provider.complete(config(null, Map.of()), providerConfig, TIMEOUT))
                .expectErrorSatisfies(error -> {
                    assertEquals(ErrorKind.CONNECTION, ((ProviderRequestException) error).getKind());
                    assertInstanceOf(WebClientRequestException.class, error.getCause());
                })
                .verify();
    }

    @Test
    void testGrokUsesOwnEndpoint() {
        GrokProvider grok = new GrokProvider(exchange.webClient(), objectMapper);

        WireRequest request = grok.buildRequest(config(null, Map.of()), providerConfig);

        assertEquals("grok", grok.getName());
        assertEquals(URI.create("https://api.x.ai/v1/chat/completions"), request.getUri());
    }
}
