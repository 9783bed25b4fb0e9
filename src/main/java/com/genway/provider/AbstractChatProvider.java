package com.genway.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.genway.config.GenwayProperties.ProviderConfig;
import com.genway.exception.GatewayException;
import com.genway.exception.ProviderRequestException;
import com.genway.model.ErrorKind;
import com.genway.model.ResolvedConfig;
import com.genway.service.retry.ErrorClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ClientHttpRequest;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClientRequest;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Abstract base class for HTTP chat providers with common functionality.
 * Subclasses only describe the wire format; sending, status handling and error mapping live here.
 */
@Slf4j
public abstract class AbstractChatProvider implements ChatProvider {

    protected static final String API_KEY_PLACEHOLDER = "{api_key}";

    protected final WebClient webClient;
    protected final ObjectMapper objectMapper;

    protected AbstractChatProvider(WebClient webClient, ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<ProviderReply> complete(ResolvedConfig config, ProviderConfig providerConfig, Duration timeout) {
        return Mono.defer(() -> {
                    WireRequest request = buildRequest(config, providerConfig);
                    log.debug("Sending request to {}: model={}", getName(), config.getModel());

                    return webClient.post()
                            .uri(request.getUri())
                            .headers(headers -> request.getHeaders().forEach(headers::set))
                            .contentType(MediaType.APPLICATION_JSON)
                            .httpRequest(httpRequest -> applyResponseTimeout(httpRequest, timeout))
                            .bodyValue(request.getBody().toString())
                            .exchangeToMono(response -> response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> {
                                        if (!response.statusCode().is2xxSuccessful()) {
                                            return Mono.error(ProviderRequestException.httpStatus(
                                                    getName(), response.statusCode().value(), body));
                                        }
                                        return Mono.fromCallable(() -> parseResponse(readBody(body)));
                                    }));
                })
                .timeout(timeout)
                .onErrorMap(error -> !(error instanceof GatewayException), this::toProviderException)
                .doOnError(error -> log.warn("Request to {} failed: {}", getName(), error.getMessage()));
    }

    /**
     * Headers the provider always sends, before configured extra headers are applied.
     */
    protected abstract Map<String, String> defaultHeaders(ProviderConfig providerConfig);

    /**
     * Merge default headers with configured ones, substituting the API key placeholder.
     */
    protected Map<String, String> headers(ProviderConfig providerConfig) {
        Map<String, String> headers = new LinkedHashMap<>(defaultHeaders(providerConfig));
        String apiKey = providerConfig.getApiKey() != null ? providerConfig.getApiKey() : "";
        providerConfig.getHeaders().forEach((name, value) ->
                headers.put(name, value == null ? "" : value.replace(API_KEY_PLACEHOLDER, apiKey)));
        return headers;
    }

    /**
     * Configured base URL without a trailing slash, or the provider's public endpoint.
     */
    protected String baseUrl(ProviderConfig providerConfig, String fallback) {
        String baseUrl = providerConfig.getBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = fallback;
        }
        return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    /**
     * Copy non-null options onto a JSON object.
     */
    protected void putAll(ObjectNode target, Map<String, Object> values) {
        values.forEach((name, value) -> target.set(name, objectMapper.valueToTree(value)));
    }

    /**
     * Copy the listed option keys that are present and non-null.
     */
    protected static Map<String, Object> pick(Map<String, Object> options, String... keys) {
        Map<String, Object> picked = new LinkedHashMap<>();
        for (String key : keys) {
            Object value = options.get(key);
            if (value != null) {
                picked.put(key, value);
            }
        }
        return picked;
    }

    protected static int intAt(JsonNode node, String... fieldNames) {
        for (String fieldName : fieldNames) {
            JsonNode value = node.path(fieldName);
            if (value.isNumber()) {
                return value.asInt();
            }
        }
        return 0;
    }

    private static void applyResponseTimeout(ClientHttpRequest httpRequest, Duration timeout) {
        Object nativeRequest = httpRequest.getNativeRequest();
        if (nativeRequest instanceof HttpClientRequest) {
            ((HttpClientRequest) nativeRequest).responseTimeout(timeout);
        }
    }

    private JsonNode readBody(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw ProviderRequestException.malformed(getName(), "body is not JSON", body);
        }
    }

    private Throwable toProviderException(Throwable error) {
        if (error instanceof TimeoutException || ErrorClassifier.isReadTimeout(error)) {
            return new ProviderRequestException(getName(), ErrorKind.TIMEOUT,
                    getName() + " request timed out", error);
        }
        if (error instanceof WebClientRequestException) {
            return new ProviderRequestException(getName(), ErrorKind.CONNECTION,
                    "Failed to connect to " + getName() + ": " + error.getMessage(), error);
        }
        return error;
    }
}
