package com.genway.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.genway.config.GenwayProperties.ProviderConfig;
import com.genway.model.ResolvedConfig;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * Interface for chat providers.
 * Implementations handle provider-specific authentication, request/response mapping,
 * and API communication.
 */
public interface ChatProvider {

    /**
     * Get provider name (e.g., "openai", "claude", "gemini").
     *
     * @return provider name
     */
    String getName();

    /**
     * Map generic options to the provider's parameter names, dropping unsupported and null ones.
     *
     * @param options merged request options
     * @return provider parameters
     */
    Map<String, Object> transformOptions(Map<String, Object> options);

    /**
     * Build the HTTP request for a resolved config.
     *
     * @param config         resolved request
     * @param providerConfig connection settings
     * @return wire request
     */
    WireRequest buildRequest(ResolvedConfig config, ProviderConfig providerConfig);

    /**
     * Extract content and usage from a successful reply.
     *
     * @param body parsed response body
     * @return reply
     * @throws com.genway.exception.ProviderRequestException if the body is not in the expected shape
     */
    ProviderReply parseResponse(JsonNode body);

    /**
     * Send one request.
     *
     * @param config         resolved request
     * @param providerConfig connection settings
     * @param timeout        per-call timeout
     * @return reply, or an error carrying an {@link com.genway.model.ErrorKind}
     */
    Mono<ProviderReply> complete(ResolvedConfig config, ProviderConfig providerConfig, Duration timeout);
}
