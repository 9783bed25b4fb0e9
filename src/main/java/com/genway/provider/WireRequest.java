package com.genway.provider;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.Value;

import java.net.URI;
import java.util.Map;

/**
 * Provider-specific HTTP request, built before anything is sent.
 */
@Value
@Builder
public class WireRequest {

    URI uri;

    @Builder.Default
    Map<String, String> headers = Map.of();

    ObjectNode body;
}
