package com.genway.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Provider-independent result of one call.
 * Failed calls carry {@code error} and {@code errorKind}, empty content and zero cost.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NormalizedResponse {

    @Builder.Default
    String content = "";

    @Builder.Default
    Usage usage = Usage.empty();

    @Builder.Default
    BigDecimal cost = BigDecimal.ZERO;

    @Builder.Default
    Map<String, Object> meta = Map.of();

    boolean cached;

    @JsonProperty("response_time_ms")
    long responseTimeMs;

    String error;

    @JsonProperty("error_kind")
    ErrorKind errorKind;

    String provider;

    String model;

    /**
     * Build a failure response; content and cost are forced empty.
     */
    public static NormalizedResponse failure(ErrorKind kind, String error, String provider, String model,
                                             long responseTimeMs, Map<String, Object> meta) {
        return NormalizedResponse.builder()
                .content("")
                .usage(Usage.empty())
                .cost(BigDecimal.ZERO)
                .meta(meta != null ? meta : Map.of())
                .cached(false)
                .responseTimeMs(Math.max(0, responseTimeMs))
                .error(error != null ? error : "Unknown error")
                .errorKind(kind != null ? kind : ErrorKind.INTERNAL)
                .provider(provider)
                .model(model)
                .build();
    }

    @JsonIgnore
    public boolean isSuccess() {
        return error == null;
    }
}
