package com.genway.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;

/**
 * Token counts reported by (or inferred for) a provider call.
 * Immutable; one instance is shared by a response, its cache entry and later hits.
 */
@Value
@Builder
@Jacksonized
public class Usage implements Serializable {

    private static final long serialVersionUID = 1L;

    @JsonProperty("input_tokens")
    int inputTokens;

    @JsonProperty("output_tokens")
    int outputTokens;

    @JsonProperty("total_tokens")
    int totalTokens;

    @JsonProperty("cached_tokens")
    int cachedTokens;

    @JsonProperty("reasoning_tokens")
    int reasoningTokens;

    public static Usage empty() {
        return Usage.builder().build();
    }

    /**
     * Build usage from raw counts, clamping negatives to zero.
     * A non-positive total is replaced by input + output.
     */
    public static Usage of(int input, int output, int total, int cached, int reasoning) {
        int in = Math.max(0, input);
        int out = Math.max(0, output);
        return Usage.builder()
                .inputTokens(in)
                .outputTokens(out)
                .totalTokens(total > 0 ? total : in + out)
                .cachedTokens(Math.max(0, cached))
                .reasoningTokens(Math.max(0, reasoning))
                .build();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return inputTokens == 0 && outputTokens == 0 && totalTokens == 0;
    }
}
