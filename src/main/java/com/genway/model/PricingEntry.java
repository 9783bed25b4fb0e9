package com.genway.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Per-model pricing in USD.
 * Text rates are per one million tokens; image prices are per generated image.
 */
@Value
@Builder
public class PricingEntry {

    public enum ModelType {
        TEXT,
        IMAGE
    }

    String model;

    String provider;

    @Builder.Default
    ModelType type = ModelType.TEXT;

    BigDecimal input;

    BigDecimal output;

    BigDecimal cachedInput;

    BigDecimal reasoning;

    /**
     * quality -> size -> price per image.
     */
    @Builder.Default
    Map<String, Map<String, BigDecimal>> imagePrices = Map.of();

    public boolean isImage() {
        return type == ModelType.IMAGE;
    }
}
