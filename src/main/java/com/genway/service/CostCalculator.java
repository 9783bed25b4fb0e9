package com.genway.service;

import com.genway.config.GenwayProperties;
import com.genway.model.PricingEntry;
import com.genway.model.Usage;
import com.genway.repository.PricingRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Optional;

/**
 * Prices a call from its token usage.
 *
 * Text models: {@code (in*input + out*output + cached*cachedInput + reasoning*reasoning) / 1M},
 * the cached and reasoning terms only where the catalogue prices them.
 * Image models: {@code price[quality][size] * n}.
 * The USD amount is converted with the configured exchange rate and rounded HALF_UP.
 */
@Slf4j
@Service
public class CostCalculator {

    private static final BigDecimal ONE_MILLION = BigDecimal.valueOf(1_000_000);
    private static final String DEFAULT_QUALITY = "standard";
    private static final String DEFAULT_SIZE = "1024x1024";

    private final PricingRegistry pricingRegistry;
    private final GenwayProperties.PricingConfig pricing;

    @Autowired
    public CostCalculator(PricingRegistry pricingRegistry, GenwayProperties properties) {
        this(pricingRegistry, properties.getPricing());
    }

    CostCalculator(PricingRegistry pricingRegistry, GenwayProperties.PricingConfig pricing) {
        this.pricingRegistry = pricingRegistry;
        this.pricing = pricing;
    }

    public BigDecimal calculate(String model, int inputTokens, int outputTokens, int cachedTokens, int reasoningTokens) {
        return calculate(model, inputTokens, outputTokens, cachedTokens, reasoningTokens, Map.of());
    }

    public BigDecimal calculate(String model, Usage usage, Map<String, Object> options) {
        if (usage == null) {
            usage = Usage.empty();
        }
        return calculate(model, usage.getInputTokens(), usage.getOutputTokens(),
                usage.getCachedTokens(), usage.getReasoningTokens(), options);
    }

    /**
     * @param imageOptions {@code quality}, {@code size} and {@code n}; ignored for text models
     */
    public BigDecimal calculate(String model, int inputTokens, int outputTokens, int cachedTokens,
                                int reasoningTokens, Map<String, Object> imageOptions) {
        Optional<PricingEntry> entry = pricingRegistry.find(model);
        if (entry.isEmpty()) {
            log.debug("No pricing for model {}, cost is 0", model);
            return round(BigDecimal.ZERO);
        }

        BigDecimal usd = entry.get().isImage()
                ? imageCost(entry.get(), imageOptions != null ? imageOptions : Map.of())
                : textCost(entry.get(), inputTokens, outputTokens, cachedTokens, reasoningTokens);

        return round(usd.multiply(pricing.getExchangeRate()));
    }

    /**
     * Cost before a call, from estimated input and output only.
     */
    public BigDecimal estimateCost(String model, int estimatedInputTokens, int estimatedOutputTokens) {
        return calculate(model, estimatedInputTokens, estimatedOutputTokens, 0, 0);
    }

    public String getCurrency() {
        return pricing.getCurrency();
    }

    private BigDecimal textCost(PricingEntry entry, int inputTokens, int outputTokens,
                                int cachedTokens, int reasoningTokens) {
        BigDecimal perMillion = BigDecimal.ZERO
                .add(rate(entry.getInput(), inputTokens))
                .add(rate(entry.getOutput(), outputTokens));
        if (cachedTokens > 0) {
            perMillion = perMillion.add(rate(entry.getCachedInput(), cachedTokens));
        }
        if (reasoningTokens > 0) {
            perMillion = perMillion.add(rate(entry.getReasoning(), reasoningTokens));
        }
        return perMillion.divide(ONE_MILLION);
    }

    private BigDecimal imageCost(PricingEntry entry, Map<String, Object> options) {
        String quality = String.valueOf(options.getOrDefault("quality", DEFAULT_QUALITY));
        String size = String.valueOf(options.getOrDefault("size", DEFAULT_SIZE));
        int count = options.get("n") instanceof Number ? ((Number) options.get("n")).intValue() : 1;

        BigDecimal perImage = entry.getImagePrices()
                .getOrDefault(quality, Map.of())
                .getOrDefault(size, BigDecimal.ZERO);
        return perImage.multiply(BigDecimal.valueOf(Math.max(0, count)));
    }

    private static BigDecimal rate(BigDecimal pricePerMillion, int tokens) {
        if (pricePerMillion == null || tokens <= 0) {
            return BigDecimal.ZERO;
        }
        return pricePerMillion.multiply(BigDecimal.valueOf(tokens));
    }

    private BigDecimal round(BigDecimal amount) {
        return amount.setScale(pricing.getDecimalPlaces(), RoundingMode.HALF_UP);
    }
}
