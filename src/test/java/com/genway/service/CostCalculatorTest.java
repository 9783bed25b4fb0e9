package com.genway.service;

import com.genway.config.GenwayProperties;
import com.genway.model.PricingEntry;
import com.genway.model.Usage;
import com.genway.support.InMemoryPricingRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CostCalculatorTest {

    private InMemoryPricingRegistry registry;
    private GenwayProperties.PricingConfig pricing;
    private CostCalculator calculator;

    @BeforeEach
    void setUp() {
        registry = new InMemoryPricingRegistry()
                .add(PricingEntry.builder()
                        .model("gpt-4o")
                        .provider("openai")
                        .input(new BigDecimal("2.50"))
                        .output(new BigDecimal("10.00"))
                        .cachedInput(new BigDecimal("1.25"))
                        .build())
                .add(PricingEntry.builder()
                        .model("o3")
                        .provider("openai")
                        .input(new BigDecimal("2.00"))
                        .output(new BigDecimal("8.00"))
                        .reasoning(new BigDecimal("8.00"))
                        .build())
                .add(PricingEntry.builder()
                        .model("dall-e-3")
                        .provider("openai")
                        .type(PricingEntry.ModelType.IMAGE)
                        .imagePrices(Map.of(
                                "standard", Map.of("1024x1024", new BigDecimal("0.040")),
                                "hd", Map.of("1024x1792", new BigDecimal("0.120"))))
                        .build());

        pricing = new GenwayProperties.PricingConfig();
        pricing.setDecimalPlaces(10);
        calculator = new CostCalculator(registry, pricing);
    }

    @Test
    void testTextCost() {
        // 1000 * 2.50 / 1M + 500 * 10.00 / 1M
        assertEquals(new BigDecimal("0.0075000000"), calculator.calculate("gpt-4o", 1000, 500, 0, 0));
    }

    @Test
    void testCachedAndReasoningTokensPricedOnlyWhenConfigured() {
        assertEquals(new BigDecimal("0.0012500000"), calculator.calculate("gpt-4o", 0, 0, 1000, 0));
        assertEquals(new BigDecimal("0.0080000000"), calculator.calculate("o3", 0, 0, 0, 1000));
        // gpt-4o has no reasoning rate
        assertEquals(0, BigDecimal.ZERO.compareTo(calculator.calculate("gpt-4o", 0, 0, 0, 1000)));
    }

    @Test
    void testCostIsLinearInTokens() {
        BigDecimal single = calculator.calculate("gpt-4o", 1234, 567, 89, 0);
        for (int k = 2; k <= 5; k++) {
            BigDecimal scaled = calculator.calculate("gpt-4o", 1234 * k, 567 * k, 89 * k, 0);
            assertEquals(0, single.multiply(BigDecimal.valueOf(k)).compareTo(scaled), "k=" + k);
        }
    }

    @Test
    void testUnknownModelCostsZero() {
        assertEquals(0, BigDecimal.ZERO.compareTo(calculator.calculate("no-such-model", 1_000_000, 1_000_000, 0, 0)));
    }

    @Test
    void testImageCost() {
        assertEquals(0, new BigDecimal("0.04").compareTo(
                calculator.calculate("dall-e-3", Usage.empty(), Map.of())));
        assertEquals(0, new BigDecimal("0.36").compareTo(
                calculator.calculate("dall-e-3", Usage.empty(), Map.of("quality", "hd", "size", "1024x1792", "n", 3))));
        assertEquals(0, BigDecimal.ZERO.compareTo(
                calculator.calculate("dall-e-3", Usage.empty(), Map.of("size", "512x512"))));
    }

    @Test
    void testExchangeRateAndRounding() {
        pricing.setExchangeRate(new BigDecimal("150"));
        pricing.setDecimalPlaces(2);

        // 0.0075 USD * 150 = 1.125 -> 1.13
        assertEquals(new BigDecimal("1.13"), calculator.calculate("gpt-4o", 1000, 500, 0, 0));
    }

    @Test
    void testEstimateCost() {
        assertEquals(calculator.calculate("gpt-4o", 2000, 1000, 0, 0), calculator.estimateCost("gpt-4o", 2000, 1000));
    }
}
