package com.genway.config;

import com.genway.model.ErrorKind;
import com.genway.model.RetryPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration properties for Genway.
 */
@Data
@Component
@ConfigurationProperties(prefix = "genway")
public class GenwayProperties {

    private DefaultsConfig defaults = new DefaultsConfig();
    private Map<String, ProviderConfig> providers = new HashMap<>();
    private CacheConfig cache = new CacheConfig();
    private StoreConfig store = new StoreConfig();
    private PricingConfig pricing = new PricingConfig();
    private RetryConfig retry = new RetryConfig();
    private RateLimitConfig rateLimits = new RateLimitConfig();
    private PresetConfig presets = new PresetConfig();
    private BatchConfig batch = new BatchConfig();
    private List<ModelFamilyRule> modelFamilies = new ArrayList<>();

    @Data
    public static class DefaultsConfig {
        private String provider = "openai";
        private String model = "gpt-4.1-mini";
        private Duration timeout = Duration.ofSeconds(30);
        private Map<String, Object> options = new LinkedHashMap<>();
    }

    @Data
    public static class ProviderConfig {
        private boolean enabled = true;
        private String baseUrl;
        private String apiKey;
        /**
         * Extra headers; values may reference {api_key}.
         */
        private Map<String, String> headers = new LinkedHashMap<>();
    }

    @Data
    public static class CacheConfig {
        private boolean enabled = true;
        private Duration ttl = Duration.ofHours(1);
        private String prefix = "genway_cache";
        private int maxSize = 10000;
        private List<String> tags = new ArrayList<>(List.of("genway"));
        private boolean singleFlight = false;
    }

    @Data
    public static class StoreConfig {
        /**
         * "memory" or "redis".
         */
        private String type = "memory";
    }

    @Data
    public static class PricingConfig {
        private String currency = "USD";
        private BigDecimal exchangeRate = BigDecimal.ONE;
        private int decimalPlaces = 2;
        private String catalogLocation = "classpath:models.yaml";
    }

    @Data
    public static class RetryConfig {
        private int maxAttempts = 3;
        private Duration initialDelay = Duration.ofMillis(1000);
        private double multiplier = 2.0;
        private double jitter = 0.0;
        private Set<ErrorKind> retryableErrors = EnumSet.copyOf(RetryPolicy.DEFAULT_RETRYABLE);

        public RetryPolicy toPolicy() {
            return RetryPolicy.builder()
                    .maxAttempts(Math.max(1, maxAttempts))
                    .initialDelay(initialDelay)
                    .multiplier(multiplier)
                    .jitter(jitter)
                    .retryableErrorKinds(retryableErrors.isEmpty()
                            ? EnumSet.noneOf(ErrorKind.class)
                            : EnumSet.copyOf(retryableErrors))
                    .build();
        }
    }

    @Data
    public static class RateLimitConfig {
        private boolean enabled = true;
        private LimitConfig defaults = new LimitConfig();
        private Map<String, LimitConfig> providers = new HashMap<>();
        private Map<String, LimitConfig> models = new HashMap<>();
    }

    /**
     * Null or non-positive values are not enforced.
     */
    @Data
    public static class LimitConfig {
        private Integer requestsPerMinute;
        private Integer tokensPerMinute;
        private Integer requestsPerDay;

        public static LimitConfig of(Integer requestsPerMinute, Integer tokensPerMinute, Integer requestsPerDay) {
            LimitConfig limits = new LimitConfig();
            limits.setRequestsPerMinute(requestsPerMinute);
            limits.setTokensPerMinute(tokensPerMinute);
            limits.setRequestsPerDay(requestsPerDay);
            return limits;
        }
    }

    @Data
    public static class PresetConfig {
        private String location = "classpath*:presets/*.yaml";
    }

    @Data
    public static class BatchConfig {
        private int concurrency = 4;
        private Duration timeout = Duration.ofSeconds(120);
    }

    /**
     * Option rewrite applied to every model whose name matches one of the patterns.
     */
    @Data
    public static class ModelFamilyRule {
        private String name;
        private List<String> patterns = new ArrayList<>();
        private Map<String, String> renameOptions = new LinkedHashMap<>();
        private List<String> removeOptions = new ArrayList<>();
    }
}
