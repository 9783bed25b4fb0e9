package com.genway.config;

import com.genway.model.RetryPolicy;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared pipeline beans that are not tied to a single component.
 */
@Configuration
public class GatewayConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public RetryPolicy retryPolicy(GenwayProperties properties) {
        return properties.getRetry().toPolicy();
    }
}
