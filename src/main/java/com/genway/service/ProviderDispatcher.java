package com.genway.service;

import com.genway.config.GenwayProperties;
import com.genway.config.GenwayProperties.ProviderConfig;
import com.genway.exception.ProviderConfigMissingException;
import com.genway.model.ResolvedConfig;
import com.genway.provider.ChatProvider;
import com.genway.provider.ProviderFactory;
import com.genway.provider.ProviderReply;
import com.genway.repository.ProviderConfigSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Sends one resolved request to its provider. Retries are the caller's concern.
 */
@Slf4j
@Service
public class ProviderDispatcher {

    private final ProviderFactory providerFactory;
    private final ProviderConfigSource providerConfigs;
    private final Duration defaultTimeout;

    public ProviderDispatcher(ProviderFactory providerFactory, ProviderConfigSource providerConfigs,
                              GenwayProperties properties) {
        this.providerFactory = providerFactory;
        this.providerConfigs = providerConfigs;
        this.defaultTimeout = properties.getDefaults().getTimeout();
    }

    public Mono<ProviderReply> dispatch(ResolvedConfig config) {
        return Mono.defer(() -> {
            ProviderConfig providerConfig = providerConfigs.find(config.getProvider())
                    .orElseThrow(() -> new ProviderConfigMissingException(config.getProvider()));
            ChatProvider provider = providerFactory.get(config.getProvider());

            log.info("Dispatching to {}: model={}", provider.getName(), config.getModel());
            return provider.complete(config, providerConfig, timeoutFor(config));
        });
    }

    /**
     * Option {@code timeout} in seconds, else the configured default.
     */
    Duration timeoutFor(ResolvedConfig config) {
        Object timeout = config.getOptions().get("timeout");
        if (timeout instanceof Number && ((Number) timeout).doubleValue() > 0) {
            return Duration.ofMillis(Math.round(((Number) timeout).doubleValue() * 1000));
        }
        if (timeout instanceof String) {
            try {
                double seconds = Double.parseDouble((String) timeout);
                if (seconds > 0) {
                    return Duration.ofMillis(Math.round(seconds * 1000));
                }
            } catch (NumberFormatException e) {
                log.warn("Ignoring invalid timeout option: {}", timeout);
            }
        }
        return defaultTimeout;
    }
}
