package com.genway.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.genway.config.GenwayProperties.ProviderConfig;
import com.genway.model.ResolvedConfig;
import com.genway.model.Usage;
import com.genway.provider.ChatProvider;
import com.genway.provider.ProviderReply;
import com.genway.provider.WireRequest;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Provider whose behaviour is set per test. Counts calls and keeps the configs it received.
 */
public class StubChatProvider implements ChatProvider {

    private final String name;
    private final AtomicInteger calls = new AtomicInteger();
    private final List<ResolvedConfig> received = new CopyOnWriteArrayList<>();
    private volatile Function<ResolvedConfig, Mono<ProviderReply>> behaviour;

    public StubChatProvider(String name) {
        this.name = name;
        this.behaviour = config -> Mono.just(reply("Echo: " + config.getPrompt(), 10, 5));
    }

    public static ProviderReply reply(String content, int inputTokens, int outputTokens) {
        return ProviderReply.builder()
                .content(content)
                .usage(Usage.of(inputTokens, outputTokens, 0, 0, 0))
                .build();
    }

    public void respondWith(Function<ResolvedConfig, Mono<ProviderReply>> behaviour) {
        this.behaviour = behaviour;
    }

    public int getCalls() {
        return calls.get();
    }

    public List<ResolvedConfig> getReceived() {
        return received;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Map<String, Object> transformOptions(Map<String, Object> options) {
        return options;
    }

    @Override
    public WireRequest buildRequest(ResolvedConfig config, ProviderConfig providerConfig) {
        throw new UnsupportedOperationException();
    }

    @Override
    public ProviderReply parseResponse(JsonNode body) {
        throw new UnsupportedOperationException();
    }

    @Override
    public Mono<ProviderReply> complete(ResolvedConfig config, ProviderConfig providerConfig, Duration timeout) {
        return Mono.defer(() -> {
            calls.incrementAndGet();
            received.add(config);
            return behaviour.apply(config);
        });
    }
}
