package com.genway.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * Shared WebClient for provider calls.
 *
 * Only connection setup is bounded here. The response timeout is set per request by the
 * provider, so a call's {@code timeout} option can be longer or shorter than the default.
 */
@Configuration
public class WebClientConfiguration {

    // Provider replies for long generations can be large
    private static final int MAX_IN_MEMORY_SIZE = 16 * 1024 * 1024;

    @Bean
    public WebClient webClient(GenwayProperties properties) {
        return createWebClient(properties.getDefaults().getTimeout());
    }

    /**
     * @param connectTimeout upper bound for establishing a connection
     */
    public static WebClient createWebClient(Duration connectTimeout) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, connectTimeout.toMillis()));

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE))
                .build();
    }
}
