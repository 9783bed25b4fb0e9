package com.genway.config;

import com.genway.store.CacheStore;
import com.genway.store.CaffeineCacheStore;
import com.genway.store.CaffeineCounterStore;
import com.genway.store.CounterStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Process-local cache and counter stores (default).
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "genway.store", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemoryStoreConfiguration {

    @Bean
    public CacheStore cacheStore(GenwayProperties properties, Clock clock) {
        log.info("Using in-memory response cache (maxSize={})", properties.getCache().getMaxSize());
        return new CaffeineCacheStore(properties.getCache().getMaxSize(), clock);
    }

    @Bean
    public CounterStore counterStore(Clock clock) {
        log.info("Using in-memory rate limit counters");
        return new CaffeineCounterStore(clock);
    }
}
