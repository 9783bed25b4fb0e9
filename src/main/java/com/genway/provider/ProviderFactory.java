package com.genway.provider;

import com.genway.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Looks up provider implementations by name. The map is built once at startup.
 */
@Slf4j
@Component
public class ProviderFactory {

    private final Map<String, ChatProvider> providers;

    public ProviderFactory(List<ChatProvider> providers) {
        Map<String, ChatProvider> byName = new TreeMap<>();
        for (ChatProvider provider : providers) {
            ChatProvider previous = byName.put(provider.getName(), provider);
            if (previous != null) {
                throw new IllegalStateException("Duplicate provider name: " + provider.getName());
            }
        }
        this.providers = Collections.unmodifiableMap(byName);
        log.info("Registered providers: {}", this.providers.keySet());
    }

    /**
     * @throws ConfigurationException if no implementation has that name
     */
    public ChatProvider get(String name) {
        ChatProvider provider = providers.get(name);
        if (provider == null) {
            throw new ConfigurationException("Unsupported provider: " + name);
        }
        return provider;
    }

    public boolean supports(String name) {
        return providers.containsKey(name);
    }

    public Set<String> names() {
        return providers.keySet();
    }
}
