package com.apichat.service.provider;

import com.apichat.exception.UnknownProviderException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Looks up the {@link ProviderAdapter} for an agent's provider id. Adding a backend means
 * adding one adapter bean; nothing else changes.
 */
@Component
@Slf4j
public class ProviderRegistry {

    private final Map<String, ProviderAdapter> adapters = new LinkedHashMap<>();

    public ProviderRegistry(List<ProviderAdapter> adapters) {
        for (ProviderAdapter adapter : adapters) {
            this.adapters.put(adapter.providerId(), adapter);
        }
        log.debug("Registered reasoning backends: {}", this.adapters.keySet());
    }

    /**
     * @throws UnknownProviderException if no adapter is registered under {@code providerId}.
     */
    public ProviderAdapter get(String providerId) {
        ProviderAdapter adapter = providerId == null ? null : adapters.get(providerId.toLowerCase(Locale.ROOT));
        if (adapter == null) {
            throw new UnknownProviderException(providerId);
        }
        return adapter;
    }

    public Set<String> providerIds() {
        return adapters.keySet();
    }
}
