package com.williamcallahan.llmorchestrator.service.provider;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Closed set of provider clients registered at startup, kept in registration order.
 */
public final class ProviderClientRegistry {
    private final Map<String, ProviderClient> clientsByName;

    /**
     * Registers the given clients.
     *
     * @param clients provider clients; names must be unique
     * @throws IllegalStateException when two clients share a name or no client is given
     */
    public ProviderClientRegistry(List<? extends ProviderClient> clients) {
        if (clients == null || clients.isEmpty()) {
            throw new IllegalStateException("At least one provider client must be registered");
        }
        Map<String, ProviderClient> registered = new LinkedHashMap<>();
        for (ProviderClient client : clients) {
            if (registered.putIfAbsent(client.name(), client) != null) {
                throw new IllegalStateException("Duplicate provider name: " + client.name());
            }
        }
        this.clientsByName = Collections.unmodifiableMap(registered);
    }

    public Optional<ProviderClient> find(String name) {
        return Optional.ofNullable(clientsByName.get(name));
    }

    public Collection<ProviderClient> all() {
        return clientsByName.values();
    }

    public List<String> names() {
        return List.copyOf(clientsByName.keySet());
    }

    public int size() {
        return clientsByName.size();
    }
}
