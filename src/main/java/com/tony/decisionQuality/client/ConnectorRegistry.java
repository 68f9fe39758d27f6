package com.tony.decisionQuality.client;

import com.tony.decisionQuality.config.SafetyGates;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Registre nom -> client, construit par l'orchestrateur et passé aux composants qui en ont besoin.
 */
@Slf4j
public class ConnectorRegistry {

    private final Map<String, LiveSourceClient> clients = new TreeMap<>();

    public ConnectorRegistry register(LiveSourceClient client) {
        clients.put(client.getName(), client);
        return this;
    }

    public Optional<LiveSourceClient> get(String name) {
        return Optional.ofNullable(clients.get(name));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(clients.keySet());
    }

    /**
     * Clients "recorded" toujours disponibles ; clients live seulement si LIVE_IO_ALLOWED.
     */
    public Optional<LiveSourceClient> resolveSafe(String name, SafetyGates gates) {
        LiveSourceClient client = clients.get(name);
        if (client == null) return Optional.empty();
        if (client.isRecorded() || gates.isLiveIoAllowed()) return Optional.of(client);
        log.warn("🛑 Client live '{}' refusé : LIVE_IO_ALLOWED n'est pas activé", name);
        return Optional.empty();
    }
}
