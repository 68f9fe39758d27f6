package com.tony.decisionQuality.client;

import java.util.List;
import java.util.Map;
import java.util.Optional;

// Ne renvoie rien, ne touche pas au réseau.
public class NullLiveClient implements LiveSourceClient {

    @Override
    public String getName() {
        return "null_live";
    }

    @Override
    public boolean isRecorded() {
        return true;
    }

    @Override
    public List<Map<String, Object>> fetchFixtures() {
        return List.of();
    }

    @Override
    public Optional<Map<String, Object>> fetchFixtureDetail(String fixtureId) {
        return Optional.empty();
    }
}
