package com.tony.decisionQuality.client;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Client déterministe pour les tests et la CI : payloads fixes, pas de réseau.
 */
public class FakeLiveClient implements LiveSourceClient {

    private final String name;
    private final List<Map<String, Object>> fixtures;

    public FakeLiveClient(List<Map<String, Object>> fixtures) {
        this("fake_live", fixtures);
    }

    public FakeLiveClient(String name, List<Map<String, Object>> fixtures) {
        this.name = name;
        this.fixtures = fixtures == null ? List.of() : List.copyOf(fixtures);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isRecorded() {
        return true;
    }

    @Override
    public List<Map<String, Object>> fetchFixtures() {
        return new ArrayList<>(fixtures);
    }

    @Override
    public Optional<Map<String, Object>> fetchFixtureDetail(String fixtureId) {
        return fixtures.stream()
                .filter(f -> Objects.equals(String.valueOf(idOf(f)), fixtureId))
                .findFirst()
                .map(LinkedHashMap::new);
    }

    private static Object idOf(Map<String, Object> fixture) {
        if (fixture.get("fixture_id") != null) return fixture.get("fixture_id");
        if (fixture.get("match_id") != null) return fixture.get("match_id");
        return fixture.get("id");
    }
}
