package com.tony.decisionQuality.client;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Source de fixtures (live ou simulée). Aucune analyse, aucune décision.
 */
public interface LiveSourceClient {

    String getName();

    /** Un client "recorded" ne fait jamais d'appel réseau et reste autorisé gates fermées. */
    boolean isRecorded();

    List<Map<String, Object>> fetchFixtures();

    Optional<Map<String, Object>> fetchFixtureDetail(String fixtureId);
}
