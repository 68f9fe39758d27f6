package com.tony.decisionQuality.model;

import lombok.Value;

import java.util.Map;

/**
 * Variante « données en retard » dérivée d'un snapshot de base. Simulation uniquement.
 */
@Value
public class ReplayScenario {
    String scenarioId;
    String baseSnapshotId;
    String fixtureId;
    ScenarioType scenarioType;
    Map<String, Object> parameters;
    String createdAtUtc;
}
