package com.tony.decisionQuality.model.report;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Résumé d'un run offline, renvoyé à l'appelant (et loggé).
 */
@Value
@Builder
public class PipelineRunSummary {
    String runId;
    int recordsCount;
    int stalenessRows;
    int decayModels;
    int penaltyRows;
    int alertsCount;
    String batchOutputChecksum;
    Path runDir;
}
