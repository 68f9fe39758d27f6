package com.tony.decisionQuality.model;

import lombok.Builder;
import lombok.Value;

/**
 * Confiance pénalisée hypothétique. Lecture seule : n'est jamais réinjectée dans une décision.
 */
@Value
@Builder
public class PenaltyResult {
    String market;
    String reasonCode;
    AgeBand ageBand;
    double originalConfidence;
    double penaltyFactor;        // [0, 1]
    double penalizedConfidence;  // clamp(original * factor, 0, 1)
}
