package com.tony.decisionQuality.model;

public enum ScenarioType {
    DELAYED_OBSERVED_AT,
    MISSING_TIMING_TAGS,
    STALE_EFFECTIVE_FROM
}
