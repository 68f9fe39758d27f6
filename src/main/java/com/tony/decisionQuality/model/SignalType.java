package com.tony.decisionQuality.model;

public enum SignalType {
    STALE_EVIDENCE,
    CONFLICTING_REASONS, // seulement si la polarité des raisons est connue
    LOW_EFFECTIVE_CONFIDENCE,
    LOW_SUPPORT
}
