package com.tony.decisionQuality.model.evidence;

// Fiabilité de la source (HIGH = la plus fiable).
public enum ReliabilityTier {
    HIGH, MED, LOW
}
