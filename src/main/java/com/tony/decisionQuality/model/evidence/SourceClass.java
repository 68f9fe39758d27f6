package com.tony.decisionQuality.model.evidence;

// Provenance de la preuve.
public enum SourceClass {
    RECORDED, LIVE_SHADOW, EDITORIAL, UNKNOWN
}
