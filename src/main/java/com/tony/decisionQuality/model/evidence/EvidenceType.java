package com.tony.decisionQuality.model.evidence;

// Nature de la preuve datée.
public enum EvidenceType {
    INJURY, SUSPENSION, TEAM_NEWS, DISRUPTION
}
