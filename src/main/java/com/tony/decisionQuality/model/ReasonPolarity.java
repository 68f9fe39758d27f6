package com.tony.decisionQuality.model;

// Sens d'un code raison par rapport à la sélection du marché.
public enum ReasonPolarity {
    SUPPORTS, OPPOSES
}
