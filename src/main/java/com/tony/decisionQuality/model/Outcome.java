package com.tony.decisionQuality.model;

// Résultat d'un marché une fois le match résolu. Tout ce qui n'est ni SUCCESS ni FAILURE compte comme neutre.
public enum Outcome {
    SUCCESS, FAILURE, NEUTRAL, UNRESOLVED;

    public boolean isCorrect() {
        return this == SUCCESS;
    }

    public boolean isNeutral() {
        return this != SUCCESS && this != FAILURE;
    }
}
