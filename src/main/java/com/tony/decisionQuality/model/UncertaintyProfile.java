package com.tony.decisionQuality.model;

import lombok.Value;

import java.util.List;

/**
 * Signaux d'une décision, dans l'ordre d'évaluation. Aucune combinaison à ce niveau.
 */
@Value
public class UncertaintyProfile {
    String runId;
    List<UncertaintySignal> signals;

    public List<UncertaintySignal> triggered() {
        return signals.stream().filter(UncertaintySignal::isTriggered).toList();
    }

    public boolean hasTriggered(SignalType type) {
        return signals.stream().anyMatch(s -> s.isTriggered() && s.getSignalType() == type);
    }
}
