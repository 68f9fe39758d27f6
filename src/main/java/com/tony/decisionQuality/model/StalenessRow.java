package com.tony.decisionQuality.model;

import lombok.Builder;
import lombok.Value;

import java.util.Comparator;

/**
 * Agrégat (market, reason_code, age_band). Jamais persisté comme état, seulement dans les rapports.
 */
@Value
@Builder
public class StalenessRow implements Comparable<StalenessRow> {

    private static final Comparator<StalenessRow> ORDER = Comparator
            .comparing(StalenessRow::getMarket)
            .thenComparing(StalenessRow::getReasonCode)
            .thenComparing(r -> r.getAgeBand().getLabel());

    String market;
    String reasonCode;
    AgeBand ageBand;
    int total;
    int correct;
    int neutral;
    Double avgConfidence;

    /** correct / (total - neutral), null si aucun cas résolu. */
    public Double getAccuracy() {
        int resolved = total - neutral;
        if (resolved <= 0) return null;
        return (double) correct / resolved;
    }

    public Double getNeutralRate() {
        if (total <= 0) return null;
        return (double) neutral / total;
    }

    @Override
    public int compareTo(StalenessRow other) {
        return ORDER.compare(this, other);
    }
}
