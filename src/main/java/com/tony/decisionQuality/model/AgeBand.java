package com.tony.decisionQuality.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;

/**
 * Les 7 tranches d'âge d'une preuve, de la plus fraîche à la plus ancienne.
 * Bornes supérieures exclusives ; la dernière tranche est ouverte.
 */
@Getter
@RequiredArgsConstructor
public enum AgeBand {
    M0_30("0-30m", Duration.ofMinutes(30).toMillis()),
    M30_H2("30m-2h", Duration.ofHours(2).toMillis()),
    H2_6("2h-6h", Duration.ofHours(6).toMillis()),
    H6_24("6h-24h", Duration.ofHours(24).toMillis()),
    D1_3("1d-3d", Duration.ofDays(3).toMillis()),
    D3_7("3d-7d", Duration.ofDays(7).toMillis()),
    D7_PLUS("7d+", Long.MAX_VALUE);

    private final String label;
    private final long upperBoundMs;

    /**
     * Âge négatif ou absent = tranche la plus fraîche. Jamais d'erreur.
     */
    public static AgeBand forAgeMs(Long ageMs) {
        if (ageMs == null || ageMs < 0) return M0_30;
        for (AgeBand band : values()) {
            if (ageMs < band.upperBoundMs) return band;
        }
        return D7_PLUS;
    }

    public static AgeBand forAge(Duration age) {
        return forAgeMs(age == null ? null : age.toMillis());
    }

    public static Optional<AgeBand> fromLabel(String label) {
        return Arrays.stream(values()).filter(b -> b.label.equals(label)).findFirst();
    }

    @JsonCreator
    public static AgeBand parse(String label) {
        return fromLabel(label).orElseThrow(() -> new IllegalArgumentException("Unknown age band: " + label));
    }

    @JsonValue
    @Override
    public String toString() {
        return label;
    }
}
