package com.tony.decisionQuality.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Courbe de pénalité par tranche d'âge pour un couple (market, reason_code).
 * Non croissante de la tranche la plus fraîche à la plus ancienne.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DecayModelParams {
    public static final String SCHEMA_VERSION = "1";
    public static final String MODEL_TYPE_PIECEWISE_V1 = "PIECEWISE_V1";

    @Builder.Default
    private String schemaVersion = SCHEMA_VERSION;

    @Builder.Default
    private String modelType = MODEL_TYPE_PIECEWISE_V1;

    private String market;
    private String reasonCode;

    @Builder.Default
    private List<AgeBand> bands = new ArrayList<>(Arrays.asList(AgeBand.values()));

    @Builder.Default
    private List<Double> penaltyByBand = new ArrayList<>();

    private String fittedAtUtc;
    private FitDiagnostics fitQuality;

    /** Aucune tranche avec assez d'observations : le modèle ne doit jamais pénaliser. */
    @JsonIgnore
    public boolean isSupportFree() {
        return fitQuality == null || fitQuality.getBandsWithSupport() == 0;
    }

    /**
     * Facteur dans [0,1] pour une tranche. 1.0 si modèle sans support ou tranche inconnue.
     */
    public double penaltyFor(AgeBand band) {
        if (isSupportFree() || band == null || bands == null || penaltyByBand == null) return 1.0;
        int idx = bands.indexOf(band);
        if (idx < 0 || idx >= penaltyByBand.size() || penaltyByBand.get(idx) == null) return 1.0;
        double factor = penaltyByBand.get(idx);
        if (Double.isNaN(factor)) return 1.0;
        return Math.max(0.0, Math.min(1.0, factor));
    }

    public double penaltyFor(String bandLabel) {
        return AgeBand.fromLabel(bandLabel).map(this::penaltyFor).orElse(1.0);
    }
}
