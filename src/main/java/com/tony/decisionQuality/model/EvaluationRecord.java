package com.tony.decisionQuality.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Une décision évaluée : résultats par marché, codes raisons, confiances et âge de la preuve.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EvaluationRecord {
    private String runId;

    // Âge de la preuve au moment de la décision (ms). null = tranche la plus fraîche.
    private Long evidenceAgeMs;

    @Builder.Default
    private Map<String, Outcome> marketOutcomes = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, List<String>> reasonCodesByMarket = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Double> marketToConfidence = new LinkedHashMap<>();

    // Optionnel : absent dans la plupart des historiques
    private Map<String, ReasonPolarity> reasonPolarities;

    public AgeBand ageBand() {
        return AgeBand.forAgeMs(evidenceAgeMs);
    }

    /**
     * Codes raisons triés par marché, seule vue utilisée par les agrégations.
     * Les marchés vides ou null, les listes null et les codes null ou blancs sont ignorés.
     */
    public Map<String, List<String>> cleanReasonCodes() {
        Map<String, List<String>> clean = new TreeMap<>();
        if (reasonCodesByMarket == null) return clean;
        reasonCodesByMarket.forEach((market, codes) -> {
            if (market == null || market.isBlank() || codes == null) return;
            List<String> kept = new ArrayList<>(codes.size());
            for (String code : codes) {
                if (code != null && !code.isBlank()) kept.add(code.trim());
            }
            if (!kept.isEmpty()) clean.put(market, kept);
        });
        return clean;
    }

    public Outcome outcomeFor(String market) {
        Outcome outcome = marketOutcomes == null ? null : marketOutcomes.get(market);
        return outcome == null ? Outcome.UNRESOLVED : outcome;
    }
}
