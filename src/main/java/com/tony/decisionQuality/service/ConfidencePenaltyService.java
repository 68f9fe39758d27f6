package com.tony.decisionQuality.service;

import com.tony.decisionQuality.model.AgeBand;
import com.tony.decisionQuality.model.DecayModelParams;
import com.tony.decisionQuality.model.PenaltyResult;
import org.springframework.stereotype.Service;

/**
 * Pénalité de confiance théorique liée à l'âge de la preuve.
 * Chemin "shadow" uniquement : le résultat sert aux rapports et ne remonte jamais dans une décision active.
 */
@Service
public class ConfidencePenaltyService {

    /**
     * Pas de modèle, ou modèle sans support = facteur 1.0 (aucun effet).
     * Une pénalité ne fait que baisser la confiance, jamais la monter.
     */
    public PenaltyResult computePenalty(String market, String reasonCode, AgeBand ageBand,
                                        double originalConfidence, DecayModelParams decayParams) {
        double factor = 1.0;
        if (decayParams != null && !decayParams.isSupportFree()) {
            factor = clamp(decayParams.penaltyFor(ageBand));
        }

        return PenaltyResult.builder()
                .market(market)
                .reasonCode(reasonCode)
                .ageBand(ageBand)
                .originalConfidence(originalConfidence)
                .penaltyFactor(factor)
                .penalizedConfidence(clamp(originalConfidence * factor))
                .build();
    }

    public PenaltyResult computePenalty(String market, String reasonCode, String ageBandLabel,
                                        double originalConfidence, DecayModelParams decayParams) {
        AgeBand band = AgeBand.fromLabel(ageBandLabel).orElse(null);
        if (band == null) {
            // Tranche inconnue : aucune information, aucune pénalité
            return PenaltyResult.builder()
                    .market(market).reasonCode(reasonCode).ageBand(null)
                    .originalConfidence(originalConfidence)
                    .penaltyFactor(1.0)
                    .penalizedConfidence(clamp(originalConfidence))
                    .build();
        }
        return computePenalty(market, reasonCode, band, originalConfidence, decayParams);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
