package com.tony.decisionQuality.service;

import com.tony.decisionQuality.model.AgeBand;
import com.tony.decisionQuality.model.DecayKey;
import com.tony.decisionQuality.model.DecayModelParams;
import com.tony.decisionQuality.model.EvaluationRecord;
import com.tony.decisionQuality.model.PenaltyShadowRow;
import com.tony.decisionQuality.model.ReasonPolarity;
import com.tony.decisionQuality.model.SignalType;
import com.tony.decisionQuality.model.UncertaintyProfile;
import com.tony.decisionQuality.model.UncertaintySignal;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Signaux d'incertitude indépendants pour une décision. Mesure uniquement : aucun refus, aucun blocage.
 * Une donnée manquante fait sauter le signal ou le laisse non déclenché, jamais deviné.
 */
@Service
public class UncertaintySignalDetector {

    public static final Set<AgeBand> STALE_EVIDENCE_BANDS = EnumSet.of(AgeBand.D3_7, AgeBand.D7_PLUS);
    public static final double LOW_EFFECTIVE_CONFIDENCE_THRESHOLD = 0.5;
    public static final int LOW_SUPPORT_BANDS_WITH_SUPPORT = 0;

    public UncertaintyProfile detect(EvaluationRecord decision,
                                     List<PenaltyShadowRow> shadowRows,
                                     Map<DecayKey, DecayModelParams> decayParams) {
        String runId = decision.getRunId() == null ? "" : decision.getRunId();
        AgeBand band = decision.ageBand();
        Map<String, List<String>> codesByMarket = decision.cleanReasonCodes();

        List<UncertaintySignal> signals = new ArrayList<>();

        // STALE_EVIDENCE
        signals.add(new UncertaintySignal(SignalType.STALE_EVIDENCE, band.getLabel(), STALE_EVIDENCE_BANDS.contains(band)));

        // CONFLICTING_REASONS : seulement si la polarité est fournie
        Map<String, ReasonPolarity> polarities = decision.getReasonPolarities();
        if (polarities != null && !polarities.isEmpty()) {
            signals.add(new UncertaintySignal(SignalType.CONFLICTING_REASONS, "reason_polarity",
                    hasConflictingReasons(codesByMarket, polarities)));
        }

        Map<DecayKey, PenaltyShadowRow> shadowByKey = new HashMap<>();
        for (PenaltyShadowRow row : shadowRows) {
            if (Objects.equals(row.getRunId(), runId)) {
                shadowByKey.put(new DecayKey(row.getResult().getMarket(), row.getResult().getReasonCode()), row);
            }
        }

        boolean lowConfidence = false;
        boolean lowSupport = false;
        for (Map.Entry<String, List<String>> entry : codesByMarket.entrySet()) {
            if (entry.getValue() == null) continue;
            for (String code : entry.getValue()) {
                DecayKey key = new DecayKey(entry.getKey(), code);

                PenaltyShadowRow shadow = shadowByKey.get(key);
                if (shadow != null && shadow.getResult().getPenalizedConfidence() < LOW_EFFECTIVE_CONFIDENCE_THRESHOLD) {
                    lowConfidence = true;
                }

                DecayModelParams params = decayParams.get(key);
                if (params != null && params.getFitQuality() != null
                        && params.getFitQuality().getBandsWithSupport() <= LOW_SUPPORT_BANDS_WITH_SUPPORT) {
                    lowSupport = true;
                }
            }
        }

        signals.add(new UncertaintySignal(SignalType.LOW_EFFECTIVE_CONFIDENCE,
                "threshold_" + LOW_EFFECTIVE_CONFIDENCE_THRESHOLD, lowConfidence));
        signals.add(new UncertaintySignal(SignalType.LOW_SUPPORT, "decay_fit_low_support", lowSupport));

        return new UncertaintyProfile(runId, List.copyOf(signals));
    }

    // Un même marché porte à la fois des raisons favorables et défavorables
    private boolean hasConflictingReasons(Map<String, List<String>> codesByMarket, Map<String, ReasonPolarity> polarities) {
        for (List<String> codes : codesByMarket.values()) {
            if (codes == null) continue;
            Set<ReasonPolarity> seen = EnumSet.noneOf(ReasonPolarity.class);
            for (String code : codes) {
                ReasonPolarity p = polarities.get(code);
                if (p != null) seen.add(p);
            }
            if (seen.size() > 1) return true;
        }
        return false;
    }
}
