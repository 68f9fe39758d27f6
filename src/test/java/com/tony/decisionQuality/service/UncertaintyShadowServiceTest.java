package com.tony.decisionQuality.service;

import com.tony.decisionQuality.model.AgeBand;
import com.tony.decisionQuality.model.DecayKey;
import com.tony.decisionQuality.model.DecayModelParams;
import com.tony.decisionQuality.model.EvaluationRecord;
import com.tony.decisionQuality.model.FitDiagnostics;
import com.tony.decisionQuality.model.Outcome;
import com.tony.decisionQuality.model.PenaltyResult;
import com.tony.decisionQuality.model.PenaltyShadowRow;
import com.tony.decisionQuality.model.ReasonPolarity;
import com.tony.decisionQuality.model.SignalType;
import com.tony.decisionQuality.model.UncertaintyProfile;
import com.tony.decisionQuality.model.UncertaintySignal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class UncertaintyShadowServiceTest {

    private final UncertaintySignalDetector detector = new UncertaintySignalDetector();
    private final UncertaintyShadowService shadowService = new UncertaintyShadowService(detector);

    @Test
    @DisplayName("Décision fraîche et confiante : aucun signal, pas de CONFLICTING_REASONS sans polarité")
    void freshConfidentDecisionHasNoSignal() {
        EvaluationRecord rec = rec("d1", Duration.ofMinutes(10), null);

        UncertaintyProfile profile = detector.detect(rec, List.of(shadow("d1", 0.75)), Map.of());

        assertThat(profile.triggered()).isEmpty();
        assertThat(profile.getSignals()).extracting(UncertaintySignal::getSignalType)
                .doesNotContain(SignalType.CONFLICTING_REASONS)
                .contains(SignalType.STALE_EVIDENCE, SignalType.LOW_EFFECTIVE_CONFIDENCE, SignalType.LOW_SUPPORT);
        assertThat(shadowService.wouldRefuse(profile)).isFalse();
    }

    @Test
    @DisplayName("Preuve vieille + confiance pénalisée basse : refus simulé")
    void staleAndLowConfidenceWouldRefuse() {
        EvaluationRecord rec = rec("d2", Duration.ofDays(4), null);

        UncertaintyProfile profile = detector.detect(rec, List.of(shadow("d2", 0.4)), Map.of());

        assertThat(profile.hasTriggered(SignalType.STALE_EVIDENCE)).isTrue();
        assertThat(profile.hasTriggered(SignalType.LOW_EFFECTIVE_CONFIDENCE)).isTrue();
        assertThat(shadowService.wouldRefuse(profile)).isTrue();
    }

    @Test
    @DisplayName("Les lignes shadow d'une autre décision sont ignorées")
    void shadowRowsAreMatchedByRunId() {
        EvaluationRecord rec = rec("d3", Duration.ofMinutes(1), null);

        UncertaintyProfile profile = detector.detect(rec, List.of(shadow("other", 0.1)), Map.of());

        assertThat(profile.hasTriggered(SignalType.LOW_EFFECTIVE_CONFIDENCE)).isFalse();
    }

    @Test
    @DisplayName("Raisons de polarités opposées sur un même marché")
    void conflictingPolarities() {
        EvaluationRecord rec = rec("d4", Duration.ofMinutes(1),
                Map.of("R1", ReasonPolarity.SUPPORTS, "R2", ReasonPolarity.OPPOSES));

        UncertaintyProfile profile = detector.detect(rec, List.of(), Map.of());

        assertThat(profile.hasTriggered(SignalType.CONFLICTING_REASONS)).isTrue();
    }

    @Test
    @DisplayName("Modèle de décroissance sans support : LOW_SUPPORT")
    void lowSupportFromDecayFit() {
        EvaluationRecord rec = rec("d5", Duration.ofMinutes(1), null);
        DecayModelParams params = DecayModelParams.builder()
                .market("one_x_two").reasonCode("R1")
                .fitQuality(FitDiagnostics.builder().bandsWithSupport(0).totalBands(7).build())
                .build();

        UncertaintyProfile profile = detector.detect(rec, List.of(), Map.of(new DecayKey("one_x_two", "R1"), params));

        assertThat(profile.hasTriggered(SignalType.LOW_SUPPORT)).isTrue();
        assertThat(shadowService.wouldRefuse(profile)).isFalse();
    }

    @Test
    @DisplayName("Le rapport shadow écrit CSV + JSON avec la colonne would_refuse")
    void writesShadowReport(@TempDir Path tempDir) throws IOException {
        List<EvaluationRecord> records = List.of(rec("d2", Duration.ofDays(4), null), rec("d1", Duration.ZERO, null));
        List<PenaltyShadowRow> rows = List.of(shadow("d2", 0.4), shadow("d1", 0.9));

        List<UncertaintyProfile> profiles = shadowService.computeProfiles(records, rows, Map.of());
        shadowService.write(profiles, "2025-03-01T00:00:00Z", tempDir);

        assertThat(profiles).extracting(UncertaintyProfile::getRunId).containsExactly("d1", "d2");
        List<String> csv = Files.readAllLines(tempDir.resolve(UncertaintyShadowService.CSV_NAME));
        assertThat(csv.get(0)).isEqualTo("run_id,would_refuse,triggered_count,triggered_signals");
        assertThat(csv.get(1)).startsWith("d1,false,0");
        assertThat(csv.get(2)).isEqualTo("d2,true,2,\"LOW_EFFECTIVE_CONFIDENCE,STALE_EVIDENCE\"");
        assertThat(tempDir.resolve(UncertaintyShadowService.JSON_NAME)).exists();
    }

    private EvaluationRecord rec(String runId, Duration age, Map<String, ReasonPolarity> polarities) {
        return EvaluationRecord.builder()
                .runId(runId)
                .evidenceAgeMs(age.toMillis())
                .marketOutcomes(Map.of("one_x_two", Outcome.SUCCESS))
                .reasonCodesByMarket(Map.of("one_x_two", polarities == null ? List.of("R1") : List.of("R1", "R2")))
                .marketToConfidence(Map.of("one_x_two", 0.8))
                .reasonPolarities(polarities)
                .build();
    }

    private PenaltyShadowRow shadow(String runId, double penalized) {
        return new PenaltyShadowRow(runId, PenaltyResult.builder()
                .market("one_x_two").reasonCode("R1").ageBand(AgeBand.M0_30)
                .originalConfidence(0.8).penaltyFactor(penalized / 0.8).penalizedConfidence(penalized)
                .build());
    }
}
