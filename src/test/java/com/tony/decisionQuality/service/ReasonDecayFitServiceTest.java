package com.tony.decisionQuality.service;

import com.tony.decisionQuality.model.AgeBand;
import com.tony.decisionQuality.model.DecayKey;
import com.tony.decisionQuality.model.DecayModelParams;
import com.tony.decisionQuality.model.StalenessRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

class ReasonDecayFitServiceTest {

    private final ReasonDecayFitService service = new ReasonDecayFitService();
    private final DecayParamsStore store = new DecayParamsStore();

    @Test
    @DisplayName("Courbe relative à la tranche supportée la plus fraîche, puis rendue non croissante")
    void fitsMonotonePiecewiseCurve() {
        List<StalenessRow> rows = List.of(
                row("one_x_two", "R1", AgeBand.M0_30, 10, 9),
                row("one_x_two", "R1", AgeBand.H6_24, 10, 6),
                row("one_x_two", "R1", AgeBand.D1_3, 3, 0),
                row("one_x_two", "R1", AgeBand.D3_7, 10, 8));

        DecayModelParams params = service.fit(rows, "2025-03-01T00:00:00Z").get(0);

        assertThat(params.getSchemaVersion()).isEqualTo("1");
        assertThat(params.getModelType()).isEqualTo("PIECEWISE_V1");
        assertThat(params.getBands()).containsExactly(AgeBand.values());
        assertThat(params.getPenaltyByBand().get(0)).isEqualTo(1.0);
        assertThat(params.getPenaltyByBand().get(2)).isEqualTo(1.0);
        assertThat(params.getPenaltyByBand().get(3)).isCloseTo(0.7, within(1e-9));
        // 3d-7d serait à 0.9 seule, mais une tranche plus ancienne ne pénalise jamais moins
        assertThat(params.getPenaltyByBand().get(5)).isCloseTo(0.7, within(1e-9));
        assertThat(params.getPenaltyByBand().get(6)).isCloseTo(0.7, within(1e-9));

        for (int i = 1; i < params.getPenaltyByBand().size(); i++) {
            assertThat(params.getPenaltyByBand().get(i)).isLessThanOrEqualTo(params.getPenaltyByBand().get(i - 1));
        }

        assertThat(params.getFitQuality().getBandsWithSupport()).isEqualTo(3);
        assertThat(params.getFitQuality().getTotalBands()).isEqualTo(7);
        assertThat(params.getFitQuality().getCoverageCounts()).containsExactly(10, 0, 0, 10, 3, 10, 0);
        assertThat(params.getFitQuality().getMseVsBaseline()).isCloseTo(0.04 / 3, within(1e-6));
    }

    @Test
    @DisplayName("Aucune tranche avec MIN_SUPPORT observations : modèle sans support, facteur 1.0 partout")
    void sparseDataGivesSupportFreeModel() {
        DecayModelParams params = service.fit(List.of(
                row("gg_ng", "R4", AgeBand.M0_30, 2, 0),
                row("gg_ng", "R4", AgeBand.D7_PLUS, 4, 0)), "t").get(0);

        assertThat(params.isSupportFree()).isTrue();
        assertThat(params.getPenaltyByBand()).containsOnly(1.0);
        assertThat(params.penaltyFor(AgeBand.D7_PLUS)).isEqualTo(1.0);
        assertThat(params.getFitQuality().getMseVsBaseline()).isNull();
    }

    @Test
    @DisplayName("Un modèle par (marché, raison), triés")
    void oneModelPerMarketAndReasonSorted() {
        List<DecayModelParams> models = service.fit(List.of(
                row("over_under_25", "R2", AgeBand.M0_30, 5, 5),
                row("one_x_two", "R3", AgeBand.M0_30, 5, 5),
                row("one_x_two", "R1", AgeBand.M0_30, 5, 5)), "t");

        assertThat(models).extracting(DecayModelParams::getMarket, DecayModelParams::getReasonCode)
                .containsExactly(
                        tuple("one_x_two", "R1"),
                        tuple("one_x_two", "R3"),
                        tuple("over_under_25", "R2"));
    }

    @Test
    @DisplayName("Sauvegarde puis relecture des paramètres ; fichier corrompu = aucun modèle")
    void storeSavesAndLoadsParams(@TempDir Path tempDir) throws IOException {
        List<DecayModelParams> models = service.fit(List.of(
                row("one_x_two", "R1", AgeBand.M0_30, 10, 9),
                row("one_x_two", "R1", AgeBand.H6_24, 10, 6)), "2025-03-01T00:00:00Z");
        Path file = tempDir.resolve(DecayParamsStore.RELATIVE_PATH);

        store.save(models, "2025-03-01T00:00:00Z", file);
        Map<DecayKey, DecayModelParams> loaded = store.load(file);

        assertThat(loaded).containsOnlyKeys(new DecayKey("one_x_two", "R1"));
        assertThat(loaded.get(new DecayKey("one_x_two", "R1"))).isEqualTo(models.get(0));

        Files.writeString(file, "{ not json");
        assertThat(store.load(file)).isEmpty();
        assertThat(store.load(tempDir.resolve("missing.json"))).isEmpty();
    }

    private StalenessRow row(String market, String reason, AgeBand band, int total, int correct) {
        return StalenessRow.builder()
                .market(market).reasonCode(reason).ageBand(band)
                .total(total).correct(correct).neutral(0)
                .build();
    }
}
