package com.tony.decisionQuality.service;

import com.tony.decisionQuality.model.AgeBand;
import com.tony.decisionQuality.model.EvaluationRecord;
import com.tony.decisionQuality.model.Outcome;
import com.tony.decisionQuality.model.StalenessReport;
import com.tony.decisionQuality.model.StalenessRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

class StalenessAggregationServiceTest {

    private final StalenessAggregationService service = new StalenessAggregationService();
    private final StalenessReportWriter writer = new StalenessReportWriter();

    @Test
    @DisplayName("Regroupe par (marché, raison, tranche) avec comptes et confiance moyenne")
    void aggregatesByMarketReasonAndBand() {
        List<EvaluationRecord> records = List.of(
                rec("r1", Duration.ofMinutes(5), "one_x_two", List.of("R1"), Outcome.SUCCESS, 0.8),
                rec("r2", Duration.ofMinutes(10), "one_x_two", List.of("R1"), Outcome.FAILURE, 0.6),
                rec("r3", Duration.ofMinutes(20), "one_x_two", List.of("R1"), Outcome.NEUTRAL, null),
                rec("r4", Duration.ofDays(4), "one_x_two", List.of("R1", "R2"), Outcome.SUCCESS, 0.7));

        StalenessReport report = service.aggregate(records, "2025-03-01T00:00:00Z", "test");

        assertThat(report.getRows()).hasSize(3);
        StalenessRow fresh = report.getRows().get(0);
        assertThat(fresh.getMarket()).isEqualTo("one_x_two");
        assertThat(fresh.getReasonCode()).isEqualTo("R1");
        assertThat(fresh.getAgeBand()).isEqualTo(AgeBand.M0_30);
        assertThat(fresh.getTotal()).isEqualTo(3);
        assertThat(fresh.getCorrect()).isEqualTo(1);
        assertThat(fresh.getNeutral()).isEqualTo(1);
        assertThat(fresh.getAccuracy()).isCloseTo(0.5, within(1e-9));
        assertThat(fresh.getAvgConfidence()).isCloseTo(0.7, within(1e-9));

        assertThat(report.getRows()).extracting(StalenessRow::getReasonCode, r -> r.getAgeBand().getLabel())
                .containsExactly(
                        tuple("R1", "0-30m"),
                        tuple("R1", "3d-7d"),
                        tuple("R2", "3d-7d"));
    }

    @Test
    @DisplayName("Aucune décision = rapport valide à zéro ligne, CSV avec en-tête")
    void emptyInputGivesEmptyReport(@TempDir Path tempDir) throws IOException {
        StalenessReport report = service.aggregate(List.of(), "2025-03-01T00:00:00Z", null);
        Path csv = tempDir.resolve("staleness.csv");
        writer.writeCsv(report, csv);

        assertThat(report.getRows()).isEmpty();
        assertThat(Files.readAllLines(csv))
                .containsExactly("market,reason_code,age_band,total,correct,accuracy,neutral_rate,avg_confidence");
    }

    @Test
    @DisplayName("Bucket sans cas résolu : précision indéfinie, confiance indéfinie")
    void allNeutralBucketHasUndefinedAccuracy() {
        StalenessReport report = service.aggregate(
                List.of(rec("r1", Duration.ZERO, "gg_ng", List.of("R9"), Outcome.UNRESOLVED, null)), "t", "");

        StalenessRow row = report.getRows().get(0);
        assertThat(row.getAccuracy()).isNull();
        assertThat(row.getNeutralRate()).isEqualTo(1.0);
        assertThat(row.getAvgConfidence()).isNull();
    }

    @Test
    @DisplayName("Le JSON écrit contient rows, computed_at_utc et notes")
    void writesJsonReport(@TempDir Path tempDir) throws IOException {
        StalenessReport report = service.aggregate(
                List.of(rec("r1", Duration.ZERO, "one_x_two", List.of("R1"), Outcome.SUCCESS, 2.0 / 3.0)),
                "2025-03-01T00:00:00Z", "nightly");
        Path json = tempDir.resolve("staleness.json");

        writer.writeJson(report, json);

        String content = Files.readString(json);
        assertThat(content).contains("\"computed_at_utc\" : \"2025-03-01T00:00:00Z\"")
                .contains("\"notes\" : \"nightly\"")
                .contains("\"avg_confidence\" : 0.6667");
    }

    @Test
    @DisplayName("Codes raisons null ou blancs : ignorés, jamais transformés en raison \"null\"")
    void nullAndBlankReasonCodesAreSkipped() {
        StalenessReport report = service.aggregate(
                List.of(rec("r1", Duration.ZERO, "one_x_two", Arrays.asList("R1", null, " "), Outcome.SUCCESS, 0.6)),
                "t", "");

        assertThat(report.getRows()).extracting(StalenessRow::getReasonCode).containsExactly("R1");
    }

    private EvaluationRecord rec(String runId, Duration age, String market, List<String> codes, Outcome outcome, Double confidence) {
        EvaluationRecord.EvaluationRecordBuilder b = EvaluationRecord.builder()
                .runId(runId)
                .evidenceAgeMs(age.toMillis())
                .marketOutcomes(Map.of(market, outcome))
                .reasonCodesByMarket(Map.of(market, codes));
        if (confidence != null) b.marketToConfidence(Map.of(market, confidence));
        return b.build();
    }
}
