package com.tony.decisionQuality.service;

import com.tony.decisionQuality.model.AgeBand;
import com.tony.decisionQuality.model.EvaluationRecord;
import com.tony.decisionQuality.model.Outcome;
import com.tony.decisionQuality.model.StalenessReport;
import com.tony.decisionQuality.model.StalenessRow;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Agrège les décisions évaluées par (market, reason_code, age_band). Aucune E/S.
 */
@Service
@Slf4j
public class StalenessAggregationService {

    public StalenessReport aggregate(List<EvaluationRecord> records, String computedAtUtc, String notes) {
        Map<BucketKey, Bucket> buckets = new HashMap<>();

        for (EvaluationRecord rec : records) {
            AgeBand band = rec.ageBand();
            Map<String, List<String>> codesByMarket = rec.cleanReasonCodes();

            for (Map.Entry<String, List<String>> entry : codesByMarket.entrySet()) {
                String market = entry.getKey();
                if (entry.getValue() == null) continue;

                Outcome outcome = rec.outcomeFor(market);
                Double confidence = rec.getMarketToConfidence() == null ? null : rec.getMarketToConfidence().get(market);

                for (String code : entry.getValue()) {
                    Bucket bucket = buckets.computeIfAbsent(new BucketKey(market, code, band), k -> new Bucket());
                    bucket.total++;
                    if (outcome.isCorrect()) bucket.correct++;
                    if (outcome.isNeutral()) bucket.neutral++;
                    if (confidence != null && !confidence.isNaN()) bucket.confidence.addValue(confidence);
                }
            }
        }

        List<StalenessRow> rows = new ArrayList<>(buckets.size());
        buckets.forEach((key, b) -> rows.add(StalenessRow.builder()
                .market(key.market())
                .reasonCode(key.reasonCode())
                .ageBand(key.band())
                .total(b.total)
                .correct(b.correct)
                .neutral(b.neutral)
                .avgConfidence(b.confidence.getN() > 0 ? b.confidence.getMean() : null)
                .build()));
        rows.sort(null);

        log.info("📊 Staleness : {} décisions -> {} lignes (market, reason, age_band)", records.size(), rows.size());
        return new StalenessReport(List.copyOf(rows), computedAtUtc, notes == null ? "" : notes);
    }

    private record BucketKey(String market, String reasonCode, AgeBand band) {
    }

    private static final class Bucket {
        int total;
        int correct;
        int neutral;
        final SummaryStatistics confidence = new SummaryStatistics();
    }
}
