package com.tony.decisionQuality.service;

import com.tony.decisionQuality.model.AgeBand;
import com.tony.decisionQuality.model.DecayKey;
import com.tony.decisionQuality.model.DecayModelParams;
import com.tony.decisionQuality.model.EvaluationRecord;
import com.tony.decisionQuality.model.PenaltyResult;
import com.tony.decisionQuality.model.PenaltyShadowRow;
import com.tony.decisionQuality.util.ReportFiles;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.tony.decisionQuality.util.ReportFiles.cell;
import static com.tony.decisionQuality.util.ReportFiles.round4;

/**
 * Rapport "shadow" : confiance pénalisée hypothétique par décision x marché x raison.
 * Écrit des fichiers, ne touche à aucune décision.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConfidencePenaltyShadowService {

    public static final String SUBDIR = "confidence_penalty_shadow";
    public static final String CSV_NAME = "confidence_penalty_shadow.csv";
    public static final String JSON_NAME = "confidence_penalty_shadow.json";

    private static final String[] CSV_COLUMNS = {
            "run_id", "market", "reason_code", "age_band", "original_confidence", "penalty_factor", "penalized_confidence"
    };

    private final ConfidencePenaltyService penaltyService;

    public List<PenaltyShadowRow> computeRows(List<EvaluationRecord> records, Map<DecayKey, DecayModelParams> decayParams) {
        List<PenaltyShadowRow> rows = new ArrayList<>();
        for (EvaluationRecord rec : records) {
            String runId = rec.getRunId() == null ? "" : rec.getRunId();
            AgeBand band = rec.ageBand();
            Map<String, Double> confidences = rec.getMarketToConfidence() == null ? Map.of() : rec.getMarketToConfidence();
            Map<String, List<String>> codesByMarket = rec.cleanReasonCodes();

            codesByMarket.forEach((market, codes) -> {
                Double confidence = confidences.get(market);
                if (confidence == null || codes == null) return;
                for (String code : codes) {
                    DecayModelParams params = decayParams.get(new DecayKey(market, code));
                    PenaltyResult r = penaltyService.computePenalty(market, code, band, confidence, params);
                    rows.add(new PenaltyShadowRow(runId, r));
                }
            });
        }
        rows.sort(Comparator.comparing(PenaltyShadowRow::getRunId)
                .thenComparing(r -> r.getResult().getMarket())
                .thenComparing(r -> r.getResult().getReasonCode()));
        return rows;
    }

    public void write(List<PenaltyShadowRow> rows, String computedAtUtc, Path outDir) {
        List<Map<String, Object>> maps = rows.stream().map(this::rowToMap).toList();

        List<String[]> lines = maps.stream().map(m -> {
            String[] line = new String[CSV_COLUMNS.length];
            for (int i = 0; i < CSV_COLUMNS.length; i++) line[i] = cell(m.get(CSV_COLUMNS[i]));
            return line;
        }).toList();
        ReportFiles.writeCsv(outDir.resolve(CSV_NAME), CSV_COLUMNS, lines);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("computed_at_utc", computedAtUtc);
        payload.put("row_count", rows.size());
        payload.put("rows", maps);
        ReportFiles.writeJson(outDir.resolve(JSON_NAME), payload);

        log.info("🕶️ Shadow pénalité de confiance : {} lignes écrites dans {}", rows.size(), outDir);
    }

    private Map<String, Object> rowToMap(PenaltyShadowRow row) {
        PenaltyResult r = row.getResult();
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("run_id", row.getRunId());
        m.put("market", r.getMarket());
        m.put("reason_code", r.getReasonCode());
        m.put("age_band", r.getAgeBand() == null ? null : r.getAgeBand().getLabel());
        m.put("original_confidence", round4(r.getOriginalConfidence()));
        m.put("penalty_factor", round4(r.getPenaltyFactor()));
        m.put("penalized_confidence", round4(r.getPenalizedConfidence()));
        return m;
    }
}
