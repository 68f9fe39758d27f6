package com.tony.decisionQuality.service;

import com.tony.decisionQuality.model.DecayKey;
import com.tony.decisionQuality.model.DecayModelParams;
import com.tony.decisionQuality.model.EvaluationRecord;
import com.tony.decisionQuality.model.PenaltyShadowRow;
import com.tony.decisionQuality.model.SignalType;
import com.tony.decisionQuality.model.UncertaintyProfile;
import com.tony.decisionQuality.model.UncertaintySignal;
import com.tony.decisionQuality.util.ReportFiles;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rapport "shadow" d'incertitude. Le champ would_refuse est une simulation : aucun refus n'est appliqué.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UncertaintyShadowService {

    public static final String SUBDIR = "uncertainty_shadow";
    public static final String CSV_NAME = "uncertainty_shadow.csv";
    public static final String JSON_NAME = "uncertainty_shadow.json";

    private static final String[] CSV_COLUMNS = {"run_id", "would_refuse", "triggered_count", "triggered_signals"};

    private final UncertaintySignalDetector detector;

    public List<UncertaintyProfile> computeProfiles(List<EvaluationRecord> records,
                                                    List<PenaltyShadowRow> shadowRows,
                                                    Map<DecayKey, DecayModelParams> decayParams) {
        return records.stream()
                .map(rec -> detector.detect(rec, shadowRows, decayParams))
                .sorted(Comparator.comparing(UncertaintyProfile::getRunId))
                .toList();
    }

    /**
     * Règle simulée : (STALE_EVIDENCE et LOW_EFFECTIVE_CONFIDENCE) ou au moins 2 signaux déclenchés.
     */
    public boolean wouldRefuse(UncertaintyProfile profile) {
        if (profile.hasTriggered(SignalType.STALE_EVIDENCE) && profile.hasTriggered(SignalType.LOW_EFFECTIVE_CONFIDENCE)) {
            return true;
        }
        return profile.triggered().size() >= 2;
    }

    public void write(List<UncertaintyProfile> profiles, String computedAtUtc, Path outDir) {
        List<Map<String, Object>> rows = profiles.stream().map(this::profileToMap).toList();

        List<String[]> lines = rows.stream().map(m -> {
            String[] line = new String[CSV_COLUMNS.length];
            for (int i = 0; i < CSV_COLUMNS.length; i++) line[i] = ReportFiles.cell(m.get(CSV_COLUMNS[i]));
            return line;
        }).toList();
        ReportFiles.writeCsv(outDir.resolve(CSV_NAME), CSV_COLUMNS, lines);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("computed_at_utc", computedAtUtc);
        payload.put("row_count", rows.size());
        payload.put("rows", rows);
        ReportFiles.writeJson(outDir.resolve(JSON_NAME), payload);

        long refusals = rows.stream().filter(r -> Boolean.TRUE.equals(r.get("would_refuse"))).count();
        log.info("🕶️ Shadow incertitude : {} décisions, {} refus simulés (non appliqués)", rows.size(), refusals);
    }

    private Map<String, Object> profileToMap(UncertaintyProfile profile) {
        List<String> triggeredTypes = profile.triggered().stream()
                .map(s -> s.getSignalType().name())
                .sorted()
                .toList();

        Map<String, Object> m = new LinkedHashMap<>();
        m.put("run_id", profile.getRunId());
        m.put("would_refuse", wouldRefuse(profile));
        m.put("triggered_count", triggeredTypes.size());
        m.put("triggered_signals", String.join(",", triggeredTypes));
        m.put("signals", profile.getSignals().stream().map(this::signalToMap).toList());
        return m;
    }

    private Map<String, Object> signalToMap(UncertaintySignal s) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("signal_type", s.getSignalType().name());
        m.put("reason_code", s.getReasonCode());
        m.put("triggered", s.isTriggered());
        return m;
    }
}
