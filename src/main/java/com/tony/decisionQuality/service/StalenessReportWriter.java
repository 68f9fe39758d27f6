package com.tony.decisionQuality.service;

import com.tony.decisionQuality.model.StalenessReport;
import com.tony.decisionQuality.model.StalenessRow;
import com.tony.decisionQuality.util.ReportFiles;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.tony.decisionQuality.util.ReportFiles.cell;
import static com.tony.decisionQuality.util.ReportFiles.round4;

@Service
@Slf4j
public class StalenessReportWriter {

    public static final String[] CSV_COLUMNS = {
            "market", "reason_code", "age_band", "total", "correct", "accuracy", "neutral_rate", "avg_confidence"
    };

    /** Forme "rapport" : {rows, computed_at_utc, notes}, valeurs arrondies à 4 décimales. */
    public Map<String, Object> toReportMap(StalenessReport report) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("rows", report.getRows().stream().map(this::rowToMap).toList());
        payload.put("computed_at_utc", report.getComputedAtUtc());
        payload.put("notes", report.getNotes());
        return payload;
    }

    public void writeJson(StalenessReport report, Path path) {
        ReportFiles.writeJson(path, toReportMap(report));
        log.info("💾 Rapport staleness JSON écrit ({} lignes) : {}", report.getRows().size(), path);
    }

    /** Ordre des lignes conservé tel quel ; l'en-tête est écrit même sans ligne. */
    public void writeCsv(StalenessReport report, Path path) {
        List<String[]> lines = report.getRows().stream()
                .map(this::rowToMap)
                .map(m -> {
                    String[] line = new String[CSV_COLUMNS.length];
                    for (int i = 0; i < CSV_COLUMNS.length; i++) line[i] = cell(m.get(CSV_COLUMNS[i]));
                    return line;
                })
                .toList();
        ReportFiles.writeCsv(path, CSV_COLUMNS, lines);
        log.info("💾 Rapport staleness CSV écrit ({} lignes) : {}", lines.size(), path);
    }

    private Map<String, Object> rowToMap(StalenessRow r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("market", r.getMarket());
        m.put("reason_code", r.getReasonCode());
        m.put("age_band", r.getAgeBand().getLabel());
        m.put("total", r.getTotal());
        m.put("correct", r.getCorrect());
        m.put("neutral", r.getNeutral());
        m.put("accuracy", round4(r.getAccuracy()));
        m.put("neutral_rate", round4(r.getNeutralRate()));
        m.put("avg_confidence", round4(r.getAvgConfidence()));
        return m;
    }
}
