package com.tony.decisionQuality.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.tony.decisionQuality.model.DecayKey;
import com.tony.decisionQuality.model.DecayModelParams;
import com.tony.decisionQuality.util.CanonicalJson;
import com.tony.decisionQuality.util.ReportFiles;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persistance de reason_decay_params.json : {params: [...], fitted_at_utc}.
 */
@Service
@Slf4j
public class DecayParamsStore {

    public static final String RELATIVE_PATH = "decay_fit/reason_decay_params.json";

    public void save(List<DecayModelParams> params, String fittedAtUtc, Path path) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("fitted_at_utc", fittedAtUtc);
        payload.put("params", params);
        ReportFiles.writeJson(path, payload);
        log.info("💾 {} modèles de décroissance écrits : {}", params.size(), path);
    }

    /**
     * Fichier absent ou illisible = aucun modèle (aucune pénalité), jamais d'exception.
     */
    public Map<DecayKey, DecayModelParams> load(Path path) {
        Map<DecayKey, DecayModelParams> out = new LinkedHashMap<>();
        if (!Files.isRegularFile(path)) return out;
        try {
            JsonNode root = CanonicalJson.mapper().readTree(path.toFile());
            JsonNode list = root.path("params");
            if (!list.isArray()) return out;
            for (JsonNode node : list) {
                if (!node.isObject()) continue;
                DecayModelParams params = CanonicalJson.mapper().treeToValue(node, DecayModelParams.class);
                out.put(DecayKey.of(params), params);
            }
        } catch (IOException | IllegalArgumentException e) {
            log.warn("⚠️ Paramètres de décroissance illisibles ({}), aucune pénalité appliquée : {}", path, e.getMessage());
            out.clear();
        }
        return out;
    }
}
