package com.tony.decisionQuality.service;

import com.tony.decisionQuality.config.PipelineProperties;
import com.tony.decisionQuality.model.ReplayScenario;
import com.tony.decisionQuality.model.ScenarioType;
import com.tony.decisionQuality.util.CanonicalJson;
import com.tony.decisionQuality.util.ReportFiles;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Génère des variantes « données en retard » à partir des métadonnées d'enveloppe d'un snapshot.
 * Seul le timing change : le payload et son empreinte restent identiques.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReplayScenarioService {

    public static final String LATE_DATA_SUBDIR = "replay_scenarios/late_data";

    public static final List<Integer> DELAY_OFFSET_MINUTES = List.of(15, 60, 6 * 60, 24 * 60, 3 * 24 * 60);
    public static final List<Integer> STALE_EFFECTIVE_OFFSET_MINUTES = List.of(-60, 60, 6 * 60);

    public static final List<String> OPTIONAL_TIMING_KEYS = List.of(
            "fetch_started_at_utc",
            "fetch_ended_at_utc",
            "latency_ms",
            "effective_from_utc",
            "expected_valid_until_utc");

    private final PipelineProperties properties;

    /** Scénario + métadonnées dérivées prêtes à être stockées. */
    public record ScenarioVariant(ReplayScenario scenario, Map<String, Object> metadata) {
    }

    public ScenarioVariant generateVariant(Map<String, Object> baseMeta, Map<String, Object> payload,
                                           ScenarioType type, Map<String, Object> parameters,
                                           String fixtureId, String createdAtUtc) {
        Map<String, Object> params = parameters == null ? Map.of() : parameters;
        String baseSnapshotId = firstText(baseMeta, "snapshot_id", "payload_checksum");
        String scenarioId = scenarioId(baseSnapshotId, type, params);

        Map<String, Object> derived = switch (type) {
            case DELAYED_OBSERVED_AT -> shiftTimestamp(baseMeta, "observed_at_utc",
                    intParam(params, "delay_minutes"), "observed_at_utc", "created_at_utc");
            case MISSING_TIMING_TAGS -> dropTimingTags(baseMeta);
            case STALE_EFFECTIVE_FROM -> shiftTimestamp(baseMeta, "effective_from_utc",
                    intParam(params, "shift_minutes"), "effective_from_utc", "observed_at_utc", "created_at_utc");
        };

        Object payloadChecksum = baseMeta.get("payload_checksum");
        derived.put("payload_checksum", isBlank(payloadChecksum)
                ? CanonicalJson.checksum(payload == null ? Map.of() : payload)
                : payloadChecksum);

        ReplayScenario scenario = new ReplayScenario(scenarioId, baseSnapshotId, fixtureId, type, params, createdAtUtc);
        derived.put("scenario", scenarioBlock(scenario));

        derived.remove("envelope_checksum");
        derived.put("envelope_checksum", CanonicalJson.checksum(derived));
        return new ScenarioVariant(scenario, derived);
    }

    public List<ScenarioVariant> generateDelayedObservedAt(Map<String, Object> baseMeta, Map<String, Object> payload,
                                                           String fixtureId, String createdAtUtc) {
        List<ScenarioVariant> out = new ArrayList<>();
        for (Integer delay : DELAY_OFFSET_MINUTES) {
            out.add(generateVariant(baseMeta, payload, ScenarioType.DELAYED_OBSERVED_AT,
                    Map.of("delay_minutes", delay), fixtureId, createdAtUtc));
        }
        return out;
    }

    public ScenarioVariant generateMissingTimingTags(Map<String, Object> baseMeta, Map<String, Object> payload,
                                                     String fixtureId, String createdAtUtc) {
        return generateVariant(baseMeta, payload, ScenarioType.MISSING_TIMING_TAGS, Map.of(), fixtureId, createdAtUtc);
    }

    public List<ScenarioVariant> generateStaleEffectiveFrom(Map<String, Object> baseMeta, Map<String, Object> payload,
                                                            String fixtureId, String createdAtUtc) {
        List<ScenarioVariant> out = new ArrayList<>();
        for (Integer shift : STALE_EFFECTIVE_OFFSET_MINUTES) {
            out.add(generateVariant(baseMeta, payload, ScenarioType.STALE_EFFECTIVE_FROM,
                    Map.of("shift_minutes", shift), fixtureId, createdAtUtc));
        }
        return out;
    }

    /**
     * Écrit {metadata, payload} dans &lt;reports&gt;/replay_scenarios/late_data/&lt;scenario_id&gt;.json.
     * Un fichier existant n'est jamais réécrit.
     */
    public Path store(ScenarioVariant variant, Map<String, Object> payload) {
        Path dir = Path.of(properties.getReportsDir()).resolve(LATE_DATA_SUBDIR);
        Path target = dir.resolve(variant.scenario().getScenarioId() + ".json");
        if (Files.exists(target)) {
            log.info("Scénario {} déjà présent, fichier conservé tel quel", variant.scenario().getScenarioId());
            return target;
        }
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("metadata", variant.metadata());
        content.put("payload", payload == null ? Map.of() : payload);
        ReportFiles.writeJson(target, content);
        log.info("🧪 Scénario {} ({}) écrit : {}", variant.scenario().getScenarioId(),
                variant.scenario().getScenarioType(), target);
        return target;
    }

    /** 16 premiers caractères hex du SHA-256 de "base__TYPE__k=v..." (paramètres triés). */
    static String scenarioId(String baseSnapshotId, ScenarioType type, Map<String, Object> parameters) {
        List<String> parts = new ArrayList<>();
        parts.add(baseSnapshotId);
        parts.add(type.name());
        new TreeMap<>(parameters).forEach((k, v) -> parts.add(k + "=" + v));
        return CanonicalJson.sha256Hex(String.join("__", parts)).substring(0, 16);
    }

    private static Map<String, Object> scenarioBlock(ReplayScenario s) {
        Map<String, Object> block = new LinkedHashMap<>();
        block.put("scenario_id", s.getScenarioId());
        block.put("base_snapshot_id", s.getBaseSnapshotId());
        block.put("fixture_id", s.getFixtureId());
        block.put("scenario_type", s.getScenarioType().name());
        block.put("parameters", s.getParameters());
        block.put("created_at_utc", s.getCreatedAtUtc());
        return block;
    }

    private static Map<String, Object> dropTimingTags(Map<String, Object> meta) {
        Map<String, Object> out = new LinkedHashMap<>(meta);
        OPTIONAL_TIMING_KEYS.forEach(out::remove);
        return out;
    }

    // Décale la première date lisible parmi sourceKeys et l'écrit dans targetKey ; sinon copie inchangée
    private static Map<String, Object> shiftTimestamp(Map<String, Object> meta, String targetKey, int minutes,
                                                      String... sourceKeys) {
        Map<String, Object> out = new LinkedHashMap<>(meta);
        OffsetDateTime base = parseIso(firstText(meta, sourceKeys));
        if (base != null) {
            out.put(targetKey, CanonicalJson.iso(base.plusMinutes(minutes)));
        }
        return out;
    }

    static OffsetDateTime parseIso(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String s = raw.trim();
        try {
            return OffsetDateTime.parse(s);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(s).atOffset(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }

    private static String firstText(Map<String, Object> meta, String... keys) {
        for (String key : keys) {
            Object v = meta.get(key);
            if (!isBlank(v)) return v.toString();
        }
        return "";
    }

    private static int intParam(Map<String, Object> params, String key) {
        Object v = params.get(key);
        if (v instanceof Number n) return n.intValue();
        if (v == null) return 0;
        try {
            return Integer.parseInt(v.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Paramètre " + key + " non entier : " + v, e);
        }
    }

    private static boolean isBlank(Object v) {
        return v == null || v.toString().isBlank();
    }
}
