package com.tony.decisionQuality.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.tony.decisionQuality.exception.EvidenceValidationException;
import com.tony.decisionQuality.model.evidence.EvidenceDraft;
import com.tony.decisionQuality.model.evidence.EvidenceItem;
import com.tony.decisionQuality.model.evidence.EvidenceType;
import com.tony.decisionQuality.model.evidence.ReliabilityTier;
import com.tony.decisionQuality.model.evidence.SourceClass;
import com.tony.decisionQuality.util.CanonicalJson;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Lit un payload de preuves enregistré : { "fixture_id": "...", "items": [ ... ] }.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecordedEvidenceParser {

    public static final int MAX_TAGS = 50;
    private static final List<String> ITEM_REQUIRED =
            List.of("title", "evidence_type", "source_class", "source_name", "reliability_tier", "observed_at");

    private final Clock clock;

    public List<EvidenceItem> parse(Path file) {
        Map<String, Object> payload;
        try {
            payload = CanonicalJson.mapper().readValue(file.toFile(), new TypeReference<Map<String, Object>>() {});
        } catch (IOException e) {
            throw new EvidenceValidationException("Cannot read recorded evidence " + file + ": " + e.getMessage());
        }
        return parsePayload(payload);
    }

    public List<EvidenceItem> parsePayload(Map<String, Object> payload) {
        if (payload == null) {
            throw new EvidenceValidationException("recorded evidence payload is empty");
        }
        for (String key : List.of("fixture_id", "items")) {
            if (!payload.containsKey(key)) {
                throw new EvidenceValidationException("recorded evidence payload missing required key: '" + key + "'");
            }
        }
        String fixtureId = Objects.toString(payload.get("fixture_id"), "").trim();
        if (fixtureId.isEmpty()) {
            throw new EvidenceValidationException("fixture_id must be non-empty");
        }
        if (!(payload.get("items") instanceof List<?> rawItems)) {
            throw new EvidenceValidationException("items must be an array");
        }

        OffsetDateTime createdAt = OffsetDateTime.now(clock);
        List<EvidenceItem> result = new ArrayList<>();
        for (int i = 0; i < rawItems.size(); i++) {
            if (!(rawItems.get(i) instanceof Map<?, ?> raw)) {
                throw new EvidenceValidationException("items[" + i + "] must be an object");
            }
            result.add(parseItem(raw, fixtureId, UUID.randomUUID().toString(), createdAt));
        }
        log.info("📥 {} preuve(s) lue(s) pour le match {}", result.size(), fixtureId);
        return result;
    }

    EvidenceItem parseItem(Map<?, ?> raw, String fixtureId, String evidenceId, OffsetDateTime createdAt) {
        for (String key : ITEM_REQUIRED) {
            if (!raw.containsKey(key)) {
                throw new EvidenceValidationException("evidence item missing required key: '" + key + "'");
            }
        }
        OffsetDateTime observedAt = parseDateTime(raw.get("observed_at"));
        if (observedAt == null) {
            throw new EvidenceValidationException("observed_at must be ISO8601 datetime");
        }
        OffsetDateTime effectiveFrom = parseDateTime(raw.get("effective_from"));

        String title = Objects.toString(raw.get("title"), "").trim();
        if (title.isEmpty()) {
            throw new EvidenceValidationException("title must be non-empty");
        }
        String sourceName = Objects.toString(raw.get("source_name"), "").trim();
        if (sourceName.isEmpty()) {
            throw new EvidenceValidationException("source_name must be non-empty");
        }

        EvidenceDraft draft = EvidenceDraft.builder()
                .evidenceId(evidenceId)
                .fixtureId(fixtureId)
                .teamId(trimmed(raw.get("team_id")))
                .playerId(trimmed(raw.get("player_id")))
                .evidenceType(parseEnum(EvidenceType.class, "evidence_type", raw.get("evidence_type")))
                .title(title)
                .description(raw.get("description") == null ? null : raw.get("description").toString())
                .sourceClass(parseEnum(SourceClass.class, "source_class", raw.get("source_class")))
                .sourceName(sourceName)
                .sourceRef(trimmed(raw.get("source_ref")))
                .reliabilityTier(parseEnum(ReliabilityTier.class, "reliability_tier", raw.get("reliability_tier")))
                .observedAt(observedAt)
                .effectiveFrom(effectiveFrom == null ? observedAt : effectiveFrom)
                .expectedValidUntil(parseDateTime(raw.get("expected_valid_until")))
                .createdAt(createdAt)
                .conflictGroupId(trimmed(raw.get("conflict_group_id")))
                .tags(parseTags(raw.get("tags")))
                .build();
        return EvidenceItem.from(draft);
    }

    /** Date ISO-8601 ; sans fuseau = UTC. Valeur illisible = null. */
    static OffsetDateTime parseDateTime(Object value) {
        if (value == null) return null;
        String s = value.toString().trim();
        if (s.isEmpty()) return null;
        try {
            return OffsetDateTime.parse(s);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(s).atOffset(ZoneOffset.UTC);
            } catch (DateTimeParseException notLocal) {
                return null;
            }
        }
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String field, Object value) {
        String s = value == null ? "" : value.toString().trim().toUpperCase(Locale.ROOT);
        for (E constant : type.getEnumConstants()) {
            if (constant.name().equals(s)) return constant;
        }
        throw new EvidenceValidationException(field + " must be one of "
                + Arrays.toString(type.getEnumConstants()) + ", got '" + value + "'");
    }

    private static List<String> parseTags(Object value) {
        if (!(value instanceof List<?> raw)) return null;
        return raw.stream()
                .filter(Objects::nonNull)
                .map(t -> t.toString().trim())
                .limit(MAX_TAGS)
                .toList();
    }

    private static String trimmed(Object value) {
        return value == null ? null : value.toString().trim();
    }
}
