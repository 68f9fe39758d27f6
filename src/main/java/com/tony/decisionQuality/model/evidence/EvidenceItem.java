package com.tony.decisionQuality.model.evidence;

import com.tony.decisionQuality.exception.EvidenceValidationException;
import com.tony.decisionQuality.util.CanonicalJson;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Fait daté sur un match / une équipe / un joueur (blessure, suspension, news, perturbation).
 * Immuable : toute modification repasse par un brouillon et recalcule le checksum.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EvidenceItem {
    public static final int TITLE_MAX_LEN = 256;
    public static final int DESCRIPTION_MAX_LEN = 2000;

    String evidenceId;
    String fixtureId;
    String teamId;
    String playerId;
    EvidenceType evidenceType;
    String title;
    String description;
    SourceClass sourceClass;
    String sourceName;
    String sourceRef;
    ReliabilityTier reliabilityTier;
    OffsetDateTime observedAt;
    OffsetDateTime effectiveFrom;
    OffsetDateTime expectedValidUntil;
    OffsetDateTime createdAt;
    String conflictGroupId;
    List<String> tags;
    String checksum;

    public static EvidenceItem from(EvidenceDraft draft) {
        if (draft.getFixtureId() == null || draft.getFixtureId().isBlank()) {
            throw new EvidenceValidationException("fixture_id must be non-empty");
        }
        if (draft.getEvidenceType() == null || draft.getSourceClass() == null || draft.getReliabilityTier() == null) {
            throw new EvidenceValidationException("evidence_type, source_class and reliability_tier are required");
        }
        if (draft.getObservedAt() == null || draft.getCreatedAt() == null) {
            throw new EvidenceValidationException("observed_at and created_at are required");
        }

        // Troncature silencieuse, pas de rejet
        String title = truncate(draft.getTitle(), TITLE_MAX_LEN);
        String description = truncate(draft.getDescription(), DESCRIPTION_MAX_LEN);
        List<String> tags = draft.getTags() == null ? null : List.copyOf(draft.getTags());

        Map<String, Object> content = canonicalContent(draft, title, description, tags);
        return new EvidenceItem(
                draft.getEvidenceId(), draft.getFixtureId(), draft.getTeamId(), draft.getPlayerId(),
                draft.getEvidenceType(), title, description, draft.getSourceClass(),
                draft.getSourceName(), draft.getSourceRef(), draft.getReliabilityTier(),
                draft.getObservedAt(), draft.getEffectiveFrom(), draft.getExpectedValidUntil(),
                draft.getCreatedAt(), draft.getConflictGroupId(), tags,
                CanonicalJson.checksum(content));
    }

    public EvidenceDraft toDraft() {
        return EvidenceDraft.builder()
                .evidenceId(evidenceId).fixtureId(fixtureId).teamId(teamId).playerId(playerId)
                .evidenceType(evidenceType).title(title).description(description)
                .sourceClass(sourceClass).sourceName(sourceName).sourceRef(sourceRef)
                .reliabilityTier(reliabilityTier).observedAt(observedAt).effectiveFrom(effectiveFrom)
                .expectedValidUntil(expectedValidUntil).createdAt(createdAt)
                .conflictGroupId(conflictGroupId)
                .tags(tags == null ? null : new ArrayList<>(tags))
                .build();
    }

    /** Contenu qui fait l'identité : tout sauf evidence_id et checksum. Tags triés. */
    private static Map<String, Object> canonicalContent(EvidenceDraft d, String title, String description, List<String> tags) {
        Map<String, Object> content = new TreeMap<>();
        content.put("conflict_group_id", d.getConflictGroupId());
        content.put("created_at", CanonicalJson.iso(d.getCreatedAt()));
        content.put("description", description);
        content.put("effective_from", CanonicalJson.iso(d.getEffectiveFrom()));
        content.put("evidence_type", d.getEvidenceType().name());
        content.put("expected_valid_until", CanonicalJson.iso(d.getExpectedValidUntil()));
        content.put("fixture_id", d.getFixtureId());
        content.put("observed_at", CanonicalJson.iso(d.getObservedAt()));
        content.put("player_id", d.getPlayerId());
        content.put("reliability_tier", d.getReliabilityTier().name());
        content.put("source_class", d.getSourceClass().name());
        content.put("source_name", d.getSourceName());
        content.put("source_ref", d.getSourceRef());
        content.put("tags", tags == null || tags.isEmpty() ? null : tags.stream().sorted().toList());
        content.put("team_id", d.getTeamId());
        content.put("title", title);
        return content;
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) return value;
        return value.substring(0, max);
    }
}
