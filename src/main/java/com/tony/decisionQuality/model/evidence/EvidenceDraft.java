package com.tony.decisionQuality.model.evidence;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Brouillon mutable d'une preuve. Passe par {@link EvidenceItem#from(EvidenceDraft)} pour être
 * tronqué et checksummé.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class EvidenceDraft {
    private String evidenceId;
    private String fixtureId;
    private String teamId;
    private String playerId;
    private EvidenceType evidenceType;
    private String title;
    private String description;
    private SourceClass sourceClass;
    private String sourceName;
    private String sourceRef;
    private ReliabilityTier reliabilityTier;
    private OffsetDateTime observedAt;
    private OffsetDateTime effectiveFrom;
    private OffsetDateTime expectedValidUntil;
    private OffsetDateTime createdAt;
    private String conflictGroupId;
    private List<String> tags;
}
