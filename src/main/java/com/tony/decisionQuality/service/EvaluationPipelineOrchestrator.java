package com.tony.decisionQuality.service;

import com.tony.decisionQuality.client.ConnectorRegistry;
import com.tony.decisionQuality.config.PipelineProperties;
import com.tony.decisionQuality.config.SafetyGates;
import com.tony.decisionQuality.config.SafetyGatesProvider;
import com.tony.decisionQuality.exception.LiveIoDisabledException;
import com.tony.decisionQuality.exception.ReportValidationException;
import com.tony.decisionQuality.model.DecayKey;
import com.tony.decisionQuality.model.DecayModelParams;
import com.tony.decisionQuality.model.EvaluationRecord;
import com.tony.decisionQuality.model.Outcome;
import com.tony.decisionQuality.model.PenaltyShadowRow;
import com.tony.decisionQuality.model.StalenessReport;
import com.tony.decisionQuality.model.UncertaintyProfile;
import com.tony.decisionQuality.model.policy.Policy;
import com.tony.decisionQuality.model.report.PipelineRunSummary;
import com.tony.decisionQuality.model.report.ReportValidationResult;
import com.tony.decisionQuality.model.report.RunIndex;
import com.tony.decisionQuality.model.report.RunIndexEntry;
import com.tony.decisionQuality.service.report.ReportSchemaValidator;
import com.tony.decisionQuality.service.report.RetentionService;
import com.tony.decisionQuality.service.report.RunIndexStore;
import com.tony.decisionQuality.util.CanonicalJson;
import com.tony.decisionQuality.util.ReportFiles;
import com.tony.decisionQuality.util.SnapshotPaths;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Enchaîne un run offline complet : staleness -> fit de décroissance -> shadow pénalité -> shadow incertitude,
 * puis rapport pipeline validé, index et rétention. Tout est écrit sous reports/runs/&lt;run_id&gt;/.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EvaluationPipelineOrchestrator {

    public static final String PIPELINE_REPORT_NAME = "pipeline_report.json";
    public static final String STALENESS_SUBDIR = "staleness";

    private final StalenessAggregationService stalenessService;
    private final StalenessReportWriter stalenessWriter;
    private final ReasonDecayFitService decayFitService;
    private final DecayParamsStore decayParamsStore;
    private final ConfidencePenaltyShadowService penaltyShadowService;
    private final UncertaintyShadowService uncertaintyShadowService;
    private final PolicyStore policyStore;
    private final ReportSchemaValidator reportValidator;
    private final RunIndexStore indexStore;
    private final RetentionService retentionService;
    private final ConnectorRegistry connectorRegistry;
    private final SafetyGatesProvider gatesProvider;
    private final PipelineProperties properties;
    private final Clock clock;

    public PipelineRunSummary runOffline(String runId, String connectorName, List<EvaluationRecord> records) {
        SafetyGates gates = gatesProvider.current();
        checkConnector(connectorName, gates);

        Path reportsDir = Path.of(properties.getReportsDir());
        // Chemin du run validé avant toute écriture
        Path runDir = SnapshotPaths.safeRunDir(runId, reportsDir.resolve(RetentionService.RUNS_SUBDIR));
        if (Files.exists(runDir)) {
            throw new IllegalStateException("Run directory already exists for run_id " + runId + ": " + runDir);
        }
        if (properties.getMaxReportsRetained() < 0) {
            throw new IllegalArgumentException("pipeline.max-reports-retained must be >= 0, got "
                    + properties.getMaxReportsRetained());
        }
        String now = CanonicalJson.iso(Instant.now(clock));

        log.info("🚀 Run {} : {} décision(s) évaluée(s), connecteur '{}'", runId, records.size(), connectorName);

        // 1. Staleness
        StalenessReport staleness = stalenessService.aggregate(records, now, "run_id=" + runId);

        // 2. Fit de décroissance par (marché, raison)
        List<DecayModelParams> decayModels = decayFitService.fit(staleness.getRows(), now);
        Map<DecayKey, DecayModelParams> decayMap = decayModels.stream()
                .collect(Collectors.toMap(DecayKey::of, Function.identity(), (a, b) -> b, LinkedHashMap::new));

        // 3. Shadows (rapport uniquement)
        List<PenaltyShadowRow> penaltyRows = penaltyShadowService.computeRows(records, decayMap);
        List<UncertaintyProfile> profiles = uncertaintyShadowService.computeProfiles(records, penaltyRows, decayMap);
        int alertsCount = (int) profiles.stream().filter(p -> !p.triggered().isEmpty()).count();

        Policy policy = policyStore.getActivePolicy();
        String batchChecksum = batchOutputChecksum(staleness, penaltyRows, profiles);

        Map<String, Object> report = buildReport(runId, connectorName, records, staleness, decayModels,
                penaltyRows, profiles, policy, batchChecksum, gates, now);

        ReportValidationResult validation = reportValidator.validate(report);
        if (!validation.isPassed()) {
            if (gates.isReportSchemaStrict()) {
                log.error("❌ Rapport du run {} rejeté (validation stricte) : {}", runId, validation.getErrors());
                throw new ReportValidationException(validation.getErrors());
            }
            log.warn("⚠️ Rapport du run {} non conforme, écrit quand même : {}", runId, validation.getErrors());
        }
        Map<String, Object> schemaValidation = new LinkedHashMap<>();
        schemaValidation.put("passed", validation.isPassed());
        schemaValidation.put("errors", validation.getErrors());
        report.put("schema_validation", schemaValidation);

        // Écritures, toutes sous runs/<run_id>/
        stalenessWriter.writeJson(staleness, runDir.resolve(STALENESS_SUBDIR).resolve("staleness_report.json"));
        stalenessWriter.writeCsv(staleness, runDir.resolve(STALENESS_SUBDIR).resolve("staleness_report.csv"));
        decayParamsStore.save(decayModels, now, runDir.resolve(DecayParamsStore.RELATIVE_PATH));
        penaltyShadowService.write(penaltyRows, now, runDir.resolve(ConfidencePenaltyShadowService.SUBDIR));
        uncertaintyShadowService.write(profiles, now, runDir.resolve(UncertaintyShadowService.SUBDIR));
        ReportFiles.writeJson(runDir.resolve(PIPELINE_REPORT_NAME), report);

        // Index + rétention
        Path indexPath = reportsDir.resolve(RunIndexStore.INDEX_FILENAME);
        RunIndex index = indexStore.load(indexPath);
        indexStore.appendRun(index, RunIndexEntry.builder()
                .runId(runId)
                .createdAtUtc(now)
                .connectorName(connectorName)
                .matchesCount(records.size())
                .batchOutputChecksum(batchChecksum)
                .alertsCount(alertsCount)
                .build());
        indexStore.save(index, indexPath);
        retentionService.cleanupReports(reportsDir, properties.getMaxReportsRetained(), false);

        log.info("✅ Run {} terminé : {} lignes staleness, {} modèles, {} lignes shadow, {} alerte(s)",
                runId, staleness.getRows().size(), decayModels.size(), penaltyRows.size(), alertsCount);

        return PipelineRunSummary.builder()
                .runId(runId)
                .recordsCount(records.size())
                .stalenessRows(staleness.getRows().size())
                .decayModels(decayModels.size())
                .penaltyRows(penaltyRows.size())
                .alertsCount(alertsCount)
                .batchOutputChecksum(batchChecksum)
                .runDir(runDir)
                .build();
    }

    // Un connecteur live connu mais non autorisé bloque le run ; un nom inconnu = fichier enregistré
    private void checkConnector(String connectorName, SafetyGates gates) {
        if (connectorRegistry.get(connectorName).isPresent()
                && connectorRegistry.resolveSafe(connectorName, gates).isEmpty()) {
            throw new LiveIoDisabledException("Connector '" + connectorName + "' requires LIVE_IO_ALLOWED=true");
        }
    }

    private Map<String, Object> buildReport(String runId, String connectorName, List<EvaluationRecord> records,
                                            StalenessReport staleness, List<DecayModelParams> decayModels,
                                            List<PenaltyShadowRow> penaltyRows, List<UncertaintyProfile> profiles,
                                            Policy policy, String batchChecksum, SafetyGates gates, String now) {
        Map<String, Object> ingestion = new LinkedHashMap<>();
        ingestion.put("connector_name", connectorName);
        ingestion.put("records_count", records.size());
        ingestion.put("batch_input_checksum", CanonicalJson.checksum(records));

        long belowThreshold = penaltyRows.stream()
                .filter(r -> r.getResult().getPenalizedConfidence()
                        < PolicyStore.minConfidenceFor(policy, r.getResult().getMarket()))
                .count();
        Map<String, Object> analysis = new LinkedHashMap<>();
        analysis.put("staleness_rows", staleness.getRows().size());
        analysis.put("decay_models", decayModels.size());
        analysis.put("decay_models_with_support", decayModels.stream().filter(m -> !m.isSupportFree()).count());
        analysis.put("penalty_shadow_rows", penaltyRows.size());
        analysis.put("below_policy_threshold_shadow", belowThreshold);
        analysis.put("policy_version", policy.getMeta().getVersion());
        analysis.put("policy_checksum", PolicyStore.policyChecksum(policy));

        Map<String, Long> outcomes = new TreeMap<>();
        for (EvaluationRecord rec : records) {
            if (rec.getMarketOutcomes() == null) continue;
            for (Outcome outcome : rec.getMarketOutcomes().values()) {
                if (outcome != null) outcomes.merge(outcome.name(), 1L, Long::sum);
            }
        }
        Map<String, Object> resolution = new LinkedHashMap<>();
        resolution.put("outcome_counts", outcomes);

        long wouldRefuse = profiles.stream().filter(uncertaintyShadowService::wouldRefuse).count();
        Map<String, Object> proposal = new LinkedHashMap<>();
        proposal.put("mode", "shadow");
        proposal.put("alerts_count", profiles.stream().filter(p -> !p.triggered().isEmpty()).count());
        proposal.put("would_refuse_count", wouldRefuse);
        proposal.put("note", "Shadow outputs only, no decision is changed");

        Map<String, Object> audit = new LinkedHashMap<>();
        audit.put("run_id", runId);
        audit.put("created_at_utc", now);
        audit.put("batch_output_checksum", batchChecksum);
        audit.put("safety_summary", gates.toSafetySummary());

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("schema_version", ReportSchemaValidator.REPORT_SCHEMA_VERSION);
        report.put("canonical_flow", ReportSchemaValidator.CANONICAL_FLOW_SHADOW_RUN);
        report.put("ingestion", ingestion);
        report.put("analysis", analysis);
        report.put("resolution", resolution);
        report.put("evaluation_report_checksum", CanonicalJson.checksum(stalenessWriter.toReportMap(staleness)));
        report.put("proposal", proposal);
        report.put("audit", audit);
        return report;
    }

    // Horodatages exclus : mêmes entrées = même empreinte d'un run à l'autre
    private String batchOutputChecksum(StalenessReport staleness, List<PenaltyShadowRow> penaltyRows,
                                       List<UncertaintyProfile> profiles) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("staleness_rows", stalenessWriter.toReportMap(staleness).get("rows"));
        content.put("penalty_rows", penaltyRows);
        content.put("uncertainty_profiles", profiles);
        return CanonicalJson.checksum(content);
    }
}
