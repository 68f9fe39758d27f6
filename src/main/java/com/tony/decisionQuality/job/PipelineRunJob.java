package com.tony.decisionQuality.job;

import com.fasterxml.jackson.core.type.TypeReference;
import com.tony.decisionQuality.config.PipelineProperties;
import com.tony.decisionQuality.model.EvaluationRecord;
import com.tony.decisionQuality.model.report.PipelineRunSummary;
import com.tony.decisionQuality.service.EvaluationPipelineOrchestrator;
import com.tony.decisionQuality.util.CanonicalJson;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Lance un run offline au démarrage quand pipeline.records-path est renseigné.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PipelineRunJob implements CommandLineRunner {

    private static final DateTimeFormatter RUN_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'");
    private static final int RUN_ID_SUFFIX_LENGTH = 8;

    private final EvaluationPipelineOrchestrator orchestrator;
    private final PipelineProperties properties;
    private final Clock clock;

    @Override
    public void run(String... args) throws Exception {
        String recordsPath = properties.getRecordsPath();
        if (recordsPath == null || recordsPath.isBlank()) {
            log.info("Aucun fichier d'évaluations configuré (pipeline.records-path), pas de run au démarrage.");
            return;
        }
        Path path = Path.of(recordsPath.trim());
        if (!Files.isRegularFile(path)) {
            log.error("❌ Fichier d'évaluations introuvable : {}", path);
            return;
        }

        List<EvaluationRecord> records = CanonicalJson.mapper()
                .readValue(path.toFile(), new TypeReference<List<EvaluationRecord>>() {});
        String runId = runIdFor(ZonedDateTime.now(clock), records);

        log.info("⏰ Démarrage du run {} sur {}", runId, path);
        PipelineRunSummary summary = orchestrator.runOffline(runId, properties.getConnectorName(), records);
        log.info("   -> {} décisions, {} alertes, checksum {}", summary.getRecordsCount(),
                summary.getAlertsCount(), summary.getBatchOutputChecksum());
    }

    /**
     * run_&lt;horodatage UTC&gt;_&lt;8 premiers hex de l'empreinte des entrées&gt; : deux runs dans la
     * même seconde sur des entrées différentes n'ont pas le même dossier.
     */
    static String runIdFor(ZonedDateTime startedAt, List<EvaluationRecord> records) {
        String stamp = startedAt.withZoneSameInstant(ZoneOffset.UTC).format(RUN_ID_FORMAT);
        return "run_" + stamp + "_" + CanonicalJson.checksum(records).substring(0, RUN_ID_SUFFIX_LENGTH);
    }
}
