package com.tony.decisionQuality.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.tony.decisionQuality.config.PipelineProperties;
import com.tony.decisionQuality.config.SafetyGates;
import com.tony.decisionQuality.exception.InvalidSnapshotPathException;
import com.tony.decisionQuality.exception.LiveIoDisabledException;
import com.tony.decisionQuality.util.CanonicalJson;
import com.tony.decisionQuality.util.ReportFiles;
import com.tony.decisionQuality.util.SnapshotPaths;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Écriture de snapshots (derrière LIVE_IO_ALLOWED + SNAPSHOT_WRITES_ALLOWED) et replay en lecture
 * seule (derrière SNAPSHOT_REPLAY_ENABLED). Tout reste sous reports/snapshots.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SnapshotHarnessService {

    public static final String REPLAY_REPORT_NAME = "replay_report.json";
    public static final String REPLAY_NOTE = "recorded replay";

    private final PipelineProperties properties;
    private final Clock clock;

    public List<Path> writeSnapshots(SafetyGates gates, String runId, List<String> filenames, Map<String, Object> payload) {
        if (!gates.isLiveIoAllowed()) {
            log.warn("🛑 Harness snapshot refusé : LIVE_IO_ALLOWED n'est pas activé");
            throw new LiveIoDisabledException("Live snapshot harness is disabled: LIVE_IO_ALLOWED is not true");
        }
        if (!gates.isSnapshotWritesAllowed()) {
            log.warn("🛑 Harness snapshot refusé : SNAPSHOT_WRITES_ALLOWED n'est pas activé");
            throw new LiveIoDisabledException("Live snapshot harness is disabled: SNAPSHOT_WRITES_ALLOWED is not true");
        }

        List<String> names = filenames == null || filenames.isEmpty() ? List.of("snapshot_stub.json") : filenames;

        // Tous les chemins validés avant la première écriture
        List<Path> targets = names.stream().map(n -> SnapshotPaths.safeSnapshotPath(runId, n, snapshotsBase())).toList();

        String createdAt = CanonicalJson.iso(Instant.now(clock));
        for (int i = 0; i < targets.size(); i++) {
            Map<String, Object> content = new LinkedHashMap<>();
            content.put("run_id", runId);
            content.put("created_at", createdAt);
            content.put("filename", names.get(i));
            content.put("payload", payload == null ? Map.of() : payload);
            content.put("payload_checksum", CanonicalJson.checksum(payload == null ? Map.of() : payload));
            ReportFiles.writeJson(targets.get(i), content);
        }
        log.info("📸 {} snapshot(s) écrit(s) pour le run {}", targets.size(), runId);
        return targets;
    }

    /**
     * Relit les *.json du run (ordre trié) et écrit replay_report.json à côté.
     */
    public Map<String, Object> replayFromSnapshots(SafetyGates gates, String runId) {
        if (!gates.isSnapshotReplayEnabled()) {
            log.warn("🛑 Replay refusé : SNAPSHOT_REPLAY_ENABLED n'est pas activé");
            throw new LiveIoDisabledException("Snapshot replay is disabled: SNAPSHOT_REPLAY_ENABLED is not true");
        }
        Path reportPath = SnapshotPaths.safeSnapshotPath(runId, REPLAY_REPORT_NAME, snapshotsBase());
        Path dir = reportPath.getParent();
        if (!Files.isDirectory(dir)) {
            throw new InvalidSnapshotPathException("snapshot_dir is not a directory: " + dir);
        }

        List<JsonNode> inputs = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            List<Path> jsonFiles = files
                    .filter(p -> p.getFileName().toString().endsWith(".json"))
                    .filter(p -> !p.getFileName().toString().equals(REPLAY_REPORT_NAME))
                    .sorted()
                    .toList();
            for (Path file : jsonFiles) {
                inputs.add(CanonicalJson.mapper().readTree(file.toFile()));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Lecture des snapshots impossible : " + dir, e);
        }

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("note", REPLAY_NOTE);
        report.put("snapshots_used", inputs.size());
        report.put("recorded_inputs", inputs);
        report.put("snapshot_dir", dir.toString());
        ReportFiles.writeJson(reportPath, report);

        log.info("⏪ Replay du run {} : {} snapshot(s) relu(s)", runId, inputs.size());
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("snapshots_used", inputs.size());
        summary.put("note", REPLAY_NOTE);
        summary.put("report_path", reportPath.toString());
        return summary;
    }

    private Path snapshotsBase() {
        return Path.of(properties.getSnapshotsDir());
    }
}
