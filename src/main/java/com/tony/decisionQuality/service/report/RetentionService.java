package com.tony.decisionQuality.service.report;

import com.tony.decisionQuality.model.report.RunIndex;
import com.tony.decisionQuality.model.report.RunIndexEntry;
import com.tony.decisionQuality.util.SnapshotPaths;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Rétention des rapports : on garde les N runs les plus récents (ordre d'ajout).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetentionService {

    public static final String RUNS_SUBDIR = "runs";

    private final RunIndexStore indexStore;

    /** Résultat d'un nettoyage : index élagué, chemins supprimés (ou à supprimer en dry-run), erreurs. */
    public record CleanupResult(RunIndex index, List<Path> deletedPaths, int errorCount) {
    }

    /**
     * Tronque l'index sur place : au plus maxRetained entrées, les plus récentes.
     * latest_run_id suit la dernière entrée survivante (null si la liste est vide).
     */
    public RunIndex pruneIndex(RunIndex index, int maxRetained) {
        if (maxRetained < 0) {
            throw new IllegalArgumentException("max_retained must be >= 0, got " + maxRetained);
        }
        List<RunIndexEntry> runs = index.getRuns() == null ? new ArrayList<>() : index.getRuns();
        if (runs.size() > maxRetained) {
            runs = new ArrayList<>(runs.subList(runs.size() - maxRetained, runs.size()));
        }
        index.setRuns(runs);
        index.setLatestRunId(runs.isEmpty() ? null : runs.get(runs.size() - 1).getRunId());
        return index;
    }

    /**
     * Élague reports/index.json et supprime les dossiers runs/&lt;run_id&gt; des runs écartés.
     * Rien n'est supprimé hors de reportsDir ; en dry-run rien n'est supprimé du tout.
     */
    public CleanupResult cleanupReports(Path reportsDir, int keepLastN, boolean dryRun) {
        if (keepLastN < 0) {
            throw new IllegalArgumentException("keep_last_n must be >= 0, got " + keepLastN);
        }
        Path indexPath = reportsDir.resolve(RunIndexStore.INDEX_FILENAME);
        RunIndex index = indexStore.load(indexPath);
        List<RunIndexEntry> runs = index.getRuns();
        if (runs.size() <= keepLastN) {
            return new CleanupResult(index, List.of(), 0);
        }

        Set<String> removed = new LinkedHashSet<>();
        runs.subList(0, runs.size() - keepLastN).forEach(e -> removed.add(e.getRunId()));
        pruneIndex(index, keepLastN);
        index.getRuns().forEach(e -> removed.remove(e.getRunId()));

        Path runsRoot = reportsDir.resolve(RUNS_SUBDIR);
        List<Path> deleted = new ArrayList<>();
        int errors = 0;
        for (String runId : removed) {
            Path candidate;
            try {
                candidate = SnapshotPaths.safeRunDir(runId, runsRoot);
            } catch (IllegalArgumentException e) {
                log.warn("⚠️ run_id {} ignoré au nettoyage : {}", runId, e.getMessage());
                errors++;
                continue;
            }
            if (!Files.exists(candidate)) continue;
            if (!SnapshotPaths.isUnder(candidate, reportsDir)) {
                errors++;
                continue;
            }
            deleted.add(candidate);
            if (!dryRun) {
                try {
                    FileSystemUtils.deleteRecursively(candidate);
                } catch (IOException e) {
                    log.error("❌ Suppression impossible : {}", candidate, e);
                    errors++;
                }
            }
        }

        if (!dryRun) {
            indexStore.save(index, indexPath);
        }
        log.info("🧹 Rétention : {} run(s) écarté(s), {} dossier(s) {}, {} erreur(s)",
                removed.size(), deleted.size(), dryRun ? "à supprimer (dry-run)" : "supprimé(s)", errors);
        return new CleanupResult(index, deleted, errors);
    }
}
