package com.tony.decisionQuality.service.report;

import com.tony.decisionQuality.model.report.RunIndex;
import com.tony.decisionQuality.model.report.RunIndexEntry;
import com.tony.decisionQuality.util.CanonicalJson;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;

/**
 * Lecture / écriture de reports/index.json. Un index absent ou corrompu est traité comme vide.
 */
@Component
@Slf4j
public class RunIndexStore {

    public static final String INDEX_FILENAME = "index.json";

    public RunIndex load(Path path) {
        if (!Files.isRegularFile(path)) {
            return RunIndex.empty();
        }
        try {
            RunIndex index = CanonicalJson.mapper().readValue(path.toFile(), RunIndex.class);
            if (index == null) return RunIndex.empty();
            if (index.getRuns() == null) index.setRuns(new ArrayList<>());
            return index;
        } catch (IOException e) {
            log.warn("⚠️ Index {} illisible, on repart d'un index vide : {}", path, e.getMessage());
            return RunIndex.empty();
        }
    }

    /** Ajoute l'entrée en fin de liste et met à jour latest_run_id. Modifie et renvoie le même index. */
    public RunIndex appendRun(RunIndex index, RunIndexEntry entry) {
        if (index.getRuns() == null) index.setRuns(new ArrayList<>());
        index.getRuns().add(entry);
        index.setLatestRunId(entry.getRunId());
        return index;
    }

    /** JSON compact à clés triées, identique d'une sauvegarde à l'autre pour un même index. */
    public void save(RunIndex index, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(path, CanonicalJson.canonicalize(index), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Écriture de l'index impossible : " + path, e);
        }
    }
}
