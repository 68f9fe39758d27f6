package com.tony.decisionQuality.util;

import com.tony.decisionQuality.exception.InvalidSnapshotPathException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Seule primitive autorisée pour construire un chemin de snapshot / replay / run :
 * base/&lt;run_id&gt;/&lt;filename&gt;, sans jamais sortir de la base. Aucune E/S en écriture ici.
 */
public final class SnapshotPaths {

    public static final String SNAPSHOTS_BASE_DIR = "reports/snapshots";
    public static final int MAX_SEGMENT_LENGTH = 128;

    private static final Pattern SAFE_SEGMENT = Pattern.compile("[A-Za-z0-9_.\\-]+");

    private SnapshotPaths() {
    }

    public static Path safeSnapshotPath(String runId, String filename) {
        return safeSnapshotPath(runId, filename, null);
    }

    public static Path safeSnapshotPath(String runId, String filename, Path baseDir) {
        String run = checkSegment("run_id", runId);
        String file = checkSegment("filename", filename);

        Path base = realBase(baseDir == null ? Path.of(SNAPSHOTS_BASE_DIR) : baseDir);
        Path resolved = base.resolve(run).resolve(file).normalize();
        if (!resolved.startsWith(base) || resolved.equals(base)) {
            throw new InvalidSnapshotPathException(
                    "Path would escape base dir: run_id=" + runId + " filename=" + filename + " -> " + resolved);
        }

        // Lien symbolique déjà présent sous la base : on vérifie sa cible réelle
        Path existing = deepestExisting(resolved, base);
        if (existing != null) {
            try {
                Path real = existing.toRealPath();
                if (!real.startsWith(base)) {
                    throw new InvalidSnapshotPathException(
                            "Path resolves outside base dir through a link: " + existing + " -> " + real);
                }
            } catch (IOException e) {
                throw new InvalidSnapshotPathException("Cannot resolve snapshot path " + existing + ": " + e.getMessage());
            }
        }
        return resolved;
    }

    /**
     * Répertoire d'un run sous la base, mêmes règles que {@link #safeSnapshotPath}.
     */
    public static Path safeRunDir(String runId, Path baseDir) {
        return safeSnapshotPath(runId, "_", baseDir).getParent();
    }

    /**
     * Les deux côtés sont résolus de la même façon (liens suivis sur la partie existante).
     */
    public static boolean isUnder(Path path, Path root) {
        try {
            return realPathOf(path).startsWith(realPathOf(root));
        } catch (InvalidSnapshotPathException e) {
            return false;
        }
    }

    private static String checkSegment(String name, String value) {
        String s = value == null ? "" : value.trim();
        if (s.isEmpty() || s.length() > MAX_SEGMENT_LENGTH || !SAFE_SEGMENT.matcher(s).matches()
                || s.contains("..") || s.equals(".")) {
            throw new InvalidSnapshotPathException("Invalid " + name + ": '" + value + "'");
        }
        return s;
    }

    private static Path realBase(Path baseDir) {
        try {
            Path abs = baseDir.toAbsolutePath().normalize();
            return Files.exists(abs) ? abs.toRealPath() : abs;
        } catch (IOException | InvalidPathException e) {
            throw new InvalidSnapshotPathException("Invalid base dir " + baseDir + ": " + e.getMessage());
        }
    }

    // Partie existante la plus profonde en chemin réel, suivie du reste tel quel
    private static Path realPathOf(Path path) {
        try {
            Path abs = path.toAbsolutePath().normalize();
            Path existing = abs;
            while (existing != null && !Files.exists(existing)) {
                existing = existing.getParent();
            }
            if (existing == null) return abs;
            return existing.toRealPath().resolve(existing.relativize(abs)).normalize();
        } catch (IOException | InvalidPathException e) {
            throw new InvalidSnapshotPathException("Cannot resolve path " + path + ": " + e.getMessage());
        }
    }

    private static Path deepestExisting(Path path, Path base) {
        Path current = path;
        while (current != null && current.startsWith(base) && !current.equals(base)) {
            if (Files.exists(current, LinkOption.NOFOLLOW_LINKS)) return current;
            current = current.getParent();
        }
        return null;
    }
}
