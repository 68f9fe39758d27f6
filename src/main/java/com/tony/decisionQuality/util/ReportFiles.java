package com.tony.decisionQuality.util;

import com.opencsv.CSVWriter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Écriture des artefacts de rapport : JSON trié/indenté, CSV avec en-tête systématique.
 */
public final class ReportFiles {

    private ReportFiles() {
    }

    public static void writeJson(Path path, Object payload) {
        try {
            createParents(path);
            try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                CanonicalJson.prettyMapper().writeValue(writer, payload);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Écriture JSON impossible : " + path, e);
        }
    }

    public static void writeCsv(Path path, String[] header, List<String[]> rows) {
        try {
            createParents(path);
            try (CSVWriter csv = new CSVWriter(Files.newBufferedWriter(path, StandardCharsets.UTF_8))) {
                csv.writeNext(header, false);
                for (String[] row : rows) {
                    csv.writeNext(row, false);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Écriture CSV impossible : " + path, e);
        }
    }

    /** Arrondi à 4 décimales, null conservé. */
    public static Double round4(Double value) {
        if (value == null) return null;
        return Math.round(value * 10000.0) / 10000.0;
    }

    public static String cell(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    private static void createParents(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
    }
}
