package com.tony.decisionQuality.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;

/**
 * Sérialisation JSON canonique (clés triées, aucun espace) + SHA-256.
 * Toutes les empreintes du projet (preuves, politiques, rapports, snapshots) passent par ici :
 * deux appelants qui hachent le même contenu logique obtiennent le même digest.
 */
public final class CanonicalJson {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .build();

    private static final ObjectMapper PRETTY = MAPPER.copy().enable(SerializationFeature.INDENT_OUTPUT);

    private CanonicalJson() {
    }

    /** Mapper partagé (snake_case, clés triées) pour la lecture et l'écriture compacte. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /** Même règles que {@link #mapper()}, indenté pour les fichiers de rapport. */
    public static ObjectMapper prettyMapper() {
        return PRETTY;
    }

    public static String canonicalize(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload non sérialisable en JSON canonique", e);
        }
    }

    public static String sha256Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 indisponible sur cette JVM", e);
        }
    }

    public static String checksum(Object value) {
        return sha256Hex(canonicalize(value));
    }

    /** Dates normalisées en UTC avant sérialisation : même instant = même texte. */
    public static String iso(OffsetDateTime dateTime) {
        if (dateTime == null) return null;
        return dateTime.withOffsetSameInstant(ZoneOffset.UTC).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }

    public static String iso(Instant instant) {
        if (instant == null) return null;
        return iso(instant.atOffset(ZoneOffset.UTC));
    }
}
