package com.tony.decisionQuality.config;

import lombok.Value;
import org.springframework.core.env.Environment;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Photo immuable des flags de sécurité, prise une fois par invocation et passée en argument
 * à chaque opération protégée. Tout est fermé par défaut.
 */
@Value
public class SafetyGates {
    public static final String LIVE_IO_ALLOWED = "LIVE_IO_ALLOWED";
    public static final String SNAPSHOT_WRITES_ALLOWED = "SNAPSHOT_WRITES_ALLOWED";
    public static final String SNAPSHOT_REPLAY_ENABLED = "SNAPSHOT_REPLAY_ENABLED";
    public static final String REPORT_SCHEMA_VALIDATE_STRICT = "REPORT_SCHEMA_VALIDATE_STRICT";

    boolean liveIoAllowed;
    boolean snapshotWritesAllowed;
    boolean snapshotReplayEnabled;
    boolean reportSchemaStrict;

    public static SafetyGates closed() {
        return new SafetyGates(false, false, false, false);
    }

    public static SafetyGates fromEnvironment(Environment env) {
        return new SafetyGates(
                flag(env, LIVE_IO_ALLOWED),
                flag(env, SNAPSHOT_WRITES_ALLOWED),
                flag(env, SNAPSHOT_REPLAY_ENABLED),
                flag(env, REPORT_SCHEMA_VALIDATE_STRICT));
    }

    /** Bloc "audit.safety_summary" des rapports pipeline. */
    public Map<String, Object> toSafetySummary() {
        Map<String, Object> flags = new LinkedHashMap<>();
        flags.put(LIVE_IO_ALLOWED, liveIoAllowed);
        flags.put(SNAPSHOT_WRITES_ALLOWED, snapshotWritesAllowed);
        flags.put(SNAPSHOT_REPLAY_ENABLED, snapshotReplayEnabled);
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("flags", flags);
        summary.put("note", "All unsafe modes require explicit opt-in");
        return summary;
    }

    private static boolean flag(Environment env, String name) {
        String raw = env.getProperty(name);
        if (raw == null) return false;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes", "on" -> true;
            default -> false;
        };
    }
}
