package com.tony.decisionQuality.service.report;

import com.tony.decisionQuality.model.report.ReportValidationResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Vérifie la forme d'un rapport pipeline : clés obligatoires, version de schéma, flux canonique.
 * Un rapport mal formé donne (false, erreurs) ; seule une entrée qui n'est pas une Map lève une exception.
 */
@Component
public class ReportSchemaValidator {

    public static final String REPORT_SCHEMA_VERSION = "report.v1";
    public static final String CANONICAL_FLOW_SHADOW_RUN = "/pipeline/shadow/run";
    public static final List<String> ALLOWED_SCHEMA_VERSIONS = List.of(REPORT_SCHEMA_VERSION);
    public static final List<String> REQUIRED_TOP_LEVEL_KEYS = List.of(
            "schema_version",
            "canonical_flow",
            "ingestion",
            "analysis",
            "resolution",
            "evaluation_report_checksum",
            "proposal",
            "audit");

    public ReportValidationResult validate(Object report) {
        if (!(report instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("report must be a JSON object, got "
                    + (report == null ? "null" : report.getClass().getSimpleName()));
        }
        List<String> errors = new ArrayList<>();
        for (String key : REQUIRED_TOP_LEVEL_KEYS) {
            if (!map.containsKey(key)) {
                errors.add("missing required key: '" + key + "'");
            }
        }

        Object schemaVersion = map.get("schema_version");
        if (schemaVersion == null) {
            String missing = "missing required key: 'schema_version'";
            if (!errors.contains(missing)) errors.add(missing);
        } else if (!ALLOWED_SCHEMA_VERSIONS.contains(schemaVersion.toString())) {
            errors.add("schema_version '" + schemaVersion + "' not in allowed set: " + ALLOWED_SCHEMA_VERSIONS);
        }

        Object flow = map.get("canonical_flow");
        if (flow != null && !CANONICAL_FLOW_SHADOW_RUN.equals(flow)) {
            errors.add("canonical_flow must be '" + CANONICAL_FLOW_SHADOW_RUN + "', got '" + flow + "'");
        }
        return new ReportValidationResult(errors.isEmpty(), List.copyOf(errors));
    }
}
