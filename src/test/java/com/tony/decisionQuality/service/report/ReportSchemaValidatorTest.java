package com.tony.decisionQuality.service.report;

import com.tony.decisionQuality.model.report.ReportValidationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReportSchemaValidatorTest {

    private final ReportSchemaValidator validator = new ReportSchemaValidator();

    @Test
    @DisplayName("Rapport complet et conforme")
    void validReportPasses() {
        ReportValidationResult result = validator.validate(validReport());

        assertThat(result.isPassed()).isTrue();
        assertThat(result.getErrors()).isEmpty();
    }

    @Test
    @DisplayName("schema_version absent : échec, un seul message qui le nomme")
    void missingSchemaVersionFails() {
        Map<String, Object> report = validReport();
        report.remove("schema_version");

        ReportValidationResult result = validator.validate(report);

        assertThat(result.isPassed()).isFalse();
        assertThat(result.getErrors()).containsExactly("missing required key: 'schema_version'");
    }

    @Test
    @DisplayName("Version inconnue : « not in allowed set »")
    void unknownSchemaVersionFails() {
        Map<String, Object> report = validReport();
        report.put("schema_version", "report.v0");

        ReportValidationResult result = validator.validate(report);

        assertThat(result.isPassed()).isFalse();
        assertThat(result.getErrors()).singleElement().asString()
                .contains("not in allowed set")
                .contains("report.v0");
    }

    @Test
    @DisplayName("Plusieurs défauts : tous listés, dans l'ordre des clés obligatoires")
    void reportsEveryProblem() {
        Map<String, Object> report = validReport();
        report.remove("audit");
        report.remove("ingestion");
        report.put("canonical_flow", "/pipeline/other");

        List<String> errors = validator.validate(report).getErrors();

        assertThat(errors).containsExactly(
                "missing required key: 'ingestion'",
                "missing required key: 'audit'",
                "canonical_flow must be '/pipeline/shadow/run', got '/pipeline/other'");
    }

    @Test
    @DisplayName("Entrée qui n'est pas un objet : exception")
    void nonMapInputThrows() {
        assertThatThrownBy(() -> validator.validate(List.of("x"))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> validator.validate(null)).isInstanceOf(IllegalArgumentException.class);
    }

    private Map<String, Object> validReport() {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("schema_version", "report.v1");
        report.put("canonical_flow", "/pipeline/shadow/run");
        report.put("ingestion", Map.of());
        report.put("analysis", Map.of());
        report.put("resolution", Map.of());
        report.put("evaluation_report_checksum", "abc");
        report.put("proposal", Map.of());
        report.put("audit", Map.of());
        return report;
    }
}
