package com.tony.decisionQuality.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "pipeline")
@Validated
@Data
public class PipelineProperties {
    // --- Répertoires ---
    private String reportsDir = "reports";
    private String snapshotsDir = "reports/snapshots";

    // --- Politique ---
    // Surchargée à chaque appel par la variable d'environnement POLICY_PATH
    private String policyPath = "policies/policy_v0.json";

    // --- Rétention ---
    @Min(0)
    private int maxReportsRetained = 100;

    // --- Runner ---
    private String recordsPath;          // vide = le runner ne fait rien
    private String connectorName = "recorded";
}
