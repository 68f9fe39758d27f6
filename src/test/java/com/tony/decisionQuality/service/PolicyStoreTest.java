package com.tony.decisionQuality.service;

import com.tony.decisionQuality.config.PipelineProperties;
import com.tony.decisionQuality.exception.PolicyValidationException;
import com.tony.decisionQuality.model.Markets;
import com.tony.decisionQuality.model.policy.MarketPolicy;
import com.tony.decisionQuality.model.policy.Policy;
import com.tony.decisionQuality.model.policy.PolicyVersion;
import com.tony.decisionQuality.model.policy.ReasonPolicy;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.env.MockEnvironment;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PolicyStoreTest {

    private static final Validator VALIDATOR = Validation.buildDefaultValidatorFactory().getValidator();

    @TempDir
    Path tempDir;

    private MockEnvironment environment;
    private PolicyStore store;

    @BeforeEach
    void setUp() {
        environment = new MockEnvironment();
        PipelineProperties properties = new PipelineProperties();
        properties.setPolicyPath(tempDir.resolve("policies/policy_v0.json").toString());
        store = new PolicyStore(VALIDATOR, environment, properties);
    }

    @Test
    @DisplayName("Sans fichier de politique : politique par défaut v0 à 0.62")
    void missingFileGivesDefaultPolicy() {
        Policy policy = store.getActivePolicy();

        assertThat(policy.getMeta().getVersion()).isEqualTo("v0");
        assertThat(policy.getMeta().getCreatedAtUtc()).isEqualTo(Instant.parse("2025-01-01T00:00:00Z"));
        assertThat(policy.getMarkets()).containsOnlyKeys(Markets.ONE_X_TWO, Markets.OVER_UNDER_25, Markets.GG_NG);
        assertThat(policy.getMarkets().values()).extracting(MarketPolicy::getMinConfidence).containsOnly(0.62);
        assertThat(policy.getReasons()).isEmpty();
    }

    @Test
    @DisplayName("Fichier corrompu via POLICY_PATH : repli sur la politique par défaut, sans exception")
    void corruptFileFallsBackToDefault() throws IOException {
        Path corrupt = tempDir.resolve("broken.json");
        Files.writeString(corrupt, "{ \"meta\": ");
        environment.setProperty(PolicyStore.POLICY_PATH_ENV, corrupt.toString());

        assertThat(store.getActivePolicy()).isEqualTo(PolicyStore.defaultPolicy());
    }

    @Test
    @DisplayName("Sauvegarde puis chargement : politique identique, même checksum")
    void saveThenLoadRoundTrip() {
        Policy policy = customPolicy(0.70);
        Path path = tempDir.resolve("policies/policy_v1.json");

        store.savePolicy(policy, path);
        Policy loaded = store.loadPolicy(path);

        assertThat(loaded).isEqualTo(policy);
        assertThat(PolicyStore.policyChecksum(loaded)).isEqualTo(PolicyStore.policyChecksum(policy));
    }

    @Test
    @DisplayName("POLICY_PATH est relu à chaque appel")
    void policyPathIsReadOnEveryCall() {
        Path path = tempDir.resolve("active.json");
        store.savePolicy(customPolicy(0.70), path);

        assertThat(store.getActivePolicy().getMeta().getVersion()).isEqualTo("v0");

        environment.setProperty(PolicyStore.POLICY_PATH_ENV, path.toString());

        assertThat(store.getActivePolicy().getMeta().getVersion()).isEqualTo("v1");
        assertThat(PolicyStore.minConfidenceFor(store.getActivePolicy(), "one_x_two")).isEqualTo(0.70);
    }

    @Test
    @DisplayName("Seuil hors [0,1] : refusé avant toute écriture")
    void invalidPolicyIsRejectedBeforeWrite() {
        Path path = tempDir.resolve("invalid.json");

        assertThatThrownBy(() -> store.savePolicy(customPolicy(1.5), path))
                .isInstanceOf(PolicyValidationException.class)
                .hasMessageContaining("minConfidence");
        assertThat(path).doesNotExist();
    }

    @Test
    @DisplayName("Bande de confiance mal formée refusée au chargement")
    void malformedBandIsRejectedOnLoad() throws IOException {
        Path path = tempDir.resolve("bands.json");
        Files.writeString(path, """
                {"meta": {"version": "v2", "created_at_utc": "2025-02-01T00:00:00Z"},
                 "markets": {"one_x_two": {"min_confidence": 0.6, "confidence_bands": [[0.5]]}},
                 "reasons": {}}
                """);

        assertThatThrownBy(() -> store.loadPolicy(path))
                .isInstanceOf(PolicyValidationException.class)
                .hasMessageContaining("confidence_bands");
    }

    @Test
    @DisplayName("Marché absent de la politique : seuil par défaut")
    void unknownMarketUsesDefaultThreshold() {
        assertThat(PolicyStore.minConfidenceFor(customPolicy(0.7), "corners")).isEqualTo(0.62);
        assertThat(PolicyStore.minConfidenceFor(null, "one_x_two")).isEqualTo(0.62);
    }

    private Policy customPolicy(double minConfidence) {
        Map<String, MarketPolicy> markets = new LinkedHashMap<>();
        markets.put("one_x_two", new MarketPolicy(minConfidence, List.of(List.of(0.6, 0.7), List.of(0.7, 1.0))));
        markets.put("gg_ng", new MarketPolicy(0.65));
        Map<String, ReasonPolicy> reasons = new LinkedHashMap<>();
        reasons.put("R1", new ReasonPolicy("R1", 0.9));
        return new Policy(new PolicyVersion("v1", Instant.parse("2025-02-01T00:00:00Z"), "tuned"), markets, reasons);
    }
}
