package com.tony.decisionQuality.service;

import com.tony.decisionQuality.config.PipelineProperties;
import com.tony.decisionQuality.exception.PolicyValidationException;
import com.tony.decisionQuality.model.Markets;
import com.tony.decisionQuality.model.policy.MarketPolicy;
import com.tony.decisionQuality.model.policy.Policy;
import com.tony.decisionQuality.model.policy.PolicyVersion;
import com.tony.decisionQuality.util.CanonicalJson;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Chargement / sauvegarde des politiques versionnées, avec repli sur la politique par défaut.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PolicyStore {

    public static final String POLICY_PATH_ENV = "POLICY_PATH";
    public static final String DEFAULT_VERSION = "v0";
    public static final double DEFAULT_MIN_CONFIDENCE = 0.62;

    private final Validator validator;
    private final Environment environment;
    private final PipelineProperties properties;

    /**
     * Politique de repli universelle. Ne doit jamais changer silencieusement.
     */
    public static Policy defaultPolicy() {
        Map<String, MarketPolicy> markets = new LinkedHashMap<>();
        for (String market : Markets.CANONICAL) {
            markets.put(market, new MarketPolicy(DEFAULT_MIN_CONFIDENCE));
        }
        PolicyVersion meta = new PolicyVersion(DEFAULT_VERSION, Instant.parse("2025-01-01T00:00:00Z"), "Default in-code policy");
        return new Policy(meta, markets, new LinkedHashMap<>());
    }

    public Policy loadPolicy(Path path) {
        Policy policy;
        try {
            policy = CanonicalJson.mapper().readValue(path.toFile(), Policy.class);
        } catch (IOException e) {
            throw new PolicyValidationException("Cannot parse policy file " + path + ": " + e.getMessage(), e);
        }
        if (policy == null) {
            throw new PolicyValidationException("Policy file " + path + " is empty");
        }
        validate(policy);
        return policy;
    }

    /**
     * Valide avant d'ouvrir le fichier : une politique invalide ne laisse aucun artefact partiel.
     */
    public void savePolicy(Policy policy, Path path) {
        validate(policy);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                CanonicalJson.prettyMapper().writeValue(writer, policy);
            }
        } catch (IOException e) {
            throw new PolicyValidationException("Cannot write policy file " + path + ": " + e.getMessage(), e);
        }
        log.info("💾 Politique {} sauvegardée : {}", policy.getMeta().getVersion(), path);
    }

    /**
     * Résout POLICY_PATH (relu à chaque appel) ou le chemin par défaut. Toute erreur = politique par défaut.
     */
    public Policy getActivePolicy() {
        String configured = environment.getProperty(POLICY_PATH_ENV);
        String raw = configured != null && !configured.isBlank() ? configured.trim() : properties.getPolicyPath();
        if (raw == null || raw.isBlank()) {
            return defaultPolicy();
        }
        try {
            Path path = Path.of(raw);
            if (!Files.isRegularFile(path)) {
                log.info("Aucun fichier de politique à {}, politique par défaut {}", path, DEFAULT_VERSION);
                return defaultPolicy();
            }
            return loadPolicy(path);
        } catch (PolicyValidationException | InvalidPathException e) {
            log.warn("⚠️ Politique illisible ({}), repli sur la politique par défaut : {}", raw, e.getMessage());
            return defaultPolicy();
        }
    }

    public static String policyChecksum(Policy policy) {
        return CanonicalJson.checksum(policy);
    }

    /** Seuil du marché, ou celui de la politique par défaut si le marché n'est pas couvert. */
    public static double minConfidenceFor(Policy policy, String market) {
        if (policy != null && policy.getMarkets() != null) {
            MarketPolicy mp = policy.getMarkets().get(market);
            if (mp != null && mp.getMinConfidence() != null) return mp.getMinConfidence();
        }
        return DEFAULT_MIN_CONFIDENCE;
    }

    private void validate(Policy policy) {
        List<String> errors = new ArrayList<>();
        Set<ConstraintViolation<Policy>> violations = validator.validate(policy);
        for (ConstraintViolation<Policy> v : violations) {
            errors.add(v.getPropertyPath() + " " + v.getMessage());
        }
        if (policy.getMarkets() != null) {
            policy.getMarkets().forEach((market, mp) -> {
                if (mp == null || mp.getConfidenceBands() == null) return;
                for (List<Double> band : mp.getConfidenceBands()) {
                    if (band == null || band.size() != 2 || band.contains(null)) {
                        errors.add("markets[" + market + "].confidence_bands entries must be [low, high] pairs");
                    }
                }
            });
        }
        if (!errors.isEmpty()) {
            errors.sort(null);
            throw new PolicyValidationException("Invalid policy: " + String.join("; ", errors));
        }
    }
}
