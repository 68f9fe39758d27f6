package com.tony.decisionQuality.model.policy;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Document de politique versionné : seuils par marché + amortissement par code raison.
 * Jamais modifié en place ; une nouvelle version remplace l'ancienne.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Policy {
    @NotNull
    @Valid
    private PolicyVersion meta;

    // clés : one_x_two, over_under_25, gg_ng
    @NotNull
    private Map<String, @NotNull @Valid MarketPolicy> markets = new LinkedHashMap<>();

    private Map<String, @NotNull @Valid ReasonPolicy> reasons = new LinkedHashMap<>();
}
