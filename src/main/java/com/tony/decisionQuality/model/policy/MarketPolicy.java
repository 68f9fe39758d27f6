package com.tony.decisionQuality.model.policy;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Seuils d'un marché.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MarketPolicy {
    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double minConfidence;

    // Paires [bas, haut], informatives (reporting uniquement)
    private List<List<Double>> confidenceBands;

    public MarketPolicy(double minConfidence) {
        this(minConfidence, null);
    }
}
