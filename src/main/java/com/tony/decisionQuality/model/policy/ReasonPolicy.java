package com.tony.decisionQuality.model.policy;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReasonPolicy {
    @NotBlank
    private String reasonCode;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double dampeningFactor = 1.0;
}
