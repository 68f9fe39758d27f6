package com.tony.decisionQuality.model.policy;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PolicyVersion {
    @NotBlank
    private String version;

    @NotNull
    private Instant createdAtUtc;

    private String notes;
}
