package com.tony.decisionQuality.config;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class PipelinePropertiesTest {

    private final Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

    @Test
    @DisplayName("Valeurs par défaut valides")
    void defaultsAreValid() {
        assertThat(validator.validate(new PipelineProperties())).isEmpty();
    }

    @Test
    @DisplayName("max-reports-retained négatif : rejeté dès le démarrage")
    void negativeRetentionIsInvalid() {
        PipelineProperties properties = new PipelineProperties();
        properties.setMaxReportsRetained(-1);

        Set<ConstraintViolation<PipelineProperties>> violations = validator.validate(properties);

        assertThat(violations).singleElement()
                .satisfies(v -> assertThat(v.getPropertyPath().toString()).isEqualTo("maxReportsRetained"));
    }
}
