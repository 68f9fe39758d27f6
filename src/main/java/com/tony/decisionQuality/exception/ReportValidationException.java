package com.tony.decisionQuality.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class ReportValidationException extends RuntimeException {

    private final List<String> errors;

    public ReportValidationException(List<String> errors) {
        super("Rapport pipeline invalide : " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }
}
