package com.tony.decisionQuality.model.report;

import lombok.Value;

import java.util.List;

@Value
public class ReportValidationResult {
    boolean passed;
    List<String> errors; // ordonnées, lisibles
}
