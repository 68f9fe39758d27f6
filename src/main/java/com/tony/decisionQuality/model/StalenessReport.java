package com.tony.decisionQuality.model;

import lombok.Value;

import java.util.List;

@Value
public class StalenessReport {
    List<StalenessRow> rows;
    String computedAtUtc;
    String notes;
}
