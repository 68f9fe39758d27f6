package com.tony.decisionQuality.model;

import lombok.Value;

@Value
public class PenaltyShadowRow {
    String runId;
    PenaltyResult result;
}
