package com.tony.decisionQuality.model.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RunIndexEntry {
    private String runId;
    private String createdAtUtc;
    private String connectorName;
    private Integer matchesCount;
    private String batchOutputChecksum;
    private Integer alertsCount;
}
