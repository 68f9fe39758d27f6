package com.tony.decisionQuality.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FitDiagnostics {
    private int bandsWithSupport;   // tranches avec total >= MIN_SUPPORT
    private int totalBands;

    @Builder.Default
    private List<Integer> coverageCounts = new ArrayList<>(); // même ordre que AgeBand

    private Double mseVsBaseline;
}
