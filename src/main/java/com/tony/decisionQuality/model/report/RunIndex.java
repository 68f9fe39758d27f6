package com.tony.decisionQuality.model.report;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Index des runs : ordre d'ajout = ordre chronologique (le plus récent en dernier).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RunIndex {
    private List<RunIndexEntry> runs = new ArrayList<>();
    private String latestRunId;

    public static RunIndex empty() {
        return new RunIndex(new ArrayList<>(), null);
    }
}
