package com.tony.decisionQuality.service;

import com.tony.decisionQuality.model.AgeBand;
import com.tony.decisionQuality.model.DecayModelParams;
import com.tony.decisionQuality.model.FitDiagnostics;
import com.tony.decisionQuality.model.StalenessRow;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Ajustement déterministe d'une courbe de pénalité par tranche d'âge, par (market, reason_code).
 *
 * <ul>
 *   <li>référence = précision de la tranche supportée la plus fraîche (1.0 si aucune) ;</li>
 *   <li>tranche supportée : pénalité = clamp(1 - max(0, référence - précision), 0, 1) ;</li>
 *   <li>tranche sous MIN_SUPPORT : exclue, 1.0 ("pas d'information") ;</li>
 *   <li>passe monotone : une tranche plus ancienne ne pénalise jamais moins qu'une plus fraîche.</li>
 * </ul>
 * Pas d'optimiseur, pas d'aléa : mêmes lignes = mêmes paramètres.
 */
@Service
@Slf4j
public class ReasonDecayFitService {

    public static final int MIN_SUPPORT = 5;

    private static final List<AgeBand> BAND_ORDER = List.of(AgeBand.values());

    public List<DecayModelParams> fit(List<StalenessRow> rows, String fittedAtUtc) {
        // TreeMap -> sortie triée par (market, reason_code)
        Map<String, Map<String, List<StalenessRow>>> grouped = new TreeMap<>();
        for (StalenessRow row : rows) {
            grouped.computeIfAbsent(row.getMarket(), m -> new TreeMap<>())
                    .computeIfAbsent(row.getReasonCode(), r -> new ArrayList<>())
                    .add(row);
        }

        List<DecayModelParams> result = new ArrayList<>();
        grouped.forEach((market, byReason) -> byReason.forEach((reasonCode, bandRows) ->
                result.add(fitOne(market, reasonCode, bandRows, fittedAtUtc))));

        long supportFree = result.stream().filter(DecayModelParams::isSupportFree).count();
        log.info("📉 Decay fit : {} modèles ajustés ({} sans support, MIN_SUPPORT={})", result.size(), supportFree, MIN_SUPPORT);
        return result;
    }

    DecayModelParams fitOne(String market, String reasonCode, List<StalenessRow> bandRows, String fittedAtUtc) {
        int n = BAND_ORDER.size();
        Double[] accuracy = new Double[n];
        int[] totals = new int[n];
        for (StalenessRow r : bandRows) {
            int idx = r.getAgeBand().ordinal();
            totals[idx] += r.getTotal();
            accuracy[idx] = r.getAccuracy();
        }

        double baseline = 1.0;
        for (int i = 0; i < n; i++) {
            if (isSupported(totals[i], accuracy[i])) {
                baseline = accuracy[i];
                break;
            }
        }

        double[] ideal = new double[n];
        double[] penalties = new double[n];
        int bandsWithSupport = 0;
        for (int i = 0; i < n; i++) {
            if (totals[i] < MIN_SUPPORT) {
                ideal[i] = 1.0;
            } else {
                bandsWithSupport++;
                double acc = accuracy[i] != null ? accuracy[i] : baseline;
                ideal[i] = clamp(1.0 - Math.max(0.0, baseline - acc));
            }
            penalties[i] = ideal[i];
        }

        for (int i = 1; i < n; i++) {
            if (penalties[i] > penalties[i - 1]) penalties[i] = penalties[i - 1];
        }

        SummaryStatistics squaredError = new SummaryStatistics();
        for (int i = 0; i < n; i++) {
            if (totals[i] >= MIN_SUPPORT) {
                squaredError.addValue(Math.pow(penalties[i] - ideal[i], 2));
            }
        }
        Double mse = squaredError.getN() > 0 ? Math.round(squaredError.getMean() * 1e6) / 1e6 : null;

        FitDiagnostics diagnostics = FitDiagnostics.builder()
                .bandsWithSupport(bandsWithSupport)
                .totalBands(n)
                .coverageCounts(new ArrayList<>(Arrays.stream(totals).boxed().toList()))
                .mseVsBaseline(mse)
                .build();

        return DecayModelParams.builder()
                .market(market)
                .reasonCode(reasonCode)
                .bands(new ArrayList<>(BAND_ORDER))
                .penaltyByBand(new ArrayList<>(Arrays.stream(penalties).boxed().toList()))
                .fittedAtUtc(fittedAtUtc)
                .fitQuality(diagnostics)
                .build();
    }

    private static boolean isSupported(int total, Double accuracy) {
        return total >= MIN_SUPPORT && accuracy != null;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
