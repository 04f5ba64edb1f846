package com.community.leaderboard.service;

import com.community.leaderboard.dto.TurnAroundSampleDTO;
import com.community.leaderboard.dto.TurnAroundSummaryDTO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate arithmetic, free of any store access.
 * <p>
 * Turn-around averaging:
 * <pre>
 * mean_c      = round( Σ tat_c / n_c )    per contributor c with n_c ≥ 1
 * mean_global = round( Σ tat   / n   )    over every valid sample
 * </pre>
 * Rounding is {@link Math#round(double)}. Samples that are not a finite decimal number are skipped.
 */
@Component
public class AggregateAlgorithm {

    private static final Logger log = LoggerFactory.getLogger(AggregateAlgorithm.class);

    public TurnAroundSummaryDTO averageTurnAround(List<TurnAroundSampleDTO> samples) {
        Map<String, List<Double>> byContributor = new LinkedHashMap<>();
        List<Double> all = new ArrayList<>();
        int skipped = 0;

        for (TurnAroundSampleDTO sample : samples) {
            Double tat = parse(sample.getRawValue());
            if (tat == null || sample.getContributor() == null) {
                skipped++;
                log.debug("Skipping turn-around sample of {}: '{}' is not a number",
                        sample.getContributor(), sample.getRawValue());
                continue;
            }
            byContributor.computeIfAbsent(sample.getContributor(), k -> new ArrayList<>()).add(tat);
            all.add(tat);
        }

        Map<String, Long> contributorMeans = new LinkedHashMap<>();
        byContributor.forEach((contributor, values) -> contributorMeans.put(contributor, roundedMean(values)));

        Long globalMean = all.isEmpty() ? null : roundedMean(all);
        return new TurnAroundSummaryDTO(contributorMeans, globalMean, all.size(), skipped);
    }

    /**
     * Arithmetic mean rounded to the nearest whole number. The list must not be empty.
     */
    public long roundedMean(List<Double> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Cannot average an empty list");
        }
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return Math.round(sum / values.size());
    }

    private static Double parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            // plain decimal notation only: no NaN, Infinity, hex or type suffixes
            double value = new BigDecimal(raw.trim()).doubleValue();
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
