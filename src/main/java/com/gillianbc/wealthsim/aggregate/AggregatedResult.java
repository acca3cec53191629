package com.gillianbc.wealthsim.aggregate;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Per-year summary of a run. Every metric is reported at the selected percentile
 * (flags as a percentage of paths); net worth also carries fixed 10/50/90 bands.
 */
@Value
@Builder
public class AggregatedResult {

    @NonNull List<Integer> years;
    int percentile;
    @NonNull Map<Metric, List<Double>> series;
    @NonNull List<Double> netWorthP10;
    @NonNull List<Double> netWorthMedian;
    @NonNull List<Double> netWorthP90;
    double inflationRate;
    int startYear;
    int iterations;
    /** Distinct retirement years of the household's people, ascending. */
    @NonNull List<Integer> retirementYears;

    public List<Double> series(Metric metric) {
        List<Double> values = series.get(metric);
        if (values == null) {
            throw new IllegalArgumentException("No series for " + metric);
        }
        return values;
    }
}
