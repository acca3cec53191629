package com.gillianbc.wealthsim.aggregate;

import com.gillianbc.wealthsim.engine.RawResults;
import com.gillianbc.wealthsim.engine.SimulationPlan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Folds raw path results into per-year percentiles using the nearest-rank rule.
 */
@Slf4j
@Component
public class Aggregator {

    public AggregatedResult aggregate(RawResults raw, SimulationPlan plan) {
        int n = raw.pathCount();
        int yearCount = raw.yearCount();
        int selected = plan.getPolicy().getPercentile();

        AggregatedResult.AggregatedResultBuilder result = AggregatedResult.builder()
                .years(Arrays.stream(raw.years()).boxed().collect(Collectors.toList()))
                .percentile(selected)
                .inflationRate(plan.getAssumptions().getInflationRate())
                .startYear(plan.getStartYear())
                .iterations(n)
                .retirementYears(Arrays.stream(plan.retirementYears()).boxed().collect(Collectors.toList()));

        EnumMap<Metric, List<Double>> allSeries = new EnumMap<>(Metric.class);
        double[] values = new double[n];
        for (Metric metric : Metric.values()) {
            List<Double> series = new ArrayList<>(yearCount);
            List<Double> p10 = new ArrayList<>(yearCount);
            List<Double> p50 = new ArrayList<>(yearCount);
            List<Double> p90 = new ArrayList<>(yearCount);
            for (int y = 0; y < yearCount; y++) {
                for (int path = 0; path < n; path++) {
                    values[path] = metric.valueOf(raw.record(path, y));
                }
                if (metric.getMode() == AggregationMode.PERCENT_TRUE) {
                    series.add(percentTrue(values));
                    continue;
                }
                Arrays.sort(values);
                series.add(percentile(values, selected));
                if (metric == Metric.NET_WORTH) {
                    p10.add(percentile(values, 10));
                    p50.add(percentile(values, 50));
                    p90.add(percentile(values, 90));
                }
            }
            allSeries.put(metric, Collections.unmodifiableList(series));
            if (metric == Metric.NET_WORTH) {
                result.netWorthP10(Collections.unmodifiableList(p10))
                        .netWorthMedian(Collections.unmodifiableList(p50))
                        .netWorthP90(Collections.unmodifiableList(p90));
            }
        }

        AggregatedResult aggregated = result.series(Collections.unmodifiableMap(allSeries)).build();
        log.debug("Aggregated {} paths x {} years at p{}", n, yearCount, selected);
        return aggregated;
    }

    /**
     * Nearest rank over an ascending array: {@code rank = ceil(p / 100 * n)}, clamped to [1, n].
     */
    public static double percentile(double[] sorted, double p) {
        if (sorted.length == 0) {
            throw new IllegalArgumentException("No values to take a percentile of");
        }
        int rank = (int) Math.ceil(p * sorted.length / 100.0);
        rank = Math.max(1, Math.min(sorted.length, rank));
        return sorted[rank - 1];
    }

    /** Percentage of entries that are non-zero. */
    public static double percentTrue(double[] flags) {
        if (flags.length == 0) {
            return 0.0;
        }
        int count = 0;
        for (double flag : flags) {
            if (flag != 0.0) {
                count++;
            }
        }
        return 100.0 * count / flags.length;
    }
}
