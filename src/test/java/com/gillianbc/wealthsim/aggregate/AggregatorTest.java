package com.gillianbc.wealthsim.aggregate;

import com.gillianbc.wealthsim.TestScenarios;
import com.gillianbc.wealthsim.engine.RawResults;
import com.gillianbc.wealthsim.engine.SimulationPlan;
import com.gillianbc.wealthsim.model.Person;
import com.gillianbc.wealthsim.model.PolicyParams;
import com.gillianbc.wealthsim.model.Scenario;
import com.gillianbc.wealthsim.model.YearRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AggregatorTest {

    private static final double[] ONE_TO_TEN = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10};

    private final Aggregator aggregator = new Aggregator();

    @Test
    @DisplayName("Nearest rank: p10 is the 1st of 10, p50 the 5th, p90 the 9th")
    void percentile_nearestRank() {
        assertEquals(1.0, Aggregator.percentile(ONE_TO_TEN, 10));
        assertEquals(5.0, Aggregator.percentile(ONE_TO_TEN, 50));
        assertEquals(9.0, Aggregator.percentile(ONE_TO_TEN, 90));
        assertEquals(2.0, Aggregator.percentile(ONE_TO_TEN, 11));
        assertEquals(10.0, Aggregator.percentile(ONE_TO_TEN, 99));
    }

    @Test
    @DisplayName("Rank is clamped to the sample")
    void percentile_clamped() {
        assertEquals(1.0, Aggregator.percentile(ONE_TO_TEN, 0));
        assertEquals(10.0, Aggregator.percentile(ONE_TO_TEN, 100));
        assertEquals(7.0, Aggregator.percentile(new double[]{7}, 50));
        assertThrows(IllegalArgumentException.class, () -> Aggregator.percentile(new double[0], 50));
    }

    @Test
    @DisplayName("Flags are the percentage of paths where they are set")
    void percentTrue_countsFlags() {
        assertEquals(30.0, Aggregator.percentTrue(new double[]{1, 0, 0, 1, 0, 0, 0, 1, 0, 0}));
        assertEquals(0.0, Aggregator.percentTrue(new double[]{0, 0}));
    }

    @Test
    @DisplayName("Aggregate reports the selected percentile, fixed bands and flag percentages")
    void aggregate_handBuiltPaths() {
        Scenario scenario = TestScenarios.baseScenario().assumptions(TestScenarios.assumptions(2026)).build();
        SimulationPlan plan = SimulationPlan.of(scenario, PolicyParams.builder().percentile(90).build());

        // netWorth descending by path so sorting matters; paths 0..2 depleted
        YearRecord[][] rows = new YearRecord[10][2];
        for (int path = 0; path < 10; path++) {
            for (int y = 0; y < 2; y++) {
                rows[path][y] = YearRecord.builder()
                        .year(2025 + y)
                        .netWorth(1_000.0 * (10 - path) + y)
                        .cashBalance(path)
                        .depleted(path < 3 && y == 1)
                        .mortgagePaidOff(true)
                        .build();
            }
        }

        AggregatedResult result = aggregator.aggregate(new RawResults(2025, rows), plan);

        assertEquals(List.of(2025, 2026), result.getYears());
        assertEquals(90, result.getPercentile());
        assertEquals(10, result.getIterations());
        assertEquals(List.of(1_000.0, 1_001.0), result.getNetWorthP10());
        assertEquals(List.of(5_000.0, 5_001.0), result.getNetWorthMedian());
        assertEquals(List.of(9_000.0, 9_001.0), result.getNetWorthP90());
        assertEquals(List.of(9_000.0, 9_001.0), result.series(Metric.NET_WORTH));
        assertEquals(List.of(8.0, 8.0), result.series(Metric.CASH_BALANCE));
        assertEquals(List.of(0.0, 30.0), result.series(Metric.DEPLETED));
        assertEquals(List.of(100.0, 100.0), result.series(Metric.MORTGAGE_PAID_OFF));
        assertEquals(List.of(2045), result.getRetirementYears());
        assertEquals(0.02, result.getInflationRate());
        assertEquals(2025, result.getStartYear());
        assertEquals(Metric.values().length, result.getSeries().size());
    }

    @Test
    @DisplayName("Rental income is reported after tax, with the gross amount as its own series")
    void aggregate_rentalIncomeIsNet() {
        Scenario scenario = TestScenarios.baseScenario().assumptions(TestScenarios.assumptions(2026)).build();
        SimulationPlan plan = SimulationPlan.of(scenario, PolicyParams.builder().build());
        YearRecord[][] rows = new YearRecord[1][2];
        for (int y = 0; y < 2; y++) {
            rows[0][y] = YearRecord.builder()
                    .year(2025 + y)
                    .rentalGross(20_000.00)
                    .rentalNet(18_514.00)
                    .isaReturns(100.00)
                    .giaReturns(200.00)
                    .pensionReturns(300.00)
                    .cashInterest(40.00)
                    .build();
        }

        AggregatedResult result = aggregator.aggregate(new RawResults(2025, rows), plan);

        assertEquals(18_514.00, result.series(Metric.RENTAL_INCOME).get(0), 0.001);
        assertEquals(20_000.00, result.series(Metric.RENTAL_GROSS).get(1), 0.001);
        assertEquals(100.00, result.series(Metric.ISA_RETURNS).get(0), 0.001);
        assertEquals(200.00, result.series(Metric.GIA_RETURNS).get(0), 0.001);
        assertEquals(300.00, result.series(Metric.PENSION_RETURNS).get(0), 0.001);
        assertEquals(40.00, result.series(Metric.CASH_RETURNS).get(0), 0.001);
    }

    @Test
    @DisplayName("Retirement years list the adults only")
    void aggregate_retirementYearsSkipChildren() {
        Scenario scenario = TestScenarios.baseScenario()
                .assumptions(TestScenarios.assumptions(2026))
                .person(Person.builder().id("kim")
                        .birthDate(LocalDate.of(2015, 1, 1)).plannedRetirementAge(60).child(true).build())
                .build();
        SimulationPlan plan = SimulationPlan.of(scenario, PolicyParams.builder().build());
        YearRecord[][] rows = {{YearRecord.builder().year(2025).build(), YearRecord.builder().year(2026).build()}};

        AggregatedResult result = aggregator.aggregate(new RawResults(2025, rows), plan);

        assertEquals(List.of(2045), result.getRetirementYears());
    }
}
