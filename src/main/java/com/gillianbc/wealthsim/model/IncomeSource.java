package com.gillianbc.wealthsim.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A recurring income. Amounts grow from the simulation start year:
 * {@code grossAnnual * (1 + annualGrowthRate)^(year - startYearOfSimulation)}.
 */
@Value
@Builder
public class IncomeSource {

    @NonNull String id;
    @NonNull IncomeKind kind;
    /** Owning person, or null for a household-level income. */
    String ownerId;
    double grossAnnual;
    double annualGrowthRate;
    /** Fraction of gross (0.05 = 5%), salary only. */
    double employeePensionPct;
    /** Fraction of gross (0.03 = 3%), salary only. */
    double employerPensionPct;
    /** First year paid, inclusive. Null means from the start. */
    Integer startYear;
    /** Last year paid, inclusive. Null means open-ended. */
    Integer endYear;

    public boolean isPaidIn(int year) {
        return (startYear == null || year >= startYear) && (endYear == null || year <= endYear);
    }

    public double amountIn(int year, int simulationStartYear) {
        return grossAnnual * Math.pow(1.0 + annualGrowthRate, year - simulationStartYear);
    }
}
