package com.gillianbc.wealthsim.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Expense {

    String name;
    double monthlyAmount;
    Integer startYear;
    Integer endYear;
    @Builder.Default boolean inflationLinked = true;

    public boolean isPaidIn(int year) {
        return (startYear == null || year >= startYear) && (endYear == null || year <= endYear);
    }

    /**
     * Annual cost in {@code year}, inflated from the simulation start year when linked.
     */
    public double annualAmountIn(int year, int simulationStartYear, double inflationRate) {
        double annual = monthlyAmount * 12.0;
        if (!inflationLinked) {
            return annual;
        }
        return annual * Math.pow(1.0 + inflationRate, year - simulationStartYear);
    }
}
