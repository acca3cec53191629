package com.gillianbc.wealthsim.model;

import com.gillianbc.wealthsim.tax.TaxBands;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Economic and policy assumptions for a scenario. Defaults are UK 2024/25.
 */
@Value
@Builder(toBuilder = true)
public class Assumptions {

    @Builder.Default double inflationRate = 0.02;
    @Builder.Default double equityReturnMean = 0.05;
    @Builder.Default double equityReturnStd = 0.10;
    @Builder.Default double isaAnnualLimit = 20_000.00;
    /** Full new state pension per person, indexed with inflation from the start year. */
    @Builder.Default double statePensionAnnual = 11_502.40;
    @Builder.Default int pensionAccessAge = 55;
    int startYear;
    /** Last simulated year, inclusive. */
    int endYear;
    /** Default discretionary spend once everyone has retired; see {@link PolicyParams}. */
    double annualSpendTarget;
    /** Cash kept back from investment, in months of that year's outflow. */
    @Builder.Default double emergencyFundMonths = 6.0;
    @NonNull @Builder.Default TaxBands taxBands = TaxBands.uk2024();

    public int yearCount() {
        return endYear - startYear + 1;
    }
}
