package com.gillianbc.wealthsim.model;

import lombok.Builder;
import lombok.Value;

/**
 * The knobs a caller can turn without resampling returns.
 * <p>
 * Policy contract:
 * <ul>
 *     <li>{@code annualSpendTarget} is discretionary spend added on top of the scenario's expenses,
 *     in every year in which all people are retired. It is a flat nominal amount.</li>
 *     <li>{@code retirementAgeOffset} is added to every person's planned retirement age (floored at 0).</li>
 *     <li>{@code percentile} (1..99) selects the reported series; bands stay at 10/50/90.</li>
 * </ul>
 * Withdrawal priority is a scenario property, not a policy: lower values are withdrawn first.
 */
@Value
@Builder(toBuilder = true)
public class PolicyParams {

    public static final int DEFAULT_PERCENTILE = 50;

    double annualSpendTarget;
    int retirementAgeOffset;
    @Builder.Default int percentile = DEFAULT_PERCENTILE;

    public static PolicyParams defaultsFor(Scenario scenario) {
        return PolicyParams.builder()
                .annualSpendTarget(scenario.getAssumptions().getAnnualSpendTarget())
                .build();
    }
}
