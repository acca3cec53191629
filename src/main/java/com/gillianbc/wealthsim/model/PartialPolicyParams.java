package com.gillianbc.wealthsim.model;

import lombok.Builder;
import lombok.Value;

/**
 * Overrides for a recalculation; null fields keep the session's last value.
 */
@Value
@Builder
public class PartialPolicyParams {

    Double annualSpendTarget;
    Integer retirementAgeOffset;
    Integer percentile;

    public static PartialPolicyParams none() {
        return PartialPolicyParams.builder().build();
    }

    public PolicyParams mergeOver(PolicyParams base) {
        return base.toBuilder()
                .annualSpendTarget(annualSpendTarget != null ? annualSpendTarget : base.getAnnualSpendTarget())
                .retirementAgeOffset(retirementAgeOffset != null ? retirementAgeOffset : base.getRetirementAgeOffset())
                .percentile(percentile != null ? percentile : base.getPercentile())
                .build();
    }
}
