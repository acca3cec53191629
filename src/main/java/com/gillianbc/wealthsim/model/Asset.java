package com.gillianbc.wealthsim.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A balance the household holds. Withdrawal priority orders drawdown: lower values are
 * used first, equal priorities fall back to the asset id.
 */
@Value
@Builder
public class Asset {

    @NonNull String id;
    String name;
    @NonNull AssetType type;
    double balance;
    /** Purchase cost for GIA gains; null means the opening balance is all principal. */
    Double costBasis;
    /** Annual contribution cap, 0 for uncapped. */
    double annualContributionCap;
    /** Null falls back to the scenario's equity assumptions (CASH falls back to 0). */
    Double growthMean;
    /** Null falls back to the scenario's equity assumptions (CASH falls back to 0). */
    Double growthStd;
    int withdrawalPriority;
    boolean contributionsStopAtRetirement;
    /** Owning person, or null for a household-level asset. */
    String ownerId;

    public double openingCostBasis() {
        return costBasis != null ? costBasis : balance;
    }
}
