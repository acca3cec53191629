package com.gillianbc.wealthsim.tax;

import lombok.Value;

/**
 * A pension withdrawal split into its tax-free and taxable parts.
 */
@Value
public class PensionDrawdown {

    public static final PensionDrawdown NONE = new PensionDrawdown(0.0, 0.0, 0.0, 0.0, 0.0);

    double gross;
    double taxFree;
    double taxable;
    double tax;
    double net;
}
