package com.gillianbc.wealthsim.tax;

import lombok.Value;

/**
 * A GIA sale: gross proceeds, the gain realised by it, CGT due and the cost basis released.
 */
@Value
public class GiaWithdrawal {

    public static final GiaWithdrawal NONE = new GiaWithdrawal(0.0, 0.0, 0.0, 0.0, 0.0);

    double gross;
    double gainRealised;
    double tax;
    double net;
    double basisReleased;
}
