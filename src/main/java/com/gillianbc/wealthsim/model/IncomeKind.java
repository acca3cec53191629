package com.gillianbc.wealthsim.model;

public enum IncomeKind {
    /** Employment income: income tax, NI and workplace pension contributions. Ends at retirement. */
    SALARY,
    /** Income tax only. Continues into retirement. */
    RENTAL,
    /** Untaxed. */
    GIFT
}
