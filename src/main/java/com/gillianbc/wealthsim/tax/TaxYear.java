package com.gillianbc.wealthsim.tax;

import lombok.Getter;

/**
 * Running tax position of one household for one simulated year. Each person keeps their own
 * taxable income (so allowances are per person) and NI-able pay; the CGT allowance is shared.
 * Created fresh for every path-year by {@link TaxCalculator#newYear(int)}.
 */
public final class TaxYear {

    private final double[] taxableIncome;
    private final double[] niablePay;
    @Getter private double cgtAllowanceRemaining;
    @Getter private double incomeTax;
    @Getter private double nationalInsurance;
    @Getter private double capitalGainsTax;

    TaxYear(int people, double cgtAllowance) {
        this.taxableIncome = new double[people];
        this.niablePay = new double[people];
        this.cgtAllowanceRemaining = cgtAllowance;
    }

    public double taxableIncomeOf(int person) {
        return taxableIncome[person];
    }

    public double niablePayOf(int person) {
        return niablePay[person];
    }

    public double totalTax() {
        return incomeTax + nationalInsurance + capitalGainsTax;
    }

    void addIncome(int person, double taxable, double tax) {
        taxableIncome[person] += taxable;
        incomeTax += tax;
    }

    void addNiablePay(int person, double pay, double ni) {
        niablePay[person] += pay;
        nationalInsurance += ni;
    }

    void useCgtAllowance(double used, double tax) {
        cgtAllowanceRemaining -= used;
        capitalGainsTax += tax;
    }
}
