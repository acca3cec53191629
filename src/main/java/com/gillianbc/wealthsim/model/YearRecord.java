package com.gillianbc.wealthsim.model;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable record of one simulated year on one path: every flow and the closing balances.
 * Incomes are annual amounts; balances are at the end of the year, after growth.
 */
@Value
@Builder
public class YearRecord {

    int year;

    double salaryGross;
    double salaryNet;
    double rentalGross;
    double rentalNet;
    double giftIncome;
    double statePensionGross;
    double statePensionNet;
    double pensionWithdrawalGross;
    double pensionIncomeNet;
    double isaWithdrawals;
    double giaWithdrawalGross;
    double giaWithdrawalNet;
    /** Growth of every invested balance plus cash interest; the sum of the four per-type returns. */
    double investmentReturns;
    double isaReturns;
    double giaReturns;
    double pensionReturns;

    double incomeTax;
    double nationalInsurance;
    double capitalGainsTax;

    /** Configured expenses plus the cost of dependent children. */
    double expenses;
    double childCosts;
    double discretionarySpend;
    double mortgagePayment;
    double mortgageInterest;
    double employeePensionContributions;
    double employerPensionContributions;
    double isaContributions;
    double giaContributions;

    double cashInterest;
    /** Spending that no eligible asset could fund this year. */
    double unfundedShortfall;

    double cashStart;
    double cashBalance;
    double isaBalance;
    double giaBalance;
    double pensionBalance;
    double totalAssets;
    double mortgageBalance;
    double totalLiabilities;
    double netWorth;

    /** True once the mortgage balance is zero (always true without a mortgage). */
    boolean mortgagePaidOff;
    /** True when eligible assets ran out before this year's shortfall was covered. */
    boolean depleted;

    public double totalTax() {
        return incomeTax + nationalInsurance + capitalGainsTax;
    }

    public double pensionContributions() {
        return employeePensionContributions + employerPensionContributions;
    }

    /** Everything that landed in the cash pool this year. */
    public double cashIn() {
        return salaryNet + rentalNet + giftIncome + statePensionNet
                + pensionIncomeNet + isaWithdrawals + giaWithdrawalNet;
    }

    /** Everything that left the cash pool this year. */
    public double cashOut() {
        return expenses + discretionarySpend + mortgagePayment + isaContributions + giaContributions;
    }

    /** Net income from all sources, withdrawals included. */
    public double totalIncome() {
        return cashIn();
    }
}
