package com.gillianbc.wealthsim.aggregate;

import com.gillianbc.wealthsim.model.YearRecord;
import lombok.Getter;

import java.util.function.ToDoubleFunction;

/**
 * Every reported series, with how to read it from a {@link YearRecord} and how to fold it across paths.
 */
public enum Metric {
    NET_WORTH(YearRecord::getNetWorth),
    SALARY_GROSS(YearRecord::getSalaryGross),
    SALARY_NET(YearRecord::getSalaryNet),
    RENTAL_INCOME(YearRecord::getRentalNet),
    RENTAL_GROSS(YearRecord::getRentalGross),
    GIFT_INCOME(YearRecord::getGiftIncome),
    STATE_PENSION_INCOME(YearRecord::getStatePensionGross),
    PENSION_INCOME(YearRecord::getPensionIncomeNet),
    PENSION_WITHDRAWAL_GROSS(YearRecord::getPensionWithdrawalGross),
    ISA_WITHDRAWALS(YearRecord::getIsaWithdrawals),
    GIA_WITHDRAWALS(YearRecord::getGiaWithdrawalGross),
    INVESTMENT_RETURNS(YearRecord::getInvestmentReturns),
    ISA_RETURNS(YearRecord::getIsaReturns),
    GIA_RETURNS(YearRecord::getGiaReturns),
    PENSION_RETURNS(YearRecord::getPensionReturns),
    CASH_RETURNS(YearRecord::getCashInterest),
    TOTAL_INCOME(YearRecord::totalIncome),
    TOTAL_EXPENSES(YearRecord::getExpenses),
    CHILD_COSTS(YearRecord::getChildCosts),
    DISCRETIONARY_SPEND(YearRecord::getDiscretionarySpend),
    MORTGAGE_PAYMENT(YearRecord::getMortgagePayment),
    PENSION_CONTRIBUTIONS(YearRecord::pensionContributions),
    ISA_CONTRIBUTIONS(YearRecord::getIsaContributions),
    GIA_CONTRIBUTIONS(YearRecord::getGiaContributions),
    INCOME_TAX(YearRecord::getIncomeTax),
    NATIONAL_INSURANCE(YearRecord::getNationalInsurance),
    CAPITAL_GAINS_TAX(YearRecord::getCapitalGainsTax),
    TOTAL_TAX(YearRecord::totalTax),
    UNFUNDED_SHORTFALL(YearRecord::getUnfundedShortfall),
    CASH_BALANCE(YearRecord::getCashBalance),
    ISA_BALANCE(YearRecord::getIsaBalance),
    GIA_BALANCE(YearRecord::getGiaBalance),
    PENSION_BALANCE(YearRecord::getPensionBalance),
    TOTAL_ASSETS(YearRecord::getTotalAssets),
    MORTGAGE_BALANCE(YearRecord::getMortgageBalance),
    TOTAL_LIABILITIES(YearRecord::getTotalLiabilities),
    MORTGAGE_PAID_OFF(r -> r.isMortgagePaidOff() ? 1.0 : 0.0, AggregationMode.PERCENT_TRUE),
    DEPLETED(r -> r.isDepleted() ? 1.0 : 0.0, AggregationMode.PERCENT_TRUE);

    private final ToDoubleFunction<YearRecord> accessor;
    @Getter
    private final AggregationMode mode;

    Metric(ToDoubleFunction<YearRecord> accessor) {
        this(accessor, AggregationMode.PERCENTILE);
    }

    Metric(ToDoubleFunction<YearRecord> accessor, AggregationMode mode) {
        this.accessor = accessor;
        this.mode = mode;
    }

    public double valueOf(YearRecord record) {
        return accessor.applyAsDouble(record);
    }
}
