package com.gillianbc.wealthsim.engine;

import com.gillianbc.wealthsim.exception.NumericException;
import com.gillianbc.wealthsim.model.Asset;
import com.gillianbc.wealthsim.model.AssetType;
import com.gillianbc.wealthsim.model.Assumptions;
import com.gillianbc.wealthsim.model.Expense;
import com.gillianbc.wealthsim.model.IncomeSource;
import com.gillianbc.wealthsim.model.Mortgage;
import com.gillianbc.wealthsim.model.Person;
import com.gillianbc.wealthsim.model.YearRecord;
import com.gillianbc.wealthsim.tax.GiaWithdrawal;
import com.gillianbc.wealthsim.tax.PensionDrawdown;
import com.gillianbc.wealthsim.tax.TaxCalculator;
import com.gillianbc.wealthsim.tax.TaxYear;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Advances a household by one year. The order of operations is fixed:
 * <ol>
 *     <li>retirement statuses from age; children never retire and do not count</li>
 *     <li>salaries, with pension contributions into the owner's pension</li>
 *     <li>rental income</li>
 *     <li>gifts</li>
 *     <li>state pension</li>
 *     <li>mortgage, expenses and the cost of dependent children</li>
 *     <li>net incomes in, outflow out of the cash pool</li>
 *     <li>withdrawals in priority order while cash is negative</li>
 *     <li>surplus above the emergency fund swept into ISAs, then GIAs</li>
 *     <li>growth from the draw table</li>
 * </ol>
 * Stateless; everything that carries over between years lives in {@link HouseholdState}.
 */
@Component
public class YearStepEngine {

    /** Residual shortfall below this is floating-point noise, not depletion. */
    static final double DEPLETION_TOLERANCE = 0.005;

    public YearRecord step(SimulationPlan plan, HouseholdState state, DrawTable draws, int path, int yearIndex) {
        final int year = plan.yearAt(yearIndex);
        final int startYear = plan.getStartYear();
        final Assumptions assumptions = plan.getAssumptions();
        final TaxCalculator taxes = plan.getTaxCalculator();
        final List<Person> people = plan.getPeople();
        final List<Asset> assets = plan.getAssets();
        final double[] balances = state.getBalances();
        final double[] basis = state.getCostBasis();
        final TaxYear tax = taxes.newYear(people.size());
        final double cashStart = state.getCash();

        // 1. statuses
        boolean allRetired = plan.hasAdults();
        for (int p = 0; p < people.size(); p++) {
            Person person = people.get(p);
            if (person.isChild()) {
                state.setRetired(p, false);
                continue;
            }
            boolean retired = person.isRetiredIn(year, plan.getPolicy().getRetirementAgeOffset());
            state.setRetired(p, retired);
            allRetired &= retired;
        }

        // 2. salaries
        double salaryGross = 0.0;
        double salaryNet = 0.0;
        double employeeContributions = 0.0;
        double employerContributions = 0.0;
        for (IncomeSource salary : plan.getSalaries()) {
            int person = plan.ownerIndex(salary.getOwnerId());
            if (state.isRetired(person) || !salary.isPaidIn(year)) {
                continue;
            }
            double gross = Math.max(0.0, salary.amountIn(year, startYear));
            double employee = 0.0;
            int pension = plan.pensionOf(person);
            if (pension >= 0) {
                employee = gross * salary.getEmployeePensionPct();
                double employer = gross * salary.getEmployerPensionPct();
                balances[pension] += employee + employer;
                employeeContributions += employee;
                employerContributions += employer;
            }
            salaryGross += gross;
            salaryNet += taxes.taxSalary(tax, person, gross, employee);
        }

        // 3. rental
        double rentalGross = 0.0;
        double rentalNet = 0.0;
        for (IncomeSource rental : plan.getRentals()) {
            if (!rental.isPaidIn(year)) {
                continue;
            }
            double gross = Math.max(0.0, rental.amountIn(year, startYear));
            rentalGross += gross;
            rentalNet += taxes.taxOtherIncome(tax, plan.ownerIndex(rental.getOwnerId()), gross);
        }

        // 4. gifts
        double giftIncome = 0.0;
        for (IncomeSource gift : plan.getGifts()) {
            if (gift.isPaidIn(year)) {
                giftIncome += Math.max(0.0, gift.amountIn(year, startYear));
            }
        }

        // 5. state pension
        double statePensionGross = 0.0;
        double statePensionNet = 0.0;
        double indexation = Math.pow(1.0 + assumptions.getInflationRate(), yearIndex);
        for (int p = 0; p < people.size(); p++) {
            if (!people.get(p).isChild() && people.get(p).receivesStatePensionIn(year)) {
                double gross = assumptions.getStatePensionAnnual() * indexation;
                statePensionGross += gross;
                statePensionNet += taxes.taxOtherIncome(tax, p, gross);
            }
        }

        // 6. mortgage and expenses
        MortgageYear mortgageYear = stepMortgage(plan.getMortgage(), state.getMortgageBalance());
        state.setMortgageBalance(mortgageYear.closingBalance());
        double expenses = 0.0;
        for (Expense expense : plan.getExpenses()) {
            if (expense.isPaidIn(year)) {
                expenses += expense.annualAmountIn(year, startYear, assumptions.getInflationRate());
            }
        }
        double childCosts = 0.0;
        for (Person person : people) {
            if (person.isDependantIn(year)) {
                childCosts += Math.max(0.0, person.getAnnualCost()) * indexation;
            }
        }
        expenses += childCosts;
        double discretionary = allRetired ? Math.max(0.0, plan.getPolicy().getAnnualSpendTarget()) : 0.0;
        double outflow = expenses + mortgageYear.payment() + discretionary;

        // 7. cash flow
        double cash = cashStart + salaryNet + rentalNet + giftIncome + statePensionNet - outflow;

        // 8. withdrawals
        double pensionGross = 0.0;
        double pensionNet = 0.0;
        double isaWithdrawals = 0.0;
        double giaGross = 0.0;
        double giaNet = 0.0;
        double unfunded = 0.0;
        if (cash < 0.0) {
            double shortfall = -cash;
            for (int i : plan.getWithdrawalOrder()) {
                if (shortfall <= 0.0) {
                    break;
                }
                if (balances[i] <= 0.0) {
                    continue;
                }
                switch (assets.get(i).getType()) {
                    case ISA: {
                        double amount = Math.min(balances[i], shortfall);
                        balances[i] -= amount;
                        isaWithdrawals += amount;
                        shortfall -= amount;
                        break;
                    }
                    case GIA: {
                        GiaWithdrawal sale = taxes.sellGia(tax, shortfall, balances[i], basis[i]);
                        balances[i] = Math.max(0.0, balances[i] - sale.getGross());
                        basis[i] = Math.max(0.0, basis[i] - sale.getBasisReleased());
                        giaGross += sale.getGross();
                        giaNet += sale.getNet();
                        shortfall -= sale.getNet();
                        break;
                    }
                    case PENSION: {
                        int owner = plan.getAssetOwner()[i];
                        if (people.get(owner).ageIn(year) < assumptions.getPensionAccessAge()) {
                            break;
                        }
                        PensionDrawdown drawdown = taxes.drawPension(tax, owner, shortfall, balances[i]);
                        balances[i] = Math.max(0.0, balances[i] - drawdown.getGross());
                        pensionGross += drawdown.getGross();
                        pensionNet += drawdown.getNet();
                        shortfall -= drawdown.getNet();
                        break;
                    }
                    default:
                        break;
                }
            }
            if (shortfall > 0.0) {
                unfunded = shortfall;
                cash = 0.0;
            } else {
                cash = -shortfall;
            }
        }
        boolean depleted = unfunded > DEPLETION_TOLERANCE;

        // 9. invest the surplus
        double isaContributions = 0.0;
        double giaContributions = 0.0;
        double surplus = cash - assumptions.getEmergencyFundMonths() * outflow / 12.0;
        if (surplus > 0.0) {
            double isaRoom = Math.max(0.0, assumptions.getIsaAnnualLimit());
            for (int i : plan.getContributionOrder()) {
                if (surplus <= 0.0) {
                    break;
                }
                Asset asset = assets.get(i);
                if (asset.isContributionsStopAtRetirement() && state.isRetired(plan.getAssetOwner()[i])) {
                    continue;
                }
                double cap = asset.getAnnualContributionCap() > 0.0 ? asset.getAnnualContributionCap() : Double.MAX_VALUE;
                boolean isa = asset.getType() == AssetType.ISA;
                if (isa) {
                    cap = Math.min(cap, isaRoom);
                }
                double amount = Math.min(surplus, cap);
                if (amount <= 0.0) {
                    continue;
                }
                balances[i] += amount;
                surplus -= amount;
                cash -= amount;
                if (isa) {
                    isaRoom -= amount;
                    isaContributions += amount;
                } else {
                    basis[i] += amount;
                    giaContributions += amount;
                }
            }
        }

        // 10. growth
        double isaReturns = 0.0;
        double giaReturns = 0.0;
        double pensionReturns = 0.0;
        for (int i = 0; i < assets.size(); i++) {
            AssetType type = assets.get(i).getType();
            if (type == AssetType.CASH) {
                continue;
            }
            double before = balances[i];
            balances[i] = Math.max(0.0, before * (1.0 + draws.draw(path, yearIndex, i)));
            double growth = balances[i] - before;
            if (type == AssetType.ISA) {
                isaReturns += growth;
            } else if (type == AssetType.GIA) {
                giaReturns += growth;
            } else {
                pensionReturns += growth;
            }
        }
        double cashInterest = 0.0;
        if (plan.getPrimaryCashAsset() >= 0 && cash > 0.0) {
            double grown = Math.max(0.0, cash * (1.0 + draws.draw(path, yearIndex, plan.getPrimaryCashAsset())));
            cashInterest = grown - cash;
            cash = grown;
        }
        double investmentReturns = isaReturns + giaReturns + pensionReturns + cashInterest;
        state.setCash(cash);

        double isaBalance = state.sumBalances(AssetType.ISA);
        double giaBalance = state.sumBalances(AssetType.GIA);
        double pensionBalance = state.sumBalances(AssetType.PENSION);
        double totalAssets = cash + isaBalance + giaBalance + pensionBalance;
        double mortgageBalance = state.getMortgageBalance();

        YearRecord record = YearRecord.builder()
                .year(year)
                .salaryGross(salaryGross)
                .salaryNet(salaryNet)
                .rentalGross(rentalGross)
                .rentalNet(rentalNet)
                .giftIncome(giftIncome)
                .statePensionGross(statePensionGross)
                .statePensionNet(statePensionNet)
                .pensionWithdrawalGross(pensionGross)
                .pensionIncomeNet(pensionNet)
                .isaWithdrawals(isaWithdrawals)
                .giaWithdrawalGross(giaGross)
                .giaWithdrawalNet(giaNet)
                .investmentReturns(investmentReturns)
                .isaReturns(isaReturns)
                .giaReturns(giaReturns)
                .pensionReturns(pensionReturns)
                .incomeTax(tax.getIncomeTax())
                .nationalInsurance(tax.getNationalInsurance())
                .capitalGainsTax(tax.getCapitalGainsTax())
                .expenses(expenses)
                .childCosts(childCosts)
                .discretionarySpend(discretionary)
                .mortgagePayment(mortgageYear.payment())
                .mortgageInterest(mortgageYear.interest())
                .employeePensionContributions(employeeContributions)
                .employerPensionContributions(employerContributions)
                .isaContributions(isaContributions)
                .giaContributions(giaContributions)
                .cashInterest(cashInterest)
                .unfundedShortfall(unfunded)
                .cashStart(cashStart)
                .cashBalance(cash)
                .isaBalance(isaBalance)
                .giaBalance(giaBalance)
                .pensionBalance(pensionBalance)
                .totalAssets(totalAssets)
                .mortgageBalance(mortgageBalance)
                .totalLiabilities(mortgageBalance)
                .netWorth(totalAssets - mortgageBalance)
                .mortgagePaidOff(mortgageBalance <= 0.0)
                .depleted(depleted)
                .build();
        requireFinite(record, path);
        return record;
    }

    /**
     * Twelve monthly steps: interest at a twelfth of the annual rate, then the payment,
     * capped at what is owed.
     */
    static MortgageYear stepMortgage(Mortgage mortgage, double openingBalance) {
        if (mortgage == null || openingBalance <= 0.0) {
            return new MortgageYear(0.0, 0.0, Math.max(0.0, openingBalance));
        }
        double monthlyRate = mortgage.getAnnualInterestRate() / 12.0;
        double balance = openingBalance;
        double paid = 0.0;
        double interestTotal = 0.0;
        for (int month = 0; month < 12 && balance > 0.0; month++) {
            double interest = balance * monthlyRate;
            double payment = Math.min(mortgage.getMonthlyPayment(), balance + interest);
            balance = balance + interest - payment;
            paid += payment;
            interestTotal += interest;
        }
        return new MortgageYear(paid, interestTotal, Math.max(0.0, balance));
    }

    record MortgageYear(double payment, double interest, double closingBalance) {
    }

    private static void requireFinite(YearRecord r, int path) {
        check(path, r, "salaryNet", r.getSalaryNet());
        check(path, r, "rentalNet", r.getRentalNet());
        check(path, r, "giftIncome", r.getGiftIncome());
        check(path, r, "statePensionNet", r.getStatePensionNet());
        check(path, r, "pensionIncomeNet", r.getPensionIncomeNet());
        check(path, r, "giaWithdrawalNet", r.getGiaWithdrawalNet());
        check(path, r, "investmentReturns", r.getInvestmentReturns());
        check(path, r, "totalTax", r.totalTax());
        check(path, r, "expenses", r.getExpenses());
        check(path, r, "mortgagePayment", r.getMortgagePayment());
        check(path, r, "unfundedShortfall", r.getUnfundedShortfall());
        check(path, r, "cashBalance", r.getCashBalance());
        check(path, r, "isaBalance", r.getIsaBalance());
        check(path, r, "giaBalance", r.getGiaBalance());
        check(path, r, "pensionBalance", r.getPensionBalance());
        check(path, r, "mortgageBalance", r.getMortgageBalance());
        check(path, r, "netWorth", r.getNetWorth());
    }

    private static void check(int path, YearRecord record, String metric, double value) {
        if (!Double.isFinite(value)) {
            throw new NumericException(path, record.getYear(), metric, value);
        }
    }
}
