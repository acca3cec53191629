package com.gillianbc.wealthsim.tax;

import lombok.Getter;

import java.util.Objects;

/**
 * Simplified UK tax rules over a {@link TaxBands} table.
 * <ul>
 *     <li>Salary: employee pension contributions come off before income tax and NI.</li>
 *     <li>Rental and state pension: income tax only, stacked on what the person has already earned.</li>
 *     <li>Gifts: untaxed.</li>
 *     <li>Pension drawdown: 25% tax-free, 75% taxed at the person's marginal rate.</li>
 *     <li>GIA: gain share of each sale taxed at a flat rate above the annual allowance.</li>
 * </ul>
 * Stateless apart from the bands; the running position for a year lives in a {@link TaxYear}.
 */
@Getter
public final class TaxCalculator {

    private final TaxBands bands;

    public TaxCalculator(TaxBands bands) {
        this.bands = Objects.requireNonNull(bands, "bands must not be null");
    }

    public TaxYear newYear(int people) {
        return new TaxYear(people, bands.getCgtAnnualAllowance());
    }

    public double incomeTax(double taxableIncome) {
        return bands.getIncomeTax().taxOn(taxableIncome);
    }

    /**
     * Taxes a salary for {@code person} and returns the net pay that reaches the household.
     *
     * @param gross                gross salary (negative treated as zero)
     * @param employeeContribution employee pension contribution taken before tax
     * @return gross - contribution - income tax - NI
     */
    public double taxSalary(TaxYear year, int person, double gross, double employeeContribution) {
        double safeGross = Math.max(0.0, gross);
        double contribution = Math.min(safeGross, Math.max(0.0, employeeContribution));
        double pay = safeGross - contribution;

        double tax = bands.getIncomeTax().marginalTaxOn(year.taxableIncomeOf(person), pay);
        double ni = bands.getNationalInsurance().marginalTaxOn(year.niablePayOf(person), pay);
        year.addIncome(person, pay, tax);
        year.addNiablePay(person, pay, ni);
        return pay - tax - ni;
    }

    /**
     * Income tax only, no NI. Used for rental income and the state pension.
     *
     * @return the amount net of tax
     */
    public double taxOtherIncome(TaxYear year, int person, double gross) {
        double safeGross = Math.max(0.0, gross);
        double tax = bands.getIncomeTax().marginalTaxOn(year.taxableIncomeOf(person), safeGross);
        year.addIncome(person, safeGross, tax);
        return safeGross - tax;
    }

    /**
     * Tax on a gross pension withdrawal of {@code gross}, stacked on the person's income so far.
     * Does not record anything against the year.
     */
    public PensionDrawdown pensionDrawdownForGross(TaxYear year, int person, double gross) {
        double safeGross = Math.max(0.0, gross);
        if (safeGross == 0.0) {
            return PensionDrawdown.NONE;
        }
        double taxFree = safeGross * bands.getPensionTaxFreeFraction();
        double taxable = safeGross - taxFree;
        double tax = bands.getIncomeTax().marginalTaxOn(year.taxableIncomeOf(person), taxable);
        return new PensionDrawdown(safeGross, taxFree, taxable, tax, safeGross - tax);
    }

    /**
     * Finds the smallest gross withdrawal whose net covers {@code targetNet}, bounded by
     * {@code available}, and records its taxable part and tax against the person.
     */
    public PensionDrawdown drawPension(TaxYear year, int person, double targetNet, double available) {
        if (!(targetNet > 0.0) || !(available > 0.0)) {
            return PensionDrawdown.NONE;
        }
        double taxedFraction = 1.0 - bands.getPensionTaxFreeFraction();
        double taxableNeeded = bands.getIncomeTax()
                .solveTaxableForNet(year.taxableIncomeOf(person), targetNet, 1.0 / taxedFraction);
        double gross = Math.min(available, taxableNeeded / taxedFraction);

        PensionDrawdown drawdown = pensionDrawdownForGross(year, person, gross);
        year.addIncome(person, drawdown.getTaxable(), drawdown.getTax());
        return drawdown;
    }

    /**
     * Sells enough of a GIA holding to raise {@code targetNet} after CGT, bounded by the balance,
     * and records the CGT and allowance used.
     * <p>
     * With gain share {@code g}, remaining allowance {@code A} and rate {@code r}, net proceeds of
     * a sale {@code G} are {@code G - r * max(0, g*G - A)}, which inverts in closed form.
     */
    public GiaWithdrawal sellGia(TaxYear year, double targetNet, double balance, double costBasis) {
        if (!(targetNet > 0.0) || !(balance > 0.0)) {
            return GiaWithdrawal.NONE;
        }
        double gainShare = Math.max(0.0, balance - Math.max(0.0, costBasis)) / balance;
        double allowance = Math.max(0.0, year.getCgtAllowanceRemaining());
        double rate = bands.getCgtRate();

        double gross;
        if (gainShare == 0.0 || targetNet * gainShare <= allowance) {
            gross = targetNet;
        } else {
            gross = (targetNet - rate * allowance) / (1.0 - rate * gainShare);
        }
        gross = Math.min(balance, gross);

        double gain = gross * gainShare;
        double allowanceUsed = Math.min(allowance, gain);
        double tax = (gain - allowanceUsed) * rate;
        double basisReleased = Math.max(0.0, costBasis) * (gross / balance);
        year.useCgtAllowance(allowanceUsed, tax);
        return new GiaWithdrawal(gross, gain, tax, gross - tax, basisReleased);
    }
}
