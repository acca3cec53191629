package com.gillianbc.wealthsim.tax;

import com.gillianbc.wealthsim.exception.ConfigurationException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * The tax-year parameters: income tax bands, class 1 NI bands, CGT allowance and rate, and the
 * tax-free share of a pension withdrawal. Flat across years for now.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class TaxBands {

    public static final double PERSONAL_ALLOWANCE = 12_570.00;
    public static final double BASIC_RATE_LIMIT = 50_270.00;
    public static final double HIGHER_RATE_LIMIT = 125_140.00;

    private final ProgressiveBands incomeTax;
    private final ProgressiveBands nationalInsurance;
    private final double cgtAnnualAllowance;
    private final double cgtRate;
    private final double pensionTaxFreeFraction;

    public TaxBands(ProgressiveBands incomeTax,
                    ProgressiveBands nationalInsurance,
                    double cgtAnnualAllowance,
                    double cgtRate,
                    double pensionTaxFreeFraction) {
        this.incomeTax = Objects.requireNonNull(incomeTax, "incomeTax must not be null");
        this.nationalInsurance = Objects.requireNonNull(nationalInsurance, "nationalInsurance must not be null");
        if (!(cgtAnnualAllowance >= 0.0) || Double.isInfinite(cgtAnnualAllowance)) {
            throw new ConfigurationException("taxBands.cgtAnnualAllowance", "must be a finite amount >= 0");
        }
        if (!(cgtRate >= 0.0 && cgtRate <= 1.0)) {
            throw new ConfigurationException("taxBands.cgtRate", "must be within [0, 1]");
        }
        if (!(pensionTaxFreeFraction >= 0.0 && pensionTaxFreeFraction < 1.0)) {
            throw new ConfigurationException("taxBands.pensionTaxFreeFraction", "must be within [0, 1)");
        }
        this.cgtAnnualAllowance = cgtAnnualAllowance;
        this.cgtRate = cgtRate;
        this.pensionTaxFreeFraction = pensionTaxFreeFraction;
    }

    /**
     * UK 2024/25: 12,570 personal allowance, 20/40/45% income tax, 8/2% employee NI,
     * 3,000 CGT allowance at a flat 10%, 25% of pension withdrawals tax-free.
     */
    public static TaxBands uk2024() {
        return new TaxBands(
                ProgressiveBands.of("taxBands.incomeTax",
                        new double[]{0.0, PERSONAL_ALLOWANCE, BASIC_RATE_LIMIT, HIGHER_RATE_LIMIT},
                        new double[]{0.0, 0.20, 0.40, 0.45}),
                ProgressiveBands.of("taxBands.nationalInsurance",
                        new double[]{0.0, PERSONAL_ALLOWANCE, BASIC_RATE_LIMIT},
                        new double[]{0.0, 0.08, 0.02}),
                3_000.00,
                0.10,
                0.25);
    }
}
