package com.gillianbc.wealthsim.tax;

import com.gillianbc.wealthsim.exception.ConfigurationException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * A progressive rate table: each band starts at a lower bound and runs to the next band's lower
 * bound (the last band is unbounded). The first band always starts at zero.
 * <p>
 * Income tax for 2024/25 reads as {@code [0 @ 0%, 12570 @ 20%, 50270 @ 40%, 125140 @ 45%]}.
 */
@ToString
@EqualsAndHashCode
public final class ProgressiveBands {

    /** Label for messages only; two tables with the same bands are equal whatever their names. */
    @Getter
    @EqualsAndHashCode.Exclude
    private final String name;
    private final double[] lowerBounds;
    private final double[] rates;

    private ProgressiveBands(String name, double[] lowerBounds, double[] rates) {
        this.name = name;
        this.lowerBounds = lowerBounds;
        this.rates = rates;
    }

    /**
     * @param name        used in error messages, e.g. {@code taxBands.incomeTax}
     * @param lowerBounds band starts; must begin at 0 and be strictly increasing
     * @param rates       marginal rate per band, each in [0, 1]
     * @throws ConfigurationException if the table is malformed
     */
    public static ProgressiveBands of(String name, double[] lowerBounds, double[] rates) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(lowerBounds, "lowerBounds must not be null");
        Objects.requireNonNull(rates, "rates must not be null");
        if (lowerBounds.length == 0 || lowerBounds.length != rates.length) {
            throw new ConfigurationException(name, "needs one rate per band and at least one band");
        }
        if (lowerBounds[0] != 0.0) {
            throw new ConfigurationException(name, "first band must start at 0 but starts at " + lowerBounds[0]);
        }
        for (int i = 0; i < lowerBounds.length; i++) {
            if (!Double.isFinite(lowerBounds[i])) {
                throw new ConfigurationException(name, "threshold " + i + " is not finite");
            }
            if (i > 0 && lowerBounds[i] <= lowerBounds[i - 1]) {
                throw new ConfigurationException(name, "thresholds must be strictly increasing but "
                        + lowerBounds[i] + " follows " + lowerBounds[i - 1]);
            }
            if (!(rates[i] >= 0.0 && rates[i] <= 1.0)) {
                throw new ConfigurationException(name, "rate " + rates[i] + " must be within [0, 1]");
            }
        }
        return new ProgressiveBands(name, lowerBounds.clone(), rates.clone());
    }

    /**
     * Tax due on {@code amount}. Negative amounts are treated as zero; NaN propagates.
     */
    public double taxOn(double amount) {
        double income = Math.max(0.0, amount);
        double tax = 0.0;
        for (int i = 0; i < lowerBounds.length; i++) {
            double lower = lowerBounds[i];
            if (income <= lower) {
                break;
            }
            double upper = upperBound(i);
            tax += (Math.min(income, upper) - lower) * rates[i];
        }
        return tax;
    }

    /**
     * Tax on {@code extra} when stacked on top of {@code base} already taxed this year.
     */
    public double marginalTaxOn(double base, double extra) {
        double safeBase = Math.max(0.0, base);
        double safeExtra = Math.max(0.0, extra);
        if (safeExtra == 0.0) {
            return 0.0;
        }
        return taxOn(safeBase + safeExtra) - taxOn(safeBase);
    }

    /**
     * Solves for the taxable amount {@code t}, stacked on {@code base}, such that
     * {@code t * grossPerTaxable - marginalTaxOn(base, t) == targetNet}.
     * <p>
     * Pension drawdown with 25% tax-free uses {@code grossPerTaxable = 4/3}: each unit of
     * taxable income comes with a third of a unit tax-free. Net per taxable unit in a band is
     * therefore {@code grossPerTaxable - rate}, which makes the solve a walk over the bands.
     *
     * @return taxable amount, or the amount reachable before net per unit drops to zero
     */
    public double solveTaxableForNet(double base, double targetNet, double grossPerTaxable) {
        if (!(targetNet > 0.0)) {
            return 0.0;
        }
        double current = Math.max(0.0, base);
        double remainingNet = targetNet;
        double taxable = 0.0;
        for (int i = 0; i < lowerBounds.length; i++) {
            double upper = upperBound(i);
            if (current >= upper) {
                continue;
            }
            double netPerUnit = grossPerTaxable - rates[i];
            if (netPerUnit <= 0.0) {
                return taxable;
            }
            double available = upper - Math.max(current, lowerBounds[i]);
            double netAvailable = available * netPerUnit;
            if (remainingNet <= netAvailable) {
                return taxable + remainingNet / netPerUnit;
            }
            taxable += available;
            remainingNet -= netAvailable;
            current = upper;
        }
        return taxable;
    }

    private double upperBound(int band) {
        return band + 1 < lowerBounds.length ? lowerBounds[band + 1] : Double.POSITIVE_INFINITY;
    }
}
