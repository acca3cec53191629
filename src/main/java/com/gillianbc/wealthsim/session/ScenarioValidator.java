package com.gillianbc.wealthsim.session;

import com.gillianbc.wealthsim.config.SimulationProperties;
import com.gillianbc.wealthsim.exception.ConfigurationException;
import com.gillianbc.wealthsim.model.Asset;
import com.gillianbc.wealthsim.model.Assumptions;
import com.gillianbc.wealthsim.model.Expense;
import com.gillianbc.wealthsim.model.IncomeSource;
import com.gillianbc.wealthsim.model.Mortgage;
import com.gillianbc.wealthsim.model.Person;
import com.gillianbc.wealthsim.model.PolicyParams;
import com.gillianbc.wealthsim.model.Scenario;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;

/**
 * Rejects malformed input before anything is sampled. Each failure names the offending field,
 * e.g. {@code assets[isa-1].growthStd}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScenarioValidator {

    /** Longest projection accepted, in years. */
    static final int MAX_PROJECTION_YEARS = 150;

    private final SimulationProperties properties;

    public void validate(Scenario scenario, int iterations, PolicyParams policy) {
        validateIterations(iterations);
        validateScenario(scenario);
        validateTableSize(scenario, iterations);
        validatePolicy(policy);
    }

    /**
     * Bounds the cached draw table and the per-path records at {@code maxDrawTableSize} cells.
     * A scenario without assets still produces one record per path-year, so it counts as one column.
     */
    public void validateTableSize(Scenario scenario, int iterations) {
        long cells = (long) iterations * scenario.getAssumptions().yearCount()
                * Math.max(1, scenario.getAssets().size());
        if (cells > properties.maxDrawTableSize()) {
            throw new ConfigurationException("iterations",
                    iterations + " paths over " + scenario.getAssumptions().yearCount() + " years and "
                            + scenario.getAssets().size() + " assets need " + cells
                            + " draws, more than the limit of " + properties.maxDrawTableSize());
        }
    }

    public void validateIterations(int iterations) {
        if (iterations < 1 || iterations > properties.maxIterations()) {
            throw new ConfigurationException("iterations",
                    "must be between 1 and " + properties.maxIterations() + ", was " + iterations);
        }
    }

    public void validatePolicy(PolicyParams policy) {
        if (policy == null) {
            throw new ConfigurationException("policy", "must not be null");
        }
        if (policy.getPercentile() < 1 || policy.getPercentile() > 99) {
            throw new ConfigurationException("policy.percentile", "must be between 1 and 99, was " + policy.getPercentile());
        }
        requireNonNegative("policy.annualSpendTarget", policy.getAnnualSpendTarget());
    }

    public void validateScenario(Scenario scenario) {
        if (scenario == null) {
            throw new ConfigurationException("scenario", "must not be null");
        }
        Assumptions assumptions = scenario.getAssumptions();
        if (assumptions.getEndYear() <= assumptions.getStartYear()) {
            throw new ConfigurationException("assumptions.endYear",
                    "must be after startYear " + assumptions.getStartYear() + ", was " + assumptions.getEndYear());
        }
        if ((long) assumptions.getEndYear() - assumptions.getStartYear() >= MAX_PROJECTION_YEARS) {
            throw new ConfigurationException("assumptions.endYear",
                    "projection may span at most " + MAX_PROJECTION_YEARS + " years, was "
                            + assumptions.getStartYear() + " to " + assumptions.getEndYear());
        }
        requireFinite("assumptions.inflationRate", assumptions.getInflationRate());
        requireFinite("assumptions.equityReturnMean", assumptions.getEquityReturnMean());
        requireNonNegative("assumptions.equityReturnStd", assumptions.getEquityReturnStd());
        requireNonNegative("assumptions.isaAnnualLimit", assumptions.getIsaAnnualLimit());
        requireNonNegative("assumptions.statePensionAnnual", assumptions.getStatePensionAnnual());
        requireNonNegative("assumptions.emergencyFundMonths", assumptions.getEmergencyFundMonths());
        requireNonNegative("assumptions.annualSpendTarget", assumptions.getAnnualSpendTarget());

        if (scenario.getPeople().isEmpty()) {
            throw new ConfigurationException("people", "at least one person is required");
        }
        Set<String> personIds = new HashSet<>();
        for (Person person : scenario.getPeople()) {
            String field = "people[" + person.getId() + "]";
            if (!personIds.add(person.getId())) {
                throw new ConfigurationException(field + ".id", "duplicate person id");
            }
            if (person.getPlannedRetirementAge() < 0) {
                throw new ConfigurationException(field + ".plannedRetirementAge", "must not be negative");
            }
            if (person.getStatePensionAge() < 0) {
                throw new ConfigurationException(field + ".statePensionAge", "must not be negative");
            }
            requireNonNegative(field + ".annualCost", person.getAnnualCost());
            if (person.getLeavesHouseholdAge() < 0) {
                throw new ConfigurationException(field + ".leavesHouseholdAge", "must not be negative");
            }
        }

        Set<String> assetIds = new HashSet<>();
        for (Asset asset : scenario.getAssets()) {
            String field = "assets[" + asset.getId() + "]";
            if (!assetIds.add(asset.getId())) {
                throw new ConfigurationException(field + ".id", "duplicate asset id");
            }
            requireOwner(field + ".ownerId", asset.getOwnerId(), personIds);
            requireNonNegative(field + ".balance", asset.getBalance());
            requireNonNegative(field + ".annualContributionCap", asset.getAnnualContributionCap());
            if (asset.getCostBasis() != null) {
                requireNonNegative(field + ".costBasis", asset.getCostBasis());
            }
            if (asset.getGrowthMean() != null) {
                requireFinite(field + ".growthMean", asset.getGrowthMean());
            }
            if (asset.getGrowthStd() != null) {
                requireNonNegative(field + ".growthStd", asset.getGrowthStd());
            }
        }

        Set<String> incomeIds = new HashSet<>();
        for (IncomeSource income : scenario.getIncomes()) {
            String field = "incomes[" + income.getId() + "]";
            if (!incomeIds.add(income.getId())) {
                throw new ConfigurationException(field + ".id", "duplicate income id");
            }
            requireOwner(field + ".ownerId", income.getOwnerId(), personIds);
            requireNonNegative(field + ".grossAnnual", income.getGrossAnnual());
            requireFinite(field + ".annualGrowthRate", income.getAnnualGrowthRate());
            requireFraction(field + ".employeePensionPct", income.getEmployeePensionPct());
            requireFraction(field + ".employerPensionPct", income.getEmployerPensionPct());
            if (income.getStartYear() != null && income.getEndYear() != null
                    && income.getEndYear() < income.getStartYear()) {
                throw new ConfigurationException(field + ".endYear", "must not be before startYear");
            }
        }

        for (int i = 0; i < scenario.getExpenses().size(); i++) {
            Expense expense = scenario.getExpenses().get(i);
            requireNonNegative("expenses[" + i + "].monthlyAmount", expense.getMonthlyAmount());
        }

        Mortgage mortgage = scenario.getMortgage();
        if (mortgage != null) {
            requireNonNegative("mortgage.balance", mortgage.getBalance());
            requireNonNegative("mortgage.annualInterestRate", mortgage.getAnnualInterestRate());
            requireNonNegative("mortgage.monthlyPayment", mortgage.getMonthlyPayment());
            if (mortgage.getBalance() > 0.0
                    && mortgage.getMonthlyPayment() <= mortgage.getBalance() * mortgage.getAnnualInterestRate() / 12.0) {
                log.warn("Mortgage payment {} does not cover the first month's interest; the balance will never clear",
                        mortgage.getMonthlyPayment());
            }
        }
    }

    private static void requireOwner(String field, String ownerId, Set<String> personIds) {
        if (ownerId != null && !personIds.contains(ownerId)) {
            throw new ConfigurationException(field, "unknown person " + ownerId);
        }
    }

    private static void requireFinite(String field, double value) {
        if (!Double.isFinite(value)) {
            throw new ConfigurationException(field, "must be finite, was " + value);
        }
    }

    private static void requireNonNegative(String field, double value) {
        requireFinite(field, value);
        if (value < 0.0) {
            throw new ConfigurationException(field, "must not be negative, was " + value);
        }
    }

    private static void requireFraction(String field, double value) {
        requireFinite(field, value);
        if (value < 0.0 || value > 1.0) {
            throw new ConfigurationException(field, "must be a fraction between 0 and 1, was " + value);
        }
    }
}
