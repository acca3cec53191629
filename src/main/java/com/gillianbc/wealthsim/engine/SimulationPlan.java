package com.gillianbc.wealthsim.engine;

import com.gillianbc.wealthsim.model.Asset;
import com.gillianbc.wealthsim.model.AssetType;
import com.gillianbc.wealthsim.model.Assumptions;
import com.gillianbc.wealthsim.model.Expense;
import com.gillianbc.wealthsim.model.IncomeKind;
import com.gillianbc.wealthsim.model.IncomeSource;
import com.gillianbc.wealthsim.model.Mortgage;
import com.gillianbc.wealthsim.model.Person;
import com.gillianbc.wealthsim.model.PolicyParams;
import com.gillianbc.wealthsim.model.Scenario;
import com.gillianbc.wealthsim.tax.TaxCalculator;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * A scenario resolved against one set of policy parameters: indexes, orderings and per-person
 * lookups computed once and shared read-only by every path.
 * <p>
 * Household-level incomes and assets (no owner) are attributed to the first adult for tax,
 * age gates and retirement checks.
 */
@Getter
public final class SimulationPlan {

    private final Scenario scenario;
    private final PolicyParams policy;
    private final Assumptions assumptions;
    private final TaxCalculator taxCalculator;
    private final int startYear;
    private final int yearCount;

    private final List<Person> people;
    private final List<Asset> assets;
    private final List<IncomeSource> salaries;
    private final List<IncomeSource> rentals;
    private final List<IncomeSource> gifts;
    private final List<Expense> expenses;
    private final Mortgage mortgage;

    private final int[] assetOwner;
    private final int[] withdrawalOrder;
    private final int[] contributionOrder;
    private final int[] pensionOfPerson;
    private final int primaryCashAsset;

    private final Map<String, Integer> personIndex;
    private final int firstAdult;

    private SimulationPlan(Scenario scenario, PolicyParams policy) {
        this.scenario = scenario;
        this.policy = policy;
        this.assumptions = scenario.getAssumptions();
        this.taxCalculator = new TaxCalculator(assumptions.getTaxBands());
        this.startYear = assumptions.getStartYear();
        this.yearCount = assumptions.yearCount();
        this.people = scenario.getPeople();
        this.assets = scenario.getAssets();
        this.expenses = scenario.getExpenses();
        this.mortgage = scenario.getMortgage();
        this.salaries = incomesOf(scenario, IncomeKind.SALARY);
        this.rentals = incomesOf(scenario, IncomeKind.RENTAL);
        this.gifts = incomesOf(scenario, IncomeKind.GIFT);

        this.personIndex = new HashMap<>();
        int adult = -1;
        for (int i = 0; i < people.size(); i++) {
            personIndex.put(people.get(i).getId(), i);
            if (adult < 0 && !people.get(i).isChild()) {
                adult = i;
            }
        }
        this.firstAdult = adult;

        this.assetOwner = new int[assets.size()];
        for (int i = 0; i < assets.size(); i++) {
            assetOwner[i] = ownerIndex(assets.get(i).getOwnerId());
        }

        int[] drawdownOrder = IntStream.range(0, assets.size()).boxed()
                .sorted(Comparator.<Integer>comparingInt(i -> assets.get(i).getWithdrawalPriority())
                        .thenComparing(i -> assets.get(i).getId()))
                .mapToInt(Integer::intValue)
                .toArray();

        this.withdrawalOrder = Arrays.stream(drawdownOrder)
                .filter(i -> assets.get(i).getType() != AssetType.CASH)
                .toArray();
        this.contributionOrder = IntStream.concat(
                        Arrays.stream(drawdownOrder).filter(i -> assets.get(i).getType() == AssetType.ISA),
                        Arrays.stream(drawdownOrder).filter(i -> assets.get(i).getType() == AssetType.GIA))
                .toArray();
        this.primaryCashAsset = Arrays.stream(drawdownOrder)
                .filter(i -> assets.get(i).getType() == AssetType.CASH)
                .findFirst()
                .orElse(-1);

        this.pensionOfPerson = new int[people.size()];
        Arrays.fill(pensionOfPerson, -1);
        for (int i : drawdownOrder) {
            if (assets.get(i).getType() == AssetType.PENSION && pensionOfPerson[assetOwner[i]] < 0) {
                pensionOfPerson[assetOwner[i]] = i;
            }
        }
    }

    /**
     * @param scenario a scenario that has passed validation
     */
    public static SimulationPlan of(Scenario scenario, PolicyParams policy) {
        Objects.requireNonNull(scenario, "scenario must not be null");
        Objects.requireNonNull(policy, "policy must not be null");
        return new SimulationPlan(scenario, policy);
    }

    private static List<IncomeSource> incomesOf(Scenario scenario, IncomeKind kind) {
        List<IncomeSource> out = new ArrayList<>();
        for (IncomeSource income : scenario.getIncomes()) {
            if (income.getKind() == kind) {
                out.add(income);
            }
        }
        return List.copyOf(out);
    }

    public int ownerIndex(String personId) {
        int household = Math.max(0, firstAdult);
        if (personId == null) {
            return household;
        }
        return personIndex.getOrDefault(personId, household);
    }

    public int yearAt(int yearIndex) {
        return startYear + yearIndex;
    }

    /** First pension asset (in withdrawal order) owned by the person, or -1. */
    public int pensionOf(int person) {
        return pensionOfPerson[person];
    }

    /** False for a household of children only, which then never counts as retired. */
    public boolean hasAdults() {
        return firstAdult >= 0;
    }

    /** Distinct retirement years of the adults, ascending. */
    public int[] retirementYears() {
        return people.stream()
                .filter(p -> !p.isChild())
                .mapToInt(p -> p.retirementYear(policy.getRetirementAgeOffset()))
                .sorted()
                .distinct()
                .toArray();
    }
}
