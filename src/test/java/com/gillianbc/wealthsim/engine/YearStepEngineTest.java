package com.gillianbc.wealthsim.engine;

import com.gillianbc.wealthsim.TestScenarios;
import com.gillianbc.wealthsim.exception.NumericException;
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
import com.gillianbc.wealthsim.model.YearRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class YearStepEngineTest {

    private static final double EPS = 1e-6;

    private final YearStepEngine engine = new YearStepEngine();

    /** All draws zero: balances only move through flows. */
    private static DrawTable flatDraws(SimulationPlan plan) {
        return new DrawTable(1, plan.getYearCount(), plan.getAssets().stream().map(Asset::getId).toList(),
                new double[plan.getYearCount() * plan.getAssets().size()]);
    }

    private static Scenario.ScenarioBuilder retiredHousehold() {
        return TestScenarios.baseScenario()
                .clearPeople()
                .person(TestScenarios.person("alex", 1980, 40));
    }

    private static Person child(String id, int birthYear, double annualCost) {
        return Person.builder()
                .id(id)
                .birthDate(LocalDate.of(birthYear, 3, 1))
                .plannedRetirementAge(65)
                .child(true)
                .annualCost(annualCost)
                .build();
    }

    /** Steps one path from the first year through {@code years} years on flat draws. */
    private List<YearRecord> run(SimulationPlan plan, int years) {
        HouseholdState state = HouseholdState.initial(plan);
        DrawTable draws = flatDraws(plan);
        return IntStream.range(0, years)
                .mapToObj(y -> engine.step(plan, state, draws, 0, y))
                .toList();
    }

    private static Asset isa(String id, int priority, double balance) {
        return Asset.builder().id(id).type(AssetType.ISA).balance(balance).withdrawalPriority(priority).build();
    }

    @Test
    @DisplayName("Lower withdrawal priority is drawn first")
    void withdrawals_lowerPriorityFirst() {
        Scenario scenario = retiredHousehold()
                .asset(isa("isa-second", 2, 50_000.00))
                .asset(isa("isa-first", 1, 50_000.00))
                .build();
        SimulationPlan plan = SimulationPlan.of(scenario, PolicyParams.builder().annualSpendTarget(10_000.00).build());
        HouseholdState state = HouseholdState.initial(plan);

        engine.step(plan, state, flatDraws(plan), 0, 0);

        assertEquals(40_000.00, state.balanceOf("isa-first"), EPS);
        assertEquals(50_000.00, state.balanceOf("isa-second"), EPS);
    }

    @Test
    @DisplayName("Equal priorities fall back to asset id order")
    void withdrawals_tieBrokenById() {
        Scenario scenario = retiredHousehold()
                .asset(isa("isa-b", 1, 50_000.00))
                .asset(isa("isa-a", 1, 50_000.00))
                .build();
        SimulationPlan plan = SimulationPlan.of(scenario, PolicyParams.builder().annualSpendTarget(10_000.00).build());
        HouseholdState state = HouseholdState.initial(plan);

        engine.step(plan, state, flatDraws(plan), 0, 0);

        assertEquals(40_000.00, state.balanceOf("isa-a"), EPS);
        assertEquals(50_000.00, state.balanceOf("isa-b"), EPS);
    }

    @Test
    @DisplayName("GIA withdrawals pay CGT and release cost basis")
    void withdrawals_giaPaysCgt() {
        Scenario scenario = retiredHousehold()
                .asset(Asset.builder().id("gia").type(AssetType.GIA).balance(100_000.00).costBasis(50_000.00).build())
                .build();
        SimulationPlan plan = SimulationPlan.of(scenario, PolicyParams.builder().annualSpendTarget(20_000.00).build());
        HouseholdState state = HouseholdState.initial(plan);

        YearRecord r = engine.step(plan, state, flatDraws(plan), 0, 0);

        double expectedGross = (20_000.00 - 300.00) / 0.95;
        assertEquals(expectedGross, r.getGiaWithdrawalGross(), EPS);
        assertEquals(20_000.00, r.getGiaWithdrawalNet(), EPS);
        assertEquals(r.getGiaWithdrawalGross() - r.getGiaWithdrawalNet(), r.getCapitalGainsTax(), EPS);
        assertEquals(50_000.00 - expectedGross / 2.0, state.getCostBasis()[0], EPS);
        assertEquals(0.0, r.getCashBalance(), EPS);
    }

    @Test
    @DisplayName("Spend target is added to expenses once everyone has retired")
    void spendTarget_addsToExpensesWhenAllRetired() {
        Scenario scenario = retiredHousehold()
                .expense(Expense.builder().name("bills").monthlyAmount(1_000.00).build())
                .asset(Asset.builder().id("cash").type(AssetType.CASH).balance(100_000.00).build())
                .build();
        SimulationPlan plan = SimulationPlan.of(scenario, PolicyParams.builder().annualSpendTarget(30_000.00).build());

        YearRecord r = engine.step(plan, HouseholdState.initial(plan), flatDraws(plan), 0, 0);

        assertEquals(12_000.00, r.getExpenses(), EPS);
        assertEquals(30_000.00, r.getDiscretionarySpend(), EPS);
        assertEquals(100_000.00 - 42_000.00, r.getCashBalance(), EPS);
    }

    @Test
    @DisplayName("No discretionary spend while anyone is still working")
    void spendTarget_waitsForEveryone() {
        Scenario scenario = retiredHousehold()
                .person(TestScenarios.person("sam", 1985, 67))
                .asset(Asset.builder().id("cash").type(AssetType.CASH).balance(100_000.00).build())
                .build();
        SimulationPlan plan = SimulationPlan.of(scenario, PolicyParams.builder().annualSpendTarget(30_000.00).build());

        YearRecord r = engine.step(plan, HouseholdState.initial(plan), flatDraws(plan), 0, 0);

        assertEquals(0.0, r.getDiscretionarySpend(), EPS);
        assertEquals(100_000.00, r.getCashBalance(), EPS);
    }

    @Test
    @DisplayName("Cash above the emergency fund is invested; the fund itself stays in cash")
    void surplus_keepsEmergencyFund() {
        Scenario scenario = retiredHousehold()
                .expense(Expense.builder().name("bills").monthlyAmount(2_000.00).build())
                .asset(Asset.builder().id("cash").type(AssetType.CASH).balance(50_000.00).build())
                .asset(isa("isa", 1, 0.0))
                .build();
        SimulationPlan plan = SimulationPlan.of(scenario, PolicyParams.builder().build());
        HouseholdState state = HouseholdState.initial(plan);

        YearRecord r = engine.step(plan, state, flatDraws(plan), 0, 0);

        // outflow 24,000 leaves 26,000; six months of outflow (12,000) stays as cash
        assertEquals(14_000.00, r.getIsaContributions(), EPS);
        assertEquals(12_000.00, r.getCashBalance(), EPS);
    }

    @Test
    @DisplayName("ISA contributions share one annual limit; the rest goes to GIA and raises its basis")
    void surplus_isaLimitThenGia() {
        Scenario scenario = retiredHousehold()
                .asset(Asset.builder().id("cash").type(AssetType.CASH).balance(50_000.00).build())
                .asset(isa("isa-1", 1, 0.0))
                .asset(isa("isa-2", 2, 0.0))
                .asset(Asset.builder().id("gia").type(AssetType.GIA).balance(10_000.00).withdrawalPriority(3).build())
                .build();
        SimulationPlan plan = SimulationPlan.of(scenario, PolicyParams.builder().build());
        HouseholdState state = HouseholdState.initial(plan);

        YearRecord r = engine.step(plan, state, flatDraws(plan), 0, 0);

        assertEquals(20_000.00, state.balanceOf("isa-1"), EPS);
        assertEquals(0.0, state.balanceOf("isa-2"), EPS);
        assertEquals(40_000.00, state.balanceOf("gia"), EPS);
        assertEquals(40_000.00, state.getCostBasis()[3], EPS);
        assertEquals(30_000.00, r.getGiaContributions(), EPS);
        assertEquals(0.0, r.getCashBalance(), EPS);
    }

    @Test
    @DisplayName("Assets flagged to stop at retirement receive nothing after it")
    void surplus_stopsAtRetirement() {
        Scenario scenario = retiredHousehold()
                .asset(Asset.builder().id("cash").type(AssetType.CASH).balance(5_000.00).build())
                .asset(Asset.builder().id("isa").type(AssetType.ISA).balance(0.0)
                        .contributionsStopAtRetirement(true).ownerId("alex").build())
                .build();
        SimulationPlan plan = SimulationPlan.of(scenario, PolicyParams.builder().build());
        HouseholdState state = HouseholdState.initial(plan);

        YearRecord r = engine.step(plan, state, flatDraws(plan), 0, 0);

        assertEquals(0.0, r.getIsaContributions(), EPS);
        assertEquals(5_000.00, r.getCashBalance(), EPS);
    }

    @Test
    @DisplayName("State pension from state pension age, indexed with inflation")
    void statePension_indexed() {
        Scenario scenario = TestScenarios.baseScenario()
                .clearPeople()
                .person(TestScenarios.person("pat", 1958, 60))
                .build();
        SimulationPlan plan = SimulationPlan.of(scenario, PolicyParams.builder().build());
        HouseholdState state = HouseholdState.initial(plan);
        DrawTable draws = flatDraws(plan);

        YearRecord first = engine.step(plan, state, draws, 0, 0);
        YearRecord second = engine.step(plan, state, draws, 0, 1);

        assertEquals(11_502.40, first.getStatePensionGross(), EPS);
        assertEquals(11_502.40, first.getStatePensionNet(), EPS);
        assertEquals(11_502.40 * 1.02, second.getStatePensionGross(), EPS);
        assertEquals(0.0, first.getNationalInsurance(), EPS);
    }

    @Test
    @DisplayName("Rental income pays income tax only, gifts are untaxed")
    void rentalAndGift() {
        Scenario scenario = retiredHousehold()
                .income(IncomeSource.builder().id("flat").kind(IncomeKind.RENTAL).ownerId("alex")
                        .grossAnnual(20_000.00).build())
                .income(IncomeSource.builder().id("gran").kind(IncomeKind.GIFT).grossAnnual(3_000.00)
                        .endYear(2025).build())
                .build();
        SimulationPlan plan = SimulationPlan.of(scenario, PolicyParams.builder().build());
        HouseholdState state = HouseholdState.initial(plan);
        DrawTable draws = flatDraws(plan);

        YearRecord first = engine.step(plan, state, draws, 0, 0);
        YearRecord second = engine.step(plan, state, draws, 0, 1);

        assertEquals(20_000.00 - (20_000.00 - 12_570.00) * 0.20, first.getRentalNet(), EPS);
        assertEquals(0.0, first.getNationalInsurance(), EPS);
        assertEquals(3_000.00, first.getGiftIncome(), EPS);
        assertEquals(0.0, second.getGiftIncome(), EPS);
    }

    @Test
    @DisplayName("Mortgage amortises monthly and reports paid off once cleared")
    void mortgage_amortisesMonthly() {
        Scenario scenario = retiredHousehold()
                .mortgage(Mortgage.builder().balance(1_000.00).annualInterestRate(0.0).monthlyPayment(100.00).build())
                .asset(Asset.builder().id("cash").type(AssetType.CASH).balance(50_000.00).build())
                .build();
        SimulationPlan plan = SimulationPlan.of(scenario, PolicyParams.builder().build());

        YearRecord r = engine.step(plan, HouseholdState.initial(plan), flatDraws(plan), 0, 0);

        assertEquals(1_000.00, r.getMortgagePayment(), EPS);
        assertEquals(0.0, r.getMortgageBalance(), EPS);
        assertTrue(r.isMortgagePaidOff());
    }

    @Test
    @DisplayName("Mortgage interest is charged at a twelfth of the annual rate")
    void stepMortgage_interest() {
        Mortgage mortgage = Mortgage.builder().balance(100_000.00).annualInterestRate(0.06).monthlyPayment(600.00).build();

        YearStepEngine.MortgageYear year = YearStepEngine.stepMortgage(mortgage, 100_000.00);

        assertEquals(7_200.00, year.payment(), EPS);
        // about 500 a month, falling as principal is repaid
        assertEquals(500.00, year.interest() / 12.0, 5.0);
        assertEquals(100_000.00 + year.interest() - 7_200.00, year.closingBalance(), EPS);
        assertFalse(year.closingBalance() <= 0.0);
    }

    @Test
    @DisplayName("A return below -100% empties the asset instead of going negative")
    void growth_flooredAtZero() {
        Scenario scenario = retiredHousehold().asset(isa("isa", 1, 10_000.00)).build();
        SimulationPlan plan = SimulationPlan.of(scenario, PolicyParams.builder().build());
        double[] values = new double[plan.getYearCount()];
        Arrays.fill(values, -1.5);
        DrawTable draws = new DrawTable(1, plan.getYearCount(), List.of("isa"), values);

        YearRecord r = engine.step(plan, HouseholdState.initial(plan), draws, 0, 0);

        assertEquals(0.0, r.getIsaBalance(), EPS);
        assertEquals(-10_000.00, r.getInvestmentReturns(), EPS);
    }

    @Test
    @DisplayName("A NaN draw is a numeric error naming path and year")
    void nanDraw_throws() {
        Scenario scenario = retiredHousehold().asset(isa("isa", 1, 10_000.00)).build();
        SimulationPlan plan = SimulationPlan.of(scenario, PolicyParams.builder().build());
        double[] values = new double[plan.getYearCount()];
        values[0] = Double.NaN;
        DrawTable draws = new DrawTable(1, plan.getYearCount(), List.of("isa"), values);

        NumericException e = assertThrows(NumericException.class, () ->
                engine.step(plan, HouseholdState.initial(plan), draws, 0, 0));
        assertEquals(0, e.getPath());
        assertEquals(2025, e.getYear());
    }

    @Test
    @DisplayName("Inflation-linked expenses compound from the start year; unlinked ones stay flat")
    void expenses_inflationLinkedCompounds() {
        Scenario scenario = retiredHousehold()
                .expense(Expense.builder().name("food").monthlyAmount(1_000.00).build())
                .expense(Expense.builder().name("phone contract").monthlyAmount(50.00).inflationLinked(false).build())
                .asset(Asset.builder().id("cash").type(AssetType.CASH).balance(200_000.00).build())
                .build();
        SimulationPlan plan = SimulationPlan.of(scenario, PolicyParams.builder().build());

        List<YearRecord> years = run(plan, 4);

        assertEquals(12_000.00 + 600.00, years.get(0).getExpenses(), EPS);
        assertEquals(12_000.00 * 1.02 + 600.00, years.get(1).getExpenses(), EPS);
        assertEquals(12_000.00 * Math.pow(1.02, 3) + 600.00, years.get(3).getExpenses(), EPS);
    }

    @Test
    @DisplayName("Expenses are paid only from their start year to their end year, inclusive")
    void expenses_startAndEndYears() {
        Scenario scenario = retiredHousehold()
                .expense(Expense.builder().name("school fees").monthlyAmount(1_000.00)
                        .startYear(2027).endYear(2028).build())
                .asset(Asset.builder().id("cash").type(AssetType.CASH).balance(200_000.00).build())
                .build();
        SimulationPlan plan = SimulationPlan.of(scenario, PolicyParams.builder().build());

        List<YearRecord> years = run(plan, 5);

        assertEquals(0.0, years.get(0).getExpenses(), EPS);
        assertEquals(0.0, years.get(1).getExpenses(), EPS);
        assertEquals(12_000.00 * Math.pow(1.02, 2), years.get(2).getExpenses(), EPS);
        assertEquals(12_000.00 * Math.pow(1.02, 3), years.get(3).getExpenses(), EPS);
        assertEquals(0.0, years.get(4).getExpenses(), EPS);
    }

    @Test
    @DisplayName("Incomes grow at their annual growth rate from the start year")
    void income_growthCompounds() {
        Scenario scenario = TestScenarios.baseScenario()
                .income(IncomeSource.builder().id("salary").kind(IncomeKind.SALARY).ownerId("alex")
                        .grossAnnual(30_000.00).annualGrowthRate(0.03).build())
                .income(IncomeSource.builder().id("gran").kind(IncomeKind.GIFT).grossAnnual(2_000.00)
                        .annualGrowthRate(0.05).build())
                .build();
        SimulationPlan plan = SimulationPlan.of(scenario, PolicyParams.builder().build());

        List<YearRecord> years = run(plan, 4);

        assertEquals(30_000.00, years.get(0).getSalaryGross(), EPS);
        assertEquals(30_000.00 * Math.pow(1.03, 3), years.get(3).getSalaryGross(), EPS);
        assertEquals(2_000.00 * Math.pow(1.05, 2), years.get(2).getGiftIncome(), EPS);
    }

    @Test
    @DisplayName("A salary that starts in a later year pays nothing before then")
    void income_futureStartYear() {
        Scenario scenario = TestScenarios.baseScenario()
                .income(IncomeSource.builder().id("new-job").kind(IncomeKind.SALARY).ownerId("alex")
                        .grossAnnual(40_000.00).startYear(2027).build())
                .build();
        SimulationPlan plan = SimulationPlan.of(scenario, PolicyParams.builder().build());

        List<YearRecord> years = run(plan, 4);

        assertEquals(0.0, years.get(0).getSalaryGross(), EPS);
        assertEquals(0.0, years.get(1).getSalaryNet(), EPS);
        assertEquals(0.0, years.get(1).getNationalInsurance(), EPS);
        assertEquals(40_000.00, years.get(2).getSalaryGross(), EPS);
        assertEquals(40_000.00, years.get(3).getSalaryGross(), EPS);
    }

    @Test
    @DisplayName("Returns are reported per asset type and sum to the investment returns")
    void growth_reportedPerAssetType() {
        Scenario scenario = retiredHousehold()
                .assumptions(Assumptions.builder().startYear(2025).endYear(2034).emergencyFundMonths(1_200.0).build())
                .expense(Expense.builder().name("bills").monthlyAmount(100.00).build())
                .asset(Asset.builder().id("cash").type(AssetType.CASH).balance(100_000.00).build())
                .asset(isa("isa", 1, 10_000.00))
                .asset(Asset.builder().id("gia").type(AssetType.GIA).balance(20_000.00).withdrawalPriority(2).build())
                .asset(Asset.builder().id("pension").type(AssetType.PENSION).balance(30_000.00)
                        .withdrawalPriority(3).ownerId("alex").build())
                .build();
        SimulationPlan plan = SimulationPlan.of(scenario, PolicyParams.builder().build());
        double[] values = new double[plan.getYearCount() * 4];
        for (int y = 0; y < plan.getYearCount(); y++) {
            values[y * 4] = 0.05;
            values[y * 4 + 1] = 0.10;
            values[y * 4 + 2] = 0.20;
            values[y * 4 + 3] = 0.30;
        }
        DrawTable draws = new DrawTable(1, plan.getYearCount(), List.of("cash", "isa", "gia", "pension"), values);

        YearRecord r = engine.step(plan, HouseholdState.initial(plan), draws, 0, 0);

        assertEquals(0.0, r.getIsaContributions() + r.getGiaContributions(), EPS);
        assertEquals(1_000.00, r.getIsaReturns(), EPS);
        assertEquals(4_000.00, r.getGiaReturns(), EPS);
        assertEquals(9_000.00, r.getPensionReturns(), EPS);
        assertEquals((100_000.00 - 1_200.00) * 0.05, r.getCashInterest(), EPS);
        assertEquals(1_000.00 + 4_000.00 + 9_000.00 + 4_940.00, r.getInvestmentReturns(), EPS);
    }

    @Test
    @DisplayName("A dependent child costs the household an inflation-indexed amount until leaving home")
    void child_costIndexedUntilLeavingAge() {
        Scenario scenario = retiredHousehold()
                .person(child("kim", 2010, 5_000.00))
                .asset(Asset.builder().id("cash").type(AssetType.CASH).balance(100_000.00).build())
                .build();
        SimulationPlan plan = SimulationPlan.of(scenario, PolicyParams.builder().build());

        List<YearRecord> years = run(plan, 4);

        // kim is 15, 16, 17, then 18 and gone
        assertEquals(5_000.00, years.get(0).getChildCosts(), EPS);
        assertEquals(5_000.00, years.get(0).getExpenses(), EPS);
        assertEquals(5_000.00 * Math.pow(1.02, 2), years.get(2).getChildCosts(), EPS);
        assertEquals(0.0, years.get(3).getChildCosts(), EPS);
        assertEquals(0.0, years.get(3).getExpenses(), EPS);
        assertEquals(100_000.00 - 5_000.00, years.get(0).getCashBalance(), EPS);
    }

    @Test
    @DisplayName("Children never block the spend target and never draw a state pension")
    void child_ignoredByRetirementChecks() {
        Scenario scenario = TestScenarios.baseScenario()
                .clearPeople()
                .person(child("kim", 1955, 0.0))
                .person(TestScenarios.person("alex", 1980, 40))
                .income(IncomeSource.builder().id("flat").kind(IncomeKind.RENTAL).grossAnnual(12_000.00).build())
                .asset(Asset.builder().id("cash").type(AssetType.CASH).balance(100_000.00).build())
                .build();
        SimulationPlan plan = SimulationPlan.of(scenario, PolicyParams.builder().annualSpendTarget(10_000.00).build());

        YearRecord r = engine.step(plan, HouseholdState.initial(plan), flatDraws(plan), 0, 0);

        assertEquals(10_000.00, r.getDiscretionarySpend(), EPS);
        assertEquals(0.0, r.getStatePensionGross(), EPS);
        assertEquals(0.0, r.getChildCosts(), EPS);
        assertEquals(1, plan.ownerIndex(null));
        assertEquals(List.of(2020), Arrays.stream(plan.retirementYears()).boxed().toList());
    }

    @Test
    @DisplayName("A household of children only is never treated as retired")
    void child_onlyHouseholdNeverRetired() {
        Scenario scenario = TestScenarios.baseScenario()
                .clearPeople()
                .person(child("kim", 2010, 0.0))
                .asset(Asset.builder().id("cash").type(AssetType.CASH).balance(100_000.00).build())
                .build();
        SimulationPlan plan = SimulationPlan.of(scenario, PolicyParams.builder().annualSpendTarget(10_000.00).build());

        YearRecord r = engine.step(plan, HouseholdState.initial(plan), flatDraws(plan), 0, 0);

        assertFalse(plan.hasAdults());
        assertEquals(0.0, r.getDiscretionarySpend(), EPS);
        assertEquals(0, plan.retirementYears().length);
    }
}
