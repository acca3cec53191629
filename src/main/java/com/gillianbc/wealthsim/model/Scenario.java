package com.gillianbc.wealthsim.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A fully resolved household scenario, as handed over by scenario storage.
 */
@Value
@Builder(toBuilder = true)
public class Scenario {

    String id;
    String name;
    @Singular("person") List<Person> people;
    @Singular List<IncomeSource> incomes;
    @Singular List<Asset> assets;
    /** At most one; null when the household has none. */
    Mortgage mortgage;
    @Singular List<Expense> expenses;
    @NonNull Assumptions assumptions;
}
