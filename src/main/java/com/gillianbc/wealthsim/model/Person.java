package com.gillianbc.wealthsim.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.LocalDate;

/**
 * A member of the household. Ages are whole years: {@code year - birthYear}.
 * <p>
 * A child never retires, draws no state pension and is ignored by the "everyone retired" check.
 * Until {@code leavesHouseholdAge} the household pays {@code annualCost} a year for them,
 * indexed with inflation from the start year.
 */
@Value
@Builder
public class Person {

    public static final int DEFAULT_STATE_PENSION_AGE = 67;
    public static final int DEFAULT_LEAVES_HOUSEHOLD_AGE = 18;

    @NonNull String id;
    String label;
    @NonNull LocalDate birthDate;
    int plannedRetirementAge;
    @Builder.Default int statePensionAge = DEFAULT_STATE_PENSION_AGE;
    boolean child;
    /** Annual cost in start-year money; only used for children. */
    double annualCost;
    @Builder.Default int leavesHouseholdAge = DEFAULT_LEAVES_HOUSEHOLD_AGE;

    public int ageIn(int year) {
        return year - birthDate.getYear();
    }

    /**
     * @param retirementAgeOffset policy shift applied to the planned age; the result never drops below 0
     */
    public int retirementAge(int retirementAgeOffset) {
        return Math.max(0, plannedRetirementAge + retirementAgeOffset);
    }

    public int retirementYear(int retirementAgeOffset) {
        return birthDate.getYear() + retirementAge(retirementAgeOffset);
    }

    public boolean isRetiredIn(int year, int retirementAgeOffset) {
        return ageIn(year) >= retirementAge(retirementAgeOffset);
    }

    public boolean receivesStatePensionIn(int year) {
        return ageIn(year) >= statePensionAge;
    }

    /** True for a child who still lives in the household in {@code year}. */
    public boolean isDependantIn(int year) {
        return child && ageIn(year) < leavesHouseholdAge;
    }
}
