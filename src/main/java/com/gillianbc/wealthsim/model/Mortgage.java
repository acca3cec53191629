package com.gillianbc.wealthsim.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Mortgage {

    double balance;
    /** Annual rate as a fraction, charged monthly at a twelfth. */
    double annualInterestRate;
    double monthlyPayment;
}
