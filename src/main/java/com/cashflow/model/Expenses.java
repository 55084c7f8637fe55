package com.cashflow.model;

import lombok.Builder;
import lombok.Value;

/**
 * Fixed monthly expense lines of a financial statement.
 * The bank loan payment is derived from the loan amount and is not stored here.
 */
@Value
@Builder(toBuilder = true)
public class Expenses {
    int taxes;
    int homeMortgagePayment;
    int schoolLoanPayment;
    int carLoanPayment;
    int creditCardPayment;
    int otherExpenses;
    int perChildExpense;
    int childCount;

    /**
     * Returns a copy with the expense line backing the given liability set to zero.
     */
    public Expenses withoutLiability(String liabilityName) {
        switch (liabilityName) {
            case Liability.HOME_MORTGAGE:
                return toBuilder().homeMortgagePayment(0).build();
            case Liability.SCHOOL_LOAN:
                return toBuilder().schoolLoanPayment(0).build();
            case Liability.CAR_LOAN:
                return toBuilder().carLoanPayment(0).build();
            case Liability.CREDIT_CARD:
                return toBuilder().creditCardPayment(0).build();
            default:
                return this;
        }
    }
}
