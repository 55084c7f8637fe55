package com.cashflow.model;

/**
 * A named debt with its outstanding balance and monthly payment.
 */
public record Liability(String name, int balance, int payment) {

    public static final String HOME_MORTGAGE = "Home Mortgage";
    public static final String SCHOOL_LOAN = "School Loan";
    public static final String CAR_LOAN = "Car Loan";
    public static final String CREDIT_CARD = "Credit Card";

    /** Not stored as a liability; tracked as {@code Player.bankLoanAmount}. */
    public static final String BANK_LOAN = "Bank Loan";

    public Liability withBalance(int newBalance) {
        return new Liability(name, newBalance, payment);
    }
}
