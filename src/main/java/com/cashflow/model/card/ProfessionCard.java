package com.cashflow.model.card;

/**
 * The starting balance sheet dealt to a player.
 */
public record ProfessionCard(
        String title,
        int salary,
        int taxes,
        int homeMortgagePayment,
        int homeMortgageBalance,
        int schoolLoanPayment,
        int schoolLoanBalance,
        int carLoanPayment,
        int carLoanBalance,
        int creditCardPayment,
        int creditCardBalance,
        int otherExpenses,
        int perChildExpense,
        int savings
) {
}
