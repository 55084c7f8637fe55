package com.cashflow.engine;

import com.cashflow.model.Expenses;
import com.cashflow.model.FinancialStatement;
import com.cashflow.model.Liability;
import com.cashflow.model.Player;
import com.cashflow.model.asset.Asset;
import com.cashflow.model.asset.PropertyAsset;
import com.cashflow.model.asset.StockAsset;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Balance-sheet arithmetic. All methods are pure and return new {@link Player} instances.
 */
public final class FinancialCalculator {

    public static final int LOAN_INCREMENT = 1000;
    public static final int MAX_CHILDREN = 3;

    private static final Set<String> HALVED_IN_BANKRUPTCY = Set.of(Liability.CAR_LOAN, Liability.CREDIT_CARD);

    private FinancialCalculator() {
    }

    // ── derived figures ─────────────────────────────────────────────────

    public static int passiveIncome(FinancialStatement statement) {
        double dividends = 0;
        int passive = 0;
        for (Asset asset : statement.getAssets()) {
            if (asset instanceof StockAsset stock) {
                dividends += stock.shares() * stock.dividendPerShare();
            } else if (asset instanceof PropertyAsset property) {
                passive += property.cashFlow();
            }
        }
        // dividends are rounded once over all holdings
        return passive + (int) Math.floor(dividends);
    }

    public static int totalIncome(FinancialStatement statement) {
        return statement.getSalary() + passiveIncome(statement);
    }

    /**
     * Monthly interest on the bank loan: 10% a year, rounded up.
     */
    public static int bankLoanPayment(int loanAmount) {
        return (int) Math.ceil(loanAmount / 120.0);
    }

    public static int totalExpenses(Player player) {
        Expenses e = player.getFinancialStatement().getExpenses();
        return e.getTaxes()
                + e.getHomeMortgagePayment()
                + e.getSchoolLoanPayment()
                + e.getCarLoanPayment()
                + e.getCreditCardPayment()
                + e.getOtherExpenses()
                + e.getPerChildExpense() * e.getChildCount()
                + bankLoanPayment(player.getBankLoanAmount());
    }

    public static int cashFlow(Player player) {
        return totalIncome(player.getFinancialStatement()) - totalExpenses(player);
    }

    public static boolean canEscape(Player player) {
        return passiveIncome(player.getFinancialStatement()) > totalExpenses(player);
    }

    /**
     * Largest multiple of $1,000 that can be borrowed while keeping monthly cash flow above zero.
     */
    public static int maxBankLoan(Player player) {
        int cashFlow = cashFlow(player);
        if (cashFlow <= 0) {
            return 0;
        }
        int loan = player.getBankLoanAmount();
        int increments = (int) ((cashFlow - 1) * 12L / 100);
        while (increments > 0 && projectedCashFlow(cashFlow, loan, increments) <= 0) {
            increments--;
        }
        while (projectedCashFlow(cashFlow, loan, increments + 1) > 0) {
            increments++;
        }
        return increments * LOAN_INCREMENT;
    }

    private static int projectedCashFlow(int cashFlow, int loan, int increments) {
        int extra = bankLoanPayment(loan + increments * LOAN_INCREMENT) - bankLoanPayment(loan);
        return cashFlow - extra;
    }

    // ── balance sheet changes ───────────────────────────────────────────

    public static Player processPayDay(Player player) {
        return player.withCash(player.getCash() + cashFlow(player));
    }

    public static Player addChild(Player player) {
        Expenses expenses = player.getFinancialStatement().getExpenses();
        if (expenses.getChildCount() >= MAX_CHILDREN) {
            return player;
        }
        Expenses updated = expenses.toBuilder().childCount(expenses.getChildCount() + 1).build();
        return player.withFinancialStatement(player.getFinancialStatement().withExpenses(updated));
    }

    public static Player takeBankLoan(Player player, int amount) {
        return player.toBuilder()
                .cash(player.getCash() + amount)
                .bankLoanAmount(player.getBankLoanAmount() + amount)
                .build();
    }

    public static Player payOffBankLoan(Player player, int amount) {
        return player.toBuilder()
                .cash(player.getCash() - amount)
                .bankLoanAmount(player.getBankLoanAmount() - amount)
                .build();
    }

    /**
     * Pays toward a named liability. Only the outstanding balance is charged; a liability paid in
     * full is removed and its expense line zeroed.
     *
     * @throws IllegalArgumentException if the player has no such liability
     */
    public static Player payOffLiability(Player player, String liabilityName, int amount) {
        FinancialStatement statement = player.getFinancialStatement();
        Liability liability = statement.findLiability(liabilityName)
                .orElseThrow(() -> new IllegalArgumentException("No liability named " + liabilityName));

        int charged = Math.min(amount, liability.balance());
        int remaining = liability.balance() - charged;
        List<Liability> liabilities = new ArrayList<>();
        for (Liability l : statement.getLiabilities()) {
            if (!l.name().equals(liabilityName)) {
                liabilities.add(l);
            } else if (remaining > 0) {
                liabilities.add(l.withBalance(remaining));
            }
        }

        FinancialStatement updated = statement.withLiabilities(liabilities);
        if (remaining <= 0) {
            updated = updated.withExpenses(updated.getExpenses().withoutLiability(liabilityName));
        }
        return player.toBuilder()
                .cash(player.getCash() - charged)
                .financialStatement(updated)
                .build();
    }

    /**
     * Borrows enough whole thousands to bring negative cash back to zero or above.
     */
    public static LoanResult forcedLoan(Player player) {
        if (player.getCash() >= 0) {
            return new LoanResult(player, 0);
        }
        int amount = (int) Math.ceil(Math.abs(player.getCash()) / (double) LOAN_INCREMENT) * LOAN_INCREMENT;
        return new LoanResult(takeBankLoan(player, amount), amount);
    }

    /**
     * Liquidates the player:
     * property sells for half its down payment, stocks are lost, car loan and credit card are halved.
     * The player is eliminated when cash flow is still negative afterwards, otherwise skips two turns.
     */
    public static BankruptcyResult declareBankruptcy(Player player) {
        FinancialStatement statement = player.getFinancialStatement();

        int proceeds = 0;
        for (Asset asset : statement.getAssets()) {
            if (asset instanceof PropertyAsset property) {
                proceeds += property.downPayment() / 2;
            }
        }

        Expenses expenses = statement.getExpenses().toBuilder()
                .carLoanPayment(statement.getExpenses().getCarLoanPayment() / 2)
                .creditCardPayment(statement.getExpenses().getCreditCardPayment() / 2)
                .build();

        List<Liability> liabilities = new ArrayList<>();
        for (Liability l : statement.getLiabilities()) {
            Liability kept = HALVED_IN_BANKRUPTCY.contains(l.name())
                    ? new Liability(l.name(), l.balance() / 2, l.payment() / 2)
                    : l;
            if (kept.balance() > 0) {
                liabilities.add(kept);
            } else {
                expenses = expenses.withoutLiability(l.name());
            }
        }

        FinancialStatement liquidated = statement.withAssets(List.of())
                .withLiabilities(liabilities)
                .withExpenses(expenses);
        Player after = player.toBuilder()
                .cash(player.getCash() + proceeds)
                .financialStatement(liquidated)
                .build();

        if (cashFlow(after) < 0) {
            return new BankruptcyResult(after.toBuilder().bankrupt(true).build(), true);
        }
        return new BankruptcyResult(after.toBuilder().bankruptTurnsLeft(2).build(), false);
    }

    public record LoanResult(Player player, int amountBorrowed) {
    }

    public record BankruptcyResult(Player player, boolean eliminated) {
    }
}
