package com.cashflow.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.cashflow.model.Liability;
import com.cashflow.model.Player;
import com.cashflow.model.asset.Asset;
import com.cashflow.model.asset.BusinessAsset;
import com.cashflow.model.asset.RealEstateAsset;
import com.cashflow.model.asset.RealEstateType;
import com.cashflow.model.asset.StockAsset;

class FinancialCalculatorTest {

    private Player engineer;

    @BeforeEach
    void setUp() {
        engineer = TestGames.engineer("p1", "Alice");
    }

    private static Player withAsset(Player player, Asset asset) {
        return player.withFinancialStatement(player.getFinancialStatement().withAsset(asset));
    }

    @Nested
    @DisplayName("derived figures")
    class DerivedFigures {

        @Test
        @DisplayName("should derive expenses and cash flow from the profession")
        void shouldDeriveFromProfession() {
            assertEquals(3160, FinancialCalculator.totalExpenses(engineer));
            assertEquals(4900, FinancialCalculator.totalIncome(engineer.getFinancialStatement()));
            assertEquals(1740, FinancialCalculator.cashFlow(engineer));
            assertEquals(0, FinancialCalculator.passiveIncome(engineer.getFinancialStatement()));
        }

        @Test
        @DisplayName("should sum floored dividends and property cash flow into passive income")
        void shouldSumPassiveIncome() {
            Player player = withAsset(engineer, new StockAsset("a1", "Div Co", "DIV", 101, 10, 0.5));
            player = withAsset(player, new RealEstateAsset("a2", "House", RealEstateType.HOUSE, 50000, 47000, 3000, 200));

            assertEquals(250, FinancialCalculator.passiveIncome(player.getFinancialStatement()));
            assertEquals(1990, FinancialCalculator.cashFlow(player));
        }

        @Test
        @DisplayName("should round dividends once across all holdings")
        void shouldRoundDividendsOnce() {
            Player player = withAsset(engineer, new StockAsset("a1", "Split Co", "SPL", 3, 5, 0.5));
            player = withAsset(player, new StockAsset("a2", "Split Co", "SPL", 3, 5, 0.5));

            assertEquals(3, FinancialCalculator.passiveIncome(player.getFinancialStatement()));
        }

        @Test
        @DisplayName("should round the bank loan payment up")
        void shouldRoundLoanPaymentUp() {
            assertEquals(0, FinancialCalculator.bankLoanPayment(0));
            assertEquals(9, FinancialCalculator.bankLoanPayment(1000));
            assertEquals(100, FinancialCalculator.bankLoanPayment(12000));
        }

        @Test
        @DisplayName("should include the bank loan payment and children in expenses")
        void shouldIncludeLoanAndChildren() {
            Player player = FinancialCalculator.addChild(engineer).toBuilder().bankLoanAmount(12000).build();

            assertEquals(3160 + 250 + 100, FinancialCalculator.totalExpenses(player));
        }

        @Test
        @DisplayName("should allow escape only when passive income exceeds expenses")
        void shouldDecideEscape() {
            assertFalse(FinancialCalculator.canEscape(engineer));

            Player rich = withAsset(engineer, new BusinessAsset("a1", "Car Wash", 100000, 60000, 40000, 3160));
            assertFalse(FinancialCalculator.canEscape(rich));

            Player richer = withAsset(engineer, new BusinessAsset("a1", "Car Wash", 100000, 60000, 40000, 3161));
            assertTrue(FinancialCalculator.canEscape(richer));
        }
    }

    @Nested
    @DisplayName("maxBankLoan()")
    class MaxBankLoan {

        @Test
        @DisplayName("should keep projected cash flow above zero")
        void shouldKeepCashFlowPositive() {
            int max = FinancialCalculator.maxBankLoan(engineer);

            assertEquals(208000, max);
            Player borrowed = FinancialCalculator.takeBankLoan(engineer, max);
            assertTrue(FinancialCalculator.cashFlow(borrowed) > 0);
            Player tooMuch = FinancialCalculator.takeBankLoan(engineer, max + 1000);
            assertTrue(FinancialCalculator.cashFlow(tooMuch) <= 0);
        }

        @Test
        @DisplayName("should be zero when cash flow is not positive")
        void shouldBeZeroWithoutCashFlow() {
            Player broke = engineer.toBuilder().bankLoanAmount(300000).build();

            assertEquals(0, FinancialCalculator.maxBankLoan(broke));
        }
    }

    @Nested
    @DisplayName("balance sheet changes")
    class BalanceSheetChanges {

        @Test
        @DisplayName("should add cash flow on pay day")
        void shouldPayDay() {
            assertEquals(400 + 1740, FinancialCalculator.processPayDay(engineer).getCash());
        }

        @Test
        @DisplayName("should cap children at three")
        void shouldCapChildren() {
            Player player = engineer;
            for (int i = 0; i < 4; i++) {
                player = FinancialCalculator.addChild(player);
            }

            assertEquals(3, player.getFinancialStatement().getExpenses().getChildCount());
            assertSame(player, FinancialCalculator.addChild(player));
        }

        @Test
        @DisplayName("should remove a liability paid in full and zero its expense")
        void shouldPayOffLiabilityInFull() {
            Player player = engineer.withCash(10000);

            Player paid = FinancialCalculator.payOffLiability(player, Liability.CAR_LOAN, 7000);

            assertEquals(3000, paid.getCash());
            assertTrue(paid.getFinancialStatement().findLiability(Liability.CAR_LOAN).isEmpty());
            assertEquals(0, paid.getFinancialStatement().getExpenses().getCarLoanPayment());
            assertEquals(1880, FinancialCalculator.cashFlow(paid));
        }

        @Test
        @DisplayName("should only charge the outstanding balance")
        void shouldChargeOnlyBalance() {
            Player player = engineer.withCash(10000);

            Player paid = FinancialCalculator.payOffLiability(player, Liability.CAR_LOAN, 8000);

            assertEquals(3000, paid.getCash());
        }

        @Test
        @DisplayName("should keep a partly paid liability and its expense")
        void shouldPayOffLiabilityPartly() {
            Player player = engineer.withCash(10000);

            Player paid = FinancialCalculator.payOffLiability(player, Liability.SCHOOL_LOAN, 5000);

            assertEquals(5000, paid.getCash());
            assertEquals(7000, paid.getFinancialStatement().findLiability(Liability.SCHOOL_LOAN).orElseThrow().balance());
            assertEquals(60, paid.getFinancialStatement().getExpenses().getSchoolLoanPayment());
        }

        @Test
        @DisplayName("should reject an unknown liability")
        void shouldRejectUnknownLiability() {
            assertThrows(IllegalArgumentException.class,
                    () -> FinancialCalculator.payOffLiability(engineer, "Yacht Loan", 1000));
        }
    }

    @Nested
    @DisplayName("forcedLoan()")
    class ForcedLoan {

        @Test
        @DisplayName("should borrow whole thousands to cover negative cash")
        void shouldBorrowThousands() {
            FinancialCalculator.LoanResult result = FinancialCalculator.forcedLoan(engineer.withCash(-1500));

            assertEquals(2000, result.amountBorrowed());
            assertEquals(500, result.player().getCash());
            assertEquals(2000, result.player().getBankLoanAmount());
        }

        @Test
        @DisplayName("should do nothing when cash is not negative")
        void shouldNotBorrowWithCash() {
            FinancialCalculator.LoanResult result = FinancialCalculator.forcedLoan(engineer.withCash(0));

            assertEquals(0, result.amountBorrowed());
            assertEquals(0, result.player().getBankLoanAmount());
        }
    }

    @Nested
    @DisplayName("declareBankruptcy()")
    class DeclareBankruptcy {

        @Test
        @DisplayName("should liquidate property at half the down payment and halve car and card debt")
        void shouldLiquidate() {
            Player player = withAsset(engineer, new RealEstateAsset("a1", "House", RealEstateType.HOUSE, 50000, 40000, 10000, 100));
            player = withAsset(player, new StockAsset("a2", "On2U", "ON2U", 100, 5, 0));
            player = player.toBuilder().cash(0).bankLoanAmount(222000).build();
            assertTrue(FinancialCalculator.cashFlow(player) < 0);

            FinancialCalculator.BankruptcyResult result = FinancialCalculator.declareBankruptcy(player);
            Player after = result.player();

            assertFalse(result.eliminated());
            assertEquals(5000, after.getCash());
            assertTrue(after.getFinancialStatement().getAssets().isEmpty());
            assertEquals(70, after.getFinancialStatement().getExpenses().getCarLoanPayment());
            assertEquals(60, after.getFinancialStatement().getExpenses().getCreditCardPayment());
            assertEquals(3500, after.getFinancialStatement().findLiability(Liability.CAR_LOAN).orElseThrow().balance());
            assertEquals(2000, after.getFinancialStatement().findLiability(Liability.CREDIT_CARD).orElseThrow().balance());
            assertEquals(75000, after.getFinancialStatement().findLiability(Liability.HOME_MORTGAGE).orElseThrow().balance());
            assertEquals(2, after.getBankruptTurnsLeft());
            assertFalse(after.isBankrupt());
            assertEquals(20, FinancialCalculator.cashFlow(after));
        }

        @Test
        @DisplayName("should eliminate a player whose cash flow stays negative")
        void shouldEliminate() {
            Player player = engineer.toBuilder().cash(0).bankLoanAmount(300000).build();

            FinancialCalculator.BankruptcyResult result = FinancialCalculator.declareBankruptcy(player);

            assertTrue(result.eliminated());
            assertTrue(result.player().isBankrupt());
        }
    }
}
