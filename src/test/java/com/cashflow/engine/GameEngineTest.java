package com.cashflow.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.cashflow.model.ActiveCard;
import com.cashflow.model.GameLogEntry;
import com.cashflow.model.GameState;
import com.cashflow.model.Liability;
import com.cashflow.model.Player;
import com.cashflow.model.PlayerSeat;
import com.cashflow.model.TurnPhase;
import com.cashflow.model.action.ActionType;
import com.cashflow.model.action.DealSize;
import com.cashflow.model.action.GameAction;
import com.cashflow.model.asset.RealEstateAsset;
import com.cashflow.model.asset.RealEstateType;
import com.cashflow.model.card.CardCatalog;
import com.cashflow.model.card.DoodadCard;

class GameEngineTest {

    private GameEngine engine;
    private GameState state;

    @BeforeEach
    void setUp() {
        engine = TestGames.engine();
        state = TestGames.twoPlayerGame(engine);
    }

    private static String lastLog(GameState s) {
        return s.getLog().get(s.getLog().size() - 1).message();
    }

    private static Player player(GameState s, String id) {
        return s.findPlayer(id).orElseThrow();
    }

    private GameState at(GameState s, int position) {
        return TestGames.withCurrent(s, s.currentPlayer().toBuilder().position(position).build());
    }

    private GameState roll(GameState s, int die1, int die2) {
        return engine.processAction(s, new GameAction.RollDice(s.currentPlayer().getId(), List.of(die1, die2), null));
    }

    @Nested
    @DisplayName("createGame()")
    class CreateGame {

        @Test
        @DisplayName("should deal professions and start with savings as cash")
        void shouldDealPlayers() {
            assertEquals(2, state.getPlayers().size());
            Player alice = state.getPlayers().get(0);
            assertEquals("Engineer", alice.getProfession());
            assertEquals(400, alice.getCash());
            assertEquals(0, alice.getPosition());
            assertEquals(4, alice.getFinancialStatement().getLiabilities().size());
            assertEquals(TurnPhase.ROLL_DICE, state.getTurnPhase());
            assertEquals(0, state.getCurrentPlayerIndex());
            assertEquals(1, state.getTurnNumber());
            assertEquals(1, state.getNextAssetId());
            assertEquals(GameLogEntry.SYSTEM, state.getLog().get(0).playerId());
            assertEquals("Game started!", state.getLog().get(0).message());
            assertEquals(1, state.getDecks().getSmallDeals().cards().size());
        }

        @Test
        @DisplayName("should only create liabilities with an outstanding balance")
        void shouldSkipZeroBalanceLiabilities() {
            GameState janitors = engine.createGame("g", List.of(new PlayerSeat("p1", "Pat")),
                    List.of(TestGames.JANITOR), TestGames.catalog());

            Player pat = janitors.getPlayers().get(0);
            assertTrue(pat.getFinancialStatement().findLiability(Liability.CREDIT_CARD).isEmpty());
            assertTrue(pat.getFinancialStatement().findLiability(Liability.SCHOOL_LOAN).isEmpty());
            assertEquals(2, pat.getFinancialStatement().getLiabilities().size());
        }

        @Test
        @DisplayName("should cycle professions when players outnumber them")
        void shouldCycleProfessions() {
            GameState game = engine.createGame("g",
                    List.of(new PlayerSeat("a", "A"), new PlayerSeat("b", "B"), new PlayerSeat("c", "C")),
                    List.of(TestGames.ENGINEER, TestGames.JANITOR), TestGames.catalog());

            assertEquals("Engineer", game.getPlayers().get(0).getProfession());
            assertEquals("Janitor", game.getPlayers().get(1).getProfession());
            assertEquals("Engineer", game.getPlayers().get(2).getProfession());
        }

        @Test
        @DisplayName("should shuffle identically for the same seed")
        void shouldBeDeterministic() {
            List<DoodadCard> doodads = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                doodads.add(new DoodadCard("dd-" + i, "Doodad " + i, "", 10 * i, false));
            }
            CardCatalog catalog = new CardCatalog(List.of(TestGames.ENGINEER), List.of(), List.of(), List.of(), doodads);
            List<PlayerSeat> seats = List.of(new PlayerSeat("a", "A"));

            GameState first = new GameEngine(new Random(7), TestGames.CLOCK).createGame("g", seats, catalog.professions(), catalog);
            GameState second = new GameEngine(new Random(7), TestGames.CLOCK).createGame("g", seats, catalog.professions(), catalog);

            assertEquals(first, second);
        }

        @Test
        @DisplayName("should refuse a game without players")
        void shouldRefuseEmptySeats() {
            assertThrows(IllegalArgumentException.class,
                    () -> engine.createGame("g", List.of(), List.of(TestGames.ENGINEER), TestGames.catalog()));
        }
    }

    @Nested
    @DisplayName("rolling")
    class Rolling {

        @Test
        @DisplayName("should move one die from 22 to 3 without a pay day")
        void shouldWrapWithoutPayDay() {
            GameState next = roll(at(state, 22), 5, 2);

            Player alice = player(next, "alice");
            assertEquals(3, alice.getPosition());
            assertEquals(400, alice.getCash());
            assertEquals(TurnPhase.RESOLVE_SPACE, next.getTurnPhase());
            assertEquals(0, next.getPayDaysRemaining());
            assertEquals(5, next.getDiceResult().total());
            assertEquals("Rolled 5, moved to space 3", lastLog(next));
        }

        @Test
        @DisplayName("should collect a passed pay day before resolving the space")
        void shouldCollectPayDay() {
            GameState next = roll(state, 5, 1);

            assertEquals(TurnPhase.PAY_DAY_COLLECTION, next.getTurnPhase());
            assertEquals(1, next.getPayDaysRemaining());
            assertEquals(List.of(ActionType.COLLECT_PAY_DAY), engine.getValidActions(next));

            next = engine.processAction(next, new GameAction.CollectPayDay("alice"));

            assertEquals(2140, player(next, "alice").getCash());
            assertEquals(0, next.getPayDaysRemaining());
            assertEquals(TurnPhase.RESOLVE_SPACE, next.getTurnPhase());
        }

        @Test
        @DisplayName("should log invalid dice and leave the state unchanged otherwise")
        void shouldRejectInvalidDice() {
            GameState next = roll(state, 7, 3);

            assertEquals(state.getLog().size() + 1, next.getLog().size());
            assertEquals("Invalid action: Each die value must be an integer between 1 and 6", lastLog(next));
            assertEquals(state.getPlayers(), next.getPlayers());
            assertEquals(TurnPhase.ROLL_DICE, next.getTurnPhase());
        }

        @Test
        @DisplayName("should let a charity donor roll both dice")
        void shouldRollBothDiceAfterCharity() {
            GameState donor = TestGames.withCurrent(state, state.currentPlayer().toBuilder().charityTurnsLeft(3).build());

            GameState next = engine.processAction(donor, new GameAction.RollDice("alice", List.of(1, 2), true));

            assertEquals(3, player(next, "alice").getPosition());
            assertEquals(2, player(next, "alice").getCharityTurnsLeft());
            assertEquals("Rolled 1+2=3, moved to space 3", lastLog(next));
        }

        @Test
        @DisplayName("should ignore a request for both dice without charity")
        void shouldIgnoreBothDiceWithoutCharity() {
            GameState next = engine.processAction(state, new GameAction.RollDice("alice", List.of(1, 2), true));

            assertEquals(1, player(next, "alice").getPosition());
        }
    }

    @Nested
    @DisplayName("spaces")
    class Spaces {

        @Test
        @DisplayName("should play a small deal from draw to end of turn")
        void shouldPlayDeal() {
            GameState next = roll(at(state, 2), 1, 6);
            assertEquals(TurnPhase.RESOLVE_SPACE, next.getTurnPhase());
            assertEquals(List.of(ActionType.CHOOSE_DEAL_TYPE, ActionType.SKIP_DEAL), engine.getValidActions(next));

            next = engine.processAction(next, new GameAction.ChooseDealType("alice", DealSize.SMALL));
            assertEquals(TurnPhase.MAKE_DECISION, next.getTurnPhase());
            ActiveCard.SmallDeal active = assertInstanceOf(ActiveCard.SmallDeal.class, next.getActiveCard());
            assertEquals(TestGames.STOCK_CARD, active.card());

            next = engine.processAction(next, new GameAction.BuyAsset("alice", 10));
            assertEquals(TurnPhase.END_OF_TURN, next.getTurnPhase());
            assertNull(next.getActiveCard());
            assertEquals(350, player(next, "alice").getCash());
            assertEquals(1, next.getDecks().getSmallDeals().discardPile().size());

            next = engine.processAction(next, new GameAction.EndTurn("alice"));
            assertEquals(1, next.getCurrentPlayerIndex());
            assertEquals(TurnPhase.ROLL_DICE, next.getTurnPhase());
            assertEquals(2, next.getTurnNumber());
        }

        @Test
        @DisplayName("should note an empty deal deck and stay put")
        void shouldHandleEmptyDeck() {
            CardCatalog noDeals = new CardCatalog(List.of(TestGames.ENGINEER), List.of(), List.of(), List.of(), List.of());
            GameState game = engine.createGame("g",
                    List.of(new PlayerSeat("alice", "Alice"), new PlayerSeat("bob", "Bob")),
                    noDeals.professions(), noDeals);
            GameState resolving = roll(at(game, 2), 1, 1);

            GameState next = engine.processAction(resolving, new GameAction.ChooseDealType("alice", DealSize.SMALL));

            assertEquals("No small deals left to draw.", lastLog(next));
            assertEquals(TurnPhase.RESOLVE_SPACE, next.getTurnPhase());
            assertNull(next.getActiveCard());
        }

        @Test
        @DisplayName("should force the doodad to be paid before the turn ends")
        void shouldPayDoodad() {
            GameState next = roll(state, 1, 4);
            assertInstanceOf(ActiveCard.Doodad.class, next.getActiveCard());
            assertEquals(List.of(ActionType.PAY_EXPENSE), engine.getValidActions(next));

            GameState refused = engine.processAction(next, new GameAction.EndTurn("alice"));
            assertEquals("Invalid action: Must pay doodad expense before ending turn", lastLog(refused));

            next = engine.processAction(next, new GameAction.PayExpense("alice"));
            assertEquals(320, player(next, "alice").getCash());
            assertEquals(TurnPhase.END_OF_TURN, next.getTurnPhase());
            assertEquals(1, next.getDecks().getDoodads().discardPile().size());
        }

        @Test
        @DisplayName("should add a child on the baby space")
        void shouldHaveBaby() {
            GameState next = roll(at(state, 5), 1, 1);

            assertEquals(1, player(next, "alice").getFinancialStatement().getExpenses().getChildCount());
            assertEquals(TurnPhase.END_OF_TURN, next.getTurnPhase());
        }

        @Test
        @DisplayName("should donate a tenth of income on charity")
        void shouldAcceptCharity() {
            GameState resolving = roll(at(state, 12), 1, 1);
            assertEquals(List.of(ActionType.ACCEPT_CHARITY, ActionType.DECLINE_CHARITY), engine.getValidActions(resolving));
            resolving = TestGames.withCurrent(resolving, resolving.currentPlayer().withCash(1000));

            GameState next = engine.processAction(resolving, new GameAction.AcceptCharity("alice"));

            assertEquals(510, player(next, "alice").getCash());
            assertEquals(3, player(next, "alice").getCharityTurnsLeft());
            assertEquals(TurnPhase.END_OF_TURN, next.getTurnPhase());
        }

        @Test
        @DisplayName("should charge expenses and skip two turns when downsized")
        void shouldDownsize() {
            GameState next = roll(at(state, 17), 1, 1);

            Player alice = player(next, "alice");
            assertEquals(240, alice.getCash());
            assertEquals(3000, alice.getBankLoanAmount());
            assertEquals(2, alice.getDownsizedTurnsLeft());
            assertEquals(TurnPhase.END_OF_TURN, next.getTurnPhase());

            next = engine.processAction(next, new GameAction.EndTurn("alice"));
            assertEquals("bob", next.currentPlayer().getId());

            next = engine.processAction(next.withPhase(TurnPhase.END_OF_TURN), new GameAction.EndTurn("bob"));
            assertEquals("bob", next.currentPlayer().getId());
            assertEquals(1, player(next, "alice").getDownsizedTurnsLeft());
            assertEquals("Downsized, turn skipped (1 left)", lastLog(next));
        }
    }

    @Nested
    @DisplayName("market")
    class Market {

        private GameState offer;

        @BeforeEach
        void setUp() {
            Player bob = player(state, "bob");
            GameState withHouse = state.withPlayer(1, bob.withFinancialStatement(bob.getFinancialStatement().withAsset(
                    new RealEstateAsset("asset-7", "House", RealEstateType.HOUSE, 50000, 47000, 3000, 200))));
            offer = roll(at(withHouse, 1), 1, 3);
        }

        @Test
        @DisplayName("should open the offer to every holder of a matching asset")
        void shouldOpenToHolders() {
            assertInstanceOf(ActiveCard.Market.class, offer.getActiveCard());
            assertEquals(TurnPhase.MAKE_DECISION, offer.getTurnPhase());
            assertEquals(List.of(ActionType.SELL_TO_MARKET, ActionType.DECLINE_MARKET), engine.getValidActions(offer, "bob"));
        }

        @Test
        @DisplayName("should let another player sell out of turn")
        void shouldSellOutOfTurn() {
            GameState next = engine.processAction(offer, new GameAction.SellToMarket("bob", "asset-7"));

            assertEquals(400 + 53000, player(next, "bob").getCash());
            assertEquals(TurnPhase.MAKE_DECISION, next.getTurnPhase());
            assertEquals("alice", next.currentPlayer().getId());
        }

        @Test
        @DisplayName("should discard the card when the current player declines")
        void shouldDecline() {
            GameState next = engine.processAction(offer, new GameAction.DeclineMarket("alice", null));

            assertEquals(TurnPhase.END_OF_TURN, next.getTurnPhase());
            assertNull(next.getActiveCard());
            assertEquals(1, next.getDecks().getMarket().discardPile().size());
        }
    }

    @Nested
    @DisplayName("player deals")
    class PlayerDeals {

        private GameState waiting;

        @BeforeEach
        void setUp() {
            GameState deciding = state.toBuilder()
                    .turnPhase(TurnPhase.MAKE_DECISION)
                    .activeCard(new ActiveCard.SmallDeal(TestGames.HOUSE_CARD))
                    .build()
                    .withPlayer(1, player(state, "bob").withCash(5000));
            waiting = engine.processAction(deciding, new GameAction.OfferDealToPlayer("alice", "bob", 1000));
        }

        @Test
        @DisplayName("should wait for the buyer")
        void shouldWaitForBuyer() {
            assertEquals(TurnPhase.WAITING_FOR_DEAL_RESPONSE, waiting.getTurnPhase());
            assertEquals("bob", waiting.getPendingPlayerDeal().buyerId());
            assertEquals(List.of(ActionType.ACCEPT_PLAYER_DEAL, ActionType.DECLINE_PLAYER_DEAL),
                    engine.getValidActions(waiting, "bob"));
            assertTrue(engine.getValidActions(waiting).isEmpty());
        }

        @Test
        @DisplayName("should move cash and the asset when accepted")
        void shouldAccept() {
            GameState next = engine.processAction(waiting, new GameAction.AcceptPlayerDeal("bob"));

            assertEquals(1000, player(next, "bob").getCash());
            assertEquals(1400, player(next, "alice").getCash());
            assertEquals(1, player(next, "bob").getFinancialStatement().getAssets().size());
            assertTrue(player(next, "alice").getFinancialStatement().getAssets().isEmpty());
            assertEquals(TurnPhase.END_OF_TURN, next.getTurnPhase());
            assertNull(next.getPendingPlayerDeal());
            assertNull(next.getActiveCard());
        }

        @Test
        @DisplayName("should refuse an offer beyond the buyer's borrowing power")
        void shouldRefuseOverpricedOffer() {
            GameState deciding = waiting.toBuilder()
                    .pendingPlayerDeal(null)
                    .turnPhase(TurnPhase.MAKE_DECISION)
                    .build();

            GameState next = engine.processAction(deciding,
                    new GameAction.OfferDealToPlayer("alice", "bob", Integer.MAX_VALUE));

            assertTrue(lastLog(next).startsWith("Invalid action: Bob cannot cover $"));
            assertEquals(TurnPhase.MAKE_DECISION, next.getTurnPhase());
            assertNull(next.getPendingPlayerDeal());
            assertEquals(400, player(next, "alice").getCash());
            assertEquals(0, player(next, "bob").getBankLoanAmount());
        }

        @Test
        @DisplayName("should return to the seller's decision when declined")
        void shouldDecline() {
            GameState next = engine.processAction(waiting, new GameAction.DeclinePlayerDeal("bob"));

            assertEquals(TurnPhase.MAKE_DECISION, next.getTurnPhase());
            assertNull(next.getPendingPlayerDeal());
            assertInstanceOf(ActiveCard.SmallDeal.class, next.getActiveCard());
        }
    }

    @Nested
    @DisplayName("loans and bankruptcy")
    class LoansAndBankruptcy {

        @Test
        @DisplayName("should take and repay a bank loan at end of turn")
        void shouldTakeAndRepayLoan() {
            GameState endOfTurn = state.withPhase(TurnPhase.END_OF_TURN);

            GameState next = engine.processAction(endOfTurn, new GameAction.TakeLoan("alice", 5000));
            assertEquals(5400, player(next, "alice").getCash());
            assertEquals(5000, player(next, "alice").getBankLoanAmount());

            next = engine.processAction(next, new GameAction.PayOffLoan("alice", Liability.BANK_LOAN, 2000));
            assertEquals(3400, player(next, "alice").getCash());
            assertEquals(3000, player(next, "alice").getBankLoanAmount());
        }

        @Test
        @DisplayName("should demand bankruptcy when a forced loan turns cash flow negative")
        void shouldTriggerBankruptcy() {
            GameState indebted = TestGames.withCurrent(state,
                    state.currentPlayer().toBuilder().position(17).bankLoanAmount(204000).build());

            GameState next = roll(indebted, 1, 1);

            assertEquals(TurnPhase.BANKRUPTCY_DECISION, next.getTurnPhase());
            assertEquals(List.of(ActionType.DECLARE_BANKRUPTCY), engine.getValidActions(next));

            next = engine.processAction(next, new GameAction.DeclareBankruptcy("alice"));
            Player alice = player(next, "alice");
            assertFalse(alice.isBankrupt());
            assertEquals(2, alice.getBankruptTurnsLeft());
            assertEquals(TurnPhase.END_OF_TURN, next.getTurnPhase());
        }

        @Test
        @DisplayName("should skip a recovering player")
        void shouldSkipRecoveringPlayer() {
            GameState recovering = state.withPlayer(0, player(state, "alice").toBuilder().bankruptTurnsLeft(2).build())
                    .toBuilder().currentPlayerIndex(1).turnPhase(TurnPhase.END_OF_TURN).build();

            GameState next = engine.processAction(recovering, new GameAction.EndTurn("bob"));

            assertEquals("bob", next.currentPlayer().getId());
            assertEquals(1, player(next, "alice").getBankruptTurnsLeft());
        }

        @Test
        @DisplayName("should end the game when every player is eliminated")
        void shouldEndWhenAllBankrupt() {
            GameState doomed = state
                    .withPlayer(0, player(state, "alice").toBuilder().bankLoanAmount(300000).build())
                    .withPlayer(1, player(state, "bob").toBuilder().bankrupt(true).build())
                    .withPhase(TurnPhase.BANKRUPTCY_DECISION);

            GameState next = engine.processAction(doomed, new GameAction.DeclareBankruptcy("alice"));
            assertTrue(player(next, "alice").isBankrupt());
            assertEquals(List.of(ActionType.END_TURN), engine.getValidActions(next));

            next = engine.processAction(next, new GameAction.EndTurn("alice"));

            assertEquals(TurnPhase.GAME_OVER, next.getTurnPhase());
            assertNull(next.getWinner());
            assertEquals("Every player is bankrupt. Game over.", lastLog(next));
        }
    }

    @Nested
    @DisplayName("fast track")
    class FastTrack {

        private GameState onFastTrack(int position, int cash, int cashFlow, String dream) {
            return TestGames.withCurrent(state, state.currentPlayer().toBuilder()
                    .escaped(true).inFastTrack(true).dream(dream)
                    .fastTrackPosition(position).cash(cash).fastTrackCashFlow(cashFlow)
                    .build());
        }

        @Test
        @DisplayName("should escape after buying enough passive income and then require a dream")
        void shouldEscapeAndChooseDream() {
            GameState deciding = TestGames.withCurrent(state, state.currentPlayer().withCash(50000)).toBuilder()
                    .turnPhase(TurnPhase.MAKE_DECISION)
                    .activeCard(new ActiveCard.BigDeal(TestGames.BUSINESS_CARD))
                    .build();

            GameState next = engine.processAction(deciding, new GameAction.BuyAsset("alice", null));
            assertTrue(player(next, "alice").isEscaped());
            assertTrue(lastLog(next).endsWith("Can escape the rat race!"));
            assertEquals(List.of(ActionType.CHOOSE_DREAM), engine.getValidActions(next));
            assertEquals("Invalid action: Must choose a dream before continuing",
                    lastLog(engine.processAction(next, new GameAction.EndTurn("alice"))));

            next = engine.processAction(next, new GameAction.ChooseDream("alice", "Private Jet"));
            Player alice = player(next, "alice");
            assertTrue(alice.isInFastTrack());
            assertEquals("Private Jet", alice.getDream());
            assertEquals(0, alice.getFastTrackPosition());
            assertEquals(400000, alice.getFastTrackCashFlow());
            assertEquals(List.of(ActionType.END_TURN), engine.getValidActions(next));
        }

        @Test
        @DisplayName("should win on a cash flow day once cash flow reaches the target")
        void shouldWinOnCashFlow() {
            GameState next = roll(onFastTrack(0, 0, 60000, "Private Jet"), 2, 2);
            assertEquals(TurnPhase.PAY_DAY_COLLECTION, next.getTurnPhase());

            next = engine.processAction(next, new GameAction.CollectPayDay("alice"));

            assertEquals(TurnPhase.GAME_OVER, next.getTurnPhase());
            assertEquals("alice", next.getWinner());
            assertEquals(60000, player(next, "alice").getCash());
            assertTrue(player(next, "alice").isWon());
        }

        @Test
        @DisplayName("should win by landing on the chosen dream")
        void shouldWinOnDream() {
            GameState next = roll(onFastTrack(6, 0, 10000, "Amazon Rainforest Adventure"), 1, 2);
            next = engine.processAction(next, new GameAction.CollectPayDay("alice"));

            assertEquals(9, player(next, "alice").getFastTrackPosition());
            assertEquals(TurnPhase.GAME_OVER, next.getTurnPhase());
            assertEquals("alice", next.getWinner());
        }

        @Test
        @DisplayName("should not win on someone else's dream")
        void shouldPassOtherDream() {
            GameState next = roll(onFastTrack(6, 0, 10000, "Private Jet"), 1, 2);
            next = engine.processAction(next, new GameAction.CollectPayDay("alice"));

            assertEquals(TurnPhase.END_OF_TURN, next.getTurnPhase());
            assertNull(next.getWinner());
        }

        @Test
        @DisplayName("should charge half the cash flow on a tax audit")
        void shouldPayTax() {
            GameState next = roll(onFastTrack(4, 30000, 10000, "Private Jet"), 1, 1);

            assertEquals(25000, player(next, "alice").getCash());
            assertEquals(TurnPhase.END_OF_TURN, next.getTurnPhase());
        }

        @Test
        @DisplayName("should halve cash on a lawsuit")
        void shouldLoseLawsuit() {
            GameState next = roll(onFastTrack(8, 30000, 10000, "Private Jet"), 1, 1);

            assertEquals(15000, player(next, "alice").getCash());
        }

        @Test
        @DisplayName("should halve cash and cash flow on a divorce")
        void shouldDivorce() {
            GameState next = roll(onFastTrack(12, 30000, 10000, "Private Jet"), 1, 1);

            assertEquals(15000, player(next, "alice").getCash());
            assertEquals(5000, player(next, "alice").getFastTrackCashFlow());
        }

        @Test
        @DisplayName("should scale business cash flow and win past the target")
        void shouldBuyBusiness() {
            GameState next = roll(onFastTrack(0, 50000, 10000, "Private Jet"), 1, 1);
            assertInstanceOf(ActiveCard.BigDeal.class, next.getActiveCard());
            assertFalse(engine.getValidActions(next).contains(ActionType.TAKE_LOAN));

            next = engine.processAction(next, new GameAction.BuyAsset("alice", null));

            assertEquals(410000, player(next, "alice").getFastTrackCashFlow());
            assertEquals(TurnPhase.GAME_OVER, next.getTurnPhase());
            assertEquals("alice", next.getWinner());
        }

        @Test
        @DisplayName("should refuse loans on the fast track")
        void shouldRefuseLoans() {
            GameState endOfTurn = onFastTrack(3, 0, 10000, "Private Jet").withPhase(TurnPhase.END_OF_TURN);

            GameState next = engine.processAction(endOfTurn, new GameAction.TakeLoan("alice", 1000));

            assertEquals("Invalid action: Loans are not available on the Fast Track", lastLog(next));
            assertSame(endOfTurn.getPlayers().get(0), next.getPlayers().get(0));
        }
    }
}
