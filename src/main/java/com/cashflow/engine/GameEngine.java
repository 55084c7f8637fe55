package com.cashflow.engine;

import com.cashflow.model.ActiveCard;
import com.cashflow.model.Deck;
import com.cashflow.model.DeckState;
import com.cashflow.model.DiceResult;
import com.cashflow.model.Expenses;
import com.cashflow.model.FinancialStatement;
import com.cashflow.model.GameLogEntry;
import com.cashflow.model.GameState;
import com.cashflow.model.Liability;
import com.cashflow.model.PendingPlayerDeal;
import com.cashflow.model.Player;
import com.cashflow.model.PlayerSeat;
import com.cashflow.model.TurnPhase;
import com.cashflow.model.action.ActionType;
import com.cashflow.model.action.DealSize;
import com.cashflow.model.action.GameAction;
import com.cashflow.model.board.FastTrackSpace;
import com.cashflow.model.board.RatRaceSpaceType;
import com.cashflow.model.card.CardCatalog;
import com.cashflow.model.card.DealCard;
import com.cashflow.model.card.DoodadCard;
import com.cashflow.model.card.MarketCard;
import com.cashflow.model.card.PropertyDeal;
import com.cashflow.model.card.ProfessionCard;
import com.cashflow.model.card.StockDeal;
import com.cashflow.model.card.StockSplitDeal;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * The turn state machine. {@link #processAction} is the only way a game moves forward; it never
 * throws for a rejected action and instead returns the unchanged state with an
 * {@code "Invalid action: "} log entry.
 * <p>
 * Randomness and time are injected so that a game is reproducible from its seed.
 */
public class GameEngine {

    public static final String INVALID_ACTION_PREFIX = "Invalid action: ";
    public static final int FAST_TRACK_WIN_CASH_FLOW = 50_000;
    public static final int FAST_TRACK_MULTIPLIER = 100;
    public static final int SKIPPED_TURNS = 2;
    public static final int CHARITY_TURNS = 3;

    private final Random random;
    private final Clock clock;
    private final ActionValidator validator;
    private final CardResolver resolver;

    public GameEngine(Random random, Clock clock) {
        this.random = random;
        this.clock = clock;
        this.validator = new ActionValidator();
        this.resolver = new CardResolver(clock);
    }

    // ── creation ────────────────────────────────────────────────────────

    /**
     * Deals a new game. Player {@code i} gets profession {@code i % professions.size()}.
     */
    public GameState createGame(String gameId, List<PlayerSeat> seats, List<ProfessionCard> professions,
                                CardCatalog catalog) {
        if (seats.isEmpty()) {
            throw new IllegalArgumentException("A game needs at least one player");
        }
        if (professions.isEmpty()) {
            throw new IllegalArgumentException("No professions to deal");
        }
        List<Player> players = new ArrayList<>();
        for (int i = 0; i < seats.size(); i++) {
            PlayerSeat seat = seats.get(i);
            players.add(createPlayer(seat.id(), seat.name(), professions.get(i % professions.size())));
        }

        DeckState decks = DeckState.builder()
                .smallDeals(Deck.shuffled(catalog.smallDeals(), random))
                .bigDeals(Deck.shuffled(catalog.bigDeals(), random))
                .market(Deck.shuffled(catalog.marketCards(), random))
                .doodads(Deck.shuffled(catalog.doodads(), random))
                .build();

        return GameState.builder()
                .id(gameId)
                .players(players)
                .currentPlayerIndex(0)
                .turnPhase(TurnPhase.ROLL_DICE)
                .decks(decks)
                .logEntry(new GameLogEntry(clock.millis(), GameLogEntry.SYSTEM, "Game started!"))
                .turnNumber(1)
                .nextAssetId(1)
                .build();
    }

    static Player createPlayer(String id, String name, ProfessionCard profession) {
        List<Liability> liabilities = new ArrayList<>();
        addIfOwed(liabilities, Liability.HOME_MORTGAGE, profession.homeMortgageBalance(), profession.homeMortgagePayment());
        addIfOwed(liabilities, Liability.SCHOOL_LOAN, profession.schoolLoanBalance(), profession.schoolLoanPayment());
        addIfOwed(liabilities, Liability.CAR_LOAN, profession.carLoanBalance(), profession.carLoanPayment());
        addIfOwed(liabilities, Liability.CREDIT_CARD, profession.creditCardBalance(), profession.creditCardPayment());

        Expenses expenses = Expenses.builder()
                .taxes(profession.taxes())
                .homeMortgagePayment(profession.homeMortgagePayment())
                .schoolLoanPayment(profession.schoolLoanPayment())
                .carLoanPayment(profession.carLoanPayment())
                .creditCardPayment(profession.creditCardPayment())
                .otherExpenses(profession.otherExpenses())
                .perChildExpense(profession.perChildExpense())
                .childCount(0)
                .build();

        return Player.builder()
                .id(id)
                .name(name)
                .profession(profession.title())
                .financialStatement(FinancialStatement.builder()
                        .salary(profession.salary())
                        .expenses(expenses)
                        .liabilities(liabilities)
                        .build())
                .cash(profession.savings())
                .build();
    }

    private static void addIfOwed(List<Liability> liabilities, String name, int balance, int payment) {
        if (balance > 0) {
            liabilities.add(new Liability(name, balance, payment));
        }
    }

    // ── dispatch ────────────────────────────────────────────────────────

    public ActionValidator.ValidationResult validate(GameState state, GameAction action) {
        return validator.validate(state, action);
    }

    public GameState processAction(GameState state, GameAction action) {
        ActionValidator.ValidationResult result = validator.validate(state, action);
        if (!result.isValid()) {
            return log(state, action.playerId(), INVALID_ACTION_PREFIX + result.getError());
        }

        switch (action.type()) {
            case ROLL_DICE:
                return rollDice(state, (GameAction.RollDice) action);
            case CHOOSE_DEAL_TYPE:
                return chooseDealType(state, (GameAction.ChooseDealType) action);
            case BUY_ASSET:
                return buyAsset(state, (GameAction.BuyAsset) action);
            case SELL_ASSET:
                return sellAsset(state, (GameAction.SellAsset) action);
            case SKIP_DEAL:
                return skipDeal(state, action);
            case PAY_EXPENSE:
                return payExpense(state, action);
            case ACCEPT_CHARITY:
                return acceptCharity(state);
            case DECLINE_CHARITY:
                return log(state, action.playerId(), "Declined charity.").withPhase(TurnPhase.END_OF_TURN);
            case TAKE_LOAN:
                return takeLoan(state, (GameAction.TakeLoan) action);
            case PAY_OFF_LOAN:
                return payOffLoan(state, (GameAction.PayOffLoan) action);
            case END_TURN:
                return endTurn(state);
            case COLLECT_PAY_DAY:
                return collectPayDay(state);
            case CHOOSE_DREAM:
                return chooseDream(state, (GameAction.ChooseDream) action);
            case SELL_TO_MARKET:
                return sellToMarket(state, (GameAction.SellToMarket) action);
            case DECLINE_MARKET:
                return declineMarket(state, action);
            case DECLARE_BANKRUPTCY:
                return declareBankruptcy(state);
            case OFFER_DEAL_TO_PLAYER:
                return offerDeal(state, (GameAction.OfferDealToPlayer) action);
            case ACCEPT_PLAYER_DEAL:
                return acceptPlayerDeal(state);
            case DECLINE_PLAYER_DEAL:
                return declinePlayerDeal(state);
            default:
                return state;
        }
    }

    // ── movement ────────────────────────────────────────────────────────

    private GameState rollDice(GameState state, GameAction.RollDice action) {
        Player player = state.currentPlayer();
        int die1 = action.diceValues().get(0);
        int die2 = action.diceValues().get(1);

        if (player.isInFastTrack()) {
            return rollFastTrack(state, player, die1, die2);
        }

        boolean bothDice = player.getCharityTurnsLeft() > 0 && action.bothDiceRequested();
        int total = BoardTopology.diceTotal(die1, die2, bothDice);
        int newPosition = BoardTopology.move(player.getPosition(), total);
        int payDays = BoardTopology.countPayDaysPassed(player.getPosition(), newPosition);

        Player moved = player.toBuilder()
                .position(newPosition)
                .charityTurnsLeft(Math.max(0, player.getCharityTurnsLeft() - 1))
                .build();
        GameState next = state.withPlayer(state.getCurrentPlayerIndex(), moved).toBuilder()
                .diceResult(new DiceResult(die1, die2, total))
                .build();
        next = log(next, player.getId(),
                "Rolled " + (bothDice ? die1 + "+" + die2 + "=" : "") + total + ", moved to space " + newPosition);

        if (payDays > 0) {
            next = next.toBuilder()
                    .payDaysRemaining(payDays)
                    .turnPhase(TurnPhase.PAY_DAY_COLLECTION)
                    .build();
            return log(next, player.getId(), "Passed " + payDays + (payDays > 1 ? " PayDays!" : " PayDay!"));
        }
        return resolveSpace(next);
    }

    private GameState rollFastTrack(GameState state, Player player, int die1, int die2) {
        int total = die1 + die2;
        int newPosition = BoardTopology.moveFastTrack(player.getFastTrackPosition(), total);
        int cashFlowDays = BoardTopology.countCashFlowDaysPassed(player.getFastTrackPosition(), newPosition);

        GameState next = state.withPlayer(state.getCurrentPlayerIndex(),
                        player.toBuilder().fastTrackPosition(newPosition).build())
                .toBuilder()
                .diceResult(new DiceResult(die1, die2, total))
                .build();
        next = log(next, player.getId(),
                "[Fast Track] Rolled " + die1 + "+" + die2 + "=" + total + ", moved to space " + newPosition);

        if (cashFlowDays > 0) {
            next = next.toBuilder()
                    .payDaysRemaining(cashFlowDays)
                    .turnPhase(TurnPhase.PAY_DAY_COLLECTION)
                    .build();
            return log(next, player.getId(), "[Fast Track] Passed " + cashFlowDays + " Cash Flow Day(s)!");
        }
        return resolveFastTrackSpace(next);
    }

    private GameState collectPayDay(GameState state) {
        int index = state.getCurrentPlayerIndex();
        Player player = state.currentPlayer();
        GameState next;

        if (player.isInFastTrack()) {
            Player paid = player.withCash(player.getCash() + player.getFastTrackCashFlow());
            next = log(state.withPlayer(index, paid), player.getId(),
                    "[Fast Track] Cash Flow Day! Collected $" + player.getFastTrackCashFlow());
            if (player.getFastTrackCashFlow() >= FAST_TRACK_WIN_CASH_FLOW) {
                return declareWinner(next, "reached $" + player.getFastTrackCashFlow() + "/mo cash flow");
            }
        } else {
            int cashFlow = FinancialCalculator.cashFlow(player);
            Player paid = FinancialCalculator.processPayDay(player);
            next = log(state.withPlayer(index, paid), player.getId(),
                    "PayDay! Collected cash flow: $" + cashFlow + ". Cash: $" + paid.getCash());
            next = resolver.applyForcedLoan(next, index);
            if (mustDeclareBankruptcy(state, next, index)) {
                return next.toBuilder().payDaysRemaining(0).turnPhase(TurnPhase.BANKRUPTCY_DECISION).build();
            }
        }

        int remaining = state.getPayDaysRemaining() - 1;
        next = next.toBuilder().payDaysRemaining(Math.max(0, remaining)).build();
        if (remaining > 0) {
            return next;
        }
        return player.isInFastTrack() ? resolveFastTrackSpace(next) : resolveSpace(next);
    }

    // ── rat race spaces ─────────────────────────────────────────────────

    private GameState resolveSpace(GameState state) {
        int index = state.getCurrentPlayerIndex();
        Player player = state.currentPlayer();
        RatRaceSpaceType space = BoardTopology.spaceType(player.getPosition());

        switch (space) {
            case DEAL:
            case CHARITY:
                return state.withPhase(TurnPhase.RESOLVE_SPACE);

            case MARKET:
                return drawMarket(state);

            case DOODAD:
                return drawDoodad(state);

            case BABY: {
                Player updated = FinancialCalculator.addChild(player);
                int children = updated.getFinancialStatement().getExpenses().getChildCount();
                GameState next = state.withPlayer(index, updated);
                next = children > player.getFinancialStatement().getExpenses().getChildCount()
                        ? log(next, player.getId(), "Had a baby! Now has " + children + " child(ren). Child expenses: $"
                                + updated.getFinancialStatement().getExpenses().getPerChildExpense() + "/child/month")
                        : log(next, player.getId(), "Already has " + FinancialCalculator.MAX_CHILDREN + " children, no more babies!");
                return next.withPhase(TurnPhase.END_OF_TURN);
            }

            case DOWNSIZED: {
                int expenses = FinancialCalculator.totalExpenses(player);
                Player updated = player.toBuilder()
                        .cash(player.getCash() - expenses)
                        .downsizedTurnsLeft(SKIPPED_TURNS)
                        .build();
                GameState next = log(state.withPlayer(index, updated), player.getId(),
                        "Downsized! Paid total expenses $" + expenses + " and loses " + SKIPPED_TURNS + " turns.");
                return settle(state, resolver.applyForcedLoan(next, index), index, TurnPhase.END_OF_TURN);
            }

            case PAY_DAY:
            default:
                return state.withPhase(TurnPhase.END_OF_TURN);
        }
    }

    private GameState drawMarket(GameState state) {
        Deck<MarketCard> deck = state.getDecks().getMarket();
        if (deck.exhausted()) {
            return log(state, state.currentPlayer().getId(), "No market cards left to draw.")
                    .withPhase(TurnPhase.END_OF_TURN);
        }
        Deck.Draw<MarketCard> draw = deck.draw(random);
        MarketCard card = draw.card();

        if (CardResolver.immediate(card.effect())) {
            GameState next = state.toBuilder()
                    .decks(state.getDecks().toBuilder().market(draw.deck().discard(card)).build())
                    .build();
            next = log(next, state.currentPlayer().getId(), "Market: " + card.title() + " - " + card.effect().description());
            next = resolver.resolveMarket(next, card);
            return settle(state, next, state.getCurrentPlayerIndex(), TurnPhase.END_OF_TURN);
        }

        GameState next = state.toBuilder()
                .activeCard(new ActiveCard.Market(card))
                .decks(state.getDecks().toBuilder().market(draw.deck()).build())
                .build();
        return resolver.resolveMarket(next, card);
    }

    private GameState drawDoodad(GameState state) {
        Deck<DoodadCard> deck = state.getDecks().getDoodads();
        if (deck.exhausted()) {
            return log(state, state.currentPlayer().getId(), "No doodad cards left to draw.")
                    .withPhase(TurnPhase.END_OF_TURN);
        }
        Deck.Draw<DoodadCard> draw = deck.draw(random);
        GameState next = state.toBuilder()
                .activeCard(new ActiveCard.Doodad(draw.card()))
                .decks(state.getDecks().toBuilder().doodads(draw.deck()).build())
                .turnPhase(TurnPhase.MAKE_DECISION)
                .build();
        return log(next, state.currentPlayer().getId(), "Doodad: " + draw.card().title() + " - " + draw.card().description());
    }

    // ── deals ───────────────────────────────────────────────────────────

    private GameState chooseDealType(GameState state, GameAction.ChooseDealType action) {
        boolean small = action.dealType() == DealSize.SMALL;
        Deck<DealCard> deck = small ? state.getDecks().getSmallDeals() : state.getDecks().getBigDeals();
        if (deck.exhausted()) {
            return log(state, action.playerId(), "No " + action.dealType().getCode() + " deals left to draw.");
        }

        Deck.Draw<DealCard> draw = deck.draw(random);
        DealCard card = draw.card();

        if (card.deal() instanceof StockSplitDeal split) {
            GameState next = state.toBuilder()
                    .decks(withDealDeck(state.getDecks(), small, draw.deck().discard(card)))
                    .build();
            next = log(next, action.playerId(), "Drew stock split card: " + card.title());
            return resolver.stockSplit(next, split).toBuilder()
                    .activeCard(null)
                    .turnPhase(TurnPhase.END_OF_TURN)
                    .build();
        }

        GameState next = state.toBuilder()
                .activeCard(small ? new ActiveCard.SmallDeal(card) : new ActiveCard.BigDeal(card))
                .decks(withDealDeck(state.getDecks(), small, draw.deck()))
                .turnPhase(TurnPhase.MAKE_DECISION)
                .build();
        return log(next, action.playerId(), "Drew " + action.dealType().getCode() + " deal: " + card.title());
    }

    private GameState buyAsset(GameState state, GameAction.BuyAsset action) {
        ActiveCard.DealActive active = (ActiveCard.DealActive) state.getActiveCard();
        int index = state.getCurrentPlayerIndex();

        GameState next = resolver.buyDeal(state, active.card(), action.playerId(), action.shares(), false);
        next = discardActiveDeal(next, active);

        Player buyer = next.getPlayers().get(index);
        if (buyer.isInFastTrack() && active.card().deal() instanceof PropertyDeal property) {
            int added = property.cashFlow() * FAST_TRACK_MULTIPLIER;
            Player boosted = buyer.toBuilder().fastTrackCashFlow(buyer.getFastTrackCashFlow() + added).build();
            next = log(next.withPlayer(index, boosted), buyer.getId(),
                    "[Fast Track] Cash flow increased by $" + added + "/mo (total: $" + boosted.getFastTrackCashFlow() + "/mo)");
            if (boosted.getFastTrackCashFlow() >= FAST_TRACK_WIN_CASH_FLOW) {
                return declareWinner(next.toBuilder().activeCard(null).build(),
                        "reached $" + boosted.getFastTrackCashFlow() + "/mo cash flow");
            }
        } else {
            next = checkEscape(next, index);
        }

        return next.toBuilder()
                .activeCard(null)
                .turnPhase(TurnPhase.END_OF_TURN)
                .build();
    }

    private GameState sellAsset(GameState state, GameAction.SellAsset action) {
        StockDeal offer = (StockDeal) ActionValidator.activeDeal(state);
        return resolver.sellStock(state, action.playerId(), action.assetId(), offer.costPerShare(), action.shares());
    }

    private GameState skipDeal(GameState state, GameAction action) {
        GameState next = state;
        if (state.getActiveCard() instanceof ActiveCard.DealActive active) {
            next = discardActiveDeal(next, active);
        }
        return log(next, action.playerId(), "Passed on the deal.").toBuilder()
                .activeCard(null)
                .turnPhase(TurnPhase.END_OF_TURN)
                .build();
    }

    private GameState offerDeal(GameState state, GameAction.OfferDealToPlayer action) {
        ActiveCard.DealActive active = (ActiveCard.DealActive) state.getActiveCard();
        Player seller = state.currentPlayer();
        Player buyer = state.findPlayer(action.targetPlayerId()).orElseThrow();

        GameState next = state.toBuilder()
                .pendingPlayerDeal(new PendingPlayerDeal(seller.getId(), buyer.getId(),
                        active.card().deal(), action.askingPrice()))
                .turnPhase(TurnPhase.WAITING_FOR_DEAL_RESPONSE)
                .build();
        return log(next, seller.getId(), seller.getName() + " offers deal \"" + active.card().title()
                + "\" to " + buyer.getName() + " for $" + action.askingPrice());
    }

    private GameState acceptPlayerDeal(GameState state) {
        PendingPlayerDeal deal = state.getPendingPlayerDeal();
        ActiveCard.DealActive active = (ActiveCard.DealActive) state.getActiveCard();
        int buyerIndex = state.indexOf(deal.buyerId());
        int sellerIndex = state.indexOf(deal.sellerId());
        PropertyDeal property = (PropertyDeal) deal.deal();

        Player buyer = state.getPlayers().get(buyerIndex);
        Player seller = state.getPlayers().get(sellerIndex);
        GameState next = state
                .withPlayer(buyerIndex, buyer.withCash(buyer.getCash() - deal.askingPrice() - property.downPayment()))
                .withPlayer(sellerIndex, seller.withCash(seller.getCash() + deal.askingPrice()));
        next = resolver.buyDeal(next, active.card(), deal.buyerId(), null, true);
        next = discardActiveDeal(next, active);
        next = log(next, buyer.getId(), buyer.getName() + " accepted the deal for $" + deal.askingPrice() + "!");
        next = resolver.applyForcedLoan(next, buyerIndex);
        next = checkEscape(next, buyerIndex);

        return next.toBuilder()
                .activeCard(null)
                .pendingPlayerDeal(null)
                .turnPhase(TurnPhase.END_OF_TURN)
                .build();
    }

    private GameState declinePlayerDeal(GameState state) {
        PendingPlayerDeal deal = state.getPendingPlayerDeal();
        String buyerName = state.findPlayer(deal.buyerId()).map(Player::getName).orElse("Player");
        GameState next = state.toBuilder()
                .pendingPlayerDeal(null)
                .turnPhase(TurnPhase.MAKE_DECISION)
                .build();
        return log(next, deal.buyerId(), buyerName + " declined the deal offer.");
    }

    // ── expenses and charity ────────────────────────────────────────────

    private GameState payExpense(GameState state, GameAction action) {
        ActiveCard.Doodad doodad = (ActiveCard.Doodad) state.getActiveCard();
        int index = state.getCurrentPlayerIndex();
        GameState next = resolver.payDoodad(state, doodad.card(), action.playerId());
        next = next.toBuilder()
                .activeCard(null)
                .decks(next.getDecks().toBuilder().doodads(next.getDecks().getDoodads().discard(doodad.card())).build())
                .build();
        return settle(state, resolver.applyForcedLoan(next, index), index, TurnPhase.END_OF_TURN);
    }

    private GameState acceptCharity(GameState state) {
        Player player = state.currentPlayer();
        int donation = ActionValidator.charityDonation(player);
        Player updated = player.toBuilder()
                .cash(player.getCash() - donation)
                .charityTurnsLeft(CHARITY_TURNS)
                .build();
        GameState next = state.withPlayer(state.getCurrentPlayerIndex(), updated);
        return log(next, player.getId(), "Donated $" + donation + " to charity. Can choose 1 or 2 dice for "
                + CHARITY_TURNS + " turns.").withPhase(TurnPhase.END_OF_TURN);
    }

    // ── market ──────────────────────────────────────────────────────────

    private GameState sellToMarket(GameState state, GameAction.SellToMarket action) {
        ActiveCard.Market market = (ActiveCard.Market) state.getActiveCard();
        GameState next = resolver.sellToMarket(state, market.card(), action.playerId(), action.assetId());
        return checkEscape(next, next.indexOf(action.playerId()));
    }

    private GameState declineMarket(GameState state, GameAction action) {
        if (!state.currentPlayer().getId().equals(action.playerId())) {
            return log(state, action.playerId(), "Passed on the market offer.");
        }
        ActiveCard.Market market = (ActiveCard.Market) state.getActiveCard();
        return state.toBuilder()
                .activeCard(null)
                .decks(state.getDecks().toBuilder().market(state.getDecks().getMarket().discard(market.card())).build())
                .turnPhase(TurnPhase.END_OF_TURN)
                .build();
    }

    // ── loans and bankruptcy ────────────────────────────────────────────

    private GameState takeLoan(GameState state, GameAction.TakeLoan action) {
        Player updated = FinancialCalculator.takeBankLoan(state.currentPlayer(), action.amount());
        return log(state.withPlayer(state.getCurrentPlayerIndex(), updated), updated.getId(),
                "Took bank loan of $" + action.amount() + ". Monthly payment: $"
                        + FinancialCalculator.bankLoanPayment(updated.getBankLoanAmount()));
    }

    private GameState payOffLoan(GameState state, GameAction.PayOffLoan action) {
        int index = state.getCurrentPlayerIndex();
        Player player = state.currentPlayer();
        GameState next;

        if (Liability.BANK_LOAN.equals(action.loanType())) {
            Player updated = FinancialCalculator.payOffBankLoan(player, action.amount());
            next = log(state.withPlayer(index, updated), player.getId(),
                    "Paid off $" + action.amount() + " of bank loan. Remaining: $" + updated.getBankLoanAmount());
        } else {
            Player updated = FinancialCalculator.payOffLiability(player, action.loanType(), action.amount());
            int paid = player.getCash() - updated.getCash();
            next = log(state.withPlayer(index, updated), player.getId(),
                    "Paid $" + paid + " toward " + action.loanType());
        }
        return checkEscape(next, index);
    }

    private GameState declareBankruptcy(GameState state) {
        Player player = state.currentPlayer();
        FinancialCalculator.BankruptcyResult result = FinancialCalculator.declareBankruptcy(player);
        GameState next = state.withPlayer(state.getCurrentPlayerIndex(), result.player());
        next = result.eliminated()
                ? log(next, player.getId(), player.getName() + " is bankrupt and eliminated from the game!")
                : log(next, player.getId(), player.getName() + " declared bankruptcy! Assets sold, some debts halved. Loses "
                        + SKIPPED_TURNS + " turns.");
        return next.withPhase(TurnPhase.END_OF_TURN);
    }

    // ── turn advance ────────────────────────────────────────────────────

    private GameState endTurn(GameState state) {
        GameState next = state;
        if (state.getActiveCard() instanceof ActiveCard.DealActive active) {
            next = discardActiveDeal(next, active);
        } else if (state.getActiveCard() instanceof ActiveCard.Market market) {
            next = next.toBuilder()
                    .decks(next.getDecks().toBuilder().market(next.getDecks().getMarket().discard(market.card())).build())
                    .build();
        }
        next = next.toBuilder()
                .activeCard(null)
                .diceResult(null)
                .pendingPlayerDeal(null)
                .payDaysRemaining(0)
                .build();

        if (next.getPlayers().stream().allMatch(Player::isBankrupt)) {
            next = log(next, GameLogEntry.SYSTEM, "Every player is bankrupt. Game over.");
            return next.withPhase(TurnPhase.GAME_OVER);
        }

        int size = next.getPlayers().size();
        int nextIndex = (state.getCurrentPlayerIndex() + 1) % size;
        while (true) {
            Player candidate = next.getPlayers().get(nextIndex);
            if (candidate.isBankrupt()) {
                nextIndex = (nextIndex + 1) % size;
                continue;
            }
            if (candidate.getBankruptTurnsLeft() > 0) {
                int left = candidate.getBankruptTurnsLeft() - 1;
                next = log(next.withPlayer(nextIndex, candidate.toBuilder().bankruptTurnsLeft(left).build()),
                        candidate.getId(), "Recovering from bankruptcy, turn skipped (" + left + " left)");
                nextIndex = (nextIndex + 1) % size;
                continue;
            }
            if (candidate.getDownsizedTurnsLeft() > 0) {
                int left = candidate.getDownsizedTurnsLeft() - 1;
                next = log(next.withPlayer(nextIndex, candidate.toBuilder().downsizedTurnsLeft(left).build()),
                        candidate.getId(), "Downsized, turn skipped (" + left + " left)");
                nextIndex = (nextIndex + 1) % size;
                continue;
            }
            break;
        }

        return next.toBuilder()
                .currentPlayerIndex(nextIndex)
                .turnPhase(TurnPhase.ROLL_DICE)
                .turnNumber(state.getTurnNumber() + 1)
                .build();
    }

    // ── fast track ──────────────────────────────────────────────────────

    private GameState chooseDream(GameState state, GameAction.ChooseDream action) {
        int index = state.indexOf(action.playerId());
        Player player = state.getPlayers().get(index);
        int cashFlow = FinancialCalculator.passiveIncome(player.getFinancialStatement()) * FAST_TRACK_MULTIPLIER;
        Player updated = player.toBuilder()
                .dream(action.dream())
                .inFastTrack(true)
                .fastTrackPosition(0)
                .fastTrackCashFlow(cashFlow)
                .build();
        return log(state.withPlayer(index, updated), player.getId(), "Chose dream: \"" + action.dream()
                + "\" and moved to the Fast Track! Fast Track cash flow: $" + cashFlow + "/mo");
    }

    private GameState resolveFastTrackSpace(GameState state) {
        int index = state.getCurrentPlayerIndex();
        Player player = state.currentPlayer();
        FastTrackSpace space = BoardTopology.fastTrackSpace(player.getFastTrackPosition());

        switch (space.type()) {
            case BUSINESS_DEAL: {
                Deck<DealCard> deck = state.getDecks().getBigDeals();
                if (deck.exhausted()) {
                    return log(state, player.getId(), "[Fast Track] No business deals left to draw.")
                            .withPhase(TurnPhase.END_OF_TURN);
                }
                Deck.Draw<DealCard> draw = deck.draw(random);
                GameState next = state.toBuilder()
                        .activeCard(new ActiveCard.BigDeal(draw.card()))
                        .decks(state.getDecks().toBuilder().bigDeals(draw.deck()).build())
                        .turnPhase(TurnPhase.MAKE_DECISION)
                        .build();
                return log(next, player.getId(), "[Fast Track] Business Deal opportunity: " + draw.card().title());
            }

            case CHARITY:
                return state.withPhase(TurnPhase.RESOLVE_SPACE);

            case TAX: {
                int tax = Math.min(player.getFastTrackCashFlow() / 2, Math.max(0, player.getCash()));
                GameState next = state.withPlayer(index, player.withCash(player.getCash() - tax));
                return log(next, player.getId(), "[Fast Track] Tax Audit! Paid $" + tax + " in taxes")
                        .withPhase(TurnPhase.END_OF_TURN);
            }

            case LAWSUIT: {
                int loss = player.getCash() / 2;
                GameState next = state.withPlayer(index, player.withCash(player.getCash() - loss));
                return log(next, player.getId(), "[Fast Track] Lawsuit! Lost $" + loss + " (half of cash on hand)")
                        .withPhase(TurnPhase.END_OF_TURN);
            }

            case DIVORCE: {
                int cashLoss = player.getCash() / 2;
                int cashFlowLoss = player.getFastTrackCashFlow() / 2;
                Player updated = player.toBuilder()
                        .cash(player.getCash() - cashLoss)
                        .fastTrackCashFlow(player.getFastTrackCashFlow() - cashFlowLoss)
                        .build();
                return log(state.withPlayer(index, updated), player.getId(), "[Fast Track] Divorce! Lost $" + cashLoss
                        + " cash and $" + cashFlowLoss + "/mo cash flow").withPhase(TurnPhase.END_OF_TURN);
            }

            case DREAM:
                if (space.dream().equals(player.getDream())) {
                    return declareWinner(state, "landed on their dream \"" + player.getDream() + "\"");
                }
                return log(state, player.getId(), "[Fast Track] Landed on dream: \"" + space.dream()
                        + "\" (not your dream: \"" + player.getDream() + "\")").withPhase(TurnPhase.END_OF_TURN);

            case CASH_FLOW_DAY:
            default:
                return state.withPhase(TurnPhase.END_OF_TURN);
        }
    }

    private GameState declareWinner(GameState state, String reason) {
        int index = state.getCurrentPlayerIndex();
        Player player = state.currentPlayer();
        GameState next = state.withPlayer(index, player.toBuilder().won(true).build());
        next = log(next, player.getId(), "WINNER! " + player.getName() + " " + reason + " and wins the game!");
        return next.toBuilder()
                .winner(player.getId())
                .turnPhase(TurnPhase.GAME_OVER)
                .build();
    }

    // ── valid actions ───────────────────────────────────────────────────

    /**
     * Actions the current player may take.
     */
    public List<ActionType> getValidActions(GameState state) {
        if (state.getPlayers().isEmpty()) {
            return List.of();
        }
        return getValidActions(state, state.currentPlayer().getId());
    }

    /**
     * Actions {@code playerId} may take right now, including out-of-turn market and deal responses.
     */
    public List<ActionType> getValidActions(GameState state, String playerId) {
        Player player = state.findPlayer(playerId).orElse(null);
        if (player == null || state.getTurnPhase() == TurnPhase.GAME_OVER) {
            return List.of();
        }
        if (player.isBankrupt()) {
            boolean handingOn = state.currentPlayer().getId().equals(playerId)
                    && state.getTurnPhase() == TurnPhase.END_OF_TURN;
            return handingOn ? List.of(ActionType.END_TURN) : List.of();
        }
        if (!state.currentPlayer().getId().equals(playerId)) {
            return outOfTurnActions(state, player);
        }
        if (player.isEscaped() && player.getDream() == null) {
            return List.of(ActionType.CHOOSE_DREAM);
        }

        List<ActionType> actions = new ArrayList<>();
        switch (state.getTurnPhase()) {
            case ROLL_DICE:
                actions.add(ActionType.ROLL_DICE);
                break;

            case PAY_DAY_COLLECTION:
                actions.add(ActionType.COLLECT_PAY_DAY);
                break;

            case RESOLVE_SPACE:
                if (ActionValidator.onDealSpace(player)) {
                    actions.add(ActionType.CHOOSE_DEAL_TYPE);
                    actions.add(ActionType.SKIP_DEAL);
                } else if (ActionValidator.onCharitySpace(state, player)) {
                    actions.add(ActionType.ACCEPT_CHARITY);
                    actions.add(ActionType.DECLINE_CHARITY);
                }
                break;

            case MAKE_DECISION:
                ActiveCard card = state.getActiveCard();
                if (card instanceof ActiveCard.DealActive active) {
                    actions.add(ActionType.BUY_ASSET);
                    actions.add(ActionType.SKIP_DEAL);
                    if (active.card().deal() instanceof PropertyDeal
                            && state.getPlayers().stream().filter(p -> !p.isBankrupt()).count() > 1) {
                        actions.add(ActionType.OFFER_DEAL_TO_PLAYER);
                    }
                    if (active.card().deal() instanceof StockDeal stock
                            && player.getFinancialStatement().findStock(stock.symbol()).isPresent()) {
                        actions.add(ActionType.SELL_ASSET);
                    }
                    if (!player.isInFastTrack()) {
                        actions.add(ActionType.TAKE_LOAN);
                    }
                } else if (card instanceof ActiveCard.Doodad) {
                    actions.add(ActionType.PAY_EXPENSE);
                } else if (card instanceof ActiveCard.Market) {
                    actions.add(ActionType.SELL_TO_MARKET);
                    actions.add(ActionType.DECLINE_MARKET);
                }
                if (!(card instanceof ActiveCard.Doodad)) {
                    actions.add(ActionType.END_TURN);
                }
                break;

            case END_OF_TURN:
                actions.add(ActionType.END_TURN);
                if (!player.isInFastTrack()) {
                    actions.add(ActionType.TAKE_LOAN);
                    actions.add(ActionType.PAY_OFF_LOAN);
                }
                break;

            case BANKRUPTCY_DECISION:
                actions.add(ActionType.DECLARE_BANKRUPTCY);
                break;

            case WAITING_FOR_DEAL_RESPONSE:
            case GAME_OVER:
            default:
                break;
        }
        return List.copyOf(actions);
    }

    private List<ActionType> outOfTurnActions(GameState state, Player player) {
        if (state.getTurnPhase() == TurnPhase.WAITING_FOR_DEAL_RESPONSE && state.getPendingPlayerDeal() != null
                && state.getPendingPlayerDeal().buyerId().equals(player.getId())) {
            return List.of(ActionType.ACCEPT_PLAYER_DEAL, ActionType.DECLINE_PLAYER_DEAL);
        }
        if (state.getTurnPhase() == TurnPhase.MAKE_DECISION && state.getActiveCard() instanceof ActiveCard.Market market) {
            boolean holdsMatch = player.getFinancialStatement().getAssets().stream()
                    .anyMatch(a -> CardResolver.sellable(a, market.card().effect()));
            if (holdsMatch) {
                return List.of(ActionType.SELL_TO_MARKET, ActionType.DECLINE_MARKET);
            }
        }
        return List.of();
    }

    // ── helpers ─────────────────────────────────────────────────────────

    /**
     * Moves to {@code nextPhase}, or to bankruptcy when a forced loan in this step left the
     * current player with negative monthly cash flow.
     */
    private GameState settle(GameState before, GameState after, int index, TurnPhase nextPhase) {
        if (mustDeclareBankruptcy(before, after, index)) {
            return log(after, after.getPlayers().get(index).getId(),
                    "Cash flow is negative after a forced loan. Must declare bankruptcy.")
                    .withPhase(TurnPhase.BANKRUPTCY_DECISION);
        }
        return after.withPhase(nextPhase);
    }

    private static boolean mustDeclareBankruptcy(GameState before, GameState after, int index) {
        if (index != after.getCurrentPlayerIndex()) {
            return false;
        }
        Player was = before.getPlayers().get(index);
        Player now = after.getPlayers().get(index);
        return !now.isInFastTrack()
                && now.getBankLoanAmount() > was.getBankLoanAmount()
                && FinancialCalculator.cashFlow(now) < 0;
    }

    private GameState checkEscape(GameState state, int index) {
        if (index < 0) {
            return state;
        }
        Player player = state.getPlayers().get(index);
        if (player.isEscaped() || player.isInFastTrack() || !FinancialCalculator.canEscape(player)) {
            return state;
        }
        GameState next = log(state, player.getId(), "Passive income ($"
                + FinancialCalculator.passiveIncome(player.getFinancialStatement()) + ") exceeds expenses ($"
                + FinancialCalculator.totalExpenses(player) + ")! Can escape the rat race!");
        return next.withPlayer(index, player.toBuilder().escaped(true).build());
    }

    private GameState discardActiveDeal(GameState state, ActiveCard.DealActive active) {
        DeckState decks = state.getDecks();
        boolean small = active instanceof ActiveCard.SmallDeal;
        Deck<DealCard> deck = small ? decks.getSmallDeals() : decks.getBigDeals();
        return state.toBuilder().decks(withDealDeck(decks, small, deck.discard(active.card()))).build();
    }

    private static DeckState withDealDeck(DeckState decks, boolean small, Deck<DealCard> deck) {
        return small ? decks.toBuilder().smallDeals(deck).build() : decks.toBuilder().bigDeals(deck).build();
    }

    private GameState log(GameState state, String playerId, String message) {
        return resolver.log(state, playerId, message);
    }
}
