package com.cashflow.engine;

import com.cashflow.model.ActiveCard;
import com.cashflow.model.GameState;
import com.cashflow.model.Liability;
import com.cashflow.model.Player;
import com.cashflow.model.TurnPhase;
import com.cashflow.model.action.ActionType;
import com.cashflow.model.action.GameAction;
import com.cashflow.model.asset.Asset;
import com.cashflow.model.asset.StockAsset;
import com.cashflow.model.board.FastTrackSpaceType;
import com.cashflow.model.board.RatRaceSpaceType;
import com.cashflow.model.card.Deal;
import com.cashflow.model.card.MarketEffect;
import com.cashflow.model.card.PropertyDeal;
import com.cashflow.model.card.StockDeal;
import com.cashflow.model.card.StockSplitDeal;

import java.util.List;

/**
 * Read-only legality check for a proposed action against a game state.
 */
public class ActionValidator {

    /**
     * Outcome of validating one action.
     */
    public static final class ValidationResult {
        private static final ValidationResult VALID = new ValidationResult(true, null);

        private final boolean valid;
        private final String error;

        private ValidationResult(boolean valid, String error) {
            this.valid = valid;
            this.error = error;
        }

        public static ValidationResult valid() {
            return VALID;
        }

        public static ValidationResult invalid(String error) {
            return new ValidationResult(false, error);
        }

        public boolean isValid() {
            return valid;
        }

        public String getError() {
            return error;
        }
    }

    public ValidationResult validate(GameState state, GameAction action) {
        if (state.getTurnPhase() == TurnPhase.GAME_OVER) {
            return ValidationResult.invalid("Game is over");
        }

        boolean currentActor = state.currentPlayer().getId().equals(action.playerId());
        if (!action.type().allowedOutOfTurn() && !currentActor) {
            return ValidationResult.invalid("Not your turn");
        }

        Player player = state.findPlayer(action.playerId()).orElse(null);
        if (player == null) {
            return ValidationResult.invalid("Player not found");
        }
        // an eliminated player may still hand the turn on
        if (player.isBankrupt() && !(currentActor && action.type() == ActionType.END_TURN
                && state.getTurnPhase() == TurnPhase.END_OF_TURN)) {
            return ValidationResult.invalid("Player has been eliminated");
        }
        if (currentActor && player.isEscaped() && player.getDream() == null
                && !(action instanceof GameAction.ChooseDream)) {
            return ValidationResult.invalid("Must choose a dream before continuing");
        }

        switch (action.type()) {
            case ROLL_DICE:
                return validateRoll(state, player, (GameAction.RollDice) action);
            case CHOOSE_DEAL_TYPE:
                return validateChooseDealType(state, player, (GameAction.ChooseDealType) action);
            case BUY_ASSET:
                return validateBuy(state, player, (GameAction.BuyAsset) action);
            case SELL_ASSET:
                return validateSellAsset(state, player, (GameAction.SellAsset) action);
            case SKIP_DEAL:
                return validateSkip(state, player);
            case PAY_EXPENSE:
                if (state.getTurnPhase() != TurnPhase.MAKE_DECISION || !(state.getActiveCard() instanceof ActiveCard.Doodad)) {
                    return ValidationResult.invalid("No expense to pay");
                }
                return ValidationResult.valid();
            case ACCEPT_CHARITY:
                return validateAcceptCharity(state, player);
            case DECLINE_CHARITY:
                return onCharitySpace(state, player)
                        ? ValidationResult.valid()
                        : ValidationResult.invalid("Cannot handle charity in current phase");
            case TAKE_LOAN:
                return validateTakeLoan(state, player, (GameAction.TakeLoan) action);
            case PAY_OFF_LOAN:
                return validatePayOff(state, player, (GameAction.PayOffLoan) action);
            case END_TURN:
                return validateEndTurn(state);
            case COLLECT_PAY_DAY:
                if (state.getTurnPhase() != TurnPhase.PAY_DAY_COLLECTION) {
                    return ValidationResult.invalid("Cannot collect pay day in current phase");
                }
                return ValidationResult.valid();
            case CHOOSE_DREAM:
                return validateChooseDream(player, (GameAction.ChooseDream) action);
            case SELL_TO_MARKET:
                return validateSellToMarket(state, player, (GameAction.SellToMarket) action);
            case DECLINE_MARKET:
                if (state.getTurnPhase() != TurnPhase.MAKE_DECISION || !(state.getActiveCard() instanceof ActiveCard.Market)) {
                    return ValidationResult.invalid("Cannot handle market action in current phase");
                }
                return ValidationResult.valid();
            case DECLARE_BANKRUPTCY:
                if (state.getTurnPhase() != TurnPhase.BANKRUPTCY_DECISION) {
                    return ValidationResult.invalid("Cannot declare bankruptcy in current phase");
                }
                return ValidationResult.valid();
            case OFFER_DEAL_TO_PLAYER:
                return validateOffer(state, (GameAction.OfferDealToPlayer) action);
            case ACCEPT_PLAYER_DEAL:
                return validateDealResponse(state, action, "No pending deal to accept");
            case DECLINE_PLAYER_DEAL:
                return validateDealResponse(state, action, "No pending deal to decline");
            default:
                return ValidationResult.invalid("Unknown action type");
        }
    }

    private ValidationResult validateRoll(GameState state, Player player, GameAction.RollDice action) {
        if (state.getTurnPhase() != TurnPhase.ROLL_DICE) {
            return ValidationResult.invalid("Cannot roll dice in current phase");
        }
        if (player.getDownsizedTurnsLeft() > 0) {
            return ValidationResult.invalid("Player is downsized and cannot roll");
        }
        List<Integer> dice = action.diceValues();
        if (dice == null || dice.size() != 2) {
            return ValidationResult.invalid("Dice values must be an array of two numbers");
        }
        for (Integer die : dice) {
            if (die == null || die < 1 || die > 6) {
                return ValidationResult.invalid("Each die value must be an integer between 1 and 6");
            }
        }
        return ValidationResult.valid();
    }

    private ValidationResult validateChooseDealType(GameState state, Player player, GameAction.ChooseDealType action) {
        if (state.getTurnPhase() != TurnPhase.RESOLVE_SPACE) {
            return ValidationResult.invalid("Cannot choose deal type in current phase");
        }
        if (!onDealSpace(player)) {
            return ValidationResult.invalid("Not on a deal space");
        }
        if (action.dealType() == null) {
            return ValidationResult.invalid("Deal type must be small or big");
        }
        return ValidationResult.valid();
    }

    private ValidationResult validateBuy(GameState state, Player player, GameAction.BuyAsset action) {
        if (state.getTurnPhase() != TurnPhase.MAKE_DECISION) {
            return ValidationResult.invalid("Cannot buy asset in current phase");
        }
        Deal deal = activeDeal(state);
        if (deal == null) {
            return ValidationResult.invalid("No active card to buy");
        }
        if (deal instanceof StockSplitDeal) {
            return ValidationResult.invalid("Stock splits cannot be bought");
        }
        if (deal instanceof StockDeal stock) {
            int shares = action.shares() == null ? 1 : action.shares();
            if (shares <= 0) {
                return ValidationResult.invalid("Shares must be positive");
            }
            int cost = CardResolver.stockCost(stock.costPerShare(), shares);
            if (cost > player.getCash()) {
                return ValidationResult.invalid("Not enough cash: " + shares + " shares cost $" + cost);
            }
            return ValidationResult.valid();
        }
        PropertyDeal property = (PropertyDeal) deal;
        if (property.downPayment() > player.getCash()) {
            return ValidationResult.invalid("Not enough cash for the $" + property.downPayment() + " down payment");
        }
        return ValidationResult.valid();
    }

    private ValidationResult validateSellAsset(GameState state, Player player, GameAction.SellAsset action) {
        if (state.getTurnPhase() != TurnPhase.MAKE_DECISION) {
            return ValidationResult.invalid("Cannot sell asset in current phase");
        }
        if (!(activeDeal(state) instanceof StockDeal offer)) {
            return ValidationResult.invalid("Stock can only be sold into an active stock offer");
        }
        Asset asset = player.getFinancialStatement().findAsset(action.assetId()).orElse(null);
        if (asset == null) {
            return ValidationResult.invalid("Asset not found");
        }
        if (!(asset instanceof StockAsset stock) || !stock.symbol().equals(offer.symbol())) {
            return ValidationResult.invalid("Asset does not match the active stock offer");
        }
        if (action.price() != null && action.price() < 0) {
            return ValidationResult.invalid("Price must be non-negative");
        }
        if (action.shares() != null) {
            if (action.shares() <= 0) {
                return ValidationResult.invalid("Shares must be positive");
            }
            if (action.shares() > stock.shares()) {
                return ValidationResult.invalid("Cannot sell more shares than owned");
            }
        }
        return ValidationResult.valid();
    }

    private ValidationResult validateSkip(GameState state, Player player) {
        boolean choosing = state.getTurnPhase() == TurnPhase.RESOLVE_SPACE && onDealSpace(player);
        boolean deciding = state.getTurnPhase() == TurnPhase.MAKE_DECISION && activeDeal(state) != null;
        if (!choosing && !deciding) {
            return ValidationResult.invalid("Cannot skip deal in current phase");
        }
        return ValidationResult.valid();
    }

    private ValidationResult validateAcceptCharity(GameState state, Player player) {
        if (!onCharitySpace(state, player)) {
            return ValidationResult.invalid("Cannot handle charity in current phase");
        }
        int donation = charityDonation(player);
        if (donation > player.getCash()) {
            return ValidationResult.invalid("Not enough cash to donate $" + donation);
        }
        return ValidationResult.valid();
    }

    private ValidationResult validateTakeLoan(GameState state, Player player, GameAction.TakeLoan action) {
        if (player.isInFastTrack()) {
            return ValidationResult.invalid("Loans are not available on the Fast Track");
        }
        boolean financingDeal = state.getTurnPhase() == TurnPhase.MAKE_DECISION && activeDeal(state) != null;
        if (state.getTurnPhase() != TurnPhase.END_OF_TURN && !financingDeal) {
            return ValidationResult.invalid("Can only take loans during end of turn or to finance a deal");
        }
        if (!positiveThousands(action.amount())) {
            return ValidationResult.invalid("Loan amount must be a positive multiple of $1,000");
        }
        int maxLoan = FinancialCalculator.maxBankLoan(player);
        if (action.amount() > maxLoan) {
            return ValidationResult.invalid("Loan amount exceeds maximum of $" + maxLoan + " (cash flow must stay positive)");
        }
        return ValidationResult.valid();
    }

    private ValidationResult validatePayOff(GameState state, Player player, GameAction.PayOffLoan action) {
        if (player.isInFastTrack()) {
            return ValidationResult.invalid("Loans are not available on the Fast Track");
        }
        if (state.getTurnPhase() != TurnPhase.END_OF_TURN) {
            return ValidationResult.invalid("Can only pay off loans during end of turn");
        }
        if (!positiveThousands(action.amount())) {
            return ValidationResult.invalid("Payment must be a positive multiple of $1,000");
        }
        if (action.amount() > player.getCash()) {
            return ValidationResult.invalid("Not enough cash");
        }
        if (Liability.BANK_LOAN.equals(action.loanType())) {
            if (action.amount() > player.getBankLoanAmount()) {
                return ValidationResult.invalid("Payment exceeds loan balance");
            }
            return ValidationResult.valid();
        }
        Liability liability = action.loanType() == null ? null
                : player.getFinancialStatement().findLiability(action.loanType()).orElse(null);
        if (liability == null) {
            return ValidationResult.invalid("Liability not found");
        }
        int roundedBalance = (int) Math.ceil(liability.balance() / (double) FinancialCalculator.LOAN_INCREMENT)
                * FinancialCalculator.LOAN_INCREMENT;
        if (action.amount() > roundedBalance) {
            return ValidationResult.invalid("Payment exceeds loan balance");
        }
        return ValidationResult.valid();
    }

    private ValidationResult validateEndTurn(GameState state) {
        switch (state.getTurnPhase()) {
            case END_OF_TURN:
                return ValidationResult.valid();
            case MAKE_DECISION:
                if (state.getActiveCard() instanceof ActiveCard.Doodad) {
                    return ValidationResult.invalid("Must pay doodad expense before ending turn");
                }
                return ValidationResult.valid();
            default:
                return ValidationResult.invalid("Cannot end turn in current phase");
        }
    }

    private ValidationResult validateChooseDream(Player player, GameAction.ChooseDream action) {
        if (!player.isEscaped()) {
            return ValidationResult.invalid("Player has not escaped rat race");
        }
        if (player.getDream() != null) {
            return ValidationResult.invalid("Player has already chosen a dream");
        }
        if (!BoardTopology.isDream(action.dream())) {
            return ValidationResult.invalid("Unknown dream: " + action.dream());
        }
        return ValidationResult.valid();
    }

    private ValidationResult validateSellToMarket(GameState state, Player player, GameAction.SellToMarket action) {
        if (state.getTurnPhase() != TurnPhase.MAKE_DECISION || !(state.getActiveCard() instanceof ActiveCard.Market market)) {
            return ValidationResult.invalid("Cannot handle market action in current phase");
        }
        Asset asset = action.assetId() == null ? null
                : player.getFinancialStatement().findAsset(action.assetId()).orElse(null);
        if (asset == null) {
            return ValidationResult.invalid("Asset not found");
        }
        MarketEffect effect = market.card().effect();
        if (!CardResolver.sellable(asset, effect)) {
            return ValidationResult.invalid("Asset does not match the market offer");
        }
        return ValidationResult.valid();
    }

    private ValidationResult validateOffer(GameState state, GameAction.OfferDealToPlayer action) {
        if (state.getTurnPhase() != TurnPhase.MAKE_DECISION) {
            return ValidationResult.invalid("Cannot offer deal in current phase");
        }
        Deal deal = activeDeal(state);
        if (deal == null) {
            return ValidationResult.invalid("No active card to offer");
        }
        if (!(deal instanceof PropertyDeal)) {
            return ValidationResult.invalid("Only real estate and business deals can be offered");
        }
        if (action.askingPrice() == null || action.askingPrice() <= 0) {
            return ValidationResult.invalid("Asking price must be positive");
        }
        if (action.playerId().equals(action.targetPlayerId())) {
            return ValidationResult.invalid("Cannot sell to yourself");
        }
        Player target = action.targetPlayerId() == null ? null : state.findPlayer(action.targetPlayerId()).orElse(null);
        if (target == null) {
            return ValidationResult.invalid("Target player not found");
        }
        if (target.isBankrupt()) {
            return ValidationResult.invalid("Cannot sell to a bankrupt player");
        }
        long cost = (long) action.askingPrice() + ((PropertyDeal) deal).downPayment();
        if (cost > (long) target.getCash() + FinancialCalculator.maxBankLoan(target)) {
            return ValidationResult.invalid(target.getName() + " cannot cover $" + cost + " even with a bank loan");
        }
        return ValidationResult.valid();
    }

    private ValidationResult validateDealResponse(GameState state, GameAction action, String noDealError) {
        if (state.getTurnPhase() != TurnPhase.WAITING_FOR_DEAL_RESPONSE || state.getPendingPlayerDeal() == null) {
            return ValidationResult.invalid(noDealError);
        }
        if (!state.getPendingPlayerDeal().buyerId().equals(action.playerId())) {
            return ValidationResult.invalid("You are not the deal recipient");
        }
        return ValidationResult.valid();
    }

    // ── shared predicates ───────────────────────────────────────────────

    static Deal activeDeal(GameState state) {
        return state.getActiveCard() instanceof ActiveCard.DealActive deal ? deal.card().deal() : null;
    }

    static boolean onDealSpace(Player player) {
        return !player.isInFastTrack() && BoardTopology.spaceType(player.getPosition()) == RatRaceSpaceType.DEAL;
    }

    static boolean onCharitySpace(GameState state, Player player) {
        if (state.getTurnPhase() != TurnPhase.RESOLVE_SPACE) {
            return false;
        }
        return player.isInFastTrack()
                ? BoardTopology.fastTrackSpaceType(player.getFastTrackPosition()) == FastTrackSpaceType.CHARITY
                : BoardTopology.spaceType(player.getPosition()) == RatRaceSpaceType.CHARITY;
    }

    static int charityDonation(Player player) {
        return (int) Math.floor(FinancialCalculator.totalIncome(player.getFinancialStatement()) * 0.1);
    }

    private static boolean positiveThousands(Integer amount) {
        return amount != null && amount > 0 && amount % FinancialCalculator.LOAN_INCREMENT == 0;
    }
}
