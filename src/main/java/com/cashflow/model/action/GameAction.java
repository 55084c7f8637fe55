package com.cashflow.model.action;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * A player action submitted to the engine, discriminated on the wire by {@code type}.
 * <p>
 * Optional numeric fields use wrapper types so that absent JSON fields stay {@code null}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = GameAction.RollDice.class, name = "ROLL_DICE"),
        @JsonSubTypes.Type(value = GameAction.ChooseDealType.class, name = "CHOOSE_DEAL_TYPE"),
        @JsonSubTypes.Type(value = GameAction.BuyAsset.class, name = "BUY_ASSET"),
        @JsonSubTypes.Type(value = GameAction.SellAsset.class, name = "SELL_ASSET"),
        @JsonSubTypes.Type(value = GameAction.SkipDeal.class, name = "SKIP_DEAL"),
        @JsonSubTypes.Type(value = GameAction.PayExpense.class, name = "PAY_EXPENSE"),
        @JsonSubTypes.Type(value = GameAction.AcceptCharity.class, name = "ACCEPT_CHARITY"),
        @JsonSubTypes.Type(value = GameAction.DeclineCharity.class, name = "DECLINE_CHARITY"),
        @JsonSubTypes.Type(value = GameAction.TakeLoan.class, name = "TAKE_LOAN"),
        @JsonSubTypes.Type(value = GameAction.PayOffLoan.class, name = "PAY_OFF_LOAN"),
        @JsonSubTypes.Type(value = GameAction.EndTurn.class, name = "END_TURN"),
        @JsonSubTypes.Type(value = GameAction.CollectPayDay.class, name = "COLLECT_PAY_DAY"),
        @JsonSubTypes.Type(value = GameAction.ChooseDream.class, name = "CHOOSE_DREAM"),
        @JsonSubTypes.Type(value = GameAction.SellToMarket.class, name = "SELL_TO_MARKET"),
        @JsonSubTypes.Type(value = GameAction.DeclineMarket.class, name = "DECLINE_MARKET"),
        @JsonSubTypes.Type(value = GameAction.DeclareBankruptcy.class, name = "DECLARE_BANKRUPTCY"),
        @JsonSubTypes.Type(value = GameAction.OfferDealToPlayer.class, name = "OFFER_DEAL_TO_PLAYER"),
        @JsonSubTypes.Type(value = GameAction.AcceptPlayerDeal.class, name = "ACCEPT_PLAYER_DEAL"),
        @JsonSubTypes.Type(value = GameAction.DeclinePlayerDeal.class, name = "DECLINE_PLAYER_DEAL")
})
public sealed interface GameAction {

    String playerId();

    ActionType type();

    record RollDice(String playerId, List<Integer> diceValues, Boolean useBothDice) implements GameAction {
        public ActionType type() {
            return ActionType.ROLL_DICE;
        }

        public boolean bothDiceRequested() {
            return Boolean.TRUE.equals(useBothDice);
        }

        /**
         * Same request with the dice replaced by authoritative values.
         */
        public RollDice withDice(int die1, int die2) {
            return new RollDice(playerId, List.of(die1, die2), useBothDice);
        }
    }

    record ChooseDealType(String playerId, DealSize dealType) implements GameAction {
        public ActionType type() {
            return ActionType.CHOOSE_DEAL_TYPE;
        }
    }

    record BuyAsset(String playerId, Integer shares) implements GameAction {
        public ActionType type() {
            return ActionType.BUY_ASSET;
        }
    }

    /** {@code price} is advisory; the active card sets the sale price. */
    record SellAsset(String playerId, String assetId, Integer shares, Integer price) implements GameAction {
        public ActionType type() {
            return ActionType.SELL_ASSET;
        }
    }

    record SkipDeal(String playerId) implements GameAction {
        public ActionType type() {
            return ActionType.SKIP_DEAL;
        }
    }

    record PayExpense(String playerId) implements GameAction {
        public ActionType type() {
            return ActionType.PAY_EXPENSE;
        }
    }

    record AcceptCharity(String playerId) implements GameAction {
        public ActionType type() {
            return ActionType.ACCEPT_CHARITY;
        }
    }

    record DeclineCharity(String playerId) implements GameAction {
        public ActionType type() {
            return ActionType.DECLINE_CHARITY;
        }
    }

    record TakeLoan(String playerId, Integer amount) implements GameAction {
        public ActionType type() {
            return ActionType.TAKE_LOAN;
        }
    }

    record PayOffLoan(String playerId, String loanType, Integer amount) implements GameAction {
        public ActionType type() {
            return ActionType.PAY_OFF_LOAN;
        }
    }

    record EndTurn(String playerId) implements GameAction {
        public ActionType type() {
            return ActionType.END_TURN;
        }
    }

    record CollectPayDay(String playerId) implements GameAction {
        public ActionType type() {
            return ActionType.COLLECT_PAY_DAY;
        }
    }

    record ChooseDream(String playerId, String dream) implements GameAction {
        public ActionType type() {
            return ActionType.CHOOSE_DREAM;
        }
    }

    record SellToMarket(String playerId, String assetId) implements GameAction {
        public ActionType type() {
            return ActionType.SELL_TO_MARKET;
        }
    }

    record DeclineMarket(String playerId, String assetId) implements GameAction {
        public ActionType type() {
            return ActionType.DECLINE_MARKET;
        }
    }

    record DeclareBankruptcy(String playerId) implements GameAction {
        public ActionType type() {
            return ActionType.DECLARE_BANKRUPTCY;
        }
    }

    record OfferDealToPlayer(String playerId, String targetPlayerId, Integer askingPrice) implements GameAction {
        public ActionType type() {
            return ActionType.OFFER_DEAL_TO_PLAYER;
        }
    }

    record AcceptPlayerDeal(String playerId) implements GameAction {
        public ActionType type() {
            return ActionType.ACCEPT_PLAYER_DEAL;
        }
    }

    record DeclinePlayerDeal(String playerId) implements GameAction {
        public ActionType type() {
            return ActionType.DECLINE_PLAYER_DEAL;
        }
    }
}
