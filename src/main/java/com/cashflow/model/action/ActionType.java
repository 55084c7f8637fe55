package com.cashflow.model.action;

/**
 * Wire names of every player action.
 */
public enum ActionType {
    ROLL_DICE,
    CHOOSE_DEAL_TYPE,
    BUY_ASSET,
    SELL_ASSET,
    SKIP_DEAL,
    PAY_EXPENSE,
    ACCEPT_CHARITY,
    DECLINE_CHARITY,
    TAKE_LOAN,
    PAY_OFF_LOAN,
    END_TURN,
    COLLECT_PAY_DAY,
    CHOOSE_DREAM,
    SELL_TO_MARKET,
    DECLINE_MARKET,
    DECLARE_BANKRUPTCY,
    OFFER_DEAL_TO_PLAYER,
    ACCEPT_PLAYER_DEAL,
    DECLINE_PLAYER_DEAL;

    /**
     * Actions that players other than the current one may submit.
     */
    public boolean allowedOutOfTurn() {
        return this == SELL_TO_MARKET || this == DECLINE_MARKET
                || this == ACCEPT_PLAYER_DEAL || this == DECLINE_PLAYER_DEAL;
    }
}
