package com.cashflow.model;

/**
 * Phases of a single player's turn.
 */
public enum TurnPhase {
    ROLL_DICE,
    PAY_DAY_COLLECTION,
    RESOLVE_SPACE,
    MAKE_DECISION,
    END_OF_TURN,
    GAME_OVER,
    BANKRUPTCY_DECISION,
    WAITING_FOR_DEAL_RESPONSE
}
