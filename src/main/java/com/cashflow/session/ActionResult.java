package com.cashflow.session;

import com.cashflow.model.GameState;

/**
 * Outcome of one submitted action. {@code state} is always the sanitized view.
 */
public record ActionResult(boolean success, GameState state, String error) {

    public static ActionResult ok(GameState state) {
        return new ActionResult(true, state, null);
    }

    public static ActionResult rejected(GameState state, String error) {
        return new ActionResult(false, state, error);
    }
}
