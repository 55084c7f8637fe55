package com.cashflow.session;

import com.cashflow.engine.GameEngine;
import com.cashflow.model.GameLogEntry;
import com.cashflow.model.GameState;
import com.cashflow.model.action.ActionType;
import com.cashflow.model.action.GameAction;
import lombok.Getter;

import java.util.List;
import java.util.Random;

/**
 * One running game. Not thread-safe on its own: all mutations for a room go through
 * {@link RoomActionQueue}, so at most one {@link #processAction} runs at a time.
 */
public class GameSession {

    @Getter
    private final String roomId;
    private final GameEngine engine;
    private final Random dice;
    private volatile GameState state;

    public GameSession(String roomId, GameEngine engine, Random dice, GameState initialState) {
        this.roomId = roomId;
        this.engine = engine;
        this.dice = dice;
        this.state = initialState;
    }

    /**
     * Applies {@code action}. Dice values supplied by the client are replaced with server rolls.
     * A rejected action leaves the stored state untouched.
     */
    public ActionResult processAction(GameAction action) {
        GameAction effective = action;
        if (action instanceof GameAction.RollDice roll) {
            List<Integer> rolled = rollDice();
            effective = roll.withDice(rolled.get(0), rolled.get(1));
        }

        GameState before = state;
        GameState after = engine.processAction(before, effective);
        String error = rejection(before, after);
        if (error != null) {
            return ActionResult.rejected(sanitize(before), error);
        }
        state = after;
        return ActionResult.ok(sanitize(after));
    }

    /**
     * Full state with deck contents replaced by placeholders of the same length and discard
     * piles emptied. Only deck sizes are revealed.
     */
    public GameState getSanitizedState() {
        return sanitize(state);
    }

    public List<ActionType> getValidActions() {
        return engine.getValidActions(state);
    }

    public List<ActionType> getValidActions(String playerId) {
        return engine.getValidActions(state, playerId);
    }

    public List<Integer> rollDice() {
        return List.of(dice.nextInt(6) + 1, dice.nextInt(6) + 1);
    }

    /** Unsanitized snapshot, for tests and server-side checks. */
    GameState currentState() {
        return state;
    }

    private static GameState sanitize(GameState state) {
        return state.toBuilder().decks(state.getDecks().hidden()).build();
    }

    private static String rejection(GameState before, GameState after) {
        List<GameLogEntry> log = after.getLog();
        if (log.size() <= before.getLog().size()) {
            return null;
        }
        String message = log.get(log.size() - 1).message();
        if (!message.startsWith(GameEngine.INVALID_ACTION_PREFIX)) {
            return null;
        }
        return message.substring(GameEngine.INVALID_ACTION_PREFIX.length());
    }
}
