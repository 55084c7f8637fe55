package com.cashflow.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Immutable snapshot of a whole game. Every processed action replaces it with a new snapshot.
 */
@Value
@Builder(toBuilder = true)
public class GameState {
    String id;
    @Singular
    List<Player> players;
    int currentPlayerIndex;
    TurnPhase turnPhase;
    ActiveCard activeCard;
    DiceResult diceResult;
    DeckState decks;
    @Singular("logEntry")
    List<GameLogEntry> log;
    int turnNumber;
    String winner;
    PendingPlayerDeal pendingPlayerDeal;
    int nextAssetId;
    int payDaysRemaining;

    public Player currentPlayer() {
        return players.get(currentPlayerIndex);
    }

    public Optional<Player> findPlayer(String playerId) {
        return players.stream().filter(p -> p.getId().equals(playerId)).findFirst();
    }

    public int indexOf(String playerId) {
        for (int i = 0; i < players.size(); i++) {
            if (players.get(i).getId().equals(playerId)) {
                return i;
            }
        }
        return -1;
    }

    public GameState withPlayer(int index, Player player) {
        List<Player> updated = new ArrayList<>(players);
        updated.set(index, player);
        return toBuilder().clearPlayers().players(updated).build();
    }

    public GameState withLog(String playerId, String message, long timestamp) {
        return toBuilder().logEntry(new GameLogEntry(timestamp, playerId, message)).build();
    }

    public GameState withPhase(TurnPhase phase) {
        return toBuilder().turnPhase(phase).build();
    }
}
