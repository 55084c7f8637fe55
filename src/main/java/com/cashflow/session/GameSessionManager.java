package com.cashflow.session;

import com.cashflow.config.CardCatalogLoader;
import com.cashflow.engine.GameEngine;
import com.cashflow.model.GameState;
import com.cashflow.model.PlayerSeat;
import com.cashflow.model.card.ProfessionCard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the live {@link GameSession} of every started room.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GameSessionManager {

    private final GameEngine gameEngine;
    private final CardCatalogLoader cardCatalogLoader;
    private final Random gameRandom;
    private final RoomActionQueue roomActionQueue;

    private final Map<String, GameSession> sessions = new ConcurrentHashMap<>();

    /**
     * Deals a new game for {@code roomId}. Professions are shuffled and cycled when there are
     * more players than professions.
     *
     * @throws IllegalStateException if the room already has a running game
     */
    public GameSession createSession(String roomId, List<PlayerSeat> seats) {
        if (sessions.containsKey(roomId)) {
            throw new IllegalStateException("Game already started for room " + roomId);
        }
        List<ProfessionCard> professions = new ArrayList<>(cardCatalogLoader.getProfessions());
        Collections.shuffle(professions, gameRandom);

        GameState initial = gameEngine.createGame(roomId, seats, professions, cardCatalogLoader.getCatalog());
        GameSession session = new GameSession(roomId, gameEngine, gameRandom, initial);
        if (sessions.putIfAbsent(roomId, session) != null) {
            throw new IllegalStateException("Game already started for room " + roomId);
        }
        log.info("Created game session for room {} with {} players", roomId, seats.size());
        return session;
    }

    public Optional<GameSession> findSession(String roomId) {
        return Optional.ofNullable(sessions.get(roomId));
    }

    /**
     * @throws IllegalArgumentException if the room has no running game
     */
    public GameSession getSession(String roomId) {
        return findSession(roomId)
                .orElseThrow(() -> new IllegalArgumentException("No game in progress for room " + roomId));
    }

    public void destroySession(String roomId) {
        if (sessions.remove(roomId) != null) {
            roomActionQueue.close(roomId);
            log.info("Destroyed game session for room {}", roomId);
        }
    }

    public int activeSessionCount() {
        return sessions.size();
    }
}
