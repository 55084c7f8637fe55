package com.cashflow.websocket;

import com.cashflow.dto.RoomDTO;
import com.cashflow.model.GameState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes room and game events to {@code /topic/room/{roomId}}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GameWebSocketHandler {

    static final String TOPIC_PREFIX = "/topic/room/";

    private final SimpMessagingTemplate messagingTemplate;

    /**
     * Broadcast a (sanitized) game state to every subscriber of the room.
     */
    public void broadcastGameState(String roomId, GameState state) {
        try {
            messagingTemplate.convertAndSend(TOPIC_PREFIX + roomId, GameMessage.gameUpdate(state));
            log.debug("Broadcast game update for room {} (turn {}, {})",
                    roomId, state.getTurnNumber(), state.getTurnPhase());
        } catch (RuntimeException e) {
            log.error("Error broadcasting game update for room {}", roomId, e);
        }
    }

    public void broadcastGameStarted(String roomId, GameState state) {
        messagingTemplate.convertAndSend(TOPIC_PREFIX + roomId, GameMessage.gameStarted(state));
    }

    public void broadcastRoomUpdate(String roomId, RoomDTO room) {
        messagingTemplate.convertAndSend(TOPIC_PREFIX + roomId, GameMessage.roomUpdate(room));
    }

    public void broadcastGameOver(String roomId, String winnerName) {
        messagingTemplate.convertAndSend(TOPIC_PREFIX + roomId, GameMessage.gameOver(winnerName));
    }

    /**
     * Broadcast an error message to the room (clients filter by playerId).
     */
    public void broadcastError(String roomId, String playerId, String error) {
        GameErrorMessage msg = new GameErrorMessage(playerId, error);
        messagingTemplate.convertAndSend(TOPIC_PREFIX + roomId, GameMessage.error(msg));
    }

    /**
     * Generic room message wrapper.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class GameMessage {
        private String type;
        private Object payload;
        private long timestamp;

        public static GameMessage gameUpdate(GameState state) {
            return of("GAME_UPDATE", state);
        }

        public static GameMessage gameStarted(GameState state) {
            return of("GAME_STARTED", state);
        }

        public static GameMessage roomUpdate(RoomDTO room) {
            return of("ROOM_UPDATE", room);
        }

        public static GameMessage gameOver(String winnerName) {
            return of("GAME_OVER", winnerName);
        }

        public static GameMessage error(GameErrorMessage error) {
            return of("ERROR", error);
        }

        private static GameMessage of(String type, Object payload) {
            return GameMessage.builder()
                    .type(type)
                    .payload(payload)
                    .timestamp(System.currentTimeMillis())
                    .build();
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GameErrorMessage {
        private String playerId;
        private String error;
    }
}
