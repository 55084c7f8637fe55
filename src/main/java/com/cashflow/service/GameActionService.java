package com.cashflow.service;

import com.cashflow.exception.UnauthorizedActionException;
import com.cashflow.model.GameState;
import com.cashflow.model.Player;
import com.cashflow.model.TurnPhase;
import com.cashflow.model.action.GameAction;
import com.cashflow.session.ActionResult;
import com.cashflow.session.ConnectionRegistry;
import com.cashflow.session.GameSession;
import com.cashflow.session.GameSessionManager;
import com.cashflow.session.RoomActionQueue;
import com.cashflow.websocket.GameWebSocketHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * The action pipeline: authorize, enqueue on the room's FIFO, apply, broadcast.
 * <p>
 * Authorization happens on the caller's thread, so an unauthorized action never reaches the
 * queue. Broadcasting happens inside the queued task so that updates leave in the order the
 * actions were applied.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GameActionService {

    static final String ACTION_FAILED = "Action could not be applied";

    private final GameSessionManager gameSessionManager;
    private final RoomActionQueue roomActionQueue;
    private final RoomService roomService;
    private final ConnectionRegistry connectionRegistry;
    private final GameWebSocketHandler webSocketHandler;

    /**
     * Submits an action authorized by the {@code X-Session-Id} token of the acting player.
     */
    public CompletableFuture<ActionResult> submitWithSessionToken(String roomId, GameAction action, String sessionId) {
        requireActor(action);
        roomService.authorize(roomId, action.playerId(), sessionId);
        return enqueue(roomId, action);
    }

    /**
     * Submits an action arriving on a STOMP connection, which must be bound to the acting player.
     */
    public CompletableFuture<ActionResult> submitFromConnection(String roomId, GameAction action, String connectionId) {
        requireActor(action);
        if (!connectionRegistry.isBound(connectionId, roomId, action.playerId())) {
            log.warn("Connection {} is not bound to player {} in room {}", connectionId, action.playerId(), roomId);
            throw new UnauthorizedActionException();
        }
        return enqueue(roomId, action);
    }

    CompletableFuture<ActionResult> enqueue(String roomId, GameAction action) {
        GameSession session = gameSessionManager.getSession(roomId);
        return roomActionQueue.submit(roomId, () -> {
            ActionResult result = session.processAction(action);
            publish(roomId, action, result);
            return result;
        }).whenComplete((result, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                log.error("Failed to apply {} from {} in room {}", action.type(), action.playerId(), roomId, cause);
                webSocketHandler.broadcastError(roomId, action.playerId(), ACTION_FAILED);
            }
        });
    }

    private void publish(String roomId, GameAction action, ActionResult result) {
        if (!result.success()) {
            log.warn("Rejected {} from {} in room {}: {}", action.type(), action.playerId(), roomId, result.error());
            webSocketHandler.broadcastError(roomId, action.playerId(), result.error());
            return;
        }

        GameState state = result.state();
        log.debug("Applied {} from {} in room {}", action.type(), action.playerId(), roomId);
        webSocketHandler.broadcastGameState(roomId, state);

        if (state.getTurnPhase() == TurnPhase.GAME_OVER) {
            String winnerName = state.getWinner() == null ? null
                    : state.findPlayer(state.getWinner()).map(Player::getName).orElse(null);
            webSocketHandler.broadcastGameOver(roomId, winnerName);
            roomService.finishRoom(roomId);
        }
    }

    private static void requireActor(GameAction action) {
        if (action == null || action.playerId() == null || action.playerId().isBlank()) {
            throw new IllegalArgumentException("Action must name the acting player");
        }
    }
}
