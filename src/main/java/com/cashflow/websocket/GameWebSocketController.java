package com.cashflow.websocket;

import com.cashflow.model.action.GameAction;
import com.cashflow.service.GameActionService;
import com.cashflow.service.RoomService;
import com.cashflow.session.ConnectionRegistry;
import com.cashflow.session.GameSessionManager;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.DestinationVariable;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

/**
 * WebSocket controller for real-time game interactions.
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class GameWebSocketController {

    private final GameActionService gameActionService;
    private final RoomService roomService;
    private final GameSessionManager gameSessionManager;
    private final ConnectionRegistry connectionRegistry;
    private final GameWebSocketHandler webSocketHandler;

    /**
     * Binds this STOMP connection to a seat. The token must be the one the seat was taken with.
     */
    @MessageMapping("/room/{roomId}/connect")
    public void handleConnect(@DestinationVariable String roomId,
                              @Payload ConnectMessage message,
                              SimpMessageHeaderAccessor headerAccessor) {
        log.debug("Connect request from player {} in room {}", message.getPlayerId(), roomId);

        try {
            roomService.authorize(roomId, message.getPlayerId(), message.getSessionId());
            connectionRegistry.bind(headerAccessor.getSessionId(), roomId, message.getPlayerId());
            gameSessionManager.findSession(roomId)
                    .ifPresent(session -> webSocketHandler.broadcastGameState(roomId, session.getSanitizedState()));
        } catch (Exception e) {
            log.error("Error processing connect", e);
            sendError(roomId, message.getPlayerId(), e.getMessage());
        }
    }

    /**
     * Submits a game action. The result is broadcast once the room's queue has applied it.
     */
    @MessageMapping("/room/{roomId}/action")
    public void handleAction(@DestinationVariable String roomId,
                             @Payload GameAction action,
                             SimpMessageHeaderAccessor headerAccessor) {
        log.debug("Action {} from {} in room {}", action.type(), action.playerId(), roomId);

        try {
            gameActionService.submitFromConnection(roomId, action, headerAccessor.getSessionId());
        } catch (Exception e) {
            log.error("Error processing action", e);
            sendError(roomId, action.playerId(), e.getMessage());
        }
    }

    private void sendError(String roomId, String playerId, String error) {
        log.warn("Error in room {}: {}", roomId, error);
        webSocketHandler.broadcastError(roomId, playerId, error);
    }

    // Message DTOs
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ConnectMessage {
        private String playerId;
        private String sessionId;
    }
}
