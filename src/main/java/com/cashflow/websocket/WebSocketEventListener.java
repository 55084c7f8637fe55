package com.cashflow.websocket;

import com.cashflow.session.ConnectionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

/**
 * Drops the seat binding of a closed STOMP connection. Queued actions still run.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebSocketEventListener {

    private final ConnectionRegistry connectionRegistry;

    @EventListener
    public void handleDisconnect(SessionDisconnectEvent event) {
        connectionRegistry.unbind(event.getSessionId()).ifPresent(binding ->
                log.info("Player {} disconnected from room {}", binding.playerId(), binding.roomId()));
    }
}
