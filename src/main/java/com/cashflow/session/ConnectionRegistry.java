package com.cashflow.session;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Which player each STOMP connection speaks for.
 */
@Component
public class ConnectionRegistry {

    public record Binding(String roomId, String playerId) {
    }

    private final Map<String, Binding> bindings = new ConcurrentHashMap<>();

    public void bind(String connectionId, String roomId, String playerId) {
        bindings.put(connectionId, new Binding(roomId, playerId));
    }

    public Optional<Binding> unbind(String connectionId) {
        return Optional.ofNullable(bindings.remove(connectionId));
    }

    public Optional<Binding> find(String connectionId) {
        return Optional.ofNullable(connectionId).map(bindings::get);
    }

    public boolean isBound(String connectionId, String roomId, String playerId) {
        return find(connectionId)
                .map(b -> b.roomId().equals(roomId) && b.playerId().equals(playerId))
                .orElse(false);
    }
}
