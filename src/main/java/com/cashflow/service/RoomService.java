package com.cashflow.service;

import com.cashflow.dto.CreateRoomRequest;
import com.cashflow.dto.JoinRoomRequest;
import com.cashflow.exception.UnauthorizedActionException;
import com.cashflow.model.PlayerSeat;
import com.cashflow.model.room.Room;
import com.cashflow.model.room.RoomPlayer;
import com.cashflow.model.room.RoomStatus;
import com.cashflow.repository.RoomPlayerRepository;
import com.cashflow.repository.RoomRepository;
import com.cashflow.session.GameSessionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Room lifecycle: create, join, leave, ready up, and start.
 * <p>
 * Every seat-level operation identifies the caller by the {@code X-Session-Id} token stored
 * when the seat was taken.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional
public class RoomService {

    private final RoomRepository roomRepository;
    private final RoomPlayerRepository roomPlayerRepository;
    private final GameSessionManager gameSessionManager;

    @Value("${game.rooms.max-players:6}")
    private int maxPlayers = 6;

    @Value("${game.rooms.min-players:2}")
    private int minPlayers = 2;

    /**
     * Opens a room with the caller seated as host.
     */
    public RoomPlayer createRoom(CreateRoomRequest request, String sessionId) {
        requireSession(sessionId);
        int capacity = request.getMaxPlayers() != null
                ? Math.max(minPlayers, Math.min(request.getMaxPlayers(), maxPlayers))
                : maxPlayers;

        Room room = roomRepository.save(Room.builder()
                .name(request.getRoomName())
                .status(RoomStatus.WAITING_FOR_PLAYERS)
                .maxPlayers(capacity)
                .minPlayers(minPlayers)
                .build());

        RoomPlayer host = addPlayer(room, request.getPlayerName(), sessionId);
        room.setHostPlayerId(host.getId());
        roomRepository.save(room);

        log.info("Room '{}' ({}) created by {}", room.getName(), room.getId(), host.getName());
        return host;
    }

    public RoomPlayer joinRoom(String roomId, JoinRoomRequest request, String sessionId) {
        requireSession(sessionId);
        Room room = getRoom(roomId);

        if (room.getStatus() != RoomStatus.WAITING_FOR_PLAYERS) {
            throw new IllegalStateException("Room is not accepting new players");
        }
        if (room.isFull()) {
            throw new IllegalStateException("Room is full");
        }
        if (roomPlayerRepository.findByRoomIdAndSessionId(roomId, sessionId).isPresent()) {
            throw new IllegalStateException("Already joined this room");
        }
        if (roomPlayerRepository.existsByRoomIdAndName(roomId, request.getPlayerName())) {
            throw new IllegalArgumentException("Player name already taken");
        }
        return addPlayer(room, request.getPlayerName(), sessionId);
    }

    /**
     * Removes the caller's seat. An emptied room is deleted; a departing host hands over to
     * the next seat.
     *
     * @return the room after the change, or {@code null} if it was deleted
     */
    public Room leaveRoom(String roomId, String sessionId) {
        Room room = getRoom(roomId);
        RoomPlayer player = requirePlayer(roomId, sessionId);
        if (room.getStatus() == RoomStatus.IN_PROGRESS) {
            throw new IllegalStateException("Cannot leave a game in progress");
        }

        room.getPlayers().remove(player);
        log.info("Player {} left room {}", player.getName(), roomId);

        if (room.getPlayers().isEmpty()) {
            closeRoom(room);
            return null;
        }
        if (player.getId().equals(room.getHostPlayerId())) {
            RoomPlayer newHost = room.getPlayers().get(0);
            room.setHostPlayerId(newHost.getId());
            log.info("Player {} is now host of room {}", newHost.getName(), roomId);
        }
        for (int i = 0; i < room.getPlayers().size(); i++) {
            room.getPlayers().get(i).setSeatOrder(i);
        }
        return roomRepository.save(room);
    }

    public Room setReady(String roomId, String sessionId, boolean ready) {
        Room room = getRoom(roomId);
        if (room.getStatus() != RoomStatus.WAITING_FOR_PLAYERS) {
            throw new IllegalStateException("Game has already started");
        }
        RoomPlayer player = requirePlayer(roomId, sessionId);
        player.setReady(ready);
        roomPlayerRepository.save(player);
        log.debug("Player {} in room {} is {}", player.getName(), roomId, ready ? "ready" : "not ready");
        return room;
    }

    /**
     * Starts the game. Only the host may start, and only once every seated player is ready.
     */
    public Room startGame(String roomId, String sessionId) {
        Room room = getRoom(roomId);
        RoomPlayer caller = requirePlayer(roomId, sessionId);
        if (!caller.getId().equals(room.getHostPlayerId())) {
            throw new UnauthorizedActionException("only the host can start the game");
        }
        if (room.getStatus() != RoomStatus.WAITING_FOR_PLAYERS) {
            throw new IllegalStateException("Game has already started");
        }
        if (room.getPlayers().size() < room.getMinPlayers()) {
            throw new IllegalStateException("Need at least " + room.getMinPlayers() + " players to start");
        }
        if (!room.canStart()) {
            throw new IllegalStateException("All players must be ready");
        }

        List<PlayerSeat> seats = room.getPlayers().stream()
                .map(p -> new PlayerSeat(p.getId(), p.getName()))
                .toList();
        gameSessionManager.createSession(room.getId(), seats);

        room.setStatus(RoomStatus.IN_PROGRESS);
        room.setStartedAt(LocalDateTime.now());
        log.info("Room {} started with {} players", roomId, seats.size());
        return roomRepository.save(room);
    }

    /**
     * Marks a finished game's room and releases its session.
     */
    public void finishRoom(String roomId) {
        roomRepository.findWithPlayersById(roomId).ifPresent(room -> {
            room.setStatus(RoomStatus.FINISHED);
            roomRepository.save(room);
            gameSessionManager.destroySession(roomId);
            log.info("Room {} finished", roomId);
        });
    }

    @Transactional(readOnly = true)
    public Room getRoom(String roomId) {
        return roomRepository.findWithPlayersById(roomId)
                .orElseThrow(() -> new IllegalArgumentException("Room not found: " + roomId));
    }

    @Transactional(readOnly = true)
    public List<Room> listRooms(boolean joinableOnly) {
        return joinableOnly ? roomRepository.findJoinableRooms() : roomRepository.findAllWithPlayers();
    }

    /**
     * The seat held by {@code sessionId} in the room.
     *
     * @throws UnauthorizedActionException if the token holds no seat there
     */
    @Transactional(readOnly = true)
    public RoomPlayer requirePlayer(String roomId, String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new UnauthorizedActionException("missing session id");
        }
        return roomPlayerRepository.findByRoomIdAndSessionId(roomId, sessionId)
                .orElseThrow(() -> new UnauthorizedActionException("not seated in this room"));
    }

    /**
     * Checks that {@code sessionId} is the token of {@code playerId} in the room.
     */
    @Transactional(readOnly = true)
    public void authorize(String roomId, String playerId, String sessionId) {
        RoomPlayer seat = requirePlayer(roomId, sessionId);
        if (!seat.getId().equals(playerId)) {
            throw new UnauthorizedActionException("session is not bound to player " + playerId);
        }
    }

    RoomPlayer addPlayer(Room room, String name, String sessionId) {
        RoomPlayer player = RoomPlayer.builder()
                .name(name)
                .room(room)
                .seatOrder(room.getPlayers().size())
                .sessionId(sessionId)
                .joinedAt(LocalDateTime.now())
                .build();

        player = roomPlayerRepository.save(player);
        room.getPlayers().add(player);

        log.info("Player {} joined room {}", name, room.getName());
        return player;
    }

    private void closeRoom(Room room) {
        gameSessionManager.destroySession(room.getId());
        roomRepository.delete(room);
        log.info("Room {} closed", room.getId());
    }

    private static void requireSession(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("X-Session-Id header is required");
        }
    }
}
