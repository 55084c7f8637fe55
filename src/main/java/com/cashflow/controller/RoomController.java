package com.cashflow.controller;

import com.cashflow.dto.CreateRoomRequest;
import com.cashflow.dto.JoinRoomRequest;
import com.cashflow.dto.JoinRoomResponse;
import com.cashflow.dto.RoomDTO;
import com.cashflow.model.GameState;
import com.cashflow.model.action.ActionType;
import com.cashflow.model.action.GameAction;
import com.cashflow.model.room.Room;
import com.cashflow.model.room.RoomPlayer;
import com.cashflow.service.GameActionService;
import com.cashflow.service.RoomService;
import com.cashflow.session.ActionResult;
import com.cashflow.session.GameSession;
import com.cashflow.session.GameSessionManager;
import com.cashflow.websocket.GameWebSocketHandler;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API controller for rooms and their games.
 */
@RestController
@RequestMapping("/api/rooms")
@RequiredArgsConstructor
@Slf4j
@CrossOrigin(origins = "*")
public class RoomController {

    private static final String SESSION_HEADER = "X-Session-Id";

    private final RoomService roomService;
    private final GameSessionManager gameSessionManager;
    private final GameActionService gameActionService;
    private final GameWebSocketHandler webSocketHandler;

    /**
     * List rooms.
     */
    @GetMapping
    public ResponseEntity<List<RoomDTO>> getRooms(
            @RequestParam(required = false, defaultValue = "false") boolean joinableOnly) {
        return ResponseEntity.ok(roomService.listRooms(joinableOnly).stream().map(RoomDTO::fromRoom).toList());
    }

    /**
     * Create a room; the caller becomes host.
     */
    @PostMapping
    public ResponseEntity<JoinRoomResponse> createRoom(@Valid @RequestBody CreateRoomRequest request,
                                                       @RequestHeader(value = SESSION_HEADER, required = false) String sessionId) {
        log.info("Creating room: {}", request.getRoomName());
        RoomPlayer host = roomService.createRoom(request, sessionId);
        Room room = roomService.getRoom(host.getRoom().getId());
        return ResponseEntity.ok(new JoinRoomResponse(host.getId(), RoomDTO.fromRoom(room)));
    }

    @GetMapping("/{roomId}")
    public ResponseEntity<RoomDTO> getRoom(@PathVariable String roomId) {
        return ResponseEntity.ok(RoomDTO.fromRoom(roomService.getRoom(roomId)));
    }

    @PostMapping("/{roomId}/join")
    public ResponseEntity<JoinRoomResponse> joinRoom(@PathVariable String roomId,
                                                     @Valid @RequestBody JoinRoomRequest request,
                                                     @RequestHeader(value = SESSION_HEADER, required = false) String sessionId) {
        log.info("Player {} joining room {}", request.getPlayerName(), roomId);
        RoomPlayer player = roomService.joinRoom(roomId, request, sessionId);

        RoomDTO room = RoomDTO.fromRoom(roomService.getRoom(roomId));
        webSocketHandler.broadcastRoomUpdate(roomId, room);
        return ResponseEntity.ok(new JoinRoomResponse(player.getId(), room));
    }

    /**
     * Leave a room. Responds 204 when the last player left and the room was closed.
     */
    @PostMapping("/{roomId}/leave")
    public ResponseEntity<RoomDTO> leaveRoom(@PathVariable String roomId,
                                             @RequestHeader(value = SESSION_HEADER, required = false) String sessionId) {
        Room room = roomService.leaveRoom(roomId, sessionId);
        if (room == null) {
            return ResponseEntity.noContent().build();
        }
        RoomDTO dto = RoomDTO.fromRoom(roomService.getRoom(roomId));
        webSocketHandler.broadcastRoomUpdate(roomId, dto);
        return ResponseEntity.ok(dto);
    }

    @PostMapping("/{roomId}/ready")
    public ResponseEntity<RoomDTO> setReady(@PathVariable String roomId,
                                            @RequestParam(defaultValue = "true") boolean ready,
                                            @RequestHeader(value = SESSION_HEADER, required = false) String sessionId) {
        roomService.setReady(roomId, sessionId, ready);
        RoomDTO dto = RoomDTO.fromRoom(roomService.getRoom(roomId));
        webSocketHandler.broadcastRoomUpdate(roomId, dto);
        return ResponseEntity.ok(dto);
    }

    /**
     * Start the game (host only).
     */
    @PostMapping("/{roomId}/start")
    public ResponseEntity<GameState> startGame(@PathVariable String roomId,
                                               @RequestHeader(value = SESSION_HEADER, required = false) String sessionId) {
        log.info("Starting game in room {}", roomId);
        roomService.startGame(roomId, sessionId);

        GameState state = gameSessionManager.getSession(roomId).getSanitizedState();
        webSocketHandler.broadcastGameStarted(roomId, state);
        return ResponseEntity.ok(state);
    }

    /**
     * Current game state with deck contents hidden.
     */
    @GetMapping("/{roomId}/state")
    public ResponseEntity<GameState> getState(@PathVariable String roomId) {
        return ResponseEntity.ok(gameSessionManager.getSession(roomId).getSanitizedState());
    }

    /**
     * Legal actions for a player, or for the current player when none is named.
     */
    @GetMapping("/{roomId}/actions")
    public ResponseEntity<List<ActionType>> getValidActions(@PathVariable String roomId,
                                                            @RequestParam(required = false) String playerId) {
        GameSession session = gameSessionManager.getSession(roomId);
        return ResponseEntity.ok(playerId == null ? session.getValidActions() : session.getValidActions(playerId));
    }

    /**
     * Submit an action. A rejected action answers 400 with the validator's error.
     */
    @PostMapping("/{roomId}/actions")
    public ResponseEntity<ActionResult> submitAction(@PathVariable String roomId,
                                                     @RequestBody GameAction action,
                                                     @RequestHeader(value = SESSION_HEADER, required = false) String sessionId) {
        ActionResult result = gameActionService.submitWithSessionToken(roomId, action, sessionId).join();
        return result.success() ? ResponseEntity.ok(result) : ResponseEntity.badRequest().body(result);
    }
}
