package com.cashflow.dto;

import com.cashflow.model.room.Room;
import com.cashflow.model.room.RoomStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * DTO for room representation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RoomDTO {

    private String id;
    private String name;
    private RoomStatus status;
    private String hostPlayerId;
    private int maxPlayers;
    private int minPlayers;
    private List<RoomPlayerDTO> players;

    public static RoomDTO fromRoom(Room room) {
        return RoomDTO.builder()
                .id(room.getId())
                .name(room.getName())
                .status(room.getStatus())
                .hostPlayerId(room.getHostPlayerId())
                .maxPlayers(room.getMaxPlayers())
                .minPlayers(room.getMinPlayers())
                .players(room.getPlayers().stream()
                        .map(p -> RoomPlayerDTO.fromPlayer(p, room.getHostPlayerId()))
                        .toList())
                .build();
    }
}
