package com.cashflow.dto;

import com.cashflow.model.room.RoomPlayer;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for a seat in a room. The session token is never exposed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RoomPlayerDTO {

    private String id;
    private String name;
    private int seatOrder;
    private boolean ready;
    private boolean host;

    public static RoomPlayerDTO fromPlayer(RoomPlayer player, String hostPlayerId) {
        return RoomPlayerDTO.builder()
                .id(player.getId())
                .name(player.getName())
                .seatOrder(player.getSeatOrder())
                .ready(player.isReady())
                .host(player.getId() != null && player.getId().equals(hostPlayerId))
                .build();
    }
}
