package com.cashflow.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Returned from create and join: the room plus the seat the caller now holds.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JoinRoomResponse {

    private String playerId;
    private RoomDTO room;
}
