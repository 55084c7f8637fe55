package com.cashflow.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for opening a new room. The creator joins as host.
 * Uses an Integer wrapper so Jackson 3 leaves an absent max as null.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CreateRoomRequest {

    @NotBlank(message = "Room name is required")
    @Size(min = 3, max = 50, message = "Room name must be between 3 and 50 characters")
    private String roomName;

    @NotBlank(message = "Player name is required")
    @Size(min = 2, max = 30, message = "Player name must be between 2 and 30 characters")
    private String playerName;

    private Integer maxPlayers;
}
