package com.cashflow.model.room;

/**
 * Lifecycle of a room.
 */
public enum RoomStatus {
    WAITING_FOR_PLAYERS,
    IN_PROGRESS,
    FINISHED
}
