package com.cashflow.model;

/**
 * One line of the append-only game log.
 */
public record GameLogEntry(long timestamp, String playerId, String message) {

    public static final String SYSTEM = "system";
}
