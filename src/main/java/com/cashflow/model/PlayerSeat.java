package com.cashflow.model;

/**
 * A participant joining a new game.
 */
public record PlayerSeat(String id, String name) {
}
