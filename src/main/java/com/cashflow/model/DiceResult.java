package com.cashflow.model;

/**
 * The last dice roll applied to the board.
 */
public record DiceResult(int die1, int die2, int total) {
}
