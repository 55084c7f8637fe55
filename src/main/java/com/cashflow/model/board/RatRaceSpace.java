package com.cashflow.model.board;

public record RatRaceSpace(int index, RatRaceSpaceType type, String label) {
}
