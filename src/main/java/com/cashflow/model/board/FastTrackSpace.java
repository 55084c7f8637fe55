package com.cashflow.model.board;

/**
 * A space on the outer track. {@code dream} is only set on dream spaces.
 */
public record FastTrackSpace(int index, FastTrackSpaceType type, String label, String dream) {
}
