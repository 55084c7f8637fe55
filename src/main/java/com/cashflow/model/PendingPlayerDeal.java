package com.cashflow.model;

import com.cashflow.model.card.Deal;

/**
 * A deal card offered by the current player to another player.
 */
public record PendingPlayerDeal(String sellerId, String buyerId, Deal deal, int askingPrice) {
}
