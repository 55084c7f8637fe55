package com.cashflow.model.card;

/**
 * A card from the small deal or big deal deck.
 */
public record DealCard(String id, String title, Deal deal) {
}
