package com.cashflow.model;

import com.cashflow.model.card.DealCard;
import com.cashflow.model.card.DoodadCard;
import com.cashflow.model.card.MarketCard;
import lombok.Builder;
import lombok.Value;

/**
 * The four card decks of a game.
 */
@Value
@Builder(toBuilder = true)
public class DeckState {
    Deck<DealCard> smallDeals;
    Deck<DealCard> bigDeals;
    Deck<MarketCard> market;
    Deck<DoodadCard> doodads;

    public DeckState hidden() {
        return new DeckState(smallDeals.hidden(), bigDeals.hidden(), market.hidden(), doodads.hidden());
    }
}
