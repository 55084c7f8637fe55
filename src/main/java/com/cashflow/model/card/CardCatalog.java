package com.cashflow.model.card;

import java.util.List;

/**
 * All static card data a game is dealt from.
 */
public record CardCatalog(
        List<ProfessionCard> professions,
        List<DealCard> smallDeals,
        List<DealCard> bigDeals,
        List<MarketCard> marketCards,
        List<DoodadCard> doodads
) {
    public CardCatalog {
        professions = List.copyOf(professions);
        smallDeals = List.copyOf(smallDeals);
        bigDeals = List.copyOf(bigDeals);
        marketCards = List.copyOf(marketCards);
        doodads = List.copyOf(doodads);
    }
}
