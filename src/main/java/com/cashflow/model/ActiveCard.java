package com.cashflow.model;

import com.cashflow.model.card.DealCard;
import com.cashflow.model.card.DoodadCard;
import com.cashflow.model.card.MarketCard;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * The card currently in play, tagged by the deck it was drawn from.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ActiveCard.SmallDeal.class, name = "smallDeal"),
        @JsonSubTypes.Type(value = ActiveCard.BigDeal.class, name = "bigDeal"),
        @JsonSubTypes.Type(value = ActiveCard.Market.class, name = "market"),
        @JsonSubTypes.Type(value = ActiveCard.Doodad.class, name = "doodad")
})
public sealed interface ActiveCard {

    /** Deal cards from either the small or the big deck. */
    sealed interface DealActive extends ActiveCard permits SmallDeal, BigDeal {
        DealCard card();
    }

    record SmallDeal(DealCard card) implements DealActive {
    }

    record BigDeal(DealCard card) implements DealActive {
    }

    record Market(MarketCard card) implements ActiveCard {
    }

    record Doodad(DoodadCard card) implements ActiveCard {
    }
}
