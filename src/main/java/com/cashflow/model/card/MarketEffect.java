package com.cashflow.model.card;

import com.cashflow.model.asset.RealEstateType;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * What a market card does when drawn.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = MarketEffect.StockPriceChange.class, name = "stockPriceChange"),
        @JsonSubTypes.Type(value = MarketEffect.RealEstateOffer.class, name = "realEstateOffer"),
        @JsonSubTypes.Type(value = MarketEffect.RealEstateOfferFlat.class, name = "realEstateOfferFlat"),
        @JsonSubTypes.Type(value = MarketEffect.DamageToProperty.class, name = "damageToProperty"),
        @JsonSubTypes.Type(value = MarketEffect.AllPlayersExpense.class, name = "allPlayersExpense")
})
public sealed interface MarketEffect {

    String description();

    /** Holders of {@code symbol} may sell every share at {@code newPrice}. */
    record StockPriceChange(String symbol, double newPrice, String description) implements MarketEffect {
    }

    /** Owners of matching property may sell at {@code floor(cost * offerMultiplier)}. */
    record RealEstateOffer(List<RealEstateType> subTypes, double offerMultiplier,
                           String description) implements MarketEffect {
    }

    record RealEstateOfferFlat(List<RealEstateType> subTypes, int offerAmount,
                               String description) implements MarketEffect {
    }

    record DamageToProperty(List<RealEstateType> subTypes, int cost, String description) implements MarketEffect {
    }

    record AllPlayersExpense(int amount, String description) implements MarketEffect {
    }
}
