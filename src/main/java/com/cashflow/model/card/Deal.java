package com.cashflow.model.card;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * The investment printed on a small or big deal card.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = StockDeal.class, name = "stock"),
        @JsonSubTypes.Type(value = RealEstateDeal.class, name = "realEstate"),
        @JsonSubTypes.Type(value = BusinessDeal.class, name = "business"),
        @JsonSubTypes.Type(value = StockSplitDeal.class, name = "stockSplit")
})
public sealed interface Deal permits StockDeal, PropertyDeal, StockSplitDeal {

    String name();

    String description();
}
