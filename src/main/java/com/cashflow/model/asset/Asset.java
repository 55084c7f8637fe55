package com.cashflow.model.asset;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * An asset on a player's balance sheet, discriminated by {@code kind}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = StockAsset.class, name = "stock"),
        @JsonSubTypes.Type(value = RealEstateAsset.class, name = "realEstate"),
        @JsonSubTypes.Type(value = BusinessAsset.class, name = "business")
})
public sealed interface Asset permits StockAsset, PropertyAsset {

    String id();

    String name();
}
