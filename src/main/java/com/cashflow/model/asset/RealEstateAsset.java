package com.cashflow.model.asset;

public record RealEstateAsset(String id, String name, RealEstateType subType, int cost,
                              int mortgage, int downPayment, int cashFlow) implements PropertyAsset {
}
