package com.cashflow.model.card;

import com.cashflow.model.asset.RealEstateType;

public record RealEstateDeal(String name, RealEstateType subType, int cost, int mortgage,
                             int downPayment, int cashFlow, String description) implements PropertyDeal {
}
