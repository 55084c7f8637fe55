package com.cashflow.model.card;

public record StockDeal(String name, String symbol, double costPerShare, double dividendPerShare,
                        PriceRange historicalPriceRange, String description) implements Deal {

    public record PriceRange(int low, int high) {
    }
}
