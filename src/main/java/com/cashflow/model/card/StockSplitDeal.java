package com.cashflow.model.card;

/**
 * Applies to every holder of {@code symbol}. A ratio below 1 is a reverse split.
 */
public record StockSplitDeal(String name, String symbol, double splitRatio, String description) implements Deal {
}
