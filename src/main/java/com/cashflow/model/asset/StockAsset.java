package com.cashflow.model.asset;

public record StockAsset(String id, String name, String symbol, int shares,
                         double costPerShare, double dividendPerShare) implements Asset {

    public StockAsset withShares(int newShares) {
        return new StockAsset(id, name, symbol, newShares, costPerShare, dividendPerShare);
    }
}
