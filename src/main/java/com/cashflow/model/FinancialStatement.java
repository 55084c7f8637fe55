package com.cashflow.model;

import com.cashflow.model.asset.Asset;
import com.cashflow.model.asset.StockAsset;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A player's balance sheet. Passive income is always derived from the assets.
 */
@Value
@Builder(toBuilder = true)
public class FinancialStatement {
    int salary;
    Expenses expenses;
    @Singular
    List<Asset> assets;
    @Singular
    List<Liability> liabilities;

    public Optional<Asset> findAsset(String assetId) {
        return assets.stream().filter(a -> a.id().equals(assetId)).findFirst();
    }

    public Optional<StockAsset> findStock(String symbol) {
        return assets.stream()
                .filter(StockAsset.class::isInstance)
                .map(StockAsset.class::cast)
                .filter(s -> s.symbol().equals(symbol))
                .findFirst();
    }

    public Optional<Liability> findLiability(String name) {
        return liabilities.stream().filter(l -> l.name().equals(name)).findFirst();
    }

    public FinancialStatement withAsset(Asset asset) {
        return toBuilder().asset(asset).build();
    }

    public FinancialStatement withoutAsset(String assetId) {
        return toBuilder().clearAssets()
                .assets(assets.stream().filter(a -> !a.id().equals(assetId)).toList())
                .build();
    }

    /**
     * Replaces the asset carrying the same id.
     */
    public FinancialStatement replaceAsset(Asset replacement) {
        List<Asset> updated = new ArrayList<>(assets.size());
        for (Asset a : assets) {
            updated.add(a.id().equals(replacement.id()) ? replacement : a);
        }
        return toBuilder().clearAssets().assets(updated).build();
    }

    public FinancialStatement withAssets(List<Asset> newAssets) {
        return toBuilder().clearAssets().assets(newAssets).build();
    }

    public FinancialStatement withLiabilities(List<Liability> newLiabilities) {
        return toBuilder().clearLiabilities().liabilities(newLiabilities).build();
    }

    public FinancialStatement withExpenses(Expenses newExpenses) {
        return toBuilder().expenses(newExpenses).build();
    }
}
