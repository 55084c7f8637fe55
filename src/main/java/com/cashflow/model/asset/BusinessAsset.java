package com.cashflow.model.asset;

public record BusinessAsset(String id, String name, int cost, int mortgage,
                            int downPayment, int cashFlow) implements PropertyAsset {
}
