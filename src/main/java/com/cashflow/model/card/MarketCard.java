package com.cashflow.model.card;

public record MarketCard(String id, String title, String description, MarketEffect effect) {
}
