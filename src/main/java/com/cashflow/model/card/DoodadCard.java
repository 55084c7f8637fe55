package com.cashflow.model.card;

/**
 * A mandatory expense. When {@code percentOfIncome} is set, {@code cost} is a percentage of total income.
 */
public record DoodadCard(String id, String title, String description, int cost, boolean percentOfIncome) {
}
