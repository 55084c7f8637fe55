package com.cashflow.model.card;

public record BusinessDeal(String name, int cost, int mortgage, int downPayment,
                           int cashFlow, String description) implements PropertyDeal {
}
