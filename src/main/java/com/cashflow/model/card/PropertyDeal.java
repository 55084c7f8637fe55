package com.cashflow.model.card;

/**
 * Deals bought with a down payment against a mortgage. Only these can be offered to another player.
 */
public sealed interface PropertyDeal extends Deal permits RealEstateDeal, BusinessDeal {

    int cost();

    int mortgage();

    int downPayment();

    int cashFlow();
}
