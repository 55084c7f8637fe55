package com.cashflow.model.asset;

/**
 * Mortgaged assets that produce a fixed monthly cash flow.
 */
public sealed interface PropertyAsset extends Asset permits RealEstateAsset, BusinessAsset {

    int cost();

    int mortgage();

    int downPayment();

    int cashFlow();
}
