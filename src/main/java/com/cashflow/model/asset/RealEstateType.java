package com.cashflow.model.asset;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Real estate categories referenced by deal and market cards.
 */
public enum RealEstateType {
    HOUSE("house"),
    CONDO("condo"),
    APARTMENT("apartment"),
    DUPLEX("duplex"),
    FOURPLEX("fourplex"),
    EIGHTPLEX("eightplex"),
    LAND("land"),
    COMMERCIAL("commercial");

    private final String code;

    RealEstateType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
