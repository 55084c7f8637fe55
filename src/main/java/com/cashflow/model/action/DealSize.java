package com.cashflow.model.action;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DealSize {
    SMALL("small"),
    BIG("big");

    private final String code;

    DealSize(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
