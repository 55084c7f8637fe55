package com.cashflow.model.board;

public enum FastTrackSpaceType {
    CASH_FLOW_DAY,
    BUSINESS_DEAL,
    CHARITY,
    TAX,
    LAWSUIT,
    DIVORCE,
    DREAM
}
