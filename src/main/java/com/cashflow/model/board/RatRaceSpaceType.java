package com.cashflow.model.board;

public enum RatRaceSpaceType {
    DEAL,
    MARKET,
    DOODAD,
    PAY_DAY,
    CHARITY,
    BABY,
    DOWNSIZED
}
