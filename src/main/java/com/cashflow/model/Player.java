package com.cashflow.model;

import lombok.Builder;
import lombok.Value;

/**
 * A player's full in-game state. Instances are immutable; every change yields a copy.
 */
@Value
@Builder(toBuilder = true)
public class Player {
    String id;
    String name;
    String profession;
    FinancialStatement financialStatement;
    int cash;
    int position;
    boolean inFastTrack;
    int fastTrackPosition;
    int fastTrackCashFlow;
    boolean escaped;
    boolean won;
    String dream;
    int downsizedTurnsLeft;
    int charityTurnsLeft;
    int bankLoanAmount;
    boolean bankrupt;
    int bankruptTurnsLeft;

    public Player withCash(int newCash) {
        return toBuilder().cash(newCash).build();
    }

    public Player withFinancialStatement(FinancialStatement statement) {
        return toBuilder().financialStatement(statement).build();
    }
}
