package com.cashflow.engine;

import com.cashflow.model.board.FastTrackSpace;
import com.cashflow.model.board.FastTrackSpaceType;
import com.cashflow.model.board.RatRaceSpace;
import com.cashflow.model.board.RatRaceSpaceType;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.cashflow.model.board.FastTrackSpaceType.*;
import static com.cashflow.model.board.RatRaceSpaceType.*;

/**
 * Layout of both tracks and the arithmetic of moving around them.
 */
public final class BoardTopology {

    public static final int RAT_RACE_SIZE = 24;
    public static final int FAST_TRACK_SIZE = 18;

    public static final Set<Integer> PAY_DAY_POSITIONS = Set.of(4, 10, 16, 22);
    public static final Set<Integer> CASH_FLOW_DAY_POSITIONS = Set.of(0, 4, 8, 12, 16);

    private static final RatRaceSpaceType[] RAT_RACE_LAYOUT = {
            DEAL, DOODAD, MARKET, DEAL, PAY_DAY, DEAL,
            BABY, DEAL, MARKET, DEAL, PAY_DAY, DOODAD,
            DEAL, RatRaceSpaceType.CHARITY, DEAL, MARKET, PAY_DAY, DEAL,
            DOWNSIZED, DEAL, DOODAD, DEAL, PAY_DAY, MARKET
    };

    public static final List<RatRaceSpace> RAT_RACE_SPACES = buildRatRace();

    public static final List<FastTrackSpace> FAST_TRACK_SPACES = List.of(
            new FastTrackSpace(0, CASH_FLOW_DAY, "Cash Flow Day", null),
            new FastTrackSpace(1, DREAM, "World Travel", "World Travel"),
            new FastTrackSpace(2, BUSINESS_DEAL, "Business Deal", null),
            new FastTrackSpace(3, FastTrackSpaceType.CHARITY, "Charity", null),
            new FastTrackSpace(4, CASH_FLOW_DAY, "Cash Flow Day", null),
            new FastTrackSpace(5, DREAM, "Private Jet", "Private Jet"),
            new FastTrackSpace(6, TAX, "Tax Audit", null),
            new FastTrackSpace(7, BUSINESS_DEAL, "Business Deal", null),
            new FastTrackSpace(8, CASH_FLOW_DAY, "Cash Flow Day", null),
            new FastTrackSpace(9, DREAM, "Amazon Rainforest Adventure", "Amazon Rainforest Adventure"),
            new FastTrackSpace(10, LAWSUIT, "Lawsuit", null),
            new FastTrackSpace(11, BUSINESS_DEAL, "Business Deal", null),
            new FastTrackSpace(12, CASH_FLOW_DAY, "Cash Flow Day", null),
            new FastTrackSpace(13, DREAM, "African Safari", "African Safari"),
            new FastTrackSpace(14, DIVORCE, "Divorce", null),
            new FastTrackSpace(15, BUSINESS_DEAL, "Business Deal", null),
            new FastTrackSpace(16, CASH_FLOW_DAY, "Cash Flow Day", null),
            new FastTrackSpace(17, DREAM, "Education Foundation", "Education Foundation")
    );

    private BoardTopology() {
    }

    public static int move(int position, int roll) {
        return Math.floorMod(position + roll, RAT_RACE_SIZE);
    }

    public static int moveFastTrack(int position, int roll) {
        return Math.floorMod(position + roll, FAST_TRACK_SIZE);
    }

    public static RatRaceSpaceType spaceType(int position) {
        return RAT_RACE_LAYOUT[Math.floorMod(position, RAT_RACE_SIZE)];
    }

    public static FastTrackSpace fastTrackSpace(int position) {
        return FAST_TRACK_SPACES.get(Math.floorMod(position, FAST_TRACK_SIZE));
    }

    public static FastTrackSpaceType fastTrackSpaceType(int position) {
        return fastTrackSpace(position).type();
    }

    public static boolean isDream(String dream) {
        return dream != null && FAST_TRACK_SPACES.stream().anyMatch(s -> dream.equals(s.dream()));
    }

    public static List<String> dreams() {
        return FAST_TRACK_SPACES.stream().filter(s -> s.type() == DREAM).map(FastTrackSpace::dream).toList();
    }

    /**
     * Number of PayDay spaces passed moving from {@code oldPosition} to {@code newPosition}.
     * Landing on a PayDay counts. Equal positions mean a full lap.
     */
    public static int countPayDaysPassed(int oldPosition, int newPosition) {
        return countMarkersPassed(PAY_DAY_POSITIONS, oldPosition, newPosition);
    }

    public static int countCashFlowDaysPassed(int oldPosition, int newPosition) {
        return countMarkersPassed(CASH_FLOW_DAY_POSITIONS, oldPosition, newPosition);
    }

    /**
     * Die total: the first die alone, or both when two dice are in play.
     */
    public static int diceTotal(int die1, int die2, boolean useBothDice) {
        return useBothDice ? die1 + die2 : die1;
    }

    private static int countMarkersPassed(Set<Integer> markers, int oldPosition, int newPosition) {
        int count = 0;
        for (int marker : markers) {
            boolean passed = newPosition > oldPosition
                    ? marker > oldPosition && marker <= newPosition
                    : marker > oldPosition || marker <= newPosition;
            if (passed) {
                count++;
            }
        }
        return count;
    }

    private static List<RatRaceSpace> buildRatRace() {
        List<RatRaceSpace> spaces = new ArrayList<>(RAT_RACE_SIZE);
        for (int i = 0; i < RAT_RACE_LAYOUT.length; i++) {
            spaces.add(new RatRaceSpace(i, RAT_RACE_LAYOUT[i], label(RAT_RACE_LAYOUT[i])));
        }
        return List.copyOf(spaces);
    }

    private static String label(RatRaceSpaceType type) {
        switch (type) {
            case PAY_DAY:
                return "PayDay";
            case DOWNSIZED:
                return "Downsized";
            default:
                String name = type.name();
                return name.charAt(0) + name.substring(1).toLowerCase();
        }
    }
}
