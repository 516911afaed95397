package com.cryptobot.core.model;

/**
 * Side of an open position.
 */
public enum Direction {
    LONG,
    SHORT;

    /**
     * +1 for longs, -1 for shorts. Multiplies raw price deltas into PnL.
     */
    public int sign() {
        return this == LONG ? 1 : -1;
    }

    public Direction opposite() {
        return this == LONG ? SHORT : LONG;
    }

    /**
     * The action that would open a position in this direction.
     */
    public TradeAction entryAction() {
        return this == LONG ? TradeAction.BUY : TradeAction.SELL;
    }

    public static Direction fromAction(TradeAction action) {
        return switch (action) {
            case BUY -> LONG;
            case SELL -> SHORT;
            case HOLD -> throw new IllegalArgumentException("HOLD has no direction");
        };
    }
}
