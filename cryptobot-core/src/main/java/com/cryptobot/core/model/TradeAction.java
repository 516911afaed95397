package com.cryptobot.core.model;

/**
 * Recommendation produced by a signal source or by aggregation.
 */
public enum TradeAction {
    BUY,
    SELL,
    HOLD
}
