package com.cryptobot.core.model;

/**
 * Whether a trade opened a position or reduced one.
 */
public enum TradeIntent {
    OPEN,
    CLOSE
}
