package com.cryptobot.core.model;

public enum TradingMode {
    /** Paper trading against the in-memory ledger. */
    MOCK,
    /** Orders forwarded to the exchange client. */
    LIVE
}
