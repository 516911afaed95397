package com.cryptobot.core.model;

public enum TradeStatus {
    PENDING,
    FILLED,
    FAILED
}
