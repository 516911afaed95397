package com.cryptobot.core.store;

public enum PairStatus {
    IDLE,
    IN_TRADE,
    COOLDOWN
}
