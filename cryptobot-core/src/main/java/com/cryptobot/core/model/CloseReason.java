package com.cryptobot.core.model;

public enum CloseReason {
    STOP_LOSS,
    TRAILING_STOP,
    PROFIT_TARGET,
    SIGNAL_REVERSAL,
    MANUAL
}
