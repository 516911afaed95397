package com.cryptobot.core.model;

public enum PositionStatus {
    OPEN,
    CLOSING,
    CLOSED
}
