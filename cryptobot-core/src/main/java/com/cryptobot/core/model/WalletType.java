package com.cryptobot.core.model;

/**
 * Exchange account partitions. Each keeps its own balances.
 */
public enum WalletType {
    SPOT("Spot Wallet"),
    FUTURES("Futures Wallet"),
    MARGIN("Cross Margin"),
    FUNDING("Funding Wallet");

    private final String displayName;

    WalletType(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
