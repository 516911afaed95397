package com.cryptobot.core.model;

public record Balance(String asset, double free, double locked, double total, WalletType walletType) {

    public static Balance empty(String asset, WalletType walletType) {
        return new Balance(asset, 0.0, 0.0, 0.0, walletType);
    }

    public boolean isEmpty() {
        return total <= 0.0;
    }
}
