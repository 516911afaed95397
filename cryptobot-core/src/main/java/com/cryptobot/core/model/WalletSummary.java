package com.cryptobot.core.model;

import java.util.List;

/**
 * All balances of one wallet with their combined USDT value.
 */
public record WalletSummary(WalletType walletType, String name, List<Balance> balances, double totalUsdt) {
    public WalletSummary {
        balances = List.copyOf(balances);
    }
}
