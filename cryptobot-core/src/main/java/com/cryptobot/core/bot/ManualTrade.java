package com.cryptobot.core.bot;

import com.cryptobot.core.model.Direction;

import java.util.Objects;

/**
 * A user-submitted entry. Size comes from {@code quantity}, else {@code amountUsdt}, else the configured
 * trade amount. A null price means "at market".
 */
public record ManualTrade(String tradeId, String symbol, Direction direction,
                          Double quantity, Double amountUsdt, Double price) {
    public ManualTrade {
        Objects.requireNonNull(tradeId, "tradeId");
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(direction, "direction");
    }
}
