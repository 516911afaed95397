package com.cryptobot.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of one execution attempt. {@code tradeId} is the idempotency key.
 *
 * @param realizedPnl PnL booked by a CLOSE trade, zero for opens
 * @param detail close reason or failure message, may be null
 */
public record Trade(
    String tradeId,
    String symbol,
    Direction direction,
    TradeIntent intent,
    double requestedPrice,
    double executedPrice,
    double quantity,
    TradingMode mode,
    TradeStatus status,
    Instant timestamp,
    double realizedPnl,
    String detail
) {
    public Trade {
        Objects.requireNonNull(tradeId, "tradeId");
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(intent, "intent");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public boolean isFilled() {
        return status == TradeStatus.FILLED;
    }

    public double notional() {
        return executedPrice * quantity;
    }

    public Trade withStatus(TradeStatus newStatus, String newDetail) {
        return new Trade(tradeId, symbol, direction, intent, requestedPrice, executedPrice,
            quantity, mode, newStatus, timestamp, realizedPnl, newDetail);
    }
}
