package com.cryptobot.core.decision;

import com.cryptobot.core.model.Direction;

import java.time.Instant;
import java.util.Objects;

/**
 * An accepted entry that has not been sent yet. Quantity is derived from {@code notionalUsdt}
 * at the price used on submission.
 */
public record PendingTrade(
    String tradeId,
    String symbol,
    Direction direction,
    double notionalUsdt,
    double decisionPrice,
    double confidence,
    Instant createdAt
) {
    public PendingTrade {
        Objects.requireNonNull(tradeId, "tradeId");
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(createdAt, "createdAt");
        if (notionalUsdt <= 0 || decisionPrice <= 0) {
            throw new IllegalArgumentException("Notional and decision price must be positive");
        }
    }
}
