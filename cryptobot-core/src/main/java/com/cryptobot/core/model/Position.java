package com.cryptobot.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of an open (or closing) position.
 * Every change produces a new instance which the position store swaps in atomically.
 */
public record Position(
    String symbol,
    Direction direction,
    double entryPrice,
    double quantity,
    Instant openedAt,
    PositionStatus status,
    boolean trailingArmed,
    double trailingPeakPnl,
    String openTradeId
) {
    public Position {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(openedAt, "openedAt");
        Objects.requireNonNull(status, "status");
        if (quantity <= 0 || !Double.isFinite(quantity)) {
            throw new IllegalArgumentException("Quantity must be positive");
        }
        if (entryPrice <= 0 || !Double.isFinite(entryPrice)) {
            throw new IllegalArgumentException("Entry price must be positive");
        }
    }

    public static Position open(String symbol, Direction direction, double entryPrice,
                                double quantity, Instant openedAt, String openTradeId) {
        return new Position(symbol, direction, entryPrice, quantity, openedAt,
            PositionStatus.OPEN, false, 0.0, openTradeId);
    }

    public double unrealizedPnl(double currentPrice) {
        return (currentPrice - entryPrice) * quantity * direction.sign();
    }

    /**
     * PnL as a percentage of the entry notional. Negative when losing.
     */
    public double pnlPercent(double currentPrice) {
        return unrealizedPnl(currentPrice) / notional() * 100.0;
    }

    public double notional() {
        return entryPrice * quantity;
    }

    public boolean isOpen() {
        return status == PositionStatus.OPEN;
    }

    public Position withStatus(PositionStatus newStatus) {
        return new Position(symbol, direction, entryPrice, quantity, openedAt,
            newStatus, trailingArmed, trailingPeakPnl, openTradeId);
    }

    public Position withQuantity(double newQuantity) {
        return new Position(symbol, direction, entryPrice, newQuantity, openedAt,
            status, trailingArmed, trailingPeakPnl, openTradeId);
    }

    /**
     * Arms trailing (if not yet armed) and raises the peak. The peak never moves down.
     */
    public Position withTrailingPeak(double pnl) {
        double peak = trailingArmed ? Math.max(trailingPeakPnl, pnl) : pnl;
        return new Position(symbol, direction, entryPrice, quantity, openedAt,
            status, true, peak, openTradeId);
    }
}
