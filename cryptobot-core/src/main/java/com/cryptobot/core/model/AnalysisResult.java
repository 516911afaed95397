package com.cryptobot.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Aggregated view of every source that answered for one symbol in one cycle.
 */
public record AnalysisResult(
    String symbol,
    List<SourceSignal> signals,
    double combinedConfidence,
    TradeAction finalAction,
    Instant timestamp
) {
    public AnalysisResult {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(finalAction, "finalAction");
        Objects.requireNonNull(timestamp, "timestamp");
        signals = List.copyOf(signals);
        if (!(combinedConfidence >= 0.0 && combinedConfidence <= 1.0)) {
            throw new IllegalArgumentException("Combined confidence out of range: " + combinedConfidence);
        }
    }

    public boolean isActionable() {
        return finalAction != TradeAction.HOLD;
    }
}
