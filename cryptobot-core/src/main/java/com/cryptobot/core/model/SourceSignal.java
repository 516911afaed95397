package com.cryptobot.core.model;

import java.util.Objects;

/**
 * One source's recommendation for a symbol.
 */
public record SourceSignal(String sourceId, TradeAction action, double confidence) {
    public SourceSignal {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(action, "action");
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException(
                "Confidence must be within [0,1] for source " + sourceId + ": " + confidence);
        }
    }
}
