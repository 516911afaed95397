package com.cryptobot.core.error;

import java.time.Duration;

/**
 * A signal source did not answer within its bound. Counted as an abstention.
 */
public class SourceTimeoutException extends TradingException {
    private final String sourceId;

    public SourceTimeoutException(String sourceId, String symbol, Duration bound) {
        super("Signal source '" + sourceId + "' timed out after " + bound.toMillis() + "ms for " + symbol);
        this.sourceId = sourceId;
    }

    public String getSourceId() {
        return sourceId;
    }
}
