package com.cryptobot.core.error;

import com.cryptobot.core.model.Trade;

import java.util.Optional;

/**
 * Order placement failed. Fresh submissions are never retried automatically.
 */
public class ExchangeException extends TradingException {
    private final transient Trade failedTrade;

    public ExchangeException(String message) {
        this(message, null, null);
    }

    public ExchangeException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public ExchangeException(String message, Trade failedTrade, Throwable cause) {
        super(message, cause);
        this.failedTrade = failedTrade;
    }

    public Optional<Trade> getFailedTrade() {
        return Optional.ofNullable(failedTrade);
    }
}
