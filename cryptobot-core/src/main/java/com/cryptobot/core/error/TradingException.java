package com.cryptobot.core.error;

/**
 * Base type for failures raised by the trading core.
 */
public class TradingException extends RuntimeException {

    public TradingException(String message) {
        super(message);
    }

    public TradingException(String message, Throwable cause) {
        super(message, cause);
    }
}
