package com.cryptobot.core.error;

/**
 * An external provider (market data, exchange account) could not be reached.
 */
public class ProviderConnectionException extends TradingException {

    public ProviderConnectionException(String message) {
        super(message);
    }

    public ProviderConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
