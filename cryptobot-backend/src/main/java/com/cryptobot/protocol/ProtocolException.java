package com.cryptobot.protocol;

import com.cryptobot.core.error.TradingException;

/**
 * A frame that is not valid JSON or lacks a required field.
 */
public class ProtocolException extends TradingException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
