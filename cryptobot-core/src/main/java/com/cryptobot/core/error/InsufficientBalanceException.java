package com.cryptobot.core.error;

/**
 * Trade aborted before submission; nothing was mutated.
 */
public class InsufficientBalanceException extends TradingException {
    private final double required;
    private final double available;

    public InsufficientBalanceException(String message, double required, double available) {
        super(String.format("%s (required %.2f, available %.2f)", message, required, available));
        this.required = required;
        this.available = available;
    }

    public double getRequired() {
        return required;
    }

    public double getAvailable() {
        return available;
    }
}
