package com.cryptobot.core.exchange;

/**
 * What the exchange actually executed. {@code executedQuantity} may be below the requested quantity.
 */
public record OrderFill(String clientOrderId, String exchangeOrderId, double executedPrice, double executedQuantity) {

    public boolean hasFill() {
        return executedQuantity > 0 && executedPrice > 0;
    }
}
