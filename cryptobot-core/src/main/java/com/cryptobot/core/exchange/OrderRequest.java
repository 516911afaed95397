package com.cryptobot.core.exchange;

import java.util.Objects;

/**
 * Market order sent to the exchange. {@code clientOrderId} carries our trade id
 * so a lost acknowledgement can be recovered with a status query.
 */
public record OrderRequest(String clientOrderId, String symbol, OrderSide side, double quantity, boolean reduceOnly) {
    public OrderRequest {
        Objects.requireNonNull(clientOrderId, "clientOrderId");
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(side, "side");
        if (quantity <= 0 || !Double.isFinite(quantity)) {
            throw new IllegalArgumentException("Order quantity must be positive");
        }
    }
}
