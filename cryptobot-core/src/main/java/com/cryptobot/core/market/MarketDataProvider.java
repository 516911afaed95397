package com.cryptobot.core.market;

import com.cryptobot.core.error.ProviderConnectionException;

import java.util.List;

/**
 * Source of market prices. Implementations talk to an exchange's public API.
 */
public interface MarketDataProvider {

    /**
     * Last traded price for {@code symbol}.
     *
     * @throws ProviderConnectionException when the provider cannot be reached
     */
    double currentPrice(String symbol);

    /**
     * Recent candle closes, oldest first.
     *
     * @throws ProviderConnectionException when the provider cannot be reached
     */
    List<Double> recentCloses(String symbol, int limit);
}
