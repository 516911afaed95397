package com.cryptobot.core.exchange;

import com.cryptobot.core.error.ExchangeException;
import com.cryptobot.core.error.ProviderConnectionException;
import com.cryptobot.core.model.Balance;
import com.cryptobot.core.model.WalletType;

import java.util.List;
import java.util.Optional;

/**
 * Order placement and account access for live trading.
 * Signing and transport belong to the implementation.
 */
public interface ExchangeClient {

    /**
     * Submit a market order.
     *
     * @throws ExchangeException when the exchange rejects the order or the outcome is unknown
     */
    OrderFill placeMarketOrder(OrderRequest request);

    /**
     * Look up an order by client order id. Safe to repeat.
     *
     * @return the fill, or empty when the exchange has no such order
     */
    Optional<OrderFill> findOrder(String symbol, String clientOrderId);

    /**
     * @throws ProviderConnectionException when the account cannot be read
     */
    List<Balance> getBalances(WalletType walletType);
}
