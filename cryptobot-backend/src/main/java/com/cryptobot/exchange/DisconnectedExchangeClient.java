package com.cryptobot.exchange;

import com.cryptobot.core.error.ExchangeException;
import com.cryptobot.core.error.ProviderConnectionException;
import com.cryptobot.core.exchange.ExchangeClient;
import com.cryptobot.core.exchange.OrderFill;
import com.cryptobot.core.exchange.OrderRequest;
import com.cryptobot.core.model.Balance;
import com.cryptobot.core.model.WalletType;

import java.util.List;
import java.util.Optional;

/**
 * Stand-in used when no signed exchange client is wired. MOCK mode never reaches it;
 * LIVE calls fail fast.
 */
public final class DisconnectedExchangeClient implements ExchangeClient {
    static final String MESSAGE = "Live exchange client is not configured";

    @Override
    public OrderFill placeMarketOrder(OrderRequest request) {
        throw new ExchangeException(MESSAGE);
    }

    @Override
    public Optional<OrderFill> findOrder(String symbol, String clientOrderId) {
        return Optional.empty();
    }

    @Override
    public List<Balance> getBalances(WalletType walletType) {
        throw new ProviderConnectionException(MESSAGE);
    }
}
