package com.cryptobot.core.balance;

import com.cryptobot.core.error.ProviderConnectionException;
import com.cryptobot.core.exchange.ExchangeClient;
import com.cryptobot.core.market.MarketDataProvider;
import com.cryptobot.core.model.Balance;
import com.cryptobot.core.model.TradingMode;
import com.cryptobot.core.model.WalletSummary;
import com.cryptobot.core.model.WalletType;
import com.cryptobot.core.store.PositionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Wallet-aware balance lookup for paper and live trading.
 * <p>
 * MOCK: every query answers the configured paper balance, whatever the wallet, so paper runs replay
 * identically. LIVE: reads the exchange; an unspecified wallet means the trading wallet.
 */
public final class BalanceResolver {
    private static final Logger logger = LoggerFactory.getLogger(BalanceResolver.class);
    public static final String QUOTE_ASSET = "USDT";

    private final ExchangeClient exchange;
    private final MarketDataProvider marketData;
    private final PositionStore store;
    private final double paperBalance;
    private final WalletType tradingWallet;

    public BalanceResolver(ExchangeClient exchange, MarketDataProvider marketData, PositionStore store,
                           double paperBalance, WalletType tradingWallet) {
        if (paperBalance < 0 || !Double.isFinite(paperBalance)) {
            throw new IllegalArgumentException("Paper balance must be a finite non-negative amount");
        }
        this.exchange = exchange;
        this.marketData = marketData;
        this.store = store;
        this.paperBalance = paperBalance;
        this.tradingWallet = tradingWallet;
    }

    public double paperBalance() {
        return paperBalance;
    }

    public WalletType tradingWallet() {
        return tradingWallet;
    }

    /**
     * In MOCK mode every wallet holds the paper balance in USDT and nothing else.
     *
     * @param walletType null selects the trading wallet
     */
    public Balance getBalance(String asset, TradingMode mode, WalletType walletType) {
        WalletType wallet = walletType != null ? walletType : tradingWallet;
        if (mode == TradingMode.MOCK) {
            return QUOTE_ASSET.equalsIgnoreCase(asset)
                ? new Balance(QUOTE_ASSET, paperBalance, 0.0, paperBalance, wallet)
                : Balance.empty(asset, wallet);
        }

        Balance balance = exchange.getBalances(wallet).stream()
            .filter(b -> b.asset().equalsIgnoreCase(asset))
            .findFirst()
            .orElse(Balance.empty(asset, wallet));

        // funds reserved for in-flight live orders are not spendable
        if (wallet == tradingWallet && QUOTE_ASSET.equalsIgnoreCase(asset)) {
            double reserved = store.reservedTotal();
            if (reserved > 0) {
                double free = Math.max(0.0, balance.free() - reserved);
                balance = new Balance(balance.asset(), free, balance.locked() + (balance.free() - free),
                    balance.total(), wallet);
            }
        }
        return balance;
    }

    /**
     * Quote-asset balance of the trading wallet, the amount sizing works from.
     */
    public Balance getTradingBalance(TradingMode mode) {
        return getBalance(QUOTE_ASSET, mode, null);
    }

    /**
     * Every non-empty balance across all wallets. Wallets that cannot be read are skipped.
     */
    public List<Balance> getAllBalances(TradingMode mode) {
        if (mode == TradingMode.MOCK) {
            return List.of(new Balance(QUOTE_ASSET, paperBalance, 0.0, paperBalance, tradingWallet));
        }
        List<Balance> all = new ArrayList<>();
        for (WalletType wallet : WalletType.values()) {
            try {
                exchange.getBalances(wallet).stream()
                    .filter(b -> !b.isEmpty())
                    .forEach(all::add);
            } catch (ProviderConnectionException e) {
                logger.warn("Skipping {} balances: {}", wallet, e.getMessage());
            }
        }
        return all;
    }

    /**
     * One summary per wallet type, in SPOT, FUTURES, MARGIN, FUNDING order.
     */
    public Map<WalletType, WalletSummary> getCategorizedBalances(TradingMode mode) {
        Map<WalletType, WalletSummary> result = new EnumMap<>(WalletType.class);
        for (WalletType wallet : WalletType.values()) {
            List<Balance> balances;
            if (mode == TradingMode.MOCK) {
                balances = List.of(new Balance(QUOTE_ASSET, paperBalance, 0.0, paperBalance, wallet));
            } else {
                try {
                    balances = exchange.getBalances(wallet).stream().filter(b -> !b.isEmpty()).toList();
                } catch (ProviderConnectionException e) {
                    logger.warn("Could not read {} wallet: {}", wallet, e.getMessage());
                    balances = List.of();
                }
            }
            result.put(wallet, new WalletSummary(wallet, wallet.displayName(), balances, valueInUsdt(balances)));
        }
        return result;
    }

    /**
     * USDT value of the given balances. Assets without a USDT price are left out.
     */
    public double valueInUsdt(List<Balance> balances) {
        double total = 0.0;
        for (Balance balance : balances) {
            if (QUOTE_ASSET.equalsIgnoreCase(balance.asset())) {
                total += balance.total();
                continue;
            }
            try {
                total += balance.total() * marketData.currentPrice(balance.asset().toUpperCase() + QUOTE_ASSET);
            } catch (RuntimeException e) {
                logger.debug("No USDT price for {}: {}", balance.asset(), e.getMessage());
            }
        }
        return total;
    }
}
