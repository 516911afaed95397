package com.cryptobot.core.monitor;

import com.cryptobot.core.config.BotConfig;
import com.cryptobot.core.error.ProviderConnectionException;
import com.cryptobot.core.execution.ExecutionGateway;
import com.cryptobot.core.market.MarketDataProvider;
import com.cryptobot.core.model.CloseReason;
import com.cryptobot.core.model.Position;
import com.cryptobot.core.model.Trade;
import com.cryptobot.core.model.TradingMode;
import com.cryptobot.core.store.PositionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Long-running task that re-prices every open position and closes it through the gateway
 * when an {@link ExitRules} rule fires.
 * <p>
 * Polls every {@code pollInterval}; while any position is down by {@code loss_check_interval_percent}
 * or more it switches to {@code fastPollInterval} so the stop loss is checked more often.
 */
public final class PositionMonitor implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(PositionMonitor.class);

    private final BotConfig config;
    private final TradingMode mode;
    private final PositionStore store;
    private final ExecutionGateway gateway;
    private final MarketDataProvider marketData;
    private final ReanalysisRequester reanalysis;
    private final Duration pollInterval;
    private final Duration fastPollInterval;

    private final AtomicBoolean running = new AtomicBoolean(true);
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final Set<String> lossWatch = ConcurrentHashMap.newKeySet();

    public PositionMonitor(BotConfig config, TradingMode mode, PositionStore store, ExecutionGateway gateway,
                           MarketDataProvider marketData, ReanalysisRequester reanalysis,
                           Duration pollInterval, Duration fastPollInterval) {
        this.config = config;
        this.mode = mode;
        this.store = store;
        this.gateway = gateway;
        this.marketData = marketData;
        this.reanalysis = reanalysis;
        this.pollInterval = pollInterval;
        this.fastPollInterval = fastPollInterval;
    }

    @Override
    public void run() {
        logger.info("👀 Position monitor started (poll {}s, fast poll {}s, enabled={})",
            pollInterval.toSeconds(), fastPollInterval.toSeconds(), config.monitorOpenTrades());

        while (running.get()) {
            boolean watching = false;
            try {
                watching = checkPositions();
            } catch (Exception e) {
                logger.error("Position monitor iteration failed: {}", e.getMessage(), e);
            }

            Duration wait = watching ? fastPollInterval : pollInterval;
            try {
                if (stopSignal.await(wait.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        logger.info("Position monitor stopped");
    }

    /**
     * Ask the loop to end after the current iteration.
     */
    public void stop() {
        running.set(false);
        stopSignal.countDown();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * One pass over all open positions.
     *
     * @return true when at least one position is on loss watch
     */
    public boolean checkPositions() {
        if (!config.monitorOpenTrades()) {
            return false;
        }
        for (Position position : store.positions()) {
            if (!position.isOpen()) {
                continue;
            }
            String symbol = position.symbol();
            try {
                onPriceUpdate(symbol, marketData.currentPrice(symbol));
            } catch (ProviderConnectionException e) {
                logger.warn("No price for {} this pass: {}", symbol, e.getMessage());
            } catch (RuntimeException e) {
                logger.error("❌ Exit check failed for {}: {}", symbol, e.getMessage(), e);
            }
        }
        return !lossWatch.isEmpty();
    }

    /**
     * Apply the exit rules to the position in {@code symbol} at {@code price}.
     *
     * @return the close trade when the position was closed
     */
    public Optional<Trade> onPriceUpdate(String symbol, double price) {
        store.recordPrice(symbol, price);
        if (!config.monitorOpenTrades()) {
            return Optional.empty();
        }

        return store.withSymbolLock(symbol, () -> {
            Optional<Position> current = store.findPosition(symbol).filter(Position::isOpen);
            if (current.isEmpty()) {
                lossWatch.remove(symbol);
                return Optional.empty();
            }
            Position position = current.get();
            ExitEvaluation evaluation = ExitRules.evaluate(position, price, config);
            trackLoss(position, price, evaluation.lossWatch());

            Optional<CloseReason> exit = evaluation.exitReason();
            if (exit.isEmpty()) {
                if (!evaluation.position().equals(position)) {
                    if (!position.trailingArmed()) {
                        logger.info("🎯 Trailing stop armed for {} at PnL {}", symbol,
                            String.format("%.4f", evaluation.unrealizedPnl()));
                    }
                    store.updatePosition(evaluation.position());
                }
                return Optional.empty();
            }

            logger.info("🚪 {} exit for {} at {} (PnL {})", exit.get(), symbol, price,
                String.format("%.4f", evaluation.unrealizedPnl()));
            Trade trade = gateway.close(UUID.randomUUID().toString(), position, price, mode, exit.get());
            lossWatch.remove(symbol);
            return Optional.of(trade);
        });
    }

    private void trackLoss(Position position, double price, boolean losing) {
        String symbol = position.symbol();
        if (!losing) {
            lossWatch.remove(symbol);
            return;
        }
        if (lossWatch.add(symbol)) {
            logger.warn("📉 {} down {}% - checking every {}s", symbol,
                String.format("%.2f", -position.pnlPercent(price)), fastPollInterval.toSeconds());
        }
        if (config.reversalExitEnabled()) {
            reanalysis.requestReanalysis(symbol);
        }
    }
}
