package com.cryptobot.core.bot;

import com.cryptobot.core.balance.BalanceResolver;
import com.cryptobot.core.config.BotConfig;
import com.cryptobot.core.decision.ApprovalQueue;
import com.cryptobot.core.decision.TradeDecision;
import com.cryptobot.core.decision.TradeDecisionEngine;
import com.cryptobot.core.error.ConfigException;
import com.cryptobot.core.error.InsufficientBalanceException;
import com.cryptobot.core.event.BotEventListener;
import com.cryptobot.core.execution.ExecutionGateway;
import com.cryptobot.core.market.MarketDataProvider;
import com.cryptobot.core.model.CloseReason;
import com.cryptobot.core.model.Position;
import com.cryptobot.core.model.Trade;
import com.cryptobot.core.model.TradingMode;
import com.cryptobot.core.monitor.PositionMonitor;
import com.cryptobot.core.scheduler.AnalysisLog;
import com.cryptobot.core.scheduler.AnalysisScheduler;
import com.cryptobot.core.signal.SymbolAnalyzer;
import com.cryptobot.core.store.PairStatus;
import com.cryptobot.core.store.PositionStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Top-level lifecycle. Starting validates the config and launches one thread for the
 * {@link AnalysisScheduler} and one for the {@link PositionMonitor}; stopping lets both finish
 * what they are doing (an order in flight included) and leaves open positions untouched.
 * The bot reports STOPPING, and refuses to start, until both threads have actually exited.
 * <p>
 * Lifecycle calls serialize on one lock. {@link #status()} takes no lock.
 */
public final class BotController {
    private static final Logger logger = LoggerFactory.getLogger(BotController.class);

    /**
     * Timing knobs that come from the service configuration rather than the per-run bot config.
     */
    public record Settings(Duration monitorPollInterval, Duration fastPollInterval, Duration shutdownTimeout) {
        public static Settings defaults() {
            return new Settings(Duration.ofSeconds(5), Duration.ofSeconds(1), Duration.ofSeconds(30));
        }
    }

    private final PositionStore store;
    private final SymbolAnalyzer analyzer;
    private final TradeDecisionEngine engine;
    private final ExecutionGateway gateway;
    private final BalanceResolver balances;
    private final MarketDataProvider marketData;
    private final AnalysisLog analysisLog;
    private final ApprovalQueue approvals;
    private final BotEventListener listener;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Settings settings;

    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private final AtomicReference<BotState> state = new AtomicReference<>(BotState.STOPPED);
    private volatile BotConfig config = BotConfig.defaults();
    private volatile TradingMode mode;
    private volatile Instant startedAt;

    // guarded by lifecycleLock
    private AnalysisScheduler scheduler;
    private PositionMonitor monitor;
    private Thread schedulerThread;
    private Thread monitorThread;

    public BotController(PositionStore store, SymbolAnalyzer analyzer, TradeDecisionEngine engine,
                         ExecutionGateway gateway, BalanceResolver balances, MarketDataProvider marketData,
                         AnalysisLog analysisLog, ApprovalQueue approvals, BotEventListener listener,
                         MeterRegistry meterRegistry, Clock clock, TradingMode initialMode, Settings settings) {
        this.store = store;
        this.analyzer = analyzer;
        this.engine = engine;
        this.gateway = gateway;
        this.balances = balances;
        this.marketData = marketData;
        this.analysisLog = analysisLog;
        this.approvals = approvals;
        this.listener = listener;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.mode = initialMode;
        this.settings = settings;
    }

    /**
     * @throws ConfigException when the config is invalid; the bot stays STOPPED
     * @throws IllegalStateException when the bot is not STOPPED
     */
    public BotStatus start(BotConfig newConfig) {
        lifecycleLock.lock();
        try {
            if (state.get() == BotState.STOPPING) {
                throw new IllegalStateException("Bot is still stopping; the previous run has not finished");
            }
            if (state.get() != BotState.STOPPED) {
                throw new IllegalStateException("Bot is already " + state.get().name().toLowerCase());
            }
            BotConfig validated = newConfig.validate();

            gateway.setRollbackEnabled(validated.rollbackEnabled());
            scheduler = new AnalysisScheduler(validated, mode, analyzer, engine, marketData, store,
                analysisLog, listener, meterRegistry, clock);
            monitor = new PositionMonitor(validated, mode, store, gateway, marketData, scheduler,
                settings.monitorPollInterval(), settings.fastPollInterval());

            config = validated;
            startedAt = clock.instant();
            state.set(BotState.RUNNING);

            schedulerThread = new Thread(scheduler, "analysis-scheduler");
            monitorThread = new Thread(monitor, "position-monitor");
            schedulerThread.start();
            monitorThread.start();

            logger.info("🤖 Bot started in {} mode: pairs={}, sources={}, interval={}s",
                mode, validated.allowedPairs(), validated.signalSources(), validated.analysisInterval().toSeconds());
        } finally {
            lifecycleLock.unlock();
        }
        BotStatus status = status();
        listener.onBotStatus(status);
        return status;
    }

    /**
     * @return false when the bot was not running
     */
    public boolean stop() {
        lifecycleLock.lock();
        try {
            if (state.get() != BotState.RUNNING) {
                logger.info("Stop requested but bot is {}", state.get());
                return false;
            }
            state.set(BotState.STOPPING);
            logger.info("🛑 Stopping bot - waiting for running iterations to finish");

            scheduler.stop();
            monitor.stop();
            Thread schedulerWorker = schedulerThread;
            Thread monitorWorker = monitorThread;
            boolean schedulerDone = awaitTermination(schedulerWorker);
            boolean monitorDone = awaitTermination(monitorWorker);

            if (schedulerDone && monitorDone) {
                markStopped();
            } else {
                Thread drain = new Thread(() -> stopWhenFinished(schedulerWorker, monitorWorker), "bot-shutdown");
                drain.setDaemon(true);
                drain.start();
            }
        } finally {
            lifecycleLock.unlock();
        }
        listener.onBotStatus(status());
        return true;
    }

    /**
     * @return true when the thread has exited
     */
    private boolean awaitTermination(Thread thread) {
        try {
            thread.join(settings.shutdownTimeout().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for {} to stop", thread.getName());
        }
        if (thread.isAlive()) {
            logger.warn("⚠️ {} still busy after {}s; bot stays STOPPING until it exits",
                thread.getName(), settings.shutdownTimeout().toSeconds());
            return false;
        }
        return true;
    }

    private void stopWhenFinished(Thread... workers) {
        try {
            for (Thread worker : workers) {
                worker.join();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Interrupted while waiting for bot threads to exit; bot left STOPPING");
            return;
        }
        lifecycleLock.lock();
        try {
            markStopped();
        } finally {
            lifecycleLock.unlock();
        }
        listener.onBotStatus(status());
    }

    // caller holds lifecycleLock
    private void markStopped() {
        state.set(BotState.STOPPED);
        startedAt = null;
        logger.info("Bot stopped; {} position(s) left open", store.activePositionCount());
    }

    public BotStatus status() {
        BotState current = state.get();
        BotConfig snapshot = config;
        Instant started = startedAt;

        Map<String, PairStatus> pairs = new LinkedHashMap<>();
        for (String symbol : snapshot.allowedPairs()) {
            pairs.put(symbol, store.pairStatus(symbol, snapshot.cooldownSecs()));
        }
        long runningSecs = started == null ? 0 : Duration.between(started, clock.instant()).toSeconds();

        return new BotStatus(current == BotState.RUNNING, current, mode, snapshot, store.positions(),
            store.stats(), pairs, approvals.size(), started, runningSecs);
    }

    public BotState state() {
        return state.get();
    }

    public boolean isRunning() {
        return state.get() == BotState.RUNNING;
    }

    /**
     * The running config, or the one the next start will use.
     */
    public BotConfig config() {
        return config;
    }

    /**
     * @throws IllegalStateException unless STOPPED; a running config never changes
     */
    public BotConfig updateConfig(BotConfig newConfig) {
        lifecycleLock.lock();
        try {
            requireStopped("Configuration");
            config = newConfig.validate();
            logger.info("Bot configuration updated for the next run");
            return config;
        } finally {
            lifecycleLock.unlock();
        }
    }

    public TradingMode mode() {
        return mode;
    }

    /**
     * @throws IllegalStateException unless STOPPED
     */
    public void setTradingMode(TradingMode newMode) {
        lifecycleLock.lock();
        try {
            requireStopped("Trading mode");
            if (newMode != mode) {
                logger.info("🔀 Trading mode {} -> {}", mode, newMode);
            }
            mode = newMode;
        } finally {
            lifecycleLock.unlock();
        }
    }

    public TradeDecision approveTrade(String tradeId) {
        return engine.approve(tradeId, config, mode);
    }

    public boolean rejectTrade(String tradeId) {
        return engine.rejectPending(tradeId);
    }

    /**
     * Close the open position in {@code symbol} at the current market price.
     *
     * @throws IllegalArgumentException when nothing is open for the symbol
     */
    public Trade closePosition(String symbol) {
        Position position = store.findPosition(symbol)
            .filter(Position::isOpen)
            .orElseThrow(() -> new IllegalArgumentException("No open position for " + symbol));
        double price = marketData.currentPrice(symbol);
        return gateway.close(UUID.randomUUID().toString(), position, price, mode, CloseReason.MANUAL);
    }

    /**
     * Open a position on request, bypassing the signal gates but not the balance check.
     */
    public Trade executeTrade(ManualTrade request) {
        double price = request.price() != null ? request.price() : marketData.currentPrice(request.symbol());
        if (!(price > 0)) {
            throw new IllegalArgumentException("Price must be positive");
        }
        double quantity;
        if (request.quantity() != null) {
            quantity = request.quantity();
        } else {
            double amount = request.amountUsdt() != null ? request.amountUsdt() : config.tradeAmountUsdt();
            quantity = amount / price;
        }

        if (store.findTrade(request.tradeId()).isEmpty()) {
            double notional = quantity * price;
            double available = balances.getTradingBalance(mode).free();
            if (notional < TradeDecisionEngine.MIN_TRADE_USDT) {
                throw new InsufficientBalanceException("Trade amount below the minimum",
                    TradeDecisionEngine.MIN_TRADE_USDT, notional);
            }
            if (notional > available) {
                throw new InsufficientBalanceException("Insufficient balance", notional, available);
            }
        }
        return gateway.open(request.tradeId(), request.symbol(), request.direction(), quantity, price, mode);
    }

    private void requireStopped(String what) {
        if (state.get() != BotState.STOPPED) {
            throw new IllegalStateException(what + " can only be changed while the bot is stopped");
        }
    }
}
