package com.cryptobot.core.scheduler;

import com.cryptobot.core.config.BotConfig;
import com.cryptobot.core.decision.TradeDecision;
import com.cryptobot.core.decision.TradeDecisionEngine;
import com.cryptobot.core.event.BotEventListener;
import com.cryptobot.core.market.MarketDataProvider;
import com.cryptobot.core.model.AnalysisResult;
import com.cryptobot.core.model.TradingMode;
import com.cryptobot.core.monitor.ReanalysisRequester;
import com.cryptobot.core.signal.SymbolAnalyzer;
import com.cryptobot.core.store.PositionStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Long-running task that analyzes each allowed pair once per interval and hands the result to
 * the {@link TradeDecisionEngine}.
 * <p>
 * A pair is skipped while its open position is already under exit monitoring (unless a re-analysis
 * was requested), within the re-analysis cooldown, or within the post-close cooldown. A failure on
 * one pair is logged and the cycle moves on to the next.
 */
public final class AnalysisScheduler implements Runnable, ReanalysisRequester {
    private static final Logger logger = LoggerFactory.getLogger(AnalysisScheduler.class);

    private final BotConfig config;
    private final TradingMode mode;
    private final SymbolAnalyzer analyzer;
    private final TradeDecisionEngine engine;
    private final MarketDataProvider marketData;
    private final PositionStore store;
    private final AnalysisLog analysisLog;
    private final BotEventListener listener;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final Map<String, Instant> lastAnalysisAt = new ConcurrentHashMap<>();
    private final Set<String> requested = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final CountDownLatch stopSignal = new CountDownLatch(1);

    public AnalysisScheduler(BotConfig config, TradingMode mode, SymbolAnalyzer analyzer, TradeDecisionEngine engine,
                             MarketDataProvider marketData, PositionStore store, AnalysisLog analysisLog,
                             BotEventListener listener, MeterRegistry meterRegistry, Clock clock) {
        this.config = config;
        this.mode = mode;
        this.analyzer = analyzer;
        this.engine = engine;
        this.marketData = marketData;
        this.store = store;
        this.analysisLog = analysisLog;
        this.listener = listener;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @Override
    public void run() {
        Duration interval = config.analysisInterval();
        logger.info("🚀 Analysis scheduler started: {} pairs every {}s ({} mode)",
            config.allowedPairs().size(), interval.toSeconds(), mode);

        while (running.get()) {
            runCycle();
            try {
                if (stopSignal.await(interval.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        logger.info("Analysis scheduler stopped");
    }

    public void stop() {
        running.set(false);
        stopSignal.countDown();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Analyze every allowed pair once. A stop request is honoured between pairs.
     */
    public void runCycle() {
        for (String symbol : config.allowedPairs()) {
            if (!running.get()) {
                return;
            }
            try {
                analyzeSymbol(symbol);
            } catch (Exception e) {
                meterRegistry.counter("bot.analysis.failures", "symbol", symbol).increment();
                logger.error("❌ Analysis cycle failed for {}: {}", symbol, e.getMessage(), e);
            }
        }
    }

    /**
     * @return the decision taken, or empty when the pair was skipped
     */
    public Optional<TradeDecision> analyzeSymbol(String symbol) {
        String skip = skipReason(symbol);
        if (skip != null) {
            logger.debug("Skipping {}: {}", symbol, skip);
            return Optional.empty();
        }
        requested.remove(symbol);

        double price = marketData.currentPrice(symbol);
        store.recordPrice(symbol, price);

        AnalysisResult result = analyzer.analyze(symbol, config);
        lastAnalysisAt.put(symbol, result.timestamp());
        analysisLog.add(result);
        listener.onAnalysis(result);
        meterRegistry.counter("bot.analysis.completed", "action", result.finalAction().name()).increment();
        logger.info("🧠 {} analysis: {} @ {} from {} source(s), price {}", symbol, result.finalAction(),
            String.format("%.2f", result.combinedConfidence()), result.signals().size(), price);

        return Optional.of(engine.process(result, config, mode, price));
    }

    @Override
    public void requestReanalysis(String symbol) {
        if (requested.add(symbol)) {
            logger.info("Re-analysis requested for {}", symbol);
        }
    }

    /**
     * @return why {@code symbol} is skipped this cycle, or null when it should be analyzed
     */
    String skipReason(String symbol) {
        Instant now = clock.instant();
        if (config.monitorOpenTrades() && store.findPosition(symbol).isPresent() && !requested.contains(symbol)) {
            return "open position is monitored";
        }
        Instant last = lastAnalysisAt.get(symbol);
        if (last != null && Duration.between(last, now).getSeconds() < config.reanalysisCooldownSeconds()) {
            return "re-analysis cooldown";
        }
        if (store.isInCooldown(symbol, config.cooldownSecs())) {
            return "post-close cooldown";
        }
        return null;
    }
}
