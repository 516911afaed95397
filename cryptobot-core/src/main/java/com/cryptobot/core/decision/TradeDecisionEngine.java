package com.cryptobot.core.decision;

import com.cryptobot.core.balance.BalanceResolver;
import com.cryptobot.core.config.BotConfig;
import com.cryptobot.core.error.InsufficientBalanceException;
import com.cryptobot.core.event.BotEventListener;
import com.cryptobot.core.execution.ExecutionGateway;
import com.cryptobot.core.market.MarketDataProvider;
import com.cryptobot.core.model.AnalysisResult;
import com.cryptobot.core.model.CloseReason;
import com.cryptobot.core.model.Direction;
import com.cryptobot.core.model.Position;
import com.cryptobot.core.model.Trade;
import com.cryptobot.core.model.TradingMode;
import com.cryptobot.core.store.PositionStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Turns an {@link AnalysisResult} into an action: reject, park for approval, or execute.
 * <p>
 * Entry gates, in order: actionable signal above the confidence threshold, concurrent position cap,
 * daily trade cap, post-close cooldown. Sizing uses {@code trade_amount_usdt}, or
 * {@code risk_per_trade_percent} of the free trading balance when that is set.
 */
public final class TradeDecisionEngine {
    private static final Logger logger = LoggerFactory.getLogger(TradeDecisionEngine.class);
    public static final double MIN_TRADE_USDT = 10.0;

    private final PositionStore store;
    private final BalanceResolver balances;
    private final ExecutionGateway gateway;
    private final MarketDataProvider marketData;
    private final ApprovalQueue approvals;
    private final BotEventListener listener;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Supplier<String> tradeIds;

    public TradeDecisionEngine(PositionStore store, BalanceResolver balances, ExecutionGateway gateway,
                               MarketDataProvider marketData, ApprovalQueue approvals, BotEventListener listener,
                               MeterRegistry meterRegistry, Clock clock) {
        this(store, balances, gateway, marketData, approvals, listener, meterRegistry, clock,
            () -> UUID.randomUUID().toString());
    }

    public TradeDecisionEngine(PositionStore store, BalanceResolver balances, ExecutionGateway gateway,
                               MarketDataProvider marketData, ApprovalQueue approvals, BotEventListener listener,
                               MeterRegistry meterRegistry, Clock clock, Supplier<String> tradeIds) {
        this.store = store;
        this.balances = balances;
        this.gateway = gateway;
        this.marketData = marketData;
        this.approvals = approvals;
        this.listener = listener;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.tradeIds = tradeIds;
    }

    /**
     * @param decisionPrice the price the analysis was made at
     */
    public TradeDecision process(AnalysisResult result, BotConfig config, TradingMode mode, double decisionPrice) {
        String symbol = result.symbol();
        Optional<Position> open = store.findPosition(symbol);
        if (open.isPresent()) {
            return handleOpenPosition(result, open.get(), config, mode, decisionPrice);
        }

        String rejection = entryRejection(result, config);
        if (rejection != null) {
            return reject(symbol, rejection);
        }

        PendingTrade order;
        try {
            order = new PendingTrade(tradeIds.get(), symbol, Direction.fromAction(result.finalAction()),
                sizeNotional(config, mode), decisionPrice, result.combinedConfidence(), clock.instant());
        } catch (InsufficientBalanceException e) {
            return reject(symbol, e.getMessage());
        }

        if (config.manualApprovalMode()) {
            approvals.add(order);
            listener.onPendingTrade(order);
            return new TradeDecision.AwaitingApproval(order);
        }
        return submit(order, config, mode);
    }

    /**
     * Execute a parked trade. Caps and cooldown are checked again since time has passed.
     *
     * @throws IllegalArgumentException when no trade with that id is pending
     */
    public TradeDecision approve(String tradeId, BotConfig config, TradingMode mode) {
        PendingTrade order = approvals.remove(tradeId)
            .orElseThrow(() -> new IllegalArgumentException("No pending trade with id " + tradeId));
        logger.info("👍 Trade {} approved for {}", tradeId, order.symbol());

        if (store.findPosition(order.symbol()).isPresent()) {
            return reject(order.symbol(), "a position is already open for " + order.symbol());
        }
        String rejection = capRejection(order.symbol(), config);
        if (rejection != null) {
            return reject(order.symbol(), rejection);
        }
        return submit(order, config, mode);
    }

    public boolean rejectPending(String tradeId) {
        boolean removed = approvals.remove(tradeId).isPresent();
        if (removed) {
            logger.info("👎 Pending trade {} rejected", tradeId);
        }
        return removed;
    }

    /**
     * Notional in USDT for a new entry.
     *
     * @throws InsufficientBalanceException when below the exchange minimum or above the free balance
     */
    public double sizeNotional(BotConfig config, TradingMode mode) {
        double available = balances.getTradingBalance(mode).free();
        double notional = config.riskPerTradePercent() > 0
            ? available * config.riskPerTradePercent() / 100.0
            : config.tradeAmountUsdt();

        if (notional < MIN_TRADE_USDT) {
            throw new InsufficientBalanceException("Trade amount below the minimum", MIN_TRADE_USDT, notional);
        }
        if (notional > available) {
            throw new InsufficientBalanceException("Insufficient balance", notional, available);
        }
        return notional;
    }

    /**
     * Holds an entry slot from the cap check until the order is booked, so concurrent entries on
     * different symbols cannot overshoot the caps.
     */
    private TradeDecision submit(PendingTrade order, BotConfig config, TradingMode mode) {
        String symbol = order.symbol();
        Optional<String> refused = store.claimEntrySlot(order.tradeId(), symbol,
            config.maxConcurrentTrades(), config.maxTradesPerDay());
        if (refused.isPresent()) {
            return reject(symbol, refused.get());
        }

        try {
            double price = order.decisionPrice();
            if (config.reconfirmBeforeEntry()) {
                double current = marketData.currentPrice(symbol);
                double movePercent = Math.abs(current - price) / price * 100.0;
                if (movePercent > config.slippageTolerancePercent()) {
                    String reason = String.format("price moved %.3f%% (%.4f -> %.4f), tolerance %.3f%%",
                        movePercent, price, current, config.slippageTolerancePercent());
                    meterRegistry.counter("bot.decisions.aborted").increment();
                    logger.warn("🛑 {} entry aborted: {}", symbol, reason);
                    return new TradeDecision.Aborted(symbol, reason);
                }
                price = current;
            }

            Trade trade = gateway.open(order.tradeId(), symbol, order.direction(), order.notionalUsdt() / price, price, mode);
            return new TradeDecision.Executed(trade);
        } finally {
            store.releaseEntrySlot(order.tradeId());
        }
    }

    private TradeDecision handleOpenPosition(AnalysisResult result, Position position, BotConfig config,
                                             TradingMode mode, double price) {
        boolean reversed = result.isActionable()
            && result.finalAction() == position.direction().opposite().entryAction()
            && result.combinedConfidence() >= config.aiConfidenceThreshold();

        if (config.reversalExitEnabled() && reversed && position.isOpen()) {
            logger.info("🔄 Signal reversed on {} ({} @ {}), closing {} position", position.symbol(),
                result.finalAction(), String.format("%.2f", result.combinedConfidence()), position.direction());
            Trade trade = gateway.close(tradeIds.get(), position, price, mode, CloseReason.SIGNAL_REVERSAL);
            return new TradeDecision.Exited(trade);
        }
        return reject(position.symbol(), "a position is already open for " + position.symbol());
    }

    private String entryRejection(AnalysisResult result, BotConfig config) {
        if (!result.isActionable()) {
            return "final action is HOLD";
        }
        if (result.combinedConfidence() < config.aiConfidenceThreshold()) {
            return String.format("confidence %.2f below threshold %.2f",
                result.combinedConfidence(), config.aiConfidenceThreshold());
        }
        return capRejection(result.symbol(), config);
    }

    private String capRejection(String symbol, BotConfig config) {
        Optional<String> capped = store.entryCapRejection(config.maxConcurrentTrades(), config.maxTradesPerDay());
        if (capped.isPresent()) {
            return capped.get();
        }
        Duration cooldown = store.cooldownRemaining(symbol, config.cooldownSecs());
        if (!cooldown.isZero()) {
            return "in post-close cooldown for another " + cooldown.toSeconds() + "s";
        }
        return null;
    }

    private TradeDecision reject(String symbol, String reason) {
        meterRegistry.counter("bot.decisions.rejected").increment();
        logger.info("⏭️ {} not traded: {}", symbol, reason);
        return new TradeDecision.Rejected(symbol, reason);
    }
}
