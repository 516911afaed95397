package com.cryptobot.core.execution;

import com.cryptobot.core.error.ExchangeException;
import com.cryptobot.core.event.BotEventListener;
import com.cryptobot.core.exchange.ExchangeClient;
import com.cryptobot.core.exchange.OrderFill;
import com.cryptobot.core.exchange.OrderRequest;
import com.cryptobot.core.exchange.OrderSide;
import com.cryptobot.core.journal.TradeJournal;
import com.cryptobot.core.model.CloseReason;
import com.cryptobot.core.model.Direction;
import com.cryptobot.core.model.Position;
import com.cryptobot.core.model.PositionStatus;
import com.cryptobot.core.model.Trade;
import com.cryptobot.core.model.TradeIntent;
import com.cryptobot.core.model.TradeStatus;
import com.cryptobot.core.model.TradingMode;
import com.cryptobot.core.store.PositionStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Opens and closes positions in paper or live mode and returns one {@link Trade} shape for both.
 * <p>
 * Both operations are idempotent on {@code tradeId}: a repeated id returns the stored trade and
 * touches nothing. Each operation runs entirely inside the symbol's lock in {@link PositionStore}.
 */
public final class ExecutionGateway {
    private static final Logger logger = LoggerFactory.getLogger(ExecutionGateway.class);
    private static final double QUANTITY_EPSILON = 1e-12;

    private final PositionStore store;
    private final ExchangeClient exchange;
    private final TradeJournal journal;
    private final BotEventListener listener;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private volatile boolean rollbackEnabled = true;

    public ExecutionGateway(PositionStore store, ExchangeClient exchange, TradeJournal journal,
                            BotEventListener listener, MeterRegistry meterRegistry, Clock clock) {
        this.store = store;
        this.exchange = exchange;
        this.journal = journal;
        this.listener = listener;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Whether a failed live order releases the balance reserved for it. When off, the reservation
     * stays in place for manual reconciliation.
     */
    public void setRollbackEnabled(boolean rollbackEnabled) {
        this.rollbackEnabled = rollbackEnabled;
    }

    public Trade open(String tradeId, String symbol, Direction direction, double quantity,
                      double price, TradingMode mode) {
        Objects.requireNonNull(tradeId, "tradeId");
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(mode, "mode");
        requirePositive("quantity", quantity);
        requirePositive("price", price);

        Optional<Trade> previous = store.findTrade(tradeId);
        if (previous.isPresent()) {
            logger.info("♻️ Trade {} already processed ({}), returning original result", tradeId, previous.get().status());
            return previous.get();
        }

        return store.withSymbolLock(symbol, () -> {
            Optional<Trade> raced = store.findTrade(tradeId);
            if (raced.isPresent()) {
                return raced.get();
            }
            if (store.findPosition(symbol).isPresent()) {
                throw new IllegalStateException("A position is already open for " + symbol);
            }
            Trade trade = mode == TradingMode.MOCK
                ? openPaper(tradeId, symbol, direction, quantity, price)
                : openLive(tradeId, symbol, direction, quantity, price);
            journalQuietly(trade);
            listener.onTradeExecuted(trade);
            meterRegistry.counter("bot.trades.opened", "mode", mode.name(), "direction", direction.name()).increment();
            logger.atInfo()
                .addKeyValue("tradeId", tradeId)
                .addKeyValue("symbol", symbol)
                .addKeyValue("direction", direction)
                .addKeyValue("price", trade.executedPrice())
                .addKeyValue("quantity", trade.quantity())
                .addKeyValue("mode", mode)
                .log("✅ Position opened");
            return trade;
        });
    }

    public Trade close(String tradeId, Position position, double price, TradingMode mode) {
        return close(tradeId, position, price, mode, CloseReason.MANUAL);
    }

    /**
     * Close {@code position} reduce-only: the order never exceeds the quantity currently held in the store.
     */
    public Trade close(String tradeId, Position position, double price, TradingMode mode, CloseReason reason) {
        Objects.requireNonNull(tradeId, "tradeId");
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(mode, "mode");
        requirePositive("price", price);

        Optional<Trade> previous = store.findTrade(tradeId);
        if (previous.isPresent()) {
            logger.info("♻️ Close {} already processed ({}), returning original result", tradeId, previous.get().status());
            return previous.get();
        }

        String symbol = position.symbol();
        return store.withSymbolLock(symbol, () -> {
            Optional<Trade> raced = store.findTrade(tradeId);
            if (raced.isPresent()) {
                return raced.get();
            }
            Position current = store.findPosition(symbol)
                .filter(Position::isOpen)
                .filter(p -> Objects.equals(p.openTradeId(), position.openTradeId()))
                .orElseThrow(() -> new IllegalStateException("No open position for " + symbol + " to close"));

            double quantity = Math.min(position.quantity(), current.quantity());
            Trade trade = mode == TradingMode.MOCK
                ? closePaper(tradeId, current, quantity, price, reason)
                : closeLive(tradeId, current, quantity, price, reason);

            journalQuietly(trade);
            listener.onPositionClosed(trade);
            meterRegistry.counter("bot.trades.closed", "mode", mode.name(), "reason", reason.name()).increment();
            logger.atInfo()
                .addKeyValue("tradeId", tradeId)
                .addKeyValue("symbol", symbol)
                .addKeyValue("reason", reason)
                .addKeyValue("price", trade.executedPrice())
                .addKeyValue("quantity", trade.quantity())
                .addKeyValue("pnl", trade.realizedPnl())
                .log("🔒 Position closed");
            return trade;
        });
    }

    // ---- paper ----

    private Trade openPaper(String tradeId, String symbol, Direction direction, double quantity, double price) {
        var now = clock.instant();
        Trade trade = new Trade(tradeId, symbol, direction, TradeIntent.OPEN, price, price, quantity,
            TradingMode.MOCK, TradeStatus.FILLED, now, 0.0, null);
        store.recordOpen(trade, Position.open(symbol, direction, price, quantity, now, tradeId));
        return trade;
    }

    private Trade closePaper(String tradeId, Position current, double quantity, double price, CloseReason reason) {
        double pnl = (price - current.entryPrice()) * quantity * current.direction().sign();
        Trade trade = new Trade(tradeId, current.symbol(), current.direction(), TradeIntent.CLOSE, price, price,
            quantity, TradingMode.MOCK, TradeStatus.FILLED, clock.instant(), pnl, reason.name());
        store.recordClose(trade, remainder(current, quantity));
        return trade;
    }

    // ---- live ----

    private Trade openLive(String tradeId, String symbol, Direction direction, double quantity, double price) {
        Trade pending = new Trade(tradeId, symbol, direction, TradeIntent.OPEN, price, 0.0, quantity,
            TradingMode.LIVE, TradeStatus.PENDING, clock.instant(), 0.0, null);
        store.reserve(symbol, tradeId, quantity * price);
        store.recordPending(pending);

        var request = new OrderRequest(tradeId, symbol, OrderSide.opening(direction), quantity, false);
        OrderFill fill;
        try {
            fill = submit(request);
        } catch (ExchangeException e) {
            throw failOpen(pending, e.getMessage(), e);
        }
        if (!fill.hasFill()) {
            throw failOpen(pending, "Order " + tradeId + " was not filled", null);
        }

        double filledQuantity = Math.min(fill.executedQuantity(), quantity);
        if (filledQuantity < quantity) {
            logger.warn("⚠️ Partial fill for {}: {} of {} {}", tradeId, filledQuantity, quantity, symbol);
        }
        var now = clock.instant();
        Trade trade = new Trade(tradeId, symbol, direction, TradeIntent.OPEN, price, fill.executedPrice(),
            filledQuantity, TradingMode.LIVE, TradeStatus.FILLED, now, 0.0, fill.exchangeOrderId());
        store.recordOpen(trade, Position.open(symbol, direction, fill.executedPrice(), filledQuantity, now, tradeId));
        return trade;
    }

    private ExchangeException failOpen(Trade pending, String message, Throwable cause) {
        if (rollbackEnabled) {
            double released = store.release(pending.symbol(), pending.tradeId());
            logger.warn("↩️ Rolled back reservation of {} USDT for failed trade {}",
                String.format("%.2f", released), pending.tradeId());
        } else {
            logger.warn("Reservation for failed trade {} kept for manual reconciliation", pending.tradeId());
        }
        Trade failed = pending.withStatus(TradeStatus.FAILED, message);
        store.recordFailed(failed);
        journalQuietly(failed);
        meterRegistry.counter("bot.orders.failed", "intent", TradeIntent.OPEN.name()).increment();
        logger.error("❌ Open order {} for {} failed: {}", pending.tradeId(), pending.symbol(), message);
        return new ExchangeException("Order for " + pending.symbol() + " failed: " + message, failed, cause);
    }

    private Trade closeLive(String tradeId, Position current, double quantity, double price, CloseReason reason) {
        String symbol = current.symbol();
        store.updatePosition(current.withStatus(PositionStatus.CLOSING));

        var request = new OrderRequest(tradeId, symbol, OrderSide.closing(current.direction()), quantity, true);
        OrderFill fill;
        try {
            fill = submit(request);
        } catch (ExchangeException e) {
            throw failClose(tradeId, current, quantity, price, e.getMessage(), e);
        }
        if (!fill.hasFill()) {
            throw failClose(tradeId, current, quantity, price, "Close order " + tradeId + " was not filled", null);
        }

        double filledQuantity = Math.min(fill.executedQuantity(), quantity);
        double pnl = (fill.executedPrice() - current.entryPrice()) * filledQuantity * current.direction().sign();
        Trade trade = new Trade(tradeId, symbol, current.direction(), TradeIntent.CLOSE, price, fill.executedPrice(),
            filledQuantity, TradingMode.LIVE, TradeStatus.FILLED, clock.instant(), pnl, reason.name());
        store.recordClose(trade, remainder(current, filledQuantity));
        return trade;
    }

    private ExchangeException failClose(String tradeId, Position current, double quantity, double price,
                                        String message, Throwable cause) {
        store.updatePosition(current.withStatus(PositionStatus.OPEN));
        Trade failed = new Trade(tradeId, current.symbol(), current.direction(), TradeIntent.CLOSE, price, 0.0,
            quantity, TradingMode.LIVE, TradeStatus.FAILED, clock.instant(), 0.0, message);
        store.recordFailed(failed);
        journalQuietly(failed);
        meterRegistry.counter("bot.orders.failed", "intent", TradeIntent.CLOSE.name()).increment();
        logger.error("❌ Close order {} for {} failed, position stays open: {}", tradeId, current.symbol(), message);
        return new ExchangeException("Close for " + current.symbol() + " failed: " + message, failed, cause);
    }

    /**
     * Send once. If the outcome is unknown, ask the exchange about the same client id
     * (a read, which the client may retry) instead of resubmitting.
     */
    private OrderFill submit(OrderRequest request) {
        try {
            return exchange.placeMarketOrder(request);
        } catch (RuntimeException submitError) {
            logger.warn("Order {} submission error, checking status: {}", request.clientOrderId(), submitError.getMessage());
            Optional<OrderFill> status;
            try {
                status = exchange.findOrder(request.symbol(), request.clientOrderId());
            } catch (RuntimeException statusError) {
                submitError.addSuppressed(statusError);
                throw asExchangeException(submitError);
            }
            return status.orElseThrow(() -> asExchangeException(submitError));
        }
    }

    /**
     * The store already holds the outcome when this runs, so a journal failure is logged and counted
     * but never reported as a failed order.
     */
    private void journalQuietly(Trade trade) {
        try {
            journal.record(trade);
        } catch (RuntimeException e) {
            meterRegistry.counter("bot.journal.failures").increment();
            logger.error("❌ Could not journal trade {} ({} {}): {}", trade.tradeId(), trade.intent(),
                trade.status(), e.getMessage(), e);
        }
    }

    private static ExchangeException asExchangeException(RuntimeException e) {
        return e instanceof ExchangeException exchangeError
            ? exchangeError
            : new ExchangeException(e.getMessage(), e);
    }

    private static Position remainder(Position current, double closedQuantity) {
        double left = current.quantity() - closedQuantity;
        return left > QUANTITY_EPSILON ? current.withQuantity(left).withStatus(PositionStatus.OPEN) : null;
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0) || !Double.isFinite(value)) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }
}
