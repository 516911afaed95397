package com.cryptobot.core.store;

import com.cryptobot.core.model.Position;
import com.cryptobot.core.model.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * The one shared mutable store: positions, trades by id, balance reservations, last prices and counters.
 * <p>
 * Writers for a symbol serialize on that symbol's lock ({@link #withSymbolLock}); every mutator checks
 * the caller holds it. Positions are immutable records swapped in one step, so readers never block
 * and never see a half-applied change.
 */
public final class PositionStore {
    private static final Logger logger = LoggerFactory.getLogger(PositionStore.class);
    private static final int RECENT_TRADE_LIMIT = 100;

    private final Map<String, Position> positions = new ConcurrentHashMap<>();
    /** Every trade seen since startup, never pruned. Replaying a trade id returns the entry kept here. */
    private final Map<String, Trade> tradesById = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> symbolLocks = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastClosedAt = new ConcurrentHashMap<>();
    private final Map<String, Double> lastPrices = new ConcurrentHashMap<>();
    private final Map<String, Double> reservations = new ConcurrentHashMap<>();

    // guarded by statsLock
    private final ReentrantLock statsLock = new ReentrantLock();
    private final Deque<Trade> recentTrades = new ArrayDeque<>();
    private final Map<String, String> entrySlots = new HashMap<>();
    private LocalDate tradeDay;
    private int tradesToday;
    private int closedTrades;
    private int winningTrades;
    private double realizedPnl;

    private final Clock clock;

    public PositionStore(Clock clock) {
        this.clock = clock;
        this.tradeDay = LocalDate.now(clock.withZone(ZoneOffset.UTC));
    }

    public PositionStore() {
        this(Clock.systemUTC());
    }

    /**
     * Run {@code action} as the only writer for {@code symbol}. Reentrant.
     */
    public <T> T withSymbolLock(String symbol, Supplier<T> action) {
        ReentrantLock lock = symbolLocks.computeIfAbsent(symbol, s -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private void requireLock(String symbol) {
        ReentrantLock lock = symbolLocks.get(symbol);
        if (lock == null || !lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Mutation of " + symbol + " outside its symbol lock");
        }
    }

    // ---- reads ----

    public Optional<Position> findPosition(String symbol) {
        return Optional.ofNullable(positions.get(symbol));
    }

    public List<Position> positions() {
        var snapshot = new ArrayList<>(positions.values());
        snapshot.sort(Comparator.comparing(Position::openedAt));
        return snapshot;
    }

    /**
     * Positions occupying a slot, including ones being closed.
     */
    public int activePositionCount() {
        return positions.size();
    }

    public Optional<Trade> findTrade(String tradeId) {
        return Optional.ofNullable(tradesById.get(tradeId));
    }

    public Optional<Double> lastPrice(String symbol) {
        return Optional.ofNullable(lastPrices.get(symbol));
    }

    public void recordPrice(String symbol, double price) {
        if (price > 0 && Double.isFinite(price)) {
            lastPrices.put(symbol, price);
        }
    }

    public Duration cooldownRemaining(String symbol, long cooldownSecs) {
        Instant closedAt = lastClosedAt.get(symbol);
        if (closedAt == null || cooldownSecs <= 0) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(clock.instant(), closedAt.plusSeconds(cooldownSecs));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public boolean isInCooldown(String symbol, long cooldownSecs) {
        return !cooldownRemaining(symbol, cooldownSecs).isZero();
    }

    public PairStatus pairStatus(String symbol, long cooldownSecs) {
        if (positions.containsKey(symbol)) {
            return PairStatus.IN_TRADE;
        }
        return isInCooldown(symbol, cooldownSecs) ? PairStatus.COOLDOWN : PairStatus.IDLE;
    }

    public int tradesToday() {
        statsLock.lock();
        try {
            rollDay();
            return tradesToday;
        } finally {
            statsLock.unlock();
        }
    }

    public TradeStats stats() {
        statsLock.lock();
        try {
            rollDay();
            return new TradeStats(tradesToday, closedTrades, winningTrades, realizedPnl);
        } finally {
            statsLock.unlock();
        }
    }

    public List<Trade> recentTrades(int limit) {
        statsLock.lock();
        try {
            List<Trade> result = new ArrayList<>();
            Iterator<Trade> it = recentTrades.iterator();
            while (it.hasNext() && result.size() < limit) {
                result.add(it.next());
            }
            return result;
        } finally {
            statsLock.unlock();
        }
    }

    /**
     * Check the concurrent and daily caps, counting entries that hold a slot but have not opened yet.
     *
     * @return why a new entry would be refused right now
     */
    public Optional<String> entryCapRejection(int maxConcurrent, int maxPerDay) {
        statsLock.lock();
        try {
            rollDay();
            return capViolation(maxConcurrent, maxPerDay);
        } finally {
            statsLock.unlock();
        }
    }

    /**
     * Check the caps and hold an entry slot for {@code tradeId} in one step. The slot counts against
     * both caps until {@link #recordOpen} consumes it or {@link #releaseEntrySlot} gives it back.
     *
     * @return why the entry is refused, or empty when the slot is held
     */
    public Optional<String> claimEntrySlot(String tradeId, String symbol, int maxConcurrent, int maxPerDay) {
        statsLock.lock();
        try {
            rollDay();
            if (entrySlots.containsKey(tradeId)) {
                return Optional.empty();
            }
            if (positions.containsKey(symbol)) {
                return Optional.of("a position is already open for " + symbol);
            }
            if (entrySlots.containsValue(symbol)) {
                return Optional.of("an entry for " + symbol + " is already in flight");
            }
            Optional<String> violation = capViolation(maxConcurrent, maxPerDay);
            if (violation.isEmpty()) {
                entrySlots.put(tradeId, symbol);
            }
            return violation;
        } finally {
            statsLock.unlock();
        }
    }

    /**
     * Give back an unused slot. No-op once the trade has opened.
     */
    public void releaseEntrySlot(String tradeId) {
        statsLock.lock();
        try {
            entrySlots.remove(tradeId);
        } finally {
            statsLock.unlock();
        }
    }

    public double reservedTotal() {
        return reservations.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    // ---- writes (caller holds the symbol lock) ----

    public void reserve(String symbol, String tradeId, double amount) {
        requireLock(symbol);
        reservations.put(tradeId, amount);
        logger.debug("Reserved {} USDT for trade {}", String.format("%.2f", amount), tradeId);
    }

    /**
     * @return the released amount, zero when nothing was reserved
     */
    public double release(String symbol, String tradeId) {
        requireLock(symbol);
        Double released = reservations.remove(tradeId);
        return released == null ? 0.0 : released;
    }

    public void recordPending(Trade trade) {
        requireLock(trade.symbol());
        tradesById.put(trade.tradeId(), trade);
    }

    public void recordOpen(Trade trade, Position position) {
        requireLock(trade.symbol());
        tradesById.put(trade.tradeId(), trade);
        reservations.remove(trade.tradeId());
        statsLock.lock();
        try {
            positions.put(position.symbol(), position);
            entrySlots.remove(trade.tradeId());
            rollDay();
            tradesToday++;
            addRecent(trade);
        } finally {
            statsLock.unlock();
        }
    }

    public void recordFailed(Trade trade) {
        requireLock(trade.symbol());
        tradesById.put(trade.tradeId(), trade);
        statsLock.lock();
        try {
            addRecent(trade);
        } finally {
            statsLock.unlock();
        }
    }

    /**
     * Book a filled close. {@code remaining} is the reduced position after a partial fill, or null when flat.
     */
    public void recordClose(Trade closeTrade, Position remaining) {
        String symbol = closeTrade.symbol();
        requireLock(symbol);
        tradesById.put(closeTrade.tradeId(), closeTrade);
        if (remaining == null) {
            positions.remove(symbol);
            lastClosedAt.put(symbol, closeTrade.timestamp());
        } else {
            positions.put(symbol, remaining);
        }
        statsLock.lock();
        try {
            closedTrades++;
            if (closeTrade.realizedPnl() > 0) {
                winningTrades++;
            }
            realizedPnl += closeTrade.realizedPnl();
            addRecent(closeTrade);
        } finally {
            statsLock.unlock();
        }
    }

    public void updatePosition(Position position) {
        requireLock(position.symbol());
        if (!positions.containsKey(position.symbol())) {
            throw new IllegalStateException("No position to update for " + position.symbol());
        }
        positions.put(position.symbol(), position);
    }

    private Optional<String> capViolation(int maxConcurrent, int maxPerDay) {
        int active = positions.size() + entrySlots.size();
        if (active >= maxConcurrent) {
            return Optional.of(String.format("max concurrent trades reached (%d/%d)", active, maxConcurrent));
        }
        int today = tradesToday + entrySlots.size();
        if (today >= maxPerDay) {
            return Optional.of(String.format("max trades per day reached (%d/%d)", today, maxPerDay));
        }
        return Optional.empty();
    }

    private void addRecent(Trade trade) {
        recentTrades.addFirst(trade);
        while (recentTrades.size() > RECENT_TRADE_LIMIT) {
            recentTrades.removeLast();
        }
    }

    private void rollDay() {
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        if (!today.equals(tradeDay)) {
            logger.info("📅 New trading day {} - resetting daily trade count (was {})", today, tradesToday);
            tradeDay = today;
            tradesToday = 0;
        }
    }
}
