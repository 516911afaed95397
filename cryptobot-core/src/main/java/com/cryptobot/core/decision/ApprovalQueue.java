package com.cryptobot.core.decision;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entries waiting for manual confirmation, keyed by trade id.
 */
public final class ApprovalQueue {
    private static final Logger logger = LoggerFactory.getLogger(ApprovalQueue.class);

    private final Map<String, PendingTrade> pending = new ConcurrentHashMap<>();

    public void add(PendingTrade trade) {
        pending.put(trade.tradeId(), trade);
        logger.info("⏳ Trade {} ({} {}) awaiting approval", trade.tradeId(), trade.direction(), trade.symbol());
    }

    public Optional<PendingTrade> remove(String tradeId) {
        return Optional.ofNullable(pending.remove(tradeId));
    }

    public List<PendingTrade> list() {
        var snapshot = new ArrayList<>(pending.values());
        snapshot.sort(Comparator.comparing(PendingTrade::createdAt));
        return snapshot;
    }

    public int size() {
        return pending.size();
    }

    public void clear() {
        pending.clear();
    }
}
