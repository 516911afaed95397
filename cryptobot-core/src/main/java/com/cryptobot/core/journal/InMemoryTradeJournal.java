package com.cryptobot.core.journal;

import com.cryptobot.core.model.Trade;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded in-memory journal. Used when no database is configured.
 */
public final class InMemoryTradeJournal implements TradeJournal {
    private final Deque<Trade> trades = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final int capacity;

    public InMemoryTradeJournal(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive");
        }
        this.capacity = capacity;
    }

    public InMemoryTradeJournal() {
        this(1000);
    }

    @Override
    public void record(Trade trade) {
        lock.lock();
        try {
            trades.addFirst(trade);
            while (trades.size() > capacity) {
                trades.removeLast();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Trade> recent(int limit) {
        lock.lock();
        try {
            List<Trade> result = new ArrayList<>(Math.min(limit, trades.size()));
            Iterator<Trade> it = trades.iterator();
            while (it.hasNext() && result.size() < limit) {
                result.add(it.next());
            }
            return result;
        } finally {
            lock.unlock();
        }
    }
}
