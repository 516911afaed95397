package com.cryptobot.core.scheduler;

import com.cryptobot.core.model.AnalysisResult;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Recent analyses, newest first, plus the latest one per symbol.
 */
public final class AnalysisLog {
    private static final int DEFAULT_CAPACITY = 200;

    private final Deque<AnalysisResult> entries = new ArrayDeque<>();
    private final Map<String, AnalysisResult> latest = new ConcurrentHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final int capacity;

    public AnalysisLog(int capacity) {
        this.capacity = capacity;
    }

    public AnalysisLog() {
        this(DEFAULT_CAPACITY);
    }

    public void add(AnalysisResult result) {
        latest.put(result.symbol(), result);
        lock.lock();
        try {
            entries.addFirst(result);
            while (entries.size() > capacity) {
                entries.removeLast();
            }
        } finally {
            lock.unlock();
        }
    }

    public List<AnalysisResult> recent(int limit) {
        lock.lock();
        try {
            List<AnalysisResult> result = new ArrayList<>();
            Iterator<AnalysisResult> it = entries.iterator();
            while (it.hasNext() && result.size() < limit) {
                result.add(it.next());
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    public Optional<AnalysisResult> latest(String symbol) {
        return Optional.ofNullable(latest.get(symbol));
    }
}
