package com.cryptobot.core.signal;

import com.cryptobot.core.error.SourceTimeoutException;
import com.cryptobot.core.model.SourceSignal;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Asks the configured sources for a symbol in parallel and waits at most {@code timeout} for them.
 * A late or failing source abstains for that cycle.
 * <p>
 * Workers come from a fixed-size pool. A source that ignores interruption keeps its worker busy, so
 * once every worker is stuck further requests queue, time out and abstain instead of adding threads.
 */
public final class SignalPoller implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(SignalPoller.class);

    private final Map<String, SignalSource> sources;
    private final Duration timeout;
    private final MeterRegistry meterRegistry;
    private final ThreadPoolExecutor executor;

    public SignalPoller(List<SignalSource> sources, Duration timeout, MeterRegistry meterRegistry) {
        this.sources = new LinkedHashMap<>();
        sources.forEach(source -> this.sources.put(source.id(), source));
        this.timeout = timeout;
        this.meterRegistry = meterRegistry;
        int workers = Math.max(2, this.sources.size() * 2);
        var counter = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(workers, workers, 60, TimeUnit.SECONDS,
            new ArrayBlockingQueue<>(workers * 4), r -> {
                Thread t = new Thread(r, "signal-source-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        this.executor.allowCoreThreadTimeOut(true);
    }

    public boolean hasSource(String sourceId) {
        return sources.containsKey(sourceId);
    }

    /**
     * @return the signals that arrived in time, in {@code sourceIds} order
     */
    public List<SourceSignal> poll(String symbol, List<String> sourceIds) {
        Map<String, Future<Optional<SourceSignal>>> pending = new LinkedHashMap<>();
        for (String sourceId : sourceIds) {
            SignalSource source = sources.get(sourceId);
            if (source == null) {
                logger.warn("Unknown signal source '{}' configured, skipping", sourceId);
                continue;
            }
            try {
                pending.put(sourceId, executor.submit(() -> source.analyze(symbol)));
            } catch (RejectedExecutionException e) {
                meterRegistry.counter("bot.signal.rejected", "source", sourceId).increment();
                logger.warn("Signal source '{}' skipped for {}: all workers busy", sourceId, symbol);
            }
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        List<SourceSignal> signals = new ArrayList<>();
        for (var entry : pending.entrySet()) {
            String sourceId = entry.getKey();
            Future<Optional<SourceSignal>> future = entry.getValue();
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                future.get(remaining, TimeUnit.NANOSECONDS)
                    .map(signal -> new SourceSignal(sourceId, signal.action(), signal.confidence()))
                    .ifPresent(signals::add);
            } catch (TimeoutException e) {
                future.cancel(true);
                executor.purge();
                meterRegistry.counter("bot.signal.timeouts", "source", sourceId).increment();
                logger.warn("⏱️ {}", new SourceTimeoutException(sourceId, symbol, timeout).getMessage());
            } catch (ExecutionException e) {
                meterRegistry.counter("bot.signal.failures", "source", sourceId).increment();
                logger.warn("Signal source '{}' failed for {}: {}", sourceId, symbol,
                    e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pending.values().forEach(f -> f.cancel(true));
                logger.warn("Interrupted while polling signal sources for {}", symbol);
                break;
            }
        }
        return signals;
    }

    int largestPoolSize() {
        return executor.getLargestPoolSize();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
