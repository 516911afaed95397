package com.cryptobot.core.signal;

import com.cryptobot.core.config.BotConfig;
import com.cryptobot.core.model.AnalysisResult;

import java.time.Clock;

/**
 * Polls the configured sources for one symbol and aggregates what came back.
 */
public final class SymbolAnalyzer {
    private final SignalPoller poller;
    private final SignalAggregator aggregator;
    private final Clock clock;

    public SymbolAnalyzer(SignalPoller poller, SignalAggregator aggregator, Clock clock) {
        this.poller = poller;
        this.aggregator = aggregator;
        this.clock = clock;
    }

    public AnalysisResult analyze(String symbol, BotConfig config) {
        var signals = poller.poll(symbol, config.signalSources());
        return aggregator.aggregate(symbol, signals, config.sourceWeights(), clock.instant());
    }
}
