package com.cryptobot.core.signal.indicator;

import com.cryptobot.core.market.MarketDataProvider;
import com.cryptobot.core.model.SourceSignal;
import com.cryptobot.core.model.TradeAction;
import com.cryptobot.core.signal.SignalSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Base for sources computed from recent closes. Abstains while history is too short.
 */
public abstract class IndicatorSignalSource implements SignalSource {
    private static final Logger logger = LoggerFactory.getLogger(IndicatorSignalSource.class);
    protected static final double MAX_CONFIDENCE = 0.95;

    private final String id;
    private final MarketDataProvider marketData;
    private final int lookback;

    protected IndicatorSignalSource(String id, MarketDataProvider marketData, int lookback) {
        this.id = id;
        this.marketData = marketData;
        this.lookback = lookback;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Optional<SourceSignal> analyze(String symbol) {
        List<Double> closes = marketData.recentCloses(symbol, lookback);
        if (closes.size() < minimumHistory()) {
            logger.debug("{}: {} closes for {}, need {} - abstaining", id, closes.size(), symbol, minimumHistory());
            return Optional.empty();
        }
        return Optional.of(evaluate(TechnicalIndicators.toArray(closes)));
    }

    protected abstract int minimumHistory();

    protected abstract SourceSignal evaluate(double[] closes);

    protected SourceSignal signal(TradeAction action, double confidence) {
        return new SourceSignal(id, action, Math.max(0.0, Math.min(MAX_CONFIDENCE, confidence)));
    }
}
