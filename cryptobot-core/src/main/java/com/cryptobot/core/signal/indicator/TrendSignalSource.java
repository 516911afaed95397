package com.cryptobot.core.signal.indicator;

import com.cryptobot.core.market.MarketDataProvider;
import com.cryptobot.core.model.SourceSignal;
import com.cryptobot.core.model.TradeAction;

/**
 * EMA(9) / EMA(21) trend. Confidence grows with the spread between the two averages.
 */
public final class TrendSignalSource extends IndicatorSignalSource {
    private static final int FAST_PERIOD = 9;
    private static final int SLOW_PERIOD = 21;
    private static final double FLAT_SPREAD_PERCENT = 0.05;

    public TrendSignalSource(MarketDataProvider marketData) {
        super("trend", marketData, 100);
    }

    @Override
    protected int minimumHistory() {
        return SLOW_PERIOD;
    }

    @Override
    protected SourceSignal evaluate(double[] closes) {
        double fast = TechnicalIndicators.ema(closes, FAST_PERIOD);
        double slow = TechnicalIndicators.ema(closes, SLOW_PERIOD);
        double spreadPercent = (fast - slow) / slow * 100.0;

        if (Math.abs(spreadPercent) < FLAT_SPREAD_PERCENT) {
            return signal(TradeAction.HOLD, 0.5);
        }
        double confidence = 0.5 + Math.abs(spreadPercent) * 0.5;
        return signal(spreadPercent > 0 ? TradeAction.BUY : TradeAction.SELL, confidence);
    }
}
