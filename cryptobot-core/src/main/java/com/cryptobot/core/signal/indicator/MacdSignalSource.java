package com.cryptobot.core.signal.indicator;

import com.cryptobot.core.market.MarketDataProvider;
import com.cryptobot.core.model.SourceSignal;
import com.cryptobot.core.model.TradeAction;

/**
 * MACD(12,26,9): the sign of the histogram gives the direction, its size relative to price the confidence.
 */
public final class MacdSignalSource extends IndicatorSignalSource {
    private static final int FAST_PERIOD = 12;
    private static final int SLOW_PERIOD = 26;
    private static final int SIGNAL_PERIOD = 9;

    public MacdSignalSource(MarketDataProvider marketData) {
        super("macd", marketData, 100);
    }

    @Override
    protected int minimumHistory() {
        return SLOW_PERIOD + SIGNAL_PERIOD - 1;
    }

    @Override
    protected SourceSignal evaluate(double[] closes) {
        var macd = TechnicalIndicators.macd(closes, FAST_PERIOD, SLOW_PERIOD, SIGNAL_PERIOD);
        double lastClose = closes[closes.length - 1];
        double histogramPercent = macd.histogram() / lastClose * 100.0;

        if (histogramPercent == 0.0) {
            return signal(TradeAction.HOLD, 0.5);
        }
        double confidence = 0.5 + Math.abs(histogramPercent) * 2.0;
        return signal(histogramPercent > 0 ? TradeAction.BUY : TradeAction.SELL, confidence);
    }
}
