package com.cryptobot.core.signal.indicator;

import com.cryptobot.core.market.MarketDataProvider;
import com.cryptobot.core.model.SourceSignal;
import com.cryptobot.core.model.TradeAction;

/**
 * RSI(14) mean reversion: oversold below 30 buys, overbought above 70 sells.
 */
public final class MomentumSignalSource extends IndicatorSignalSource {
    private static final int PERIOD = 14;
    private static final double OVERSOLD = 30.0;
    private static final double OVERBOUGHT = 70.0;

    public MomentumSignalSource(MarketDataProvider marketData) {
        super("momentum", marketData, 100);
    }

    @Override
    protected int minimumHistory() {
        return PERIOD + 1;
    }

    @Override
    protected SourceSignal evaluate(double[] closes) {
        double rsi = TechnicalIndicators.rsi(closes, PERIOD);
        if (rsi < OVERSOLD) {
            return signal(TradeAction.BUY, 0.5 + (OVERSOLD - rsi) / OVERSOLD * 0.5);
        }
        if (rsi > OVERBOUGHT) {
            return signal(TradeAction.SELL, 0.5 + (rsi - OVERBOUGHT) / (100.0 - OVERBOUGHT) * 0.5);
        }
        return signal(TradeAction.HOLD, 0.5);
    }
}
