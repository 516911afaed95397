package com.cryptobot.core.signal.indicator;

import com.cryptobot.core.market.MarketDataProvider;
import com.cryptobot.core.model.SourceSignal;
import com.cryptobot.core.model.TradeAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Indicator signal source Tests")
class IndicatorSignalSourceTest {

    @Mock
    private MarketDataProvider marketData;

    private static List<Double> linear(int count, double start, double step) {
        return IntStream.range(0, count).mapToObj(i -> start + i * step).toList();
    }

    @Test
    @DisplayName("Trend should buy when the fast EMA is above the slow EMA")
    void trendBuysInUptrend() {
        when(marketData.recentCloses(eq("BTCUSDT"), anyInt())).thenReturn(linear(100, 100, 1));

        Optional<SourceSignal> signal = new TrendSignalSource(marketData).analyze("BTCUSDT");

        assertThat(signal).isPresent();
        assertThat(signal.get().sourceId()).isEqualTo("trend");
        assertThat(signal.get().action()).isEqualTo(TradeAction.BUY);
        assertThat(signal.get().confidence()).isBetween(0.5, IndicatorSignalSource.MAX_CONFIDENCE);
    }

    @Test
    @DisplayName("Trend should hold on a flat market")
    void trendHoldsWhenFlat() {
        when(marketData.recentCloses(eq("BTCUSDT"), anyInt())).thenReturn(Collections.nCopies(60, 100.0));

        SourceSignal signal = new TrendSignalSource(marketData).analyze("BTCUSDT").orElseThrow();

        assertThat(signal.action()).isEqualTo(TradeAction.HOLD);
        assertThat(signal.confidence()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Momentum should sell when RSI is overbought")
    void momentumSellsWhenOverbought() {
        when(marketData.recentCloses(eq("ETHUSDT"), anyInt())).thenReturn(linear(40, 100, 1));

        SourceSignal signal = new MomentumSignalSource(marketData).analyze("ETHUSDT").orElseThrow();

        assertThat(signal.action()).isEqualTo(TradeAction.SELL);
        assertThat(signal.confidence()).isEqualTo(IndicatorSignalSource.MAX_CONFIDENCE);
    }

    @Test
    @DisplayName("Momentum should buy when RSI is oversold")
    void momentumBuysWhenOversold() {
        when(marketData.recentCloses(eq("ETHUSDT"), anyInt())).thenReturn(linear(40, 200, -1));

        SourceSignal signal = new MomentumSignalSource(marketData).analyze("ETHUSDT").orElseThrow();

        assertThat(signal.action()).isEqualTo(TradeAction.BUY);
    }

    @Test
    @DisplayName("MACD should buy when momentum is accelerating upward")
    void macdBuysOnAcceleration() {
        List<Double> closes = IntStream.range(0, 80).mapToObj(i -> 100.0 + i * i * 0.05).toList();
        when(marketData.recentCloses(eq("SOLUSDT"), anyInt())).thenReturn(closes);

        SourceSignal signal = new MacdSignalSource(marketData).analyze("SOLUSDT").orElseThrow();

        assertThat(signal.sourceId()).isEqualTo("macd");
        assertThat(signal.action()).isEqualTo(TradeAction.BUY);
    }

    @Test
    @DisplayName("Should abstain when history is too short")
    void abstainsOnShortHistory() {
        when(marketData.recentCloses(eq("BTCUSDT"), anyInt())).thenReturn(linear(10, 100, 1));

        assertThat(new TrendSignalSource(marketData).analyze("BTCUSDT")).isEmpty();
        assertThat(new MomentumSignalSource(marketData).analyze("BTCUSDT")).isEmpty();
        assertThat(new MacdSignalSource(marketData).analyze("BTCUSDT")).isEmpty();
    }
}
