package com.cryptobot.core.signal.indicator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("TechnicalIndicators Tests")
class TechnicalIndicatorsTest {

    private static final double DELTA = 1e-9;

    private static double[] rising(int count, double start, double step) {
        return IntStream.range(0, count).mapToDouble(i -> start + i * step).toArray();
    }

    private static double[] constant(int count, double value) {
        return IntStream.range(0, count).mapToDouble(i -> value).toArray();
    }

    @Nested
    @DisplayName("Moving averages")
    class MovingAverages {

        @Test
        @DisplayName("SMA should average the last period values")
        void sma() {
            assertEquals(4.0, TechnicalIndicators.sma(new double[]{1, 2, 3, 4, 5}, 3), DELTA);
        }

        @Test
        @DisplayName("EMA should be seeded with the SMA of the first period values")
        void emaSeed() {
            double[] series = TechnicalIndicators.emaSeries(new double[]{2, 4, 6}, 3);
            assertThat(series).hasSize(1);
            assertEquals(4.0, series[0], DELTA);
        }

        @Test
        @DisplayName("EMA should follow the smoothing recurrence")
        void emaRecurrence() {
            // seed (1+2+3)/3 = 2, k = 0.5, next = 5 * 0.5 + 2 * 0.5
            assertEquals(3.5, TechnicalIndicators.ema(new double[]{1, 2, 3, 5}, 3), DELTA);
        }

        @Test
        @DisplayName("EMA of a constant series is the constant")
        void emaConstant() {
            assertEquals(100.0, TechnicalIndicators.ema(constant(50, 100.0), 21), DELTA);
        }

        @Test
        @DisplayName("Should reject a series shorter than the period")
        void insufficientHistory() {
            assertThatThrownBy(() -> TechnicalIndicators.ema(new double[]{1, 2}, 3))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("needs 3 values");
        }
    }

    @Nested
    @DisplayName("RSI")
    class Rsi {

        @Test
        @DisplayName("Should be 100 when prices only rise")
        void onlyGains() {
            assertEquals(100.0, TechnicalIndicators.rsi(rising(30, 100, 1), 14), DELTA);
        }

        @Test
        @DisplayName("Should be 0 when prices only fall")
        void onlyLosses() {
            assertEquals(0.0, TechnicalIndicators.rsi(rising(30, 200, -1), 14), DELTA);
        }

        @Test
        @DisplayName("Should be 50 for a flat series")
        void flat() {
            assertEquals(50.0, TechnicalIndicators.rsi(constant(30, 10.0), 14), DELTA);
        }

        @Test
        @DisplayName("Should be 50 when gains equal losses")
        void balanced() {
            double[] closes = IntStream.range(0, 15).mapToDouble(i -> i % 2 == 0 ? 100 : 101).toArray();
            assertEquals(50.0, TechnicalIndicators.rsi(closes, 14), DELTA);
        }
    }

    @Nested
    @DisplayName("MACD")
    class MacdTests {

        @Test
        @DisplayName("Should be zero everywhere for a flat series")
        void flat() {
            var macd = TechnicalIndicators.macd(constant(60, 50.0), 12, 26, 9);
            assertEquals(0.0, macd.macd(), DELTA);
            assertEquals(0.0, macd.signal(), DELTA);
            assertEquals(0.0, macd.histogram(), DELTA);
        }

        @Test
        @DisplayName("Should be positive in an uptrend")
        void uptrend() {
            var macd = TechnicalIndicators.macd(rising(60, 100, 1), 12, 26, 9);
            assertThat(macd.macd()).isPositive();
            assertEquals(macd.macd() - macd.signal(), macd.histogram(), DELTA);
        }

        @Test
        @DisplayName("Should need slow + signal - 1 closes")
        void minimumHistory() {
            assertThatCode(() -> TechnicalIndicators.macd(rising(34, 100, 1), 12, 26, 9))
                .doesNotThrowAnyException();
            assertThatThrownBy(() -> TechnicalIndicators.macd(rising(33, 100, 1), 12, 26, 9))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Bands and dispersion")
    class Dispersion {

        @Test
        @DisplayName("Bollinger bands collapse to the mean for a flat series")
        void flatBollinger() {
            var bands = TechnicalIndicators.bollinger(constant(20, 10.0), 20, 2.0);
            assertEquals(10.0, bands.upper(), DELTA);
            assertEquals(10.0, bands.lower(), DELTA);
            assertEquals(0.5, bands.percentB(10.0), DELTA);
        }

        @Test
        @DisplayName("Volatility of a flat series is zero")
        void flatVolatility() {
            assertEquals(0.0, TechnicalIndicators.volatility(constant(10, 3.0)), DELTA);
        }

        @Test
        @DisplayName("VWAP weights prices by volume")
        void vwap() {
            assertEquals(12.5, TechnicalIndicators.vwap(new double[]{10, 20}, new double[]{3, 1}), DELTA);
        }
    }
}
