package com.cryptobot.core.signal.indicator;

import java.util.List;

/**
 * Indicator math over close series (oldest first).
 * <p>
 * EMAs are seeded with the simple average of their first {@code period} values. The MACD signal line
 * is a true EMA of the MACD line, not a fixed fraction of it.
 */
public final class TechnicalIndicators {

    private TechnicalIndicators() {
    }

    public record Macd(double macd, double signal, double histogram) {}

    public record BollingerBands(double upper, double middle, double lower) {

        /**
         * 0 at the lower band, 1 at the upper band.
         */
        public double percentB(double price) {
            double width = upper - lower;
            return width == 0 ? 0.5 : (price - lower) / width;
        }
    }

    public static double[] toArray(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }

    /**
     * EMA series; element {@code i} corresponds to {@code values[i + period - 1]}.
     */
    public static double[] emaSeries(double[] values, int period) {
        requireHistory(values, period, "EMA(" + period + ")");
        double k = 2.0 / (period + 1);
        double[] result = new double[values.length - period + 1];

        double seed = 0.0;
        for (int i = 0; i < period; i++) {
            seed += values[i];
        }
        result[0] = seed / period;
        for (int i = period; i < values.length; i++) {
            result[i - period + 1] = values[i] * k + result[i - period] * (1 - k);
        }
        return result;
    }

    public static double ema(double[] values, int period) {
        double[] series = emaSeries(values, period);
        return series[series.length - 1];
    }

    public static double sma(double[] values, int period) {
        requireHistory(values, period, "SMA(" + period + ")");
        double sum = 0.0;
        for (int i = values.length - period; i < values.length; i++) {
            sum += values[i];
        }
        return sum / period;
    }

    /**
     * Wilder's RSI. 100 when there were no losses over the window.
     */
    public static double rsi(double[] closes, int period) {
        requireHistory(closes, period + 1, "RSI(" + period + ")");
        double gain = 0.0;
        double loss = 0.0;
        for (int i = 1; i <= period; i++) {
            double change = closes[i] - closes[i - 1];
            if (change > 0) gain += change; else loss -= change;
        }
        double avgGain = gain / period;
        double avgLoss = loss / period;
        for (int i = period + 1; i < closes.length; i++) {
            double change = closes[i] - closes[i - 1];
            avgGain = (avgGain * (period - 1) + Math.max(change, 0)) / period;
            avgLoss = (avgLoss * (period - 1) + Math.max(-change, 0)) / period;
        }
        if (avgLoss == 0) {
            return avgGain == 0 ? 50.0 : 100.0;
        }
        double rs = avgGain / avgLoss;
        return 100.0 - 100.0 / (1.0 + rs);
    }

    public static Macd macd(double[] closes, int fastPeriod, int slowPeriod, int signalPeriod) {
        if (fastPeriod >= slowPeriod) {
            throw new IllegalArgumentException("Fast period must be shorter than slow period");
        }
        requireHistory(closes, slowPeriod + signalPeriod - 1, "MACD");
        double[] fast = emaSeries(closes, fastPeriod);
        double[] slow = emaSeries(closes, slowPeriod);

        // align the fast series to the slow one, which starts later
        int offset = slowPeriod - fastPeriod;
        double[] macdLine = new double[slow.length];
        for (int i = 0; i < slow.length; i++) {
            macdLine[i] = fast[i + offset] - slow[i];
        }
        double macd = macdLine[macdLine.length - 1];
        double signal = ema(macdLine, signalPeriod);
        return new Macd(macd, signal, macd - signal);
    }

    public static BollingerBands bollinger(double[] closes, int period, double stdDevs) {
        double middle = sma(closes, period);
        double variance = 0.0;
        for (int i = closes.length - period; i < closes.length; i++) {
            variance += Math.pow(closes[i] - middle, 2);
        }
        double std = Math.sqrt(variance / period);
        return new BollingerBands(middle + stdDevs * std, middle, middle - stdDevs * std);
    }

    /**
     * Standard deviation of simple returns, in percent.
     */
    public static double volatility(double[] closes) {
        requireHistory(closes, 3, "volatility");
        double[] returns = new double[closes.length - 1];
        double mean = 0.0;
        for (int i = 1; i < closes.length; i++) {
            returns[i - 1] = (closes[i] - closes[i - 1]) / closes[i - 1];
            mean += returns[i - 1];
        }
        mean /= returns.length;
        double variance = 0.0;
        for (double r : returns) {
            variance += Math.pow(r - mean, 2);
        }
        return Math.sqrt(variance / (returns.length - 1)) * 100.0;
    }

    public static double vwap(double[] prices, double[] volumes) {
        if (prices.length != volumes.length || prices.length == 0) {
            throw new IllegalArgumentException("VWAP needs matching, non-empty price and volume series");
        }
        double notional = 0.0;
        double volume = 0.0;
        for (int i = 0; i < prices.length; i++) {
            notional += prices[i] * volumes[i];
            volume += volumes[i];
        }
        return volume == 0 ? prices[prices.length - 1] : notional / volume;
    }

    private static void requireHistory(double[] values, int needed, String indicator) {
        if (values.length < needed) {
            throw new IllegalArgumentException(
                indicator + " needs " + needed + " values, got " + values.length);
        }
    }
}
