package com.marketsync.aggregation;

/**
 * Technical indicators over an ordered series (oldest first). Every function returns null when the series is
 * shorter than the indicator needs.
 */
public final class IndicatorCalculator {

    private IndicatorCalculator() {
    }

    public static Double sma(double[] values, int period) {
        if (period <= 0 || values.length < period) {
            return null;
        }
        double sum = 0.0;
        for (int i = values.length - period; i < values.length; i++) {
            sum += values[i];
        }
        return sum / period;
    }

    /**
     * EMA seeded with the SMA of the first {@code period} values, smoothing 2 / (period + 1).
     */
    public static Double ema(double[] values, int period) {
        if (period <= 0 || values.length < period) {
            return null;
        }
        double ema = 0.0;
        for (int i = 0; i < period; i++) {
            ema += values[i];
        }
        ema /= period;
        double k = 2.0 / (period + 1);
        for (int i = period; i < values.length; i++) {
            ema = values[i] * k + ema * (1 - k);
        }
        return ema;
    }

    /**
     * Wilder RSI. 100 when there were no losses over the window.
     */
    public static Double rsi(double[] closes, int period) {
        if (period <= 0 || closes.length <= period) {
            return null;
        }
        double gain = 0.0;
        double loss = 0.0;
        for (int i = 1; i <= period; i++) {
            double diff = closes[i] - closes[i - 1];
            if (diff >= 0) {
                gain += diff;
            } else {
                loss -= diff;
            }
        }
        double avgGain = gain / period;
        double avgLoss = loss / period;
        for (int i = period + 1; i < closes.length; i++) {
            double diff = closes[i] - closes[i - 1];
            avgGain = (avgGain * (period - 1) + Math.max(diff, 0.0)) / period;
            avgLoss = (avgLoss * (period - 1) + Math.max(-diff, 0.0)) / period;
        }
        if (avgLoss == 0.0) {
            return 100.0;
        }
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }

    /** EMA(fast) − EMA(slow). */
    public static Double macd(double[] closes, int fast, int slow) {
        Double f = ema(closes, fast);
        Double s = ema(closes, slow);
        return f == null || s == null ? null : f - s;
    }

    /**
     * @return {upper, middle, lower} with population standard deviation, or null
     */
    public static double[] bollinger(double[] closes, int period, double width) {
        Double middle = sma(closes, period);
        if (middle == null) {
            return null;
        }
        double variance = 0.0;
        for (int i = closes.length - period; i < closes.length; i++) {
            double d = closes[i] - middle;
            variance += d * d;
        }
        double std = Math.sqrt(variance / period);
        return new double[] {middle + width * std, middle, middle - width * std};
    }

    /**
     * Wilder ATR over true ranges; needs period + 1 bars.
     */
    public static Double atr(double[] highs, double[] lows, double[] closes, int period) {
        int n = closes.length;
        if (period <= 0 || n <= period || highs.length != n || lows.length != n) {
            return null;
        }
        double sum = 0.0;
        for (int i = 1; i <= period; i++) {
            sum += trueRange(highs[i], lows[i], closes[i - 1]);
        }
        double atr = sum / period;
        for (int i = period + 1; i < n; i++) {
            atr = (atr * (period - 1) + trueRange(highs[i], lows[i], closes[i - 1])) / period;
        }
        return atr;
    }

    private static double trueRange(double high, double low, double prevClose) {
        return Math.max(high - low, Math.max(Math.abs(high - prevClose), Math.abs(low - prevClose)));
    }
}
