package com.stockinsight.analysis.indicator;

import java.util.Arrays;
import java.util.List;

/**
 * Pure calculation utilities for technical indicators.
 * Input series are expected oldest-first (last index = most recent bar).
 * Every method returns NaN instead of a fabricated value when the series is too short.
 */
public final class TechnicalIndicators {

    private TechnicalIndicators() {}

    // ── Simple Moving Average ────────────────────────────────────────────────

    /**
     * @param values  series, oldest-first
     * @param period  number of periods ending at the latest value
     * @return SMA value, or NaN if insufficient data
     */
    public static double sma(List<Double> values, int period) {
        return smaEndingAt(values, period, values == null ? -1 : values.size() - 1);
    }

    static double smaEndingAt(List<Double> values, int period, int end) {
        if (values == null || period <= 0 || end + 1 < period) return Double.NaN;
        double sum = 0;
        for (int i = end - period + 1; i <= end; i++) sum += values.get(i);
        return sum / period;
    }

    // ── Exponential Moving Average ───────────────────────────────────────────

    /**
     * Full EMA series seeded with the SMA of the first {@code period} values.
     * Entries before index {@code period - 1} are NaN.
     */
    public static double[] emaSeries(double[] values, int period) {
        double[] out = new double[values.length];
        Arrays.fill(out, Double.NaN);
        if (period <= 0 || values.length < period) return out;
        double k = 2.0 / (period + 1);
        double seed = 0;
        for (int i = 0; i < period; i++) seed += values[i];
        out[period - 1] = seed / period;
        for (int i = period; i < values.length; i++) {
            out[i] = out[i - 1] + k * (values[i] - out[i - 1]);
        }
        return out;
    }

    /**
     * @return most-recent EMA value, or NaN if insufficient data
     */
    public static double ema(List<Double> values, int period) {
        if (values == null || values.isEmpty()) return Double.NaN;
        double[] series = emaSeries(toArray(values), period);
        return series[series.length - 1];
    }

    // ── RSI ─────────────────────────────────────────────────────────────────

    /**
     * Computes RSI using Wilder's Smoothed Moving Average.
     * A series with neither gains nor losses has RSI 50.
     * @param closes  closing prices, oldest-first
     * @param period  lookback period (typically 14)
     * @return RSI value 0–100, or NaN if insufficient data
     */
    public static double rsi(List<Double> closes, int period) {
        if (closes == null || period <= 0 || closes.size() < period + 1) return Double.NaN;
        int n = closes.size();

        double avgGain = 0;
        double avgLoss = 0;

        // Initial average over first `period` changes
        for (int i = 1; i <= period; i++) {
            double change = closes.get(i) - closes.get(i - 1);
            if (change > 0) avgGain += change;
            else avgLoss += -change;
        }
        avgGain /= period;
        avgLoss /= period;

        for (int i = period + 1; i < n; i++) {
            double change = closes.get(i) - closes.get(i - 1);
            double gain = Math.max(change, 0);
            double loss = Math.max(-change, 0);
            avgGain = (avgGain * (period - 1) + gain) / period;
            avgLoss = (avgLoss * (period - 1) + loss) / period;
        }

        if (avgGain == 0 && avgLoss == 0) return 50.0;
        if (avgLoss == 0) return 100.0;
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }

    // ── Standard deviation (population) ─────────────────────────────────────

    public static double stdDev(List<Double> values, int period) {
        if (values == null || period <= 0 || values.size() < period) return Double.NaN;
        double mean = sma(values, period);
        double variance = 0;
        for (int i = values.size() - period; i < values.size(); i++) {
            double diff = values.get(i) - mean;
            variance += diff * diff;
        }
        return Math.sqrt(variance / period);
    }

    /**
     * Standard deviation of simple daily returns over the whole series, in percent.
     * Needs at least three values (two returns).
     */
    public static double returnVolatilityPercent(List<Double> closes) {
        if (closes == null || closes.size() < 3) return Double.NaN;
        int n = closes.size() - 1;
        double[] returns = new double[n];
        double mean = 0;
        for (int i = 1; i <= n; i++) {
            double prev = closes.get(i - 1);
            returns[i - 1] = prev == 0 ? 0 : (closes.get(i) - prev) / prev;
            mean += returns[i - 1];
        }
        mean /= n;
        double variance = 0;
        for (double r : returns) variance += (r - mean) * (r - mean);
        return Math.sqrt(variance / n) * 100.0;
    }

    static double[] toArray(List<Double> values) {
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) out[i] = values.get(i);
        return out;
    }
}
