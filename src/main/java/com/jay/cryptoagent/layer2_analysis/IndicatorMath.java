package com.jay.cryptoagent.layer2_analysis;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Stateless indicator arithmetic over plain arrays.
 * EMA is seeded with the simple average of the first n values, RSI uses Wilder's smoothing.
 */
public final class IndicatorMath {

    private IndicatorMath() {}

    public record Macd(double macd, double signal, double histogram) {}

    public record SwingLevels(List<Double> swingLows, List<Double> swingHighs) {}

    // ── EMA ────────────────────────────────────────────────────────────────────

    public static double ema(double[] values, int period) {
        if (values.length < period) return values[values.length - 1];
        double k = 2.0 / (period + 1);
        double ema = mean(values, 0, period);
        for (int i = period; i < values.length; i++) {
            ema = values[i] * k + ema * (1 - k);
        }
        return ema;
    }

    /**
     * Full EMA series, same length as the input. The first n slots hold the seed average so the
     * series lines up index-for-index with its source.
     */
    public static double[] emaSeries(double[] values, int period) {
        double[] out = new double[values.length];
        if (values.length < period) {
            Arrays.fill(out, values[0]);
            return out;
        }
        double k = 2.0 / (period + 1);
        double ema = mean(values, 0, period);
        for (int i = 0; i < period; i++) out[i] = ema;
        for (int i = period; i < values.length; i++) {
            ema = values[i] * k + ema * (1 - k);
            out[i] = ema;
        }
        return out;
    }

    // ── RSI ────────────────────────────────────────────────────────────────────

    public static double rsi(double[] closes, int period) {
        if (closes.length < period + 1) return 50;

        double avgGain = 0;
        double avgLoss = 0;
        for (int i = 1; i <= period; i++) {
            double change = closes[i] - closes[i - 1];
            if (change > 0) avgGain += change;
            else avgLoss += -change;
        }
        avgGain /= period;
        avgLoss /= period;

        for (int i = period + 1; i < closes.length; i++) {
            double change = closes[i] - closes[i - 1];
            double gain = change > 0 ? change : 0;
            double loss = change < 0 ? -change : 0;
            avgGain = (avgGain * (period - 1) + gain) / period;
            avgLoss = (avgLoss * (period - 1) + loss) / period;
        }

        if (avgLoss == 0) return 100;
        double rs = avgGain / avgLoss;
        return 100 - 100 / (1 + rs);
    }

    // ── MACD ───────────────────────────────────────────────────────────────────

    /** MACD(12, 26) with a 9-period signal line computed over the whole MACD series. */
    public static Macd macd(double[] closes) {
        double[] ema12 = emaSeries(closes, 12);
        double[] ema26 = emaSeries(closes, 26);
        double[] line = new double[closes.length];
        for (int i = 0; i < closes.length; i++) {
            line[i] = ema12[i] - ema26[i];
        }
        double[] signal = emaSeries(line, 9);
        double m = line[line.length - 1];
        double s = signal[signal.length - 1];
        return new Macd(m, s, m - s);
    }

    // ── Swing Points ───────────────────────────────────────────────────────────

    /**
     * A candle is a swing high (low) when its high (low) is strictly greater (less) than the
     * highs (lows) of the {@code window} candles on each side.
     */
    public static SwingLevels swingLevels(double[] highs, double[] lows, int window) {
        List<Double> swingLows = new ArrayList<>();
        List<Double> swingHighs = new ArrayList<>();
        for (int i = window; i < highs.length - window; i++) {
            boolean isHigh = true;
            boolean isLow = true;
            for (int j = 1; j <= window; j++) {
                if (highs[i] <= highs[i - j] || highs[i] <= highs[i + j]) isHigh = false;
                if (lows[i] >= lows[i - j] || lows[i] >= lows[i + j]) isLow = false;
            }
            if (isHigh) swingHighs.add(highs[i]);
            if (isLow) swingLows.add(lows[i]);
        }
        return new SwingLevels(swingLows, swingHighs);
    }

    private static double mean(double[] values, int from, int to) {
        double sum = 0;
        for (int i = from; i < to; i++) sum += values[i];
        return sum / (to - from);
    }
}
