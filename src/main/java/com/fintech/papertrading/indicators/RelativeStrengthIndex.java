package com.fintech.papertrading.indicators;

import java.util.Arrays;

/**
 * Relative strength index with Wilder smoothing, bounded to [0, 100].
 *
 * <p>Needs {@code period + 1} prices. The first average gain/loss is a simple mean
 * over the first {@code period} changes; each later change is folded in as
 * {@code avg = (avg * (period - 1) + change) / period}. An average loss of zero
 * yields 100.
 */
public class RelativeStrengthIndex implements Indicator {

    private final int period;

    public RelativeStrengthIndex(int period) {
        if (period < 1) {
            throw new IllegalArgumentException("Period must be positive: " + period);
        }
        this.period = period;
    }

    @Override
    public double[] calculate(double[] prices) {
        double[] result = new double[prices.length];
        Arrays.fill(result, Double.NaN);
        if (prices.length < period + 1) {
            return result;
        }

        double avgGain = 0.0;
        double avgLoss = 0.0;
        for (int i = 1; i <= period; i++) {
            double change = prices[i] - prices[i - 1];
            avgGain += Math.max(change, 0.0);
            avgLoss += Math.max(-change, 0.0);
        }
        avgGain /= period;
        avgLoss /= period;
        result[period] = rsi(avgGain, avgLoss);

        for (int i = period + 1; i < prices.length; i++) {
            double change = prices[i] - prices[i - 1];
            avgGain = (avgGain * (period - 1) + Math.max(change, 0.0)) / period;
            avgLoss = (avgLoss * (period - 1) + Math.max(-change, 0.0)) / period;
            result[i] = rsi(avgGain, avgLoss);
        }
        return result;
    }

    private static double rsi(double avgGain, double avgLoss) {
        if (avgLoss == 0.0) {
            return 100.0;
        }
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }

    @Override
    public int period() {
        return period;
    }
}
