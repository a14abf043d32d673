package com.fintech.papertrading.indicators;

import java.util.Arrays;

/**
 * Exponential moving average seeded with the SMA of the first {@code period} prices,
 * then {@code ema[i] = price[i] * k + ema[i-1] * (1 - k)} with {@code k = 2 / (period + 1)}.
 */
public class ExponentialMovingAverage implements Indicator {

    private final int period;
    private final double multiplier;

    public ExponentialMovingAverage(int period) {
        if (period < 1) {
            throw new IllegalArgumentException("Period must be positive: " + period);
        }
        this.period = period;
        this.multiplier = 2.0 / (period + 1);
    }

    @Override
    public double[] calculate(double[] prices) {
        double[] result = new double[prices.length];
        Arrays.fill(result, Double.NaN);
        if (prices.length < period) {
            return result;
        }

        double seed = 0.0;
        for (int i = 0; i < period; i++) {
            seed += prices[i];
        }
        result[period - 1] = seed / period;

        for (int i = period; i < prices.length; i++) {
            result[i] = prices[i] * multiplier + result[i - 1] * (1 - multiplier);
        }
        return result;
    }

    @Override
    public int period() {
        return period;
    }
}
