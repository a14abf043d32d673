package com.fintech.papertrading.indicators;

import java.util.Arrays;

/**
 * Simple moving average using a running sum. The first {@code period - 1} entries are NaN.
 */
public class SimpleMovingAverage implements Indicator {

    private final int period;

    public SimpleMovingAverage(int period) {
        if (period < 1) {
            throw new IllegalArgumentException("Period must be positive: " + period);
        }
        this.period = period;
    }

    @Override
    public double[] calculate(double[] prices) {
        double[] result = new double[prices.length];
        Arrays.fill(result, Double.NaN);
        if (prices.length < period) {
            return result;
        }

        double sum = 0.0;
        for (int i = 0; i < prices.length; i++) {
            sum += prices[i];
            if (i >= period) {
                sum -= prices[i - period];
            }
            if (i >= period - 1) {
                result[i] = sum / period;
            }
        }
        return result;
    }

    @Override
    public int period() {
        return period;
    }
}
