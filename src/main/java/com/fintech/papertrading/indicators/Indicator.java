package com.fintech.papertrading.indicators;

/**
 * Stateless technical indicator over a price series.
 * Output has the input's length; entries before the warmup completes are {@code NaN}.
 */
public interface Indicator {

    double[] calculate(double[] prices);

    int period();
}
