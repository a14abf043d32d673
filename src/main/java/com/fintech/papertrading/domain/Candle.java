package com.fintech.papertrading.domain;

/**
 * Immutable OHLC candlestick summarising the ticks of one period for one asset.
 *
 * @param asset Asset symbol
 * @param time Period start timestamp (epoch millis)
 * @param open First price in period
 * @param high Maximum price (must be >= open, close, low)
 * @param low Minimum price (must be <= open, close, high)
 * @param close Last price in period
 * @param ticks Number of observations folded into the candle
 */
public record Candle(
    String asset,
    long time,
    double open,
    double high,
    double low,
    double close,
    long ticks
) {

    /**
     * Creates a single-price candle (first tick in period).
     */
    public static Candle of(String asset, long time, double price) {
        return new Candle(asset, time, price, price, price, price, 1);
    }

    /**
     * Validates OHLC invariants: high >= {open,close,low}, low <= {open,close}.
     */
    public Candle {
        if (high < low) {
            throw new IllegalArgumentException(
                "High price (" + high + ") cannot be less than low price (" + low + ")"
            );
        }
        if (high < open || high < close) {
            throw new IllegalArgumentException(
                "High price (" + high + ") must be >= open (" + open + ") and close (" + close + ")"
            );
        }
        if (low > open || low > close) {
            throw new IllegalArgumentException(
                "Low price (" + low + ") must be <= open (" + open + ") and close (" + close + ")"
            );
        }
    }
}
