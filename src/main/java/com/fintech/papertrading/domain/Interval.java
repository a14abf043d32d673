package com.fintech.papertrading.domain;

/**
 * OHLC resolutions kept by the market data store.
 * Candles close after a fixed number of ticks at the 5-second polling cadence.
 */
public enum Interval {

    M1(60_000L, 12, "1m"),
    M5(300_000L, 60, "5m");

    private final long milliseconds;
    private final int ticksPerCandle;
    private final String label;

    Interval(long milliseconds, int ticksPerCandle, String label) {
        this.milliseconds = milliseconds;
        this.ticksPerCandle = ticksPerCandle;
        this.label = label;
    }

    /** Returns interval duration in milliseconds. */
    public long toMillis() {
        return milliseconds;
    }

    /** Returns the number of 5-second ticks folded into one candle. */
    public int ticksPerCandle() {
        return ticksPerCandle;
    }

    public String label() {
        return label;
    }

    /**
     * Aligns timestamp to period start: (timestamp / intervalMs) * intervalMs.
     */
    public long alignTimestamp(long timestamp) {
        return (timestamp / milliseconds) * milliseconds;
    }

    /**
     * Parses "1m"/"m1"/"5m"/"m5" (case-insensitive).
     *
     * @throws IllegalArgumentException for any other value
     */
    public static Interval parse(String value) {
        return switch (value.trim().toLowerCase()) {
            case "1m", "m1" -> M1;
            case "5m", "m5" -> M5;
            default -> throw new IllegalArgumentException(
                "Unsupported interval '" + value + "'. Allowed: 1m, 5m");
        };
    }
}
