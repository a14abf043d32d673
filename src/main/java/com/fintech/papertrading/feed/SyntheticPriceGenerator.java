package com.fintech.papertrading.feed;

import com.fintech.papertrading.domain.PriceTick;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic fallback series used when the feed cannot backfill history.
 *
 * <p>Point {@code i} steps back from {@code now}, oldest first, and sums three sine
 * waves around the base price: a 1% trend, a 0.5% short-term swing and 0.02% noise.
 */
public final class SyntheticPriceGenerator {

    private static final double TREND_AMPLITUDE = 0.01;
    private static final double SWING_AMPLITUDE = 0.005;
    private static final double NOISE_AMPLITUDE = 0.0002;

    private SyntheticPriceGenerator() {
    }

    /**
     * Generates {@code points} ticks ending at {@code nowMillis}, spaced {@code stepMillis} apart.
     */
    public static List<PriceTick> generate(String asset, double basePrice, long nowMillis, int points, long stepMillis) {
        if (!(basePrice > 0)) {
            throw new IllegalArgumentException("Base price must be positive: " + basePrice);
        }
        List<PriceTick> series = new ArrayList<>(Math.max(points, 0));
        for (int i = points - 1; i >= 0; i--) {
            series.add(new PriceTick(nowMillis - i * stepMillis, asset, priceAt(basePrice, i)));
        }
        return series;
    }

    static double priceAt(double basePrice, int i) {
        double trend = Math.sin(i / 100.0) * basePrice * TREND_AMPLITUDE;
        double swing = Math.sin(i / 20.0) * basePrice * SWING_AMPLITUDE;
        double noise = Math.sin(i * 7.0) * basePrice * NOISE_AMPLITUDE;
        return basePrice + trend + swing + noise;
    }
}
