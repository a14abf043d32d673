package com.fintech.papertrading.bot;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Fixed-size buffer of recent prices for strategies that track movement across ticks.
 */
public class PriceHistory {

    private final Deque<Double> prices = new ArrayDeque<>();
    private final int maxSize;

    public PriceHistory(int maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("Max size must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
    }

    public void push(double price) {
        prices.addLast(price);
        if (prices.size() > maxSize) {
            prices.removeFirst();
        }
    }

    /** The most recent {@code n} prices (fewer if not enough data), oldest first. */
    public List<Double> lastN(int n) {
        List<Double> all = new ArrayList<>(prices);
        return all.subList(Math.max(0, all.size() - n), all.size());
    }

    public boolean hasAtLeast(int n) {
        return prices.size() >= n;
    }

    public int size() {
        return prices.size();
    }
}
