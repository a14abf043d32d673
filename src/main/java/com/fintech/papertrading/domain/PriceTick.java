package com.fintech.papertrading.domain;

import java.util.Objects;

/**
 * Immutable price observation for a single asset, priced in the reference currency.
 *
 * @param timestamp Observation time (Unix epoch millis)
 * @param asset Asset symbol (e.g., "BTC")
 * @param price Price of one unit of the asset
 */
public record PriceTick(
    long timestamp,
    String asset,
    double price
) {

    public PriceTick {
        Objects.requireNonNull(asset, "Asset cannot be null");
    }

    /** Validates price > 0 (and finite), timestamp > 0. */
    public boolean isValid() {
        return price > 0 && Double.isFinite(price) && timestamp > 0;
    }
}
