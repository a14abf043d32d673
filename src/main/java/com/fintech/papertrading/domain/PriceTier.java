package com.fintech.papertrading.domain;

/**
 * Price-point resolutions kept by the market data store.
 * RAW holds every polled tick; FIVE_MINUTE holds one close per 5-minute period.
 */
public enum PriceTier {
    RAW,
    FIVE_MINUTE
}
