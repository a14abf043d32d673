package com.fintech.papertrading.marketdata;

import com.fintech.papertrading.domain.Candle;
import com.fintech.papertrading.domain.Interval;
import com.fintech.papertrading.domain.PriceTick;
import com.fintech.papertrading.domain.PriceTier;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeSet;

/**
 * Bounded multi-resolution price history per asset and the single source of
 * truth for "current price".
 *
 * <p>Tiers:
 * <ul>
 *   <li>{@link PriceTier#RAW}: every polled tick (24h at 5s cadence by default)</li>
 *   <li>{@link PriceTier#FIVE_MINUTE}: one close per 5 minutes (24h)</li>
 *   <li>{@link Interval#M1} OHLC: 1h of 1-minute candles</li>
 *   <li>{@link Interval#M5} OHLC: 24h of 5-minute candles</li>
 * </ul>
 *
 * <p>Queries on missing data return absence, never a zero price. Not thread-safe;
 * all access goes through the {@code TradingState} read/write lock.
 */
public class MarketDataStore {

    private final String referenceCurrency;
    private final Map<PriceTier, BoundedSeries<PriceTick>> priceSeries = new EnumMap<>(PriceTier.class);
    private final Map<Interval, BoundedSeries<Candle>> candleSeries = new EnumMap<>(Interval.class);

    public MarketDataStore(String referenceCurrency, Capacities capacities) {
        this.referenceCurrency = Objects.requireNonNull(referenceCurrency, "Reference currency cannot be null");
        priceSeries.put(PriceTier.RAW, new BoundedSeries<>(capacities.rawTicks(), PriceTick::asset));
        priceSeries.put(PriceTier.FIVE_MINUTE, new BoundedSeries<>(capacities.fiveMinutePrices(), PriceTick::asset));
        candleSeries.put(Interval.M1, new BoundedSeries<>(capacities.oneMinuteCandles(), Candle::asset));
        candleSeries.put(Interval.M5, new BoundedSeries<>(capacities.fiveMinuteCandles(), Candle::asset));
    }

    /** Appends a raw tick. */
    public void ingest(PriceTick tick) {
        ingest(PriceTier.RAW, tick);
    }

    public void ingest(PriceTier tier, PriceTick tick) {
        priceSeries.get(tier).append(tick);
    }

    public void ingestOhlc(Interval interval, Candle candle) {
        candleSeries.get(interval).append(candle);
    }

    /** Price of the most recent raw tick for the asset. */
    public OptionalDouble latestPrice(String asset) {
        return priceSeries.get(PriceTier.RAW).latest(asset)
            .map(tick -> OptionalDouble.of(tick.price()))
            .orElse(OptionalDouble.empty());
    }

    /**
     * Base priced in quote units, triangulated through the reference currency.
     * Absent when either leg has no data or the divisor is not positive.
     */
    public OptionalDouble pairPrice(String base, String quote) {
        if (base.equals(quote)) {
            return OptionalDouble.empty();
        }
        if (quote.equals(referenceCurrency)) {
            return latestPrice(base);
        }
        OptionalDouble quotePrice = latestPrice(quote);
        if (quotePrice.isEmpty() || quotePrice.getAsDouble() <= 0) {
            return OptionalDouble.empty();
        }
        if (base.equals(referenceCurrency)) {
            return OptionalDouble.of(1.0 / quotePrice.getAsDouble());
        }
        OptionalDouble basePrice = latestPrice(base);
        if (basePrice.isEmpty()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(basePrice.getAsDouble() / quotePrice.getAsDouble());
    }

    /**
     * USD-style valuation of one unit: 1.0 for the reference currency itself,
     * otherwise the latest price.
     */
    public OptionalDouble referencePrice(String asset) {
        return asset.equals(referenceCurrency) ? OptionalDouble.of(1.0) : latestPrice(asset);
    }

    /** Last {@code limit} raw ticks, oldest first. */
    public List<PriceTick> window(String asset, int limit) {
        return window(PriceTier.RAW, asset, limit);
    }

    public List<PriceTick> window(PriceTier tier, String asset, int limit) {
        return priceSeries.get(tier).last(asset, limit);
    }

    /** Last {@code limit} closed candles, oldest first. */
    public List<Candle> candles(Interval interval, String asset, int limit) {
        return candleSeries.get(interval).last(asset, limit);
    }

    public int size(PriceTier tier, String asset) {
        return priceSeries.get(tier).size(asset);
    }

    public int size(Interval interval, String asset) {
        return candleSeries.get(interval).size(asset);
    }

    public int capacity(PriceTier tier) {
        return priceSeries.get(tier).capacity();
    }

    public int capacity(Interval interval) {
        return candleSeries.get(interval).capacity();
    }

    /** Assets with at least one raw tick. */
    public Set<String> assets() {
        return new TreeSet<>(priceSeries.get(PriceTier.RAW).assets());
    }

    public String referenceCurrency() {
        return referenceCurrency;
    }

    /**
     * Per-asset capacity of each tier.
     */
    public record Capacities(int rawTicks, int fiveMinutePrices, int oneMinuteCandles, int fiveMinuteCandles) {

        /** 24h of 5s ticks, 24h of 5m points, 1h of 1m candles, 24h of 5m candles. */
        public static Capacities defaults() {
            return new Capacities(17_280, 288, 60, 288);
        }
    }
}
