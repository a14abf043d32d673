package com.fintech.papertrading.aggregation;

import com.fintech.papertrading.domain.Candle;
import com.fintech.papertrading.domain.Interval;
import com.fintech.papertrading.domain.PriceTick;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Live OHLC accumulators, one per asset per interval.
 *
 * <p>Candles close on tick count rather than wall clock: at the 5-second polling
 * cadence a 1-minute candle folds 12 ticks and a 5-minute candle 60. Closed
 * candles are returned to the caller, which ingests them into the store under
 * the state lock.
 */
@Component
public class CandleAggregator {

    private static final Logger log = LoggerFactory.getLogger(CandleAggregator.class);

    // Active candles keyed by "ASSET-INTERVAL" (e.g., "BTC-M1")
    private final Map<String, MutableCandle> activeCandles = new ConcurrentHashMap<>();

    private final AtomicLong ticksProcessed = new AtomicLong(0);
    private final AtomicLong candlesCompleted = new AtomicLong(0);

    public CandleAggregator(MeterRegistry meterRegistry) {
        meterRegistry.gauge("candle.aggregator.ticks.processed", ticksProcessed);
        meterRegistry.gauge("candle.aggregator.candles.completed", candlesCompleted);
    }

    /**
     * Folds a tick into every interval's accumulator.
     *
     * @return candles closed by this tick (possibly empty)
     */
    public List<ClosedCandle> onTick(PriceTick tick) {
        if (!tick.isValid()) {
            log.warn("Invalid tick received, skipping: {}", tick);
            return List.of();
        }

        List<ClosedCandle> closed = new ArrayList<>(Interval.values().length);
        for (Interval interval : Interval.values()) {
            String key = createKey(tick.asset(), interval);
            activeCandles.compute(key, (k, current) -> {
                MutableCandle candle = current;
                if (candle == null) {
                    candle = new MutableCandle(tick.asset(), interval.alignTimestamp(tick.timestamp()), tick.price());
                } else {
                    candle.update(tick.price());
                }

                if (candle.ticks >= interval.ticksPerCandle()) {
                    closed.add(new ClosedCandle(interval, candle.toImmutableCandle()));
                    candlesCompleted.incrementAndGet();
                    log.debug("Closed candle: asset={}, interval={}, window={}",
                             tick.asset(), interval, candle.windowStart);
                    // Reset: the next tick opens a fresh period
                    return null;
                }
                return candle;
            });
        }

        ticksProcessed.incrementAndGet();
        return closed;
    }

    /**
     * Discards all open accumulators for an asset (used after a backfill so live
     * candles start on a clean boundary).
     */
    public void reset(String asset) {
        for (Interval interval : Interval.values()) {
            activeCandles.remove(createKey(asset, interval));
        }
    }

    private String createKey(String asset, Interval interval) {
        return asset + "-" + interval.name();
    }

    /** Returns total ticks processed. */
    public long getTicksProcessed() {
        return ticksProcessed.get();
    }

    /** Returns total candles closed. */
    public long getCandlesCompleted() {
        return candlesCompleted.get();
    }

    /**
     * A candle closed for a given interval.
     */
    public record ClosedCandle(Interval interval, Candle candle) {
    }

    /**
     * Internal mutable accumulator. Only touched inside {@code compute}.
     */
    private static class MutableCandle {
        final String asset;
        final long windowStart;
        final double open;
        double high;
        double low;
        double close;
        long ticks;

        MutableCandle(String asset, long windowStart, double initialPrice) {
            this.asset = asset;
            this.windowStart = windowStart;
            this.open = initialPrice;
            this.high = initialPrice;
            this.low = initialPrice;
            this.close = initialPrice;
            this.ticks = 1;
        }

        void update(double price) {
            this.high = Math.max(this.high, price);
            this.low = Math.min(this.low, price);
            this.close = price;
            this.ticks++;
        }

        Candle toImmutableCandle() {
            return new Candle(asset, windowStart, open, high, low, close, ticks);
        }
    }
}
