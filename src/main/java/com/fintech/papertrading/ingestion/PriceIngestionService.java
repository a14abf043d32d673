package com.fintech.papertrading.ingestion;

import com.fintech.papertrading.aggregation.CandleAggregator;
import com.fintech.papertrading.aggregation.CandleAggregator.ClosedCandle;
import com.fintech.papertrading.config.TradingProperties;
import com.fintech.papertrading.domain.Candle;
import com.fintech.papertrading.domain.Interval;
import com.fintech.papertrading.domain.PriceTick;
import com.fintech.papertrading.domain.PriceTier;
import com.fintech.papertrading.feed.PriceFeedClient;
import com.fintech.papertrading.feed.PriceFeedException;
import com.fintech.papertrading.feed.SyntheticPriceGenerator;
import com.fintech.papertrading.state.TradingState;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One independent task per traded asset: backfill the store, then poll the spot
 * price on a fixed cadence.
 *
 * <p>Network calls run outside the state lock; only the resulting ticks and candles
 * are written under it. A failed poll is logged and counted, and the next poll
 * runs as scheduled.
 */
@Service
@ConditionalOnProperty(name = "trading.ingestion.enabled", havingValue = "true", matchIfMissing = true)
public class PriceIngestionService {

    private static final Logger log = LoggerFactory.getLogger(PriceIngestionService.class);

    static final long TICK_SPACING_MILLIS = 5_000L;
    private static final int ONE_MINUTE_GRANULARITY = 60;
    private static final int FIVE_MINUTE_GRANULARITY = 300;
    private static final Duration FIVE_MINUTE_HISTORY = Duration.ofHours(24);

    private final TradingState state;
    private final PriceFeedClient feed;
    private final CandleAggregator aggregator;
    private final TradingProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final ScheduledExecutorService scheduler;

    public PriceIngestionService(
            TradingState state,
            PriceFeedClient feed,
            CandleAggregator aggregator,
            TradingProperties properties,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.state = state;
        this.feed = feed;
        this.aggregator = aggregator;
        this.properties = properties;
        this.clock = clock;
        this.meterRegistry = meterRegistry;

        AtomicInteger threadCounter = new AtomicInteger(1);
        int threads = Math.max(1, properties.getIngestion().getAssets().size());
        this.scheduler = Executors.newScheduledThreadPool(threads, r -> {
            Thread thread = new Thread(r, "price-ingestion-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
    }

    @PostConstruct
    public void start() {
        long pollMillis = properties.getIngestion().getPollInterval().toMillis();
        for (String asset : properties.getIngestion().getAssets()) {
            scheduler.execute(() -> {
                backfillOrContinue(asset);
                scheduler.scheduleAtFixedRate(() -> pollOnce(asset), pollMillis, pollMillis, TimeUnit.MILLISECONDS);
                log.info("Starting live {} price polling ({}ms interval)", asset, pollMillis);
            });
        }
        log.info("Started price ingestion for {}", properties.getIngestion().getAssets());
    }

    private void backfillOrContinue(String asset) {
        try {
            backfill(asset);
        } catch (RuntimeException e) {
            // Polling is scheduled regardless
            meterRegistry.counter("ingestion.backfill.failures", "asset", asset).increment();
            log.error("Unexpected error while backfilling {}, continuing with live polling", asset, e);
        }
    }

    /**
     * Fills the raw tier with the last hour of history interpolated to 5-second ticks,
     * and the 5-minute tiers with the last 24 hours. Falls back to a synthetic series
     * when history is unavailable.
     */
    public void backfill(String asset) {
        Instant now = clock.instant();
        log.info("Backfilling {} price data for last {}...", asset, properties.getIngestion().getBackfillRange());

        try {
            List<Candle> minuteCandles = feed.ohlc(asset, now.minus(properties.getIngestion().getBackfillRange()),
                now, ONE_MINUTE_GRANULARITY);
            if (minuteCandles.isEmpty()) {
                throw new PriceFeedException("No minute candles returned for " + asset);
            }
            List<PriceTick> ticks = interpolate(asset, minuteCandles, TICK_SPACING_MILLIS);
            state.write(s -> {
                minuteCandles.forEach(candle -> s.marketData().ingestOhlc(Interval.M1, candle));
                ticks.forEach(tick -> s.marketData().ingest(tick));
                return null;
            });
            log.info("Backfilled {} from {} minute candles ({} ticks)", asset, minuteCandles.size(), ticks.size());
        } catch (PriceFeedException e) {
            log.error("Failed to fetch {} historical data: {}", asset, e.getMessage());
            backfillSynthetic(asset, now);
        }

        try {
            List<Candle> fiveMinuteCandles = feed.ohlc(asset, now.minus(FIVE_MINUTE_HISTORY), now,
                FIVE_MINUTE_GRANULARITY);
            state.write(s -> {
                for (Candle candle : fiveMinuteCandles) {
                    s.marketData().ingestOhlc(Interval.M5, candle);
                    s.marketData().ingest(PriceTier.FIVE_MINUTE, new PriceTick(candle.time(), asset, candle.close()));
                }
                return null;
            });
            log.info("Backfilled {} 5-minute candles for {}", fiveMinuteCandles.size(), asset);
        } catch (PriceFeedException e) {
            log.warn("Failed to fetch {} 5-minute history, tier fills from live data: {}", asset, e.getMessage());
        }

        aggregator.reset(asset);
    }

    private void backfillSynthetic(String asset, Instant now) {
        Double basePrice;
        try {
            basePrice = feed.spot(asset).price();
        } catch (PriceFeedException e) {
            basePrice = properties.getIngestion().getSeedPrices().get(asset);
            log.error("Failed to fetch current {} price for simulation, seed price={}: {}",
                asset, basePrice, e.getMessage());
        }
        if (basePrice == null || !(basePrice > 0)) {
            log.error("No base price available for {}, raw tier fills from live data only", asset);
            return;
        }

        List<PriceTick> series = SyntheticPriceGenerator.generate(asset, basePrice, now.toEpochMilli(),
            properties.getIngestion().getSyntheticPoints(), TICK_SPACING_MILLIS);
        state.write(s -> {
            series.forEach(tick -> s.marketData().ingest(tick));
            return null;
        });
        meterRegistry.counter("ingestion.synthetic.backfills", "asset", asset).increment();
        log.info("Backfilled {} with {} simulated points around {}", asset, series.size(), basePrice);
    }

    /**
     * Fetches one spot price and folds it into the store and the candle accumulators.
     *
     * @return true when a tick was ingested
     */
    public boolean pollOnce(String asset) {
        try {
            PriceTick tick = feed.spot(asset);
            List<ClosedCandle> closed = aggregator.onTick(tick);
            state.write(s -> {
                s.marketData().ingest(tick);
                for (ClosedCandle entry : closed) {
                    Candle candle = entry.candle();
                    s.marketData().ingestOhlc(entry.interval(), candle);
                    if (entry.interval() == Interval.M5) {
                        s.marketData().ingest(PriceTier.FIVE_MINUTE, new PriceTick(candle.time(), asset, candle.close()));
                    }
                }
                return null;
            });
            log.debug("Fetched {} price: {}", asset, tick.price());
            return true;
        } catch (PriceFeedException e) {
            meterRegistry.counter("ingestion.fetch.failures", "asset", asset).increment();
            log.warn("Failed to fetch {} price: {}", asset, e.getMessage());
            return false;
        } catch (RuntimeException e) {
            // An escaping exception would cancel the periodic task
            meterRegistry.counter("ingestion.fetch.failures", "asset", asset).increment();
            log.error("Unexpected error while polling {}", asset, e);
            return false;
        }
    }

    /**
     * Linear interpolation between consecutive candle closes at a fixed spacing.
     * The last candle contributes its own close.
     */
    static List<PriceTick> interpolate(String asset, List<Candle> candles, long spacingMillis) {
        List<PriceTick> ticks = new ArrayList<>();
        for (int i = 0; i + 1 < candles.size(); i++) {
            Candle from = candles.get(i);
            Candle to = candles.get(i + 1);
            long span = to.time() - from.time();
            long steps = Math.max(1, span / spacingMillis);
            for (long step = 0; step < steps; step++) {
                double fraction = (double) step / steps;
                double price = from.close() + (to.close() - from.close()) * fraction;
                ticks.add(new PriceTick(from.time() + step * spacingMillis, asset, price));
            }
        }
        if (!candles.isEmpty()) {
            Candle last = candles.get(candles.size() - 1);
            ticks.add(new PriceTick(last.time(), asset, last.close()));
        }
        return ticks;
    }

    @PreDestroy
    public void shutdown() {
        log.info("Stopping price ingestion");
        scheduler.shutdownNow();
    }
}
