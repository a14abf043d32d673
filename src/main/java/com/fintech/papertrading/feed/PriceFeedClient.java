package com.fintech.papertrading.feed;

import com.fintech.papertrading.domain.Candle;
import com.fintech.papertrading.domain.PriceTick;

import java.time.Instant;
import java.util.List;

/**
 * External source of reference-currency prices.
 * Implementations raise {@link PriceFeedException} for any transport or parse failure.
 */
public interface PriceFeedClient {

    /**
     * Current spot price of an asset.
     */
    PriceTick spot(String asset);

    /**
     * Close prices between {@code start} and {@code end}, oldest first.
     */
    List<PriceTick> history(String asset, Instant start, Instant end, int granularitySeconds);

    /**
     * OHLC candles between {@code start} and {@code end}, oldest first.
     */
    List<Candle> ohlc(String asset, Instant start, Instant end, int granularitySeconds);
}
