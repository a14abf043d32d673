package com.fintech.papertrading.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fintech.papertrading.domain.Candle;

import java.util.ArrayList;
import java.util.List;

/**
 * Response format compatible with TradingView Lightweight Charts.
 *
 * Uses columnar format where each OHLC component is in its own array. The feed has
 * no volume, so "n" carries the number of observations folded into each candle.
 *
 * Example response:
 * {
 *   "s": "ok",
 *   "t": [1620000000, 1620000060],
 *   "o": [29500.5, 29501.0],
 *   "h": [29510.0, 29505.0],
 *   "l": [29490.0, 29500.0],
 *   "c": [29505.0, 29502.0],
 *   "n": [12, 12]
 * }
 */
public record CandleResponse(
    @JsonProperty("s") String status,
    @JsonProperty("t") List<Long> time,
    @JsonProperty("o") List<Double> open,
    @JsonProperty("h") List<Double> high,
    @JsonProperty("l") List<Double> low,
    @JsonProperty("c") List<Double> close,
    @JsonProperty("n") List<Long> ticks
) {

    /**
     * Creates a successful response from a list of candles.
     */
    public static CandleResponse fromCandles(List<Candle> candles) {
        int size = candles.size();

        List<Long> time = new ArrayList<>(size);
        List<Double> open = new ArrayList<>(size);
        List<Double> high = new ArrayList<>(size);
        List<Double> low = new ArrayList<>(size);
        List<Double> close = new ArrayList<>(size);
        List<Long> ticks = new ArrayList<>(size);

        for (Candle candle : candles) {
            // Milliseconds to seconds for TradingView
            time.add(candle.time() / 1000);
            open.add(candle.open());
            high.add(candle.high());
            low.add(candle.low());
            close.add(candle.close());
            ticks.add(candle.ticks());
        }

        return new CandleResponse("ok", time, open, high, low, close, ticks);
    }
}
