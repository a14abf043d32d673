package com.fintech.papertrading.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fintech.papertrading.domain.PriceTick;

import java.util.ArrayList;
import java.util.List;

/**
 * Columnar price series: one array per field, aligned by index.
 *
 * Example response:
 * {
 *   "s": "ok",
 *   "asset": "BTC",
 *   "t": [1620000000, 1620000005],
 *   "p": [29500.5, 29501.0]
 * }
 */
public record PriceHistoryResponse(
    @JsonProperty("s") String status,
    @JsonProperty("asset") String asset,
    @JsonProperty("t") List<Long> time,
    @JsonProperty("p") List<Double> price
) {

    public static PriceHistoryResponse fromTicks(String asset, List<PriceTick> ticks) {
        List<Long> time = new ArrayList<>(ticks.size());
        List<Double> price = new ArrayList<>(ticks.size());
        for (PriceTick tick : ticks) {
            time.add(tick.timestamp() / 1000);
            price.add(tick.price());
        }
        return new PriceHistoryResponse("ok", asset, time, price);
    }
}
