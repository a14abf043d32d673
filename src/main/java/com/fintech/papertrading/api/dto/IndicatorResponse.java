package com.fintech.papertrading.api.dto;

import com.fintech.papertrading.indicators.IndicatorService.IndicatorSeries;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Price series plus each requested indicator aligned by index; warmup entries are null.
 */
public record IndicatorResponse(
    String asset,
    String timeframe,
    List<Long> timestamps,
    List<Double> prices,
    Map<String, List<Double>> indicators
) {

    public static IndicatorResponse from(IndicatorSeries series, String timeframe) {
        List<Long> timestamps = new ArrayList<>(series.timestamps().length);
        for (long timestamp : series.timestamps()) {
            timestamps.add(timestamp / 1000);
        }
        List<Double> prices = new ArrayList<>(series.prices().length);
        for (double price : series.prices()) {
            prices.add(price);
        }
        return new IndicatorResponse(series.asset(), timeframe, timestamps, prices, series.values());
    }
}
