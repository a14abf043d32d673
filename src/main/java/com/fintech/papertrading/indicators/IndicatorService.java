package com.fintech.papertrading.indicators;

import com.fintech.papertrading.config.TradingProperties;
import com.fintech.papertrading.domain.PriceTick;
import com.fintech.papertrading.state.TradingState;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Evaluates named indicators ("sma_20", "ema_12", "rsi_14") over the last hour of raw ticks.
 */
@Service
public class IndicatorService {

    public static final int MIN_POINTS = 20;
    static final int MIN_PERIOD = 2;
    static final int MAX_PERIOD = 200;

    private final TradingState state;
    private final TradingProperties properties;

    public IndicatorService(TradingState state, TradingProperties properties) {
        this.state = state;
        this.properties = properties;
    }

    /**
     * @throws NoSuchElementException when the asset has no price data
     * @throws IllegalArgumentException for fewer than {@link #MIN_POINTS} points or an unknown indicator
     */
    public IndicatorSeries evaluate(String asset, String indicatorList) {
        Map<String, Indicator> requested = parse(indicatorList);

        List<PriceTick> window = state.window(asset, properties.getBot().getContextWindow());
        if (window.isEmpty()) {
            throw new NoSuchElementException("No price data found for asset: " + asset);
        }
        if (window.size() < MIN_POINTS) {
            throw new IllegalArgumentException(
                "Insufficient data for indicators. Need at least " + MIN_POINTS + " points, have " + window.size());
        }

        long[] timestamps = new long[window.size()];
        double[] prices = new double[window.size()];
        for (int i = 0; i < window.size(); i++) {
            timestamps[i] = window.get(i).timestamp();
            prices[i] = window.get(i).price();
        }

        Map<String, List<Double>> values = new LinkedHashMap<>();
        requested.forEach((name, indicator) -> values.put(name, withNulls(indicator.calculate(prices))));
        return new IndicatorSeries(asset, timestamps, prices, values);
    }

    /**
     * Parses a comma-separated list of {@code type_period} names.
     *
     * @throws IllegalArgumentException for malformed names, unknown types or periods outside [2, 200]
     */
    static Map<String, Indicator> parse(String indicatorList) {
        Map<String, Indicator> indicators = new LinkedHashMap<>();
        if (indicatorList == null || indicatorList.isBlank()) {
            throw new IllegalArgumentException("At least one indicator is required");
        }
        for (String raw : indicatorList.split(",")) {
            String name = raw.trim().toLowerCase();
            String[] parts = name.split("_");
            if (parts.length != 2) {
                throw new IllegalArgumentException("Malformed indicator '" + raw.trim() + "', expected e.g. sma_20");
            }
            int period;
            try {
                period = Integer.parseInt(parts[1]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid period in indicator '" + raw.trim() + "'");
            }
            if (period < MIN_PERIOD || period > MAX_PERIOD) {
                throw new IllegalArgumentException(
                    "Period must be between " + MIN_PERIOD + " and " + MAX_PERIOD + ": " + raw.trim());
            }
            indicators.put(name, create(parts[0], period));
        }
        return indicators;
    }

    private static Indicator create(String type, int period) {
        return switch (type) {
            case "sma" -> new SimpleMovingAverage(period);
            case "ema" -> new ExponentialMovingAverage(period);
            case "rsi" -> new RelativeStrengthIndex(period);
            default -> throw new IllegalArgumentException("Unknown indicator type '" + type + "'. Allowed: sma, ema, rsi");
        };
    }

    private static List<Double> withNulls(double[] values) {
        List<Double> result = new ArrayList<>(values.length);
        for (double value : values) {
            result.add(Double.isNaN(value) ? null : value);
        }
        return result;
    }

    /**
     * Evaluated indicators aligned with the price series; warmup entries are null.
     */
    public record IndicatorSeries(String asset, long[] timestamps, double[] prices, Map<String, List<Double>> values) {
    }
}
