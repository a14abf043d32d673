package com.fintech.papertrading.feed;

import com.fasterxml.jackson.databind.JsonNode;
import com.fintech.papertrading.config.TradingProperties;
import com.fintech.papertrading.domain.Candle;
import com.fintech.papertrading.domain.PriceTick;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;

/**
 * Coinbase adapter: spot prices from the public v2 API, candles from the exchange API.
 *
 * <p>Candle rows arrive as {@code [time, low, high, open, close, volume]} with time in
 * epoch seconds, newest first; they are returned oldest first. All calls go through
 * the "priceFeed" circuit breaker.
 */
@Component
public class CoinbasePriceFeedClient implements PriceFeedClient {

    private static final Logger log = LoggerFactory.getLogger(CoinbasePriceFeedClient.class);

    private final RestTemplate restTemplate;
    private final TradingProperties properties;
    private final CircuitBreaker circuitBreaker;
    private final Clock clock;

    public CoinbasePriceFeedClient(
            @Qualifier("priceFeedRestTemplate") RestTemplate restTemplate,
            TradingProperties properties,
            CircuitBreakerRegistry circuitBreakerRegistry,
            Clock clock) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker("priceFeed");
        this.clock = clock;

        circuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                log.warn("Price feed circuit breaker state changed: {} -> {}",
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState())
            );
    }

    @Override
    public PriceTick spot(String asset) {
        URI uri = UriComponentsBuilder.fromHttpUrl(properties.getFeed().getSpotBaseUrl())
            .path("/prices/{pair}/spot")
            .buildAndExpand(productId(asset))
            .toUri();

        JsonNode body = call(uri, "spot " + asset);
        JsonNode amount = body.path("data").path("amount");
        if (amount.isMissingNode()) {
            throw new PriceFeedException("Spot response for " + asset + " has no data.amount");
        }
        double price = parsePrice(amount.asText(), asset);
        return new PriceTick(clock.millis(), asset, price);
    }

    @Override
    public List<PriceTick> history(String asset, Instant start, Instant end, int granularitySeconds) {
        return ohlc(asset, start, end, granularitySeconds).stream()
            .map(candle -> new PriceTick(candle.time(), asset, candle.close()))
            .toList();
    }

    @Override
    public List<Candle> ohlc(String asset, Instant start, Instant end, int granularitySeconds) {
        URI uri = UriComponentsBuilder.fromHttpUrl(properties.getFeed().getExchangeBaseUrl())
            .path("/products/{pair}/candles")
            .queryParam("start", start.toString())
            .queryParam("end", end.toString())
            .queryParam("granularity", granularitySeconds)
            .buildAndExpand(productId(asset))
            .encode()
            .toUri();

        JsonNode body = call(uri, "candles " + asset);
        if (!body.isArray()) {
            throw new PriceFeedException("Candle response for " + asset + " is not an array");
        }

        List<Candle> candles = new ArrayList<>(body.size());
        for (JsonNode row : body) {
            if (!row.isArray() || row.size() < 5) {
                log.debug("Skipping malformed candle row for {}: {}", asset, row);
                continue;
            }
            try {
                candles.add(new Candle(
                    asset,
                    row.get(0).asLong() * 1000L,
                    row.get(3).asDouble(),
                    row.get(2).asDouble(),
                    row.get(1).asDouble(),
                    row.get(4).asDouble(),
                    1
                ));
            } catch (IllegalArgumentException e) {
                log.debug("Skipping inconsistent candle row for {}: {}", asset, e.getMessage());
            }
        }
        candles.sort(Comparator.comparingLong(Candle::time));
        log.debug("Fetched {} candles for {} at {}s granularity", candles.size(), asset, granularitySeconds);
        return candles;
    }

    private JsonNode call(URI uri, String description) {
        Supplier<JsonNode> request = () -> restTemplate.getForObject(uri, JsonNode.class);
        try {
            JsonNode body = circuitBreaker.executeSupplier(request);
            if (body == null) {
                throw new PriceFeedException("Empty response for " + description);
            }
            return body;
        } catch (CallNotPermittedException e) {
            throw new PriceFeedException("Price feed circuit breaker open, skipping " + description, e);
        } catch (RestClientException e) {
            throw new PriceFeedException("Request failed for " + description + ": " + e.getMessage(), e);
        }
    }

    private String productId(String asset) {
        return asset + "-" + properties.getReferenceCurrency();
    }

    private static double parsePrice(String raw, String asset) {
        try {
            double price = Double.parseDouble(raw);
            if (!(price > 0) || !Double.isFinite(price)) {
                throw new PriceFeedException("Non-positive spot price for " + asset + ": " + raw);
            }
            return price;
        } catch (NumberFormatException e) {
            throw new PriceFeedException("Unparseable spot price for " + asset + ": " + raw, e);
        }
    }
}
