package com.fintech.papertrading.api;

import com.fintech.papertrading.api.dto.CandleResponse;
import com.fintech.papertrading.api.dto.PriceHistoryResponse;
import com.fintech.papertrading.api.dto.PriceResponse;
import com.fintech.papertrading.domain.Candle;
import com.fintech.papertrading.domain.Interval;
import com.fintech.papertrading.domain.PriceTick;
import com.fintech.papertrading.state.TradingState;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.NoSuchElementException;

/**
 * Read-only market data: latest price, raw price history and OHLC candles.
 */
@RestController
@RequestMapping("/api/v1")
@Validated
@Tag(name = "Market Data", description = "Prices and candles from the in-memory market data store")
public class MarketDataController {

    private static final Logger log = LoggerFactory.getLogger(MarketDataController.class);

    private final TradingState state;
    private final MeterRegistry meterRegistry;

    public MarketDataController(TradingState state, MeterRegistry meterRegistry) {
        this.state = state;
        this.meterRegistry = meterRegistry;
    }

    @Operation(summary = "Get the latest price of an asset")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Latest price"),
        @ApiResponse(
            responseCode = "404",
            description = "No price ingested yet for the asset",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    @GetMapping("/price")
    public ResponseEntity<PriceResponse> getPrice(
            @Parameter(description = "Asset symbol", example = "BTC")
            @RequestParam(defaultValue = "BTC") @NotBlank String asset) {
        String symbol = normalize(asset);
        List<PriceTick> latest = state.window(symbol, 1);
        if (latest.isEmpty()) {
            throw new NoSuchElementException("No price data found for asset: " + symbol);
        }
        return ResponseEntity.ok(PriceResponse.from(latest.get(0)));
    }

    @Operation(
        summary = "Get raw price history",
        description = "Most recent 5-second ticks, oldest first. Returns fewer points when less history is available."
    )
    @GetMapping("/price/history")
    public ResponseEntity<PriceHistoryResponse> getPriceHistory(
            @Parameter(description = "Asset symbol", example = "BTC")
            @RequestParam(defaultValue = "BTC") @NotBlank String asset,

            @Parameter(description = "Maximum number of ticks", example = "720")
            @RequestParam(defaultValue = "720")
            @Min(value = 1, message = "Limit must be at least 1")
            @Max(value = 17_280, message = "Limit must be at most 17280")
            int limit) {
        String symbol = normalize(asset);
        return ResponseEntity.ok(PriceHistoryResponse.fromTicks(symbol, state.window(symbol, limit)));
    }

    /**
     * GET /api/v1/candles
     *
     * @param asset Asset symbol (e.g., "BTC")
     * @param interval Candle interval, "1m" or "5m"
     * @param limit Maximum number of candles, newest last
     * @return TradingView-compatible OHLC data
     */
    @Operation(
        summary = "Get OHLC candles",
        description = """
            Returns the most recent closed candles for an asset.

            **Supported Intervals:** 1m (last hour), 5m (last 24 hours)

            **Example Request:**
            ```
            GET /api/v1/candles?asset=BTC&interval=1m&limit=60
            ```
            """
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Successfully retrieved candle data",
            content = @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = CandleResponse.class),
                examples = @ExampleObject(
                    name = "Sample Response",
                    value = """
                        {
                          "s": "ok",
                          "t": [1733529420, 1733529480],
                          "o": [50000.0, 50100.0],
                          "h": [50150.0, 50200.0],
                          "l": [49950.0, 50000.0],
                          "c": [50100.0, 50050.0],
                          "n": [12, 12]
                        }
                        """
                )
            )
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Unsupported interval or limit out of range",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    @GetMapping("/candles")
    public ResponseEntity<CandleResponse> getCandles(
            @Parameter(description = "Asset symbol", example = "BTC")
            @RequestParam(defaultValue = "BTC") @NotBlank String asset,

            @Parameter(description = "Candle interval: 1m, 5m", example = "1m")
            @RequestParam(defaultValue = "1m") @NotBlank String interval,

            @Parameter(description = "Maximum number of candles", example = "60")
            @RequestParam(defaultValue = "60")
            @Min(value = 1, message = "Limit must be at least 1")
            @Max(value = 288, message = "Limit must be at most 288")
            int limit) {

        Timer.Sample sample = Timer.start(meterRegistry);
        String symbol = normalize(asset);
        Interval parsed = Interval.parse(interval);

        List<Candle> candles = state.candles(parsed, symbol, limit);
        sample.stop(meterRegistry.timer("api.candles.latency", "interval", parsed.label()));

        log.debug("Returning {} {} candles for {}", candles.size(), parsed.label(), symbol);
        return ResponseEntity.ok(CandleResponse.fromCandles(candles));
    }

    static String normalize(String asset) {
        return asset.trim().toUpperCase();
    }
}
