package com.fintech.papertrading.api;

import com.fintech.papertrading.api.dto.IndicatorResponse;
import com.fintech.papertrading.indicators.IndicatorService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
@Validated
@Tag(name = "Indicators", description = "Technical indicators over recent prices")
public class IndicatorController {

    private static final String SUPPORTED_TIMEFRAME = "1h";

    private final IndicatorService indicatorService;

    public IndicatorController(IndicatorService indicatorService) {
        this.indicatorService = indicatorService;
    }

    @Operation(
        summary = "Compute indicators",
        description = "Evaluates a comma-separated list such as sma_20,ema_12,rsi_14 over the last hour of 5-second "
            + "prices. Needs at least 20 points. Periods must be between 2 and 200."
    )
    @GetMapping("/indicators")
    public ResponseEntity<IndicatorResponse> getIndicators(
            @Parameter(description = "Asset symbol", example = "BTC")
            @RequestParam(defaultValue = "BTC") @NotBlank String asset,

            @Parameter(description = "Only 1h is supported", example = "1h")
            @RequestParam(defaultValue = SUPPORTED_TIMEFRAME) String timeframe,

            @Parameter(description = "Comma-separated indicator names", example = "sma_20,ema_12,rsi_14")
            @RequestParam @NotBlank String indicators) {

        if (!SUPPORTED_TIMEFRAME.equals(timeframe)) {
            throw new IllegalArgumentException(
                "Indicators are only supported for 1h timeframe. Requested: " + timeframe);
        }
        IndicatorService.IndicatorSeries series =
            indicatorService.evaluate(MarketDataController.normalize(asset), indicators);
        return ResponseEntity.ok(IndicatorResponse.from(series, timeframe));
    }
}
