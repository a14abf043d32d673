package com.fintech.papertrading.api.dto;

import com.fintech.papertrading.domain.PriceTick;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Latest price of an asset in the reference currency.
 */
@Schema(description = "Latest price observation")
public record PriceResponse(
    @Schema(example = "BTC") String asset,
    @Schema(example = "42513.27") double price,
    @Schema(description = "Unix seconds", example = "1733529420") long timestamp
) {

    public static PriceResponse from(PriceTick tick) {
        return new PriceResponse(tick.asset(), tick.price(), tick.timestamp() / 1000);
    }
}
