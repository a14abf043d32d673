package com.fintech.papertrading.api.dto;

import com.fintech.papertrading.domain.TradeSide;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Manual market order. Quantity is validated by the ledger so rejections carry a ledger error code.
 */
public record TradeRequest(
    @Schema(description = "Trading user, defaults to the demo user", example = "demo_user")
    String userId,

    @Schema(example = "BTC")
    @NotBlank(message = "Base asset is required")
    String baseAsset,

    @Schema(example = "USD")
    @NotBlank(message = "Quote asset is required")
    String quoteAsset,

    @Schema(example = "BUY")
    @NotNull(message = "Side is required")
    TradeSide side,

    @Schema(description = "Quantity of base asset", example = "0.01")
    @NotNull(message = "Quantity is required")
    Double quantity
) {
}
