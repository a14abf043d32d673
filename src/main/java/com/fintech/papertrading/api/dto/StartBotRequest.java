package com.fintech.papertrading.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record StartBotRequest(
    @Schema(description = "Trading user, defaults to the demo user", example = "demo_user")
    String userId,

    @Schema(description = "Registered strategy name", example = "naive_momentum")
    @NotBlank(message = "Bot name is required")
    String botName,

    @Schema(example = "BTC")
    @NotBlank(message = "Base asset is required")
    String baseAsset,

    @Schema(example = "USD")
    @NotBlank(message = "Quote asset is required")
    String quoteAsset,

    @Schema(description = "Loss in the reference currency that stops the bot", example = "1000")
    @NotNull(message = "Stoploss amount is required")
    Double stoplossAmount
) {
}
