package com.fintech.papertrading.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

/**
 * Deposit or withdrawal of the reference currency.
 */
public record AmountRequest(
    @Schema(description = "Trading user, defaults to the demo user", example = "demo_user")
    String userId,

    @Schema(example = "500")
    @NotNull(message = "Amount is required")
    Double amount
) {
}
