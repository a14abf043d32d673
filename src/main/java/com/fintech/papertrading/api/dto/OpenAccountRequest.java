package com.fintech.papertrading.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record OpenAccountRequest(
    @NotBlank(message = "User id is required")
    @Pattern(regexp = "^[A-Za-z0-9_-]{3,64}$", message = "User id must be 3-64 letters, digits, '_' or '-'")
    String userId,

    @NotBlank(message = "Username is required")
    @Size(max = 100, message = "Username must be at most 100 characters")
    String username
) {
}
