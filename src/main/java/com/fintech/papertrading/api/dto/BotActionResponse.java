package com.fintech.papertrading.api.dto;

import com.fintech.papertrading.bot.BotStatus;

public record BotActionResponse(boolean success, String message, BotStatus status) {
}
