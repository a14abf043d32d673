package com.fintech.papertrading.bot;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fintech.papertrading.state.BotSupervisionRecord;

import java.time.Instant;

/**
 * Snapshot of a user's bot. All fields but {@code active} are null when no bot runs.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BotStatus(
    boolean active,
    String botName,
    String tradingPair,
    Double stoplossAmount,
    Double initialPortfolioValue,
    Long ticks,
    Instant startedAt
) {

    public static BotStatus inactive() {
        return new BotStatus(false, null, null, null, null, null, null);
    }

    public static BotStatus of(BotSupervisionRecord record) {
        return new BotStatus(
            true,
            record.getStrategyName(),
            record.tradingPair(),
            record.getStoplossAmount(),
            record.getInitialPortfolioValueUsd(),
            record.getTicks(),
            record.getStartedAt()
        );
    }
}
