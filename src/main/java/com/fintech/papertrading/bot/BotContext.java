package com.fintech.papertrading.bot;

import com.fintech.papertrading.domain.PriceTick;

import java.util.List;

/**
 * Immutable market and portfolio snapshot handed to a strategy on each tick.
 *
 * @param priceWindow Most recent raw ticks of the base asset, oldest first
 * @param baseBalance Base asset balance
 * @param quoteBalance Quote asset balance
 * @param currentPrice Base priced in quote units
 * @param baseAsset Base asset symbol
 * @param quoteAsset Quote asset symbol
 * @param tickCount Ticks completed since the bot started (0-indexed)
 */
public record BotContext(
    List<PriceTick> priceWindow,
    double baseBalance,
    double quoteBalance,
    double currentPrice,
    String baseAsset,
    String quoteAsset,
    long tickCount
) {

    public BotContext {
        priceWindow = List.copyOf(priceWindow);
    }
}
