package com.fintech.papertrading.bot;

/**
 * Strategy output. Buy and sell sizes are expressed in quote-currency value;
 * the supervisor converts them to a base quantity at the current price.
 */
public record BotDecision(Action action, double quoteAmount) {

    private static final BotDecision DO_NOTHING = new BotDecision(Action.DO_NOTHING, 0.0);

    public enum Action {
        DO_NOTHING,
        BUY,
        SELL
    }

    public static BotDecision doNothing() {
        return DO_NOTHING;
    }

    public static BotDecision buy(double quoteAmount) {
        return new BotDecision(Action.BUY, quoteAmount);
    }

    public static BotDecision sell(double quoteAmount) {
        return new BotDecision(Action.SELL, quoteAmount);
    }
}
