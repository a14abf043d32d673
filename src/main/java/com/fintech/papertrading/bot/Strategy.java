package com.fintech.papertrading.bot;

/**
 * Trading decision function. One instance per running bot; it is only ever
 * called from that bot's task, so implementations may keep unsynchronized state.
 */
public interface Strategy {

    /**
     * Examines the context, updates internal state and returns a decision.
     */
    BotDecision tick(BotContext context);

    /** Display name, also used to tag the bot's trades. */
    String name();
}
