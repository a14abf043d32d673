package com.fintech.papertrading.bot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Naive momentum: buys after three strictly rising prices, sells after three strictly
 * falling ones, then sits out three ticks. Each trade is worth 1% of the stoploss.
 */
public class MomentumStrategy implements Strategy {

    private static final Logger log = LoggerFactory.getLogger(MomentumStrategy.class);

    public static final String REGISTRY_NAME = "naive_momentum";
    public static final String DISPLAY_NAME = "Naive Momentum Bot";

    static final int HISTORY_SIZE = 10;
    static final int TREND_LENGTH = 3;
    static final int COOLDOWN_TICKS = 3;
    static final double STEP_FRACTION = 0.01;

    private final double stepSize;
    private final PriceHistory history = new PriceHistory(HISTORY_SIZE);
    private int cooldownRemaining;

    public MomentumStrategy(double stoplossAmount) {
        this.stepSize = stoplossAmount * STEP_FRACTION;
    }

    @Override
    public BotDecision tick(BotContext context) {
        history.push(context.currentPrice());

        if (cooldownRemaining > 0) {
            cooldownRemaining--;
            return BotDecision.doNothing();
        }
        if (!history.hasAtLeast(TREND_LENGTH)) {
            return BotDecision.doNothing();
        }

        List<Double> recent = history.lastN(TREND_LENGTH);
        if (recent.get(1) > recent.get(0) && recent.get(2) > recent.get(1)) {
            cooldownRemaining = COOLDOWN_TICKS;
            log.debug("Uptrend detected at {}, buying {} {}", context.currentPrice(), stepSize, context.quoteAsset());
            return BotDecision.buy(stepSize);
        }
        if (recent.get(1) < recent.get(0) && recent.get(2) < recent.get(1)) {
            cooldownRemaining = COOLDOWN_TICKS;
            log.debug("Downtrend detected at {}, selling {} {}", context.currentPrice(), stepSize, context.quoteAsset());
            return BotDecision.sell(stepSize);
        }
        return BotDecision.doNothing();
    }

    @Override
    public String name() {
        return DISPLAY_NAME;
    }

    double getStepSize() {
        return stepSize;
    }

    int getCooldownRemaining() {
        return cooldownRemaining;
    }
}
