package com.fintech.papertrading.bot;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.DoubleFunction;

/**
 * Closed set of strategies that can be started by name. Each start gets a fresh instance.
 */
@Component
public class StrategyRegistry {

    private final Map<String, DoubleFunction<Strategy>> factories = Map.of(
        MomentumStrategy.REGISTRY_NAME, MomentumStrategy::new
    );

    /**
     * Creates a new strategy instance sized by the bot's stoploss.
     *
     * @throws BotException INVALID_REQUEST for unknown names
     */
    public Strategy create(String name, double stoplossAmount) {
        DoubleFunction<Strategy> factory = name == null ? null : factories.get(name);
        if (factory == null) {
            throw new BotException(BotException.Reason.INVALID_REQUEST,
                "Unknown bot: " + name + ". Available: " + names());
        }
        return factory.apply(stoplossAmount);
    }

    public Set<String> names() {
        return new TreeSet<>(factories.keySet());
    }
}
