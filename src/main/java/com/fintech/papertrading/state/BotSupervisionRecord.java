package com.fintech.papertrading.state;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Registry entry for one running bot. At most one exists per user.
 *
 * <p>The record exclusively owns the bot's scheduled task: removing it from
 * {@link TradingState.Guarded#activeBots()} is the stop signal, and
 * {@link #abort()} cancels the task outright.
 */
public class BotSupervisionRecord {

    private final String userId;
    private final String strategyName;
    private final String baseAsset;
    private final String quoteAsset;
    private final double stoplossAmount;
    private final double initialPortfolioValueUsd;
    private final Instant startedAt;
    private final AtomicLong ticks = new AtomicLong(0);

    private volatile Future<?> taskHandle;

    public BotSupervisionRecord(
            String userId,
            String strategyName,
            String baseAsset,
            String quoteAsset,
            double stoplossAmount,
            double initialPortfolioValueUsd,
            Instant startedAt) {
        this.userId = Objects.requireNonNull(userId, "User id cannot be null");
        this.strategyName = strategyName;
        this.baseAsset = baseAsset;
        this.quoteAsset = quoteAsset;
        this.stoplossAmount = stoplossAmount;
        this.initialPortfolioValueUsd = initialPortfolioValueUsd;
        this.startedAt = startedAt;
    }

    /** Attaches the scheduled task. Called once, under the write lock, right after scheduling. */
    public void attach(Future<?> handle) {
        this.taskHandle = handle;
    }

    /** Hard-aborts the task, interrupting it if it is mid-tick. */
    public void abort() {
        Future<?> handle = taskHandle;
        if (handle != null) {
            handle.cancel(true);
        }
    }

    public long incrementTicks() {
        return ticks.incrementAndGet();
    }

    public String getUserId() {
        return userId;
    }

    public String getStrategyName() {
        return strategyName;
    }

    public String getBaseAsset() {
        return baseAsset;
    }

    public String getQuoteAsset() {
        return quoteAsset;
    }

    public String tradingPair() {
        return baseAsset + "/" + quoteAsset;
    }

    public double getStoplossAmount() {
        return stoplossAmount;
    }

    public double getInitialPortfolioValueUsd() {
        return initialPortfolioValueUsd;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public long getTicks() {
        return ticks.get();
    }

    @Override
    public String toString() {
        return "BotSupervisionRecord{user=" + userId + ", strategy=" + strategyName
            + ", pair=" + tradingPair() + ", stoploss=" + stoplossAmount + "}";
    }
}
