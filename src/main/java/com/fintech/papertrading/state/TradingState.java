package com.fintech.papertrading.state;

import com.fintech.papertrading.domain.Account;
import com.fintech.papertrading.domain.Candle;
import com.fintech.papertrading.domain.Interval;
import com.fintech.papertrading.domain.PriceTick;
import com.fintech.papertrading.marketdata.MarketDataStore;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Process-wide shared state: market data, accounts and the active-bot registry,
 * guarded by one fair read/write lock.
 *
 * <p>Readers run concurrently. Every mutation runs its whole check-and-mutate
 * sequence inside {@link #write(Function)}, which serializes all balance changes
 * and keeps per-user history in lock-acquisition order.
 *
 * <p>The guarded collections are only reachable through the {@link Guarded} view
 * handed to a locked callback; the view must not escape the callback.
 */
public class TradingState {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);
    private final Guarded guarded;

    public TradingState(MarketDataStore marketData) {
        this.guarded = new Guarded(marketData);
    }

    /**
     * Runs an action under the shared read lock.
     */
    public <T> T read(Function<Guarded, T> action) {
        return locked(lock.readLock(), action);
    }

    /**
     * Runs an action under the exclusive write lock.
     */
    public <T> T write(Function<Guarded, T> action) {
        return locked(lock.writeLock(), action);
    }

    private <T> T locked(Lock target, Function<Guarded, T> action) {
        target.lock();
        try {
            return action.apply(guarded);
        } finally {
            target.unlock();
        }
    }

    // Convenience accessors for single-step reads and writes

    public void ingest(PriceTick tick) {
        write(state -> {
            state.marketData().ingest(tick);
            return null;
        });
    }

    public void ingestOhlc(Interval interval, Candle candle) {
        write(state -> {
            state.marketData().ingestOhlc(interval, candle);
            return null;
        });
    }

    public List<PriceTick> window(String asset, int limit) {
        return read(state -> state.marketData().window(asset, limit));
    }

    public List<Candle> candles(Interval interval, String asset, int limit) {
        return read(state -> state.marketData().candles(interval, asset, limit));
    }

    /** Deep snapshot of an account. */
    public Optional<Account> account(String userId) {
        return read(state -> Optional.ofNullable(state.accounts().get(userId)).map(Account::copy));
    }

    public Optional<BotSupervisionRecord> activeBot(String userId) {
        return read(state -> Optional.ofNullable(state.activeBots().get(userId)));
    }

    /**
     * View over the guarded data. Only valid inside a locked callback.
     */
    public static final class Guarded {

        private final MarketDataStore marketData;
        private final Map<String, Account> accounts = new HashMap<>();
        private final Map<String, BotSupervisionRecord> activeBots = new HashMap<>();

        private Guarded(MarketDataStore marketData) {
            this.marketData = marketData;
        }

        public MarketDataStore marketData() {
            return marketData;
        }

        public Map<String, Account> accounts() {
            return accounts;
        }

        public Map<String, BotSupervisionRecord> activeBots() {
            return activeBots;
        }
    }
}
