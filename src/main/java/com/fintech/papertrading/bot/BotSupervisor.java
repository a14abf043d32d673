package com.fintech.papertrading.bot;

import com.fintech.papertrading.config.TradingProperties;
import com.fintech.papertrading.domain.Account;
import com.fintech.papertrading.domain.PriceTick;
import com.fintech.papertrading.domain.TradeSide;
import com.fintech.papertrading.domain.Transaction;
import com.fintech.papertrading.ledger.LedgerService;
import com.fintech.papertrading.ledger.TradeError;
import com.fintech.papertrading.ledger.TradeException;
import com.fintech.papertrading.state.BotSupervisionRecord;
import com.fintech.papertrading.state.TradingState;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one scheduled task per active bot and enforces its loss limit.
 *
 * <p>A bot lives exactly as long as its {@link BotSupervisionRecord} is registered in
 * the trading state. Each tick first checks the record is still there, and every
 * trade it makes re-checks the record under the write lock, so once a stop removes
 * the record no further trade can land. Stopping also cancels the task outright.
 */
@Service
public class BotSupervisor {

    private static final Logger log = LoggerFactory.getLogger(BotSupervisor.class);

    /** Outcome of a single tick. */
    enum TickOutcome {
        CONTINUE,
        STOPPED,
        TERMINATED
    }

    /** Metric tag for why a bot stopped. */
    enum StopCause {
        USER,
        CONTEXT,
        INSUFFICIENT_FUNDS,
        EXECUTION_ERROR,
        STOPLOSS
    }

    private final TradingState state;
    private final LedgerService ledger;
    private final StrategyRegistry registry;
    private final TradingProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final ScheduledExecutorService scheduler;

    public BotSupervisor(
            TradingState state,
            LedgerService ledger,
            StrategyRegistry registry,
            TradingProperties properties,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.state = state;
        this.ledger = ledger;
        this.registry = registry;
        this.properties = properties;
        this.clock = clock;
        this.meterRegistry = meterRegistry;

        AtomicInteger threadCounter = new AtomicInteger(1);
        this.scheduler = Executors.newScheduledThreadPool(properties.getBot().getSchedulerThreads(), r -> {
            Thread thread = new Thread(r, "bot-supervisor-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });

        Gauge.builder("bot.active", this, BotSupervisor::activeCount)
            .description("Bots currently running")
            .register(meterRegistry);
    }

    /**
     * Registers and schedules a bot. The record is inserted and the task scheduled
     * under one write lock, so two concurrent starts for a user cannot both succeed.
     *
     * @throws BotException INVALID_REQUEST for a non-positive stoploss or unknown strategy,
     *                      NOT_FOUND for an unknown user, CONFLICT when a bot already runs
     */
    public BotStatus start(String userId, String strategyName, String baseAsset, String quoteAsset, double stoplossAmount) {
        if (!(stoplossAmount > 0) || !Double.isFinite(stoplossAmount)) {
            throw new BotException(BotException.Reason.INVALID_REQUEST, "Stoploss amount must be positive");
        }
        if (baseAsset == null || quoteAsset == null || baseAsset.equals(quoteAsset)) {
            throw new BotException(BotException.Reason.INVALID_REQUEST, "Base and quote assets must differ");
        }
        Strategy strategy = registry.create(strategyName, stoplossAmount);
        long periodMillis = properties.getBot().getTickInterval().toMillis();

        BotSupervisionRecord record = state.write(s -> {
            if (s.activeBots().containsKey(userId)) {
                throw new BotException(BotException.Reason.CONFLICT, "User already has an active bot running");
            }
            Account account = s.accounts().get(userId);
            if (account == null) {
                throw new BotException(BotException.Reason.NOT_FOUND, "User not found: " + userId);
            }
            double initialValue = LedgerService.portfolioValue(s.marketData(), account);
            BotSupervisionRecord created = new BotSupervisionRecord(userId, strategy.name(), baseAsset, quoteAsset,
                stoplossAmount, initialValue, clock.instant());
            s.activeBots().put(userId, created);

            ScheduledFuture<?> task = scheduler.scheduleAtFixedRate(
                () -> runTick(created, strategy), periodMillis, periodMillis, TimeUnit.MILLISECONDS);
            created.attach(task);
            return created;
        });

        log.info("Bot '{}' started for user {} on {} (stoploss: {}, initial value: {})",
            record.getStrategyName(), userId, record.tradingPair(), stoplossAmount,
            record.getInitialPortfolioValueUsd());
        return BotStatus.of(record);
    }

    /**
     * Deregisters the user's bot and aborts its task.
     *
     * @return the final status of the stopped bot
     * @throws BotException NOT_FOUND when no bot is active
     */
    public BotStatus stop(String userId) {
        BotSupervisionRecord record = state.write(s -> s.activeBots().remove(userId));
        if (record == null) {
            throw new BotException(BotException.Reason.NOT_FOUND, "No active bot for this user");
        }
        record.abort();
        meterRegistry.counter("bot.stops", "cause", StopCause.USER.name()).increment();
        log.info("Bot '{}' stopped by user {}", record.getStrategyName(), userId);
        return BotStatus.of(record);
    }

    public BotStatus status(String userId) {
        return state.activeBot(userId).map(BotStatus::of).orElseGet(BotStatus::inactive);
    }

    private void runTick(BotSupervisionRecord record, Strategy strategy) {
        try {
            tick(record, strategy);
        } catch (RuntimeException e) {
            // An escaping exception would silently cancel the periodic task
            log.error("Unexpected error in bot tick: {}", record, e);
            stopWithReason(record, StopCause.EXECUTION_ERROR, "execution error: " + e.getMessage());
        }
    }

    /**
     * One supervision step: assemble context, ask the strategy, execute, check the stoploss.
     */
    TickOutcome tick(BotSupervisionRecord record, Strategy strategy) {
        String userId = record.getUserId();
        if (!isRegistered(record)) {
            log.debug("Bot record gone, terminating task: {}", record);
            record.abort();
            return TickOutcome.TERMINATED;
        }

        Optional<BotContext> assembled = assembleContext(record);
        if (assembled.isEmpty()) {
            return stopWithReason(record, StopCause.CONTEXT, "context assembly failed");
        }
        BotContext context = assembled.get();

        BotDecision decision = strategy.tick(context);
        log.debug("Bot tick {} for {}: price={}, decision={}", context.tickCount(), userId,
            context.currentPrice(), decision);

        if (decision.action() != BotDecision.Action.DO_NOTHING) {
            double quantity = decision.quoteAmount() / context.currentPrice();
            TradeSide side = decision.action() == BotDecision.Action.BUY ? TradeSide.BUY : TradeSide.SELL;

            if (side == TradeSide.BUY && context.quoteBalance() < decision.quoteAmount()) {
                return stopWithReason(record, StopCause.INSUFFICIENT_FUNDS, "insufficient funds");
            }
            if (side == TradeSide.SELL && context.baseBalance() < quantity) {
                log.info("Bot tried to sell {} {} but only has {}, skipping",
                    quantity, record.getBaseAsset(), context.baseBalance());
            } else {
                try {
                    Optional<Transaction> trade =
                        ledger.executeSupervisedTrade(record, side, quantity, context.currentPrice());
                    if (trade.isEmpty()) {
                        return TickOutcome.TERMINATED;
                    }
                } catch (TradeException e) {
                    if (e.getError() == TradeError.INSUFFICIENT_FUNDS) {
                        return stopWithReason(record, StopCause.INSUFFICIENT_FUNDS, "insufficient funds");
                    }
                    if (e.getError() == TradeError.INSUFFICIENT_ASSETS) {
                        log.info("Bot sell skipped for {}: {}", userId, e.getMessage());
                    } else {
                        return stopWithReason(record, StopCause.EXECUTION_ERROR,
                            "execution error: " + e.getError().description());
                    }
                }
            }
        }

        OptionalDouble currentValue = ledger.portfolioValue(userId);
        if (currentValue.isEmpty()) {
            return stopWithReason(record, StopCause.CONTEXT, "context assembly failed");
        }
        double loss = record.getInitialPortfolioValueUsd() - currentValue.getAsDouble();
        if (loss >= record.getStoplossAmount()) {
            return stopWithReason(record, StopCause.STOPLOSS, String.format(
                "Stoploss breached: lost $%.2f (limit: $%.2f)", loss, record.getStoplossAmount()));
        }

        record.incrementTicks();
        return TickOutcome.CONTINUE;
    }

    private Optional<BotContext> assembleContext(BotSupervisionRecord record) {
        int contextWindow = properties.getBot().getContextWindow();
        return state.read(s -> {
            List<PriceTick> window = s.marketData().window(record.getBaseAsset(), contextWindow);
            OptionalDouble price = s.marketData().pairPrice(record.getBaseAsset(), record.getQuoteAsset());
            Account account = s.accounts().get(record.getUserId());
            if (window.isEmpty() || price.isEmpty() || account == null) {
                log.error("Failed to assemble bot context for {}: ticks={}, price={}, account={}",
                    record.getUserId(), window.size(), price, account != null);
                return Optional.empty();
            }
            return Optional.of(new BotContext(
                window,
                account.balance(record.getBaseAsset()),
                account.balance(record.getQuoteAsset()),
                price.getAsDouble(),
                record.getBaseAsset(),
                record.getQuoteAsset(),
                record.getTicks()
            ));
        });
    }

    /**
     * Deregisters the bot if {@code record} is still the registered one, then aborts its task.
     */
    private TickOutcome stopWithReason(BotSupervisionRecord record, StopCause cause, String reason) {
        boolean removed = state.write(s -> s.activeBots().remove(record.getUserId(), record));
        if (removed) {
            meterRegistry.counter("bot.stops", "cause", cause.name()).increment();
            log.warn("Bot '{}' stopped for user {}: {}", record.getStrategyName(), record.getUserId(), reason);
        }
        record.abort();
        return TickOutcome.STOPPED;
    }

    private boolean isRegistered(BotSupervisionRecord record) {
        return state.read(s -> s.activeBots().get(record.getUserId()) == record);
    }

    int activeCount() {
        return state.read(s -> s.activeBots().size());
    }

    @PreDestroy
    public void shutdown() {
        log.info("Bot supervisor shutting down, {} bots active", activeCount());
        scheduler.shutdownNow();
    }
}
