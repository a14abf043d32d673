package com.fintech.papertrading.ledger;

import com.fintech.papertrading.config.TradingProperties;
import com.fintech.papertrading.domain.Account;
import com.fintech.papertrading.domain.TradeSide;
import com.fintech.papertrading.domain.Transaction;
import com.fintech.papertrading.domain.TransactionType;
import com.fintech.papertrading.marketdata.MarketDataStore;
import com.fintech.papertrading.persistence.AccountPersistenceService;
import com.fintech.papertrading.state.BotSupervisionRecord;
import com.fintech.papertrading.state.TradingState;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Function;

/**
 * All balance mutation and transaction history, one entry point per economic action.
 *
 * <p>Every action runs validate + mutate + append inside a single
 * {@link TradingState#write} section, so a balance check is never acted on after
 * another writer changed the balance. The updated account is mirrored to the
 * durable store after the lock is released.
 */
@Service
public class LedgerService {

    private static final Logger log = LoggerFactory.getLogger(LedgerService.class);

    private final TradingState state;
    private final AccountPersistenceService persistence;
    private final TradingProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final Timer tradeTimer;

    public LedgerService(
            TradingState state,
            AccountPersistenceService persistence,
            TradingProperties properties,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.state = state;
        this.persistence = persistence;
        this.properties = properties;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.tradeTimer = meterRegistry.timer("ledger.trade.execution.time");
    }

    /**
     * Creates an account seeded with the starting balance of the reference currency.
     *
     * @throws DuplicateAccountException if the user id is taken
     */
    public Account openAccount(String userId, String username) {
        Account snapshot = state.write(s -> {
            if (s.accounts().containsKey(userId)) {
                throw new DuplicateAccountException(userId);
            }
            Account account = Account.seeded(username, referenceCurrency(), properties.getStartingBalance());
            s.accounts().put(userId, account);
            return account.copy();
        });
        log.info("Opened account: user={}, balance={} {}", userId, properties.getStartingBalance(), referenceCurrency());
        persistence.mirror(userId, snapshot);
        return snapshot;
    }

    /**
     * Installs an existing account (startup load and demo reset). Not mirrored.
     */
    public void register(String userId, Account account) {
        state.write(s -> s.accounts().put(userId, account.copy()));
    }

    /**
     * Manual trade at the current pair price.
     *
     * @throws TradeException with the rejection reason; nothing is mutated on rejection
     */
    public Transaction executeTrade(String userId, String baseAsset, String quoteAsset, TradeSide side, double quantity) {
        return tradeTimer.record(() -> commit(userId, s -> {
            requirePositive(quantity);
            double price = s.marketData().pairPrice(baseAsset, quoteAsset)
                .orElseThrow(() -> reject(TradeError.PRICE_UNAVAILABLE));
            return applyTrade(s.marketData(), s.accounts().get(userId),
                userId, baseAsset, quoteAsset, side, quantity, price, null);
        }));
    }

    /**
     * Bot trade at a price the supervisor already observed, tagged with the strategy name.
     * Applied only while {@code record} is still the registered bot for its user, so a
     * stopped bot can never write.
     *
     * @return the trade, or empty when the bot was stopped before the write lock was acquired
     * @throws TradeException with the rejection reason
     */
    public Optional<Transaction> executeSupervisedTrade(
            BotSupervisionRecord record, TradeSide side, double quantity, double price) {
        String userId = record.getUserId();
        return tradeTimer.record(() -> commitOptional(userId, s -> {
            if (s.activeBots().get(userId) != record) {
                log.debug("Discarding trade from stopped bot: {}", record);
                return Optional.empty();
            }
            requirePositive(quantity);
            if (!(price > 0) || !Double.isFinite(price)) {
                throw reject(TradeError.PRICE_UNAVAILABLE);
            }
            return Optional.of(applyTrade(s.marketData(), s.accounts().get(userId), userId,
                record.getBaseAsset(), record.getQuoteAsset(), side, quantity, price, record.getStrategyName()));
        }));
    }

    /**
     * Credits the reference currency.
     *
     * @throws TradeException DEPOSIT_TOO_SMALL, DEPOSIT_TOO_LARGE, INVALID_QUANTITY or USER_NOT_FOUND
     */
    public Transaction deposit(String userId, double amount) {
        if (!Double.isFinite(amount)) {
            throw reject(TradeError.INVALID_QUANTITY);
        }
        if (amount < properties.getLedger().getMinDeposit()) {
            throw reject(TradeError.DEPOSIT_TOO_SMALL);
        }
        if (amount > properties.getLedger().getMaxDeposit()) {
            throw reject(TradeError.DEPOSIT_TOO_LARGE);
        }
        return commit(userId, s -> {
            Account account = requireAccount(s.accounts().get(userId));
            Transaction deposit = cashMovement(userId, TransactionType.DEPOSIT, TradeSide.BUY, amount);
            account.adjust(referenceCurrency(), amount);
            account.append(deposit);
            return deposit;
        });
    }

    /**
     * Debits the reference currency.
     *
     * @throws TradeException INVALID_QUANTITY, WITHDRAWAL_EXCEEDS_BALANCE or USER_NOT_FOUND
     */
    public Transaction withdraw(String userId, double amount) {
        return commit(userId, s -> {
            requirePositive(amount);
            Account account = requireAccount(s.accounts().get(userId));
            if (amount > account.balance(referenceCurrency())) {
                throw reject(TradeError.WITHDRAWAL_EXCEEDS_BALANCE);
            }
            Transaction withdrawal = cashMovement(userId, TransactionType.WITHDRAWAL, TradeSide.SELL, amount);
            account.adjust(referenceCurrency(), -amount);
            account.append(withdrawal);
            return withdrawal;
        });
    }

    /** Deep snapshot of an account. */
    public Optional<Account> account(String userId) {
        return state.account(userId);
    }

    /**
     * Total value of an account in the reference currency, or empty for unknown users.
     */
    public OptionalDouble portfolioValue(String userId) {
        return state.read(s -> {
            Account account = s.accounts().get(userId);
            return account == null
                ? OptionalDouble.empty()
                : OptionalDouble.of(portfolioValue(s.marketData(), account));
        });
    }

    /**
     * Sums every positive balance, pricing non-reference assets at their latest price.
     * An asset without a price is logged and contributes nothing. Caller holds a lock.
     */
    public static double portfolioValue(MarketDataStore marketData, Account account) {
        double total = 0.0;
        for (Map.Entry<String, Double> entry : account.getBalances().entrySet()) {
            double balance = entry.getValue();
            if (balance <= 0) {
                continue;
            }
            OptionalDouble price = marketData.referencePrice(entry.getKey());
            if (price.isPresent()) {
                total += balance * price.getAsDouble();
            } else {
                log.warn("Could not price {} when calculating portfolio value", entry.getKey());
            }
        }
        return total;
    }

    private Transaction applyTrade(
            MarketDataStore marketData,
            Account account,
            String userId,
            String baseAsset,
            String quoteAsset,
            TradeSide side,
            double quantity,
            double price,
            String executedBy) {
        requireAccount(account);
        double quoteCost = price * quantity;

        if (side == TradeSide.BUY && account.balance(quoteAsset) < quoteCost) {
            throw reject(TradeError.INSUFFICIENT_FUNDS);
        }
        if (side == TradeSide.SELL && account.balance(baseAsset) < quantity) {
            throw reject(TradeError.INSUFFICIENT_ASSETS);
        }

        Transaction trade = new Transaction(
            userId,
            TransactionType.TRADE,
            baseAsset,
            quoteAsset,
            side,
            quantity,
            price,
            clock.instant(),
            boxed(marketData.referencePrice(baseAsset)),
            boxed(marketData.referencePrice(quoteAsset)),
            executedBy
        );

        if (side == TradeSide.BUY) {
            account.adjust(quoteAsset, -quoteCost);
            account.adjust(baseAsset, quantity);
        } else {
            account.adjust(baseAsset, -quantity);
            account.adjust(quoteAsset, quoteCost);
        }
        account.append(trade);

        log.info("Trade executed: user={}, {} {} {}/{} @ {}{}", userId, side, quantity, baseAsset, quoteAsset,
                 price, executedBy == null ? "" : " by " + executedBy);
        return trade;
    }

    private Transaction cashMovement(String userId, TransactionType type, TradeSide side, double amount) {
        String currency = referenceCurrency();
        return new Transaction(userId, type, currency, currency, side, amount, 1.0, clock.instant(),
            1.0, 1.0, null);
    }

    /**
     * Runs a mutation under the write lock, snapshots the account inside the same
     * section and mirrors it once the lock is released.
     */
    private Transaction commit(String userId, Function<TradingState.Guarded, Transaction> mutation) {
        return commitOptional(userId, s -> Optional.of(mutation.apply(s)))
            .orElseThrow(() -> new IllegalStateException("Mutation produced no transaction"));
    }

    private Optional<Transaction> commitOptional(
            String userId, Function<TradingState.Guarded, Optional<Transaction>> mutation) {
        Committed committed = state.write(s -> {
            Optional<Transaction> result = mutation.apply(s);
            Account account = s.accounts().get(userId);
            return new Committed(result, result.isPresent() && account != null ? account.copy() : null);
        });
        if (committed.snapshot() != null) {
            persistence.mirror(userId, committed.snapshot());
        }
        return committed.transaction();
    }

    private void requirePositive(double quantity) {
        if (!(quantity > 0) || !Double.isFinite(quantity)) {
            throw reject(TradeError.INVALID_QUANTITY);
        }
    }

    private Account requireAccount(Account account) {
        if (account == null) {
            throw reject(TradeError.USER_NOT_FOUND);
        }
        return account;
    }

    private TradeException reject(TradeError error) {
        meterRegistry.counter("ledger.rejections", "error", error.name()).increment();
        return new TradeException(error);
    }

    private String referenceCurrency() {
        return properties.getReferenceCurrency();
    }

    private static Double boxed(OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : null;
    }

    private record Committed(Optional<Transaction> transaction, Account snapshot) {
    }
}
