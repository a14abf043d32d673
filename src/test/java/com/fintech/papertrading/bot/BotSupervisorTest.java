package com.fintech.papertrading.bot;

import com.fintech.papertrading.config.TradingProperties;
import com.fintech.papertrading.domain.Account;
import com.fintech.papertrading.domain.PriceTick;
import com.fintech.papertrading.domain.TradeSide;
import com.fintech.papertrading.domain.Transaction;
import com.fintech.papertrading.ledger.LedgerService;
import com.fintech.papertrading.marketdata.MarketDataStore;
import com.fintech.papertrading.persistence.AccountPersistenceService;
import com.fintech.papertrading.state.BotSupervisionRecord;
import com.fintech.papertrading.state.TradingState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;

/**
 * Unit tests for {@link BotSupervisor}.
 *
 * <p>The tick interval is set to an hour so scheduled tasks never fire during a
 * test; ticks are driven directly with scripted strategies.
 */
@DisplayName("BotSupervisor Tests")
class BotSupervisorTest {

    private static final String USER = "trader";
    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    private TradingState state;
    private LedgerService ledger;
    private SimpleMeterRegistry meterRegistry;
    private BotSupervisor supervisor;

    @BeforeEach
    void setUp() {
        TradingProperties properties = new TradingProperties();
        properties.getBot().setTickInterval(Duration.ofHours(1));
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

        state = new TradingState(new MarketDataStore("USD", MarketDataStore.Capacities.defaults()));
        meterRegistry = new SimpleMeterRegistry();
        ledger = new LedgerService(state, mock(AccountPersistenceService.class), properties, clock, meterRegistry);
        supervisor = new BotSupervisor(state, ledger, new StrategyRegistry(), properties, clock, meterRegistry);

        ledger.register(USER, Account.seeded("Trader", "USD", 10_000.0));
        state.ingest(new PriceTick(1, "BTC", 50_000.0));
    }

    @AfterEach
    void tearDown() {
        supervisor.shutdown();
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("start registers the bot with its initial portfolio value")
        void testStart() {
            BotStatus status = supervisor.start(USER, "naive_momentum", "BTC", "USD", 250.0);

            assertThat(status.active()).isTrue();
            assertThat(status.botName()).isEqualTo("Naive Momentum Bot");
            assertThat(status.tradingPair()).isEqualTo("BTC/USD");
            assertThat(status.stoplossAmount()).isEqualTo(250.0);
            assertThat(status.initialPortfolioValue()).isEqualTo(10_000.0);
            assertThat(status.ticks()).isZero();
            assertThat(status.startedAt()).isEqualTo(NOW);
            assertThat(supervisor.status(USER)).isEqualTo(status);
            assertThat(meterRegistry.get("bot.active").gauge().value()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("A second start for the same user is CONFLICT")
        void testConflict() {
            supervisor.start(USER, "naive_momentum", "BTC", "USD", 250.0);

            assertReason(() -> supervisor.start(USER, "naive_momentum", "ETH", "USD", 100.0),
                BotException.Reason.CONFLICT);
        }

        @Test
        @DisplayName("Unknown users are NOT_FOUND")
        void testUnknownUser() {
            assertReason(() -> supervisor.start("ghost", "naive_momentum", "BTC", "USD", 100.0),
                BotException.Reason.NOT_FOUND);
            assertThat(supervisor.activeCount()).isZero();
        }

        @ParameterizedTest(name = "stoploss {0} rejected")
        @ValueSource(doubles = {0.0, -10.0, Double.NaN})
        @DisplayName("Non-positive stoploss is INVALID_REQUEST")
        void testInvalidStoploss(double stoploss) {
            assertReason(() -> supervisor.start(USER, "naive_momentum", "BTC", "USD", stoploss),
                BotException.Reason.INVALID_REQUEST);
        }

        @Test
        @DisplayName("Identical base and quote, or an unknown strategy, is INVALID_REQUEST")
        void testInvalidPairAndStrategy() {
            assertReason(() -> supervisor.start(USER, "naive_momentum", "USD", "USD", 100.0),
                BotException.Reason.INVALID_REQUEST);
            assertReason(() -> supervisor.start(USER, "grid", "BTC", "USD", 100.0),
                BotException.Reason.INVALID_REQUEST);
        }

        @Test
        @DisplayName("stop deregisters the bot; a second stop is NOT_FOUND")
        void testStop() {
            supervisor.start(USER, "naive_momentum", "BTC", "USD", 250.0);

            BotStatus stopped = supervisor.stop(USER);

            assertThat(stopped.botName()).isEqualTo("Naive Momentum Bot");
            assertThat(supervisor.status(USER)).isEqualTo(BotStatus.inactive());
            assertThat(meterRegistry.counter("bot.stops", "cause", "USER").count()).isEqualTo(1.0);
            assertReason(() -> supervisor.stop(USER), BotException.Reason.NOT_FOUND);
        }

        @Test
        @DisplayName("A user may start a new bot after stopping the previous one")
        void testRestart() {
            supervisor.start(USER, "naive_momentum", "BTC", "USD", 250.0);
            supervisor.stop(USER);

            assertThat(supervisor.start(USER, "naive_momentum", "BTC", "USD", 100.0).active()).isTrue();
        }
    }

    @Nested
    @DisplayName("tick")
    class Tick {

        @Test
        @DisplayName("Buy decisions trade quote value at the current price, tagged with the strategy")
        void testBuyExecutes() {
            BotSupervisionRecord record = startBot(250.0);

            BotSupervisor.TickOutcome outcome = supervisor.tick(record, scripted(BotDecision.buy(1_000.0)));

            assertThat(outcome).isEqualTo(BotSupervisor.TickOutcome.CONTINUE);
            Account account = ledger.account(USER).orElseThrow();
            assertThat(account.balance("USD")).isCloseTo(9_000.0, within(1e-9));
            assertThat(account.balance("BTC")).isCloseTo(0.02, within(1e-12));
            Transaction trade = account.getHistory().get(0);
            assertThat(trade.side()).isEqualTo(TradeSide.BUY);
            assertThat(trade.executedBy()).isEqualTo("Naive Momentum Bot");
            assertThat(record.getTicks()).isEqualTo(1);
        }

        @Test
        @DisplayName("Buying beyond the quote balance stops the bot")
        void testInsufficientFundsStops() {
            BotSupervisionRecord record = startBot(250.0);

            BotSupervisor.TickOutcome outcome = supervisor.tick(record, scripted(BotDecision.buy(20_000.0)));

            assertThat(outcome).isEqualTo(BotSupervisor.TickOutcome.STOPPED);
            assertThat(supervisor.status(USER).active()).isFalse();
            assertThat(ledger.account(USER).orElseThrow().getHistory()).isEmpty();
            assertThat(meterRegistry.counter("bot.stops", "cause", "INSUFFICIENT_FUNDS").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Selling more base than held is skipped and the bot keeps running")
        void testSellWithoutAssetsSkipped() {
            BotSupervisionRecord record = startBot(250.0);

            BotSupervisor.TickOutcome outcome = supervisor.tick(record, scripted(BotDecision.sell(500.0)));

            assertThat(outcome).isEqualTo(BotSupervisor.TickOutcome.CONTINUE);
            assertThat(ledger.account(USER).orElseThrow().getHistory()).isEmpty();
            assertThat(supervisor.status(USER).active()).isTrue();
        }

        @Test
        @DisplayName("A loss at or beyond the stoploss stops the bot")
        void testStoplossBreached() {
            ledger.executeTrade(USER, "BTC", "USD", TradeSide.BUY, 0.1);
            BotSupervisionRecord record = startBot(100.0);
            state.ingest(new PriceTick(2, "BTC", 48_000.0));

            BotSupervisor.TickOutcome outcome = supervisor.tick(record, scripted());

            assertThat(outcome).isEqualTo(BotSupervisor.TickOutcome.STOPPED);
            assertThat(supervisor.status(USER).active()).isFalse();
            assertThat(meterRegistry.counter("bot.stops", "cause", "STOPLOSS").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("A loss below the stoploss keeps the bot running")
        void testLossWithinLimit() {
            ledger.executeTrade(USER, "BTC", "USD", TradeSide.BUY, 0.1);
            BotSupervisionRecord record = startBot(500.0);
            state.ingest(new PriceTick(2, "BTC", 48_000.0));

            assertThat(supervisor.tick(record, scripted())).isEqualTo(BotSupervisor.TickOutcome.CONTINUE);
            assertThat(supervisor.status(USER).ticks()).isEqualTo(1L);
        }

        @Test
        @DisplayName("Missing market data stops the bot")
        void testContextFailureStops() {
            BotSupervisionRecord record = state.write(s -> {
                BotSupervisionRecord created = new BotSupervisionRecord(USER, "Naive Momentum Bot", "SOL", "USD",
                    100.0, 10_000.0, NOW);
                s.activeBots().put(USER, created);
                return created;
            });

            BotSupervisor.TickOutcome outcome = supervisor.tick(record, scripted(BotDecision.buy(10.0)));

            assertThat(outcome).isEqualTo(BotSupervisor.TickOutcome.STOPPED);
            assertThat(meterRegistry.counter("bot.stops", "cause", "CONTEXT").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("A stopped bot's record terminates without trading or touching its successor")
        void testStaleRecordTerminates() {
            BotSupervisionRecord stale = startBot(250.0);
            supervisor.stop(USER);
            supervisor.start(USER, "naive_momentum", "BTC", "USD", 300.0);

            BotSupervisor.TickOutcome outcome = supervisor.tick(stale, scripted(BotDecision.buy(1_000.0)));

            assertThat(outcome).isEqualTo(BotSupervisor.TickOutcome.TERMINATED);
            assertThat(ledger.account(USER).orElseThrow().getHistory()).isEmpty();
            assertThat(supervisor.status(USER).stoplossAmount()).isEqualTo(300.0);
        }

        private BotSupervisionRecord startBot(double stoploss) {
            supervisor.start(USER, "naive_momentum", "BTC", "USD", stoploss);
            return state.activeBot(USER).orElseThrow();
        }
    }

    private static void assertReason(Runnable action, BotException.Reason reason) {
        assertThatThrownBy(action::run)
            .isInstanceOf(BotException.class)
            .extracting(e -> ((BotException) e).getReason())
            .isEqualTo(reason);
    }

    private static Strategy scripted(BotDecision... decisions) {
        return new ScriptedStrategy(decisions);
    }

    /** Replays fixed decisions, then does nothing. */
    private static final class ScriptedStrategy implements Strategy {

        private final Deque<BotDecision> decisions;

        ScriptedStrategy(BotDecision... decisions) {
            this.decisions = new ArrayDeque<>(Arrays.asList(decisions));
        }

        @Override
        public BotDecision tick(BotContext context) {
            return decisions.isEmpty() ? BotDecision.doNothing() : decisions.poll();
        }

        @Override
        public String name() {
            return "Naive Momentum Bot";
        }
    }
}
